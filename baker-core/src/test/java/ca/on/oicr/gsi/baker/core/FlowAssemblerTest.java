package ca.on.oicr.gsi.baker.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;

import ca.on.oicr.gsi.baker.EcsRunConfig;
import ca.on.oicr.gsi.baker.FargateExecutor;
import ca.on.oicr.gsi.baker.PipelineTask;
import ca.on.oicr.gsi.baker.ResolutionError;
import ca.on.oicr.gsi.baker.S3FlowStorage;
import java.time.Duration;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.Test;

public class FlowAssemblerTest {
  private final FlowAssembler assembler = new FlowAssembler();

  private Targets targets(String recipeId) {
    return new TargetResolver(new RecordingFilesystem())
        .resolve(
            Fixtures.TARGET,
            Fixtures.bakery(Fixtures.fargateCluster()).getTargets().get(Fixtures.TARGET),
            "org/repo",
            recipeId,
            "zarr",
            Fixtures.secrets())
        .orElseThrow();
  }

  @Test
  public void everyTask_getsThreeRetriesThreeMinutesApart() {
    for (final var inputs : new int[] {1, 5, 12}) {
      final var job =
          assembler
              .assemble(
                  Fixtures.bakery(Fixtures.fargateCluster()),
                  Fixtures.manifest(),
                  "sst",
                  Fixtures.recipe(inputs),
                  targets("sst"),
                  Fixtures.secrets(),
                  false)
              .orElseThrow();
      assertEquals(2 * inputs + 2, job.getTasks().size());
      for (final var task : job.getTasks()) {
        assertEquals(3, task.getMaxRetries());
        assertEquals(Duration.ofMinutes(3), task.getRetryDelay());
      }
    }
  }

  @Test
  public void job_isNamedAfterRecipeAndBoundToCluster() {
    final var job =
        assembler
            .assemble(
                Fixtures.bakery(Fixtures.fargateCluster()),
                Fixtures.manifest(),
                "sst",
                Fixtures.recipe(3),
                targets("sst"),
                Fixtures.secrets(),
                false)
            .orElseThrow();
    assertEquals("sst", job.getName());
    assertEquals("flow-bucket", ((S3FlowStorage) job.getStorage()).bucket());
    assertEquals("sst", ((FargateExecutor) job.getExecutor()).tags().get("Recipe"));
    assertEquals(Fixtures.BAKERY_ID, ((EcsRunConfig) job.getRunConfig()).labels().get(0));
  }

  @Test
  public void assembly_setsRecipeStorageSlots() throws Exception {
    final var recipe = Fixtures.recipe(2);
    final var targets = targets("sst");
    final var job =
        assembler
            .assemble(
                Fixtures.bakery(Fixtures.fargateCluster()),
                Fixtures.manifest(),
                "sst",
                recipe,
                targets,
                Fixtures.secrets(),
                false)
            .orElseThrow();
    assertEquals(targets.output(), recipe.getTarget());
    assertEquals(targets.inputCache(), recipe.getInputCache());
    assertEquals(targets.metadataCache(), recipe.getMetadataCache());
    assertEquals("cache_input[0]", job.getTasks().get(0).getName());
    assertEquals("s3://pangeo-forge-us-west-2/org/repo/sst/cache/0", job.getTasks().get(0).run());
  }

  @Test
  public void pruning_keepsTwoInputs() {
    final var job =
        assembler
            .assemble(
                Fixtures.bakery(Fixtures.fargateCluster()),
                Fixtures.manifest(),
                "sst",
                Fixtures.recipe(12),
                targets("sst"),
                Fixtures.secrets(),
                true)
            .orElseThrow();
    assertEquals(
        "cache_input[0],cache_input[1],prepare_target,store_chunk[0],store_chunk[1],"
            + "finalize_target",
        job.getTasks().stream().map(PipelineTask::getName).collect(Collectors.joining(",")));
  }

  @Test
  public void unknownClusterType_leavesRecipeUntouched() {
    final var cluster = Fixtures.fargateCluster();
    cluster.setType("gcp.gke");
    final var recipe = Fixtures.recipe(2);
    final var result =
        assembler.assemble(
            Fixtures.bakery(cluster),
            Fixtures.manifest(),
            "sst",
            recipe,
            targets("sst"),
            Fixtures.secrets(),
            false);
    assertEquals(Optional.of(ResolutionError.UNSUPPORTED_CLUSTER_TYPE), result.error());
    assertNull(recipe.getTarget());
  }

  @Test
  public void kubernetesCluster_assembles() {
    final var job =
        assembler
            .assemble(
                Fixtures.bakery(Fixtures.aksCluster()),
                Fixtures.manifest(),
                "sst",
                Fixtures.recipe(1),
                targets("sst"),
                Fixtures.secrets(),
                false)
            .orElseThrow();
    assertNotNull(job.getExecutor());
    assertEquals("flow-container", job.getStorage().location());
  }
}

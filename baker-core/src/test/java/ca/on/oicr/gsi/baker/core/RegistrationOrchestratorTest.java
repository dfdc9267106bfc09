package ca.on.oicr.gsi.baker.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import ca.on.oicr.gsi.baker.FilePattern;
import ca.on.oicr.gsi.baker.HdfReferenceRecipe;
import ca.on.oicr.gsi.baker.PipelineJob;
import ca.on.oicr.gsi.baker.Recipe;
import ca.on.oicr.gsi.baker.ResolutionError;
import ca.on.oicr.gsi.baker.Secrets;
import ca.on.oicr.gsi.baker.api.Bakery;
import ca.on.oicr.gsi.baker.api.RecipeEntry;
import ca.on.oicr.gsi.baker.api.RecipeManifest;
import ca.on.oicr.gsi.baker.api.Versions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class RegistrationOrchestratorTest {
  private static final Path MANIFEST = Path.of("recipes", "sst", "meta.yaml");
  private static final RegistrationContext CONTEXT =
      new RegistrationContext("pangeo-forge/sst-feedstock", "pangeo-forge", Optional.empty());

  private static final String VALID_RECIPE =
      String.join(
          "\n",
          "recipe:",
          "  type: xarray-zarr",
          "  file_pattern:",
          "    url_template: https://data.example.com/{time}.nc",
          "    concat_dim: time",
          "    keys: ['2020-01', '2020-02']",
          "");

  @Rule public final TemporaryFolder folder = new TemporaryFolder();
  private final RecordingEngine engine = new RecordingEngine();
  private final RecordingFilesystem filesystem = new RecordingFilesystem();
  private final RecordingRegistrar registrar = new RecordingRegistrar();
  private int loads;

  private RegisteredRecipeLoader loader() {
    return RegisteredRecipeLoader.builder()
        .recipe("recipe:recipe", () -> Fixtures.recipe(3))
        .recipe("recipe:references", () -> new HdfReferenceRecipe(pattern()))
        .family(
            "recipes:by_region",
            () -> {
              loads++;
              final var family = new LinkedHashMap<String, Recipe>();
              family.put("pacific", Fixtures.recipe(2));
              family.put("atlantic", Fixtures.recipe(2));
              family.put("arctic", Fixtures.recipe(2));
              return family;
            })
        .family(
            "recipes:mixed",
            () -> {
              final var family = new LinkedHashMap<String, Recipe>();
              family.put("first", Fixtures.recipe(2));
              family.put("second", new HdfReferenceRecipe(pattern()));
              family.put("third", Fixtures.recipe(2));
              return family;
            })
        .build();
  }

  private static FilePattern pattern() {
    return new FilePattern("https://data.example.com/{time}.h5", "time", List.of("a", "b"));
  }

  private RegistrationOrchestrator orchestrator() {
    return new RegistrationOrchestrator(
        filesystem,
        loader(),
        engine,
        Optional.of(registrar),
        RegistrationOrchestrator.DEFAULT_BOT_TOKEN_SECRET);
  }

  private RegistrationReport register(RecipeManifest manifest, Bakery bakery) {
    return register(CONTEXT, manifest, bakery, Fixtures.secrets());
  }

  private RegistrationReport register(
      RegistrationContext context, RecipeManifest manifest, Bakery bakery, Secrets secrets) {
    return orchestrator()
        .register(
            context,
            MANIFEST,
            manifest,
            Map.of(Fixtures.BAKERY_ID, bakery),
            secrets,
            Fixtures.runtime(),
            false);
  }

  @Test
  public void singleRecipe_isRegisteredUnderEntryId() {
    final var report =
        register(
            Fixtures.manifest(new RecipeEntry("sst-daily", "recipe:recipe", null)),
            Fixtures.bakery(Fixtures.fargateCluster()));
    assertTrue(report.isSuccessful());
    assertEquals(
        List.of(new RegisteredJob("sst-daily", "flow-1", Optional.empty(), Optional.empty())),
        report.registered());
    assertEquals("sst-daily", engine.jobs.get(0).getName());
    assertEquals(List.of("pangeo-forge"), engine.projects);
    assertTrue(engine.runs.isEmpty());
    assertTrue(registrar.hooks.isEmpty());
  }

  @Test
  public void recipeOutput_isNamespacedByRepository() {
    register(
        Fixtures.manifest(new RecipeEntry("sst-daily", "recipe:recipe", null)),
        Fixtures.bakery(Fixtures.fargateCluster()));
    final var job = engine.jobs.get(0);
    assertEquals(
        "s3://pangeo-forge-us-west-2/pangeo-forge/sst-feedstock/sst-daily.zarr",
        job.getTasks().stream()
            .filter(t -> t.getName().equals("finalize_target"))
            .findFirst()
            .map(
                t -> {
                  try {
                    return t.run();
                  } catch (Exception e) {
                    throw new AssertionError(e);
                  }
                })
            .orElseThrow());
  }

  @Test
  public void family_isRegisteredInFamilyOrder() {
    final var report =
        register(
            Fixtures.manifest(new RecipeEntry("ignored", null, "recipes:by_region")),
            Fixtures.bakery(Fixtures.fargateCluster()));
    assertTrue(report.isSuccessful());
    assertEquals(
        List.of("pacific", "atlantic", "arctic"),
        engine.jobs.stream().map(PipelineJob::getName).collect(Collectors.toList()));
    assertEquals(1, loads);
  }

  @Test
  public void versionMismatch_touchesNothing() {
    final var manifest = Fixtures.manifest(new RecipeEntry("sst-daily", "recipe:recipe", null));
    manifest.setPangeoNotebookVersion("2021.06.05");
    final var report = register(manifest, Fixtures.bakery(Fixtures.fargateCluster()));
    assertEquals(
        Optional.of(ResolutionError.NOTEBOOK_VERSION_MISMATCH),
        report.failure().map(RegistrationReport.Failure::error));
    assertTrue(filesystem.opened.isEmpty());
    assertTrue(engine.jobs.isEmpty());
    assertTrue(report.registered().isEmpty());
  }

  @Test
  public void runtimeEngineMismatch_registersNothing() {
    final var report =
        orchestrator()
            .register(
                CONTEXT,
                MANIFEST,
                Fixtures.manifest(new RecipeEntry("sst-daily", "recipe:recipe", null)),
                Map.of(Fixtures.BAKERY_ID, Fixtures.bakery(Fixtures.fargateCluster())),
                Fixtures.secrets(),
                new Versions(Fixtures.NOTEBOOK, Fixtures.FRAMEWORK, "1.0.0"),
                false);
    assertEquals(
        Optional.of(ResolutionError.ENGINE_VERSION_MISMATCH),
        report.failure().map(RegistrationReport.Failure::error));
    assertTrue(engine.jobs.isEmpty());
  }

  @Test
  public void unknownClusterType_registersNothing() {
    final var cluster = Fixtures.fargateCluster();
    cluster.setType("gcp.gke");
    final var report =
        register(
            Fixtures.manifest(
                new RecipeEntry("sst-daily", "recipe:recipe", null),
                new RecipeEntry("sst-monthly", "recipe:recipe", null)),
            Fixtures.bakery(cluster));
    assertFalse(report.isSuccessful());
    assertEquals(
        Optional.of(ResolutionError.UNSUPPORTED_CLUSTER_TYPE),
        report.failure().map(RegistrationReport.Failure::error));
    assertTrue(report.registered().isEmpty());
    assertTrue(engine.jobs.isEmpty());
  }

  @Test
  public void unknownBakery_isReported() {
    final var manifest = Fixtures.manifest(new RecipeEntry("sst-daily", "recipe:recipe", null));
    manifest.getBakery().setId("missing.bakery");
    assertEquals(
        Optional.of(ResolutionError.UNKNOWN_BAKERY),
        register(manifest, Fixtures.bakery(Fixtures.fargateCluster()))
            .failure()
            .map(RegistrationReport.Failure::error));
  }

  @Test
  public void unknownTarget_isReported() {
    final var manifest = Fixtures.manifest(new RecipeEntry("sst-daily", "recipe:recipe", null));
    manifest.getBakery().setTarget("missing-target");
    assertEquals(
        Optional.of(ResolutionError.UNKNOWN_TARGET),
        register(manifest, Fixtures.bakery(Fixtures.fargateCluster()))
            .failure()
            .map(RegistrationReport.Failure::error));
  }

  @Test
  public void unknownReference_isReported() {
    assertEquals(
        Optional.of(ResolutionError.UNKNOWN_RECIPE_REFERENCE),
        register(
                Fixtures.manifest(new RecipeEntry("sst-daily", "recipe:missing", null)),
                Fixtures.bakery(Fixtures.fargateCluster()))
            .failure()
            .map(RegistrationReport.Failure::error));
  }

  @Test
  public void unsupportedRecipeKind_isReported() {
    assertEquals(
        Optional.of(ResolutionError.UNSUPPORTED_RECIPE_TYPE),
        register(
                Fixtures.manifest(new RecipeEntry("refs", "recipe:references", null)),
                Fixtures.bakery(Fixtures.fargateCluster()))
            .failure()
            .map(RegistrationReport.Failure::error));
  }

  @Test
  public void familyMemberFailure_abortsRemainingWork() {
    final var report =
        register(
            Fixtures.manifest(
                new RecipeEntry("ignored", null, "recipes:mixed"),
                new RecipeEntry("after", "recipe:recipe", null)),
            Fixtures.bakery(Fixtures.fargateCluster()));
    assertEquals(
        Optional.of(ResolutionError.UNSUPPORTED_RECIPE_TYPE),
        report.failure().map(RegistrationReport.Failure::error));
    assertEquals(
        List.of("first"),
        report.registered().stream().map(RegisteredJob::recipeId).collect(Collectors.toList()));
    assertEquals(1, engine.jobs.size());
  }

  @Test
  public void engineFailure_keepsEarlierRegistrations() {
    engine.failAfter = 1;
    final var report =
        register(
            Fixtures.manifest(
                new RecipeEntry("sst-daily", "recipe:recipe", null),
                new RecipeEntry("sst-monthly", "recipe:recipe", null)),
            Fixtures.bakery(Fixtures.fargateCluster()));
    assertEquals(
        Optional.of(ResolutionError.ENGINE_FAILURE),
        report.failure().map(RegistrationReport.Failure::error));
    assertEquals(1, report.registered().size());
    assertEquals("sst-daily", report.registered().get(0).recipeId());
  }

  @Test
  public void correlationId_startsRunAndAttachesHook() {
    final var report =
        register(
            new RegistrationContext(
                "pangeo-forge/sst-feedstock", "pangeo-forge", Optional.of("1234567")),
            Fixtures.manifest(new RecipeEntry("sst-daily", "recipe:recipe", null)),
            Fixtures.bakery(Fixtures.fargateCluster()),
            Fixtures.secrets());
    assertTrue(report.isSuccessful());
    assertEquals(List.of("flow-1:1234567"), engine.runs);
    assertEquals(List.of("flow-1:pangeo-forge/sst-feedstock:bot-token"), registrar.hooks);
    assertEquals(
        new RegisteredJob("sst-daily", "flow-1", Optional.of("run-1"), Optional.of("hook-1")),
        report.registered().get(0));
  }

  @Test
  public void correlationIdWithoutBotToken_registersNothing() {
    final var secrets =
        Secrets.of(Map.of("AWS_KEY", "access-key", "AWS_SECRET", "secret-key"));
    final var report =
        register(
            new RegistrationContext(
                "pangeo-forge/sst-feedstock", "pangeo-forge", Optional.of("1234567")),
            Fixtures.manifest(new RecipeEntry("sst-daily", "recipe:recipe", null)),
            Fixtures.bakery(Fixtures.fargateCluster()),
            secrets);
    assertEquals(
        Optional.of(ResolutionError.MISSING_SECRET),
        report.failure().map(RegistrationReport.Failure::error));
    assertTrue(engine.jobs.isEmpty());
  }

  @Test
  public void correlationIdWithoutAutomation_registersNothing() {
    final var report =
        new RegistrationOrchestrator(
                filesystem,
                loader(),
                engine,
                Optional.empty(),
                RegistrationOrchestrator.DEFAULT_BOT_TOKEN_SECRET)
            .register(
                new RegistrationContext(
                    "pangeo-forge/sst-feedstock", "pangeo-forge", Optional.of("1234567")),
                MANIFEST,
                Fixtures.manifest(new RecipeEntry("sst-daily", "recipe:recipe", null)),
                Map.of(Fixtures.BAKERY_ID, Fixtures.bakery(Fixtures.fargateCluster())),
                Fixtures.secrets(),
                Fixtures.runtime(),
                false);
    assertEquals(
        Optional.of(ResolutionError.MISSING_AUTOMATION),
        report.failure().map(RegistrationReport.Failure::error));
    assertTrue(engine.jobs.isEmpty());
    assertTrue(engine.runs.isEmpty());
  }

  private RegistrationReport registerDeclared(String definition) throws IOException {
    final var directory = folder.getRoot().toPath();
    final var manifest = directory.resolve("meta.yaml");
    Files.writeString(manifest, "title: test\n");
    Files.writeString(directory.resolve("recipe.yaml"), definition);
    return new RegistrationOrchestrator(
            filesystem,
            new DeclarativeRecipeLoader(),
            engine,
            Optional.of(registrar),
            RegistrationOrchestrator.DEFAULT_BOT_TOKEN_SECRET)
        .register(
            CONTEXT,
            manifest,
            Fixtures.manifest(
                new RecipeEntry("sst-daily", "recipe:recipe", null),
                new RecipeEntry("sst-monthly", "recipe:broken", null)),
            Map.of(Fixtures.BAKERY_ID, Fixtures.bakery(Fixtures.fargateCluster())),
            Fixtures.secrets(),
            Fixtures.runtime(),
            false);
  }

  @Test
  public void declaredRecipeWithoutFilePattern_isReported() throws IOException {
    final var report = registerDeclared(VALID_RECIPE + "broken:\n  type: xarray-zarr\n");
    assertEquals(
        Optional.of(ResolutionError.INVALID_RECIPE_DEFINITION),
        report.failure().map(RegistrationReport.Failure::error));
    assertTrue(report.failure().get().message().contains("file pattern"));
    assertEquals(
        List.of("sst-daily"),
        report.registered().stream().map(RegisteredJob::recipeId).collect(Collectors.toList()));
  }

  @Test
  public void declaredRecipeWithZeroInputsPerChunk_isReported() throws IOException {
    final var report =
        registerDeclared(
            VALID_RECIPE
                + String.join(
                    "\n",
                    "broken:",
                    "  type: xarray-zarr",
                    "  inputs_per_chunk: 0",
                    "  file_pattern:",
                    "    url_template: https://data.example.com/{time}.nc",
                    "    concat_dim: time",
                    "    keys: ['2020-01']",
                    ""));
    assertEquals(
        Optional.of(ResolutionError.INVALID_RECIPE_DEFINITION),
        report.failure().map(RegistrationReport.Failure::error));
    assertTrue(report.failure().get().message().contains("Inputs per chunk"));
    assertEquals(1, engine.jobs.size());
  }
}

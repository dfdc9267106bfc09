package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.Executor;
import ca.on.oicr.gsi.baker.FlowStorage;
import ca.on.oicr.gsi.baker.PipelineJob;
import ca.on.oicr.gsi.baker.Recipe;
import ca.on.oicr.gsi.baker.Resolution;
import ca.on.oicr.gsi.baker.ResolutionError;
import ca.on.oicr.gsi.baker.RunConfig;
import ca.on.oicr.gsi.baker.Secrets;
import ca.on.oicr.gsi.baker.api.Bakery;
import ca.on.oicr.gsi.baker.api.RecipeManifest;
import java.time.Duration;
import java.util.stream.Collectors;

/**
 * Binds a recipe to the resources a bakery provides and produces a job ready to register
 *
 * <p>Every task of the job is retried {@link #MAX_RETRIES} times, {@link #RETRY_DELAY} apart, and
 * runs with the recipe library's logging at its most verbose.
 */
public final class FlowAssembler {
  public static final int MAX_RETRIES = 3;
  public static final Duration RETRY_DELAY = Duration.ofMinutes(3);

  private static PipelineJob bind(
      String recipeId,
      Recipe recipe,
      Targets targets,
      boolean prune,
      Executor executor,
      FlowStorage storage,
      RunConfig runConfig) {
    recipe.setTarget(targets.output());
    recipe.setInputCache(targets.inputCache());
    recipe.setMetadataCache(targets.metadataCache());
    final var job = (prune ? recipe.copyPruned() : recipe).toJob();
    job.setStorage(storage);
    job.setRunConfig(runConfig);
    job.setExecutor(executor);
    for (final var task : job.getTasks()) {
      task.setMaxRetries(MAX_RETRIES);
      task.setRetryDelay(RETRY_DELAY);
      task.wrap(VerboseLogging::wrap);
    }
    job.setName(recipeId);
    return job;
  }

  private final ClusterExecutorBuilder executorBuilder;
  private final FlowStorageResolver flowStorageResolver;
  private final RunConfigBuilder runConfigBuilder;

  public FlowAssembler() {
    this(new ClusterExecutorBuilder(), new FlowStorageResolver(), new RunConfigBuilder());
  }

  public FlowAssembler(
      ClusterExecutorBuilder executorBuilder,
      FlowStorageResolver flowStorageResolver,
      RunConfigBuilder runConfigBuilder) {
    this.executorBuilder = executorBuilder;
    this.flowStorageResolver = flowStorageResolver;
    this.runConfigBuilder = runConfigBuilder;
  }

  /**
   * Assemble a job for a recipe
   *
   * <p>The recipe definition is checked and the executor, flow storage, and run configuration are
   * resolved before the recipe is modified, so a failure leaves the recipe untouched.
   *
   * @param bakery the bakery the recipe runs on
   * @param manifest the manifest that declared the recipe
   * @param recipeId the identifier of the recipe; the job is named after it
   * @param recipe the recipe to bind
   * @param targets the recipe's resolved storage locations
   * @param secrets the credentials for the cluster and flow storage
   * @param prune whether to register a reduced copy of the recipe instead
   */
  public Resolution<PipelineJob> assemble(
      Bakery bakery,
      RecipeManifest manifest,
      String recipeId,
      Recipe recipe,
      Targets targets,
      Secrets secrets,
      boolean prune) {
    final var problems = recipe.validate().collect(Collectors.joining(" "));
    if (!problems.isEmpty()) {
      return Resolution.failed(
          ResolutionError.INVALID_RECIPE_DEFINITION,
          String.format("Recipe %s is not usable: %s", recipeId, problems));
    }
    final var cluster = bakery.getCluster();
    final var recipeBakery = manifest.getBakery();
    return executorBuilder
        .build(cluster, recipeBakery.getResources(), recipeId, secrets)
        .then(
            executor ->
                flowStorageResolver
                    .resolve(cluster, secrets)
                    .then(
                        storage ->
                            runConfigBuilder
                                .build(cluster, recipeBakery.getId(), recipeId, secrets)
                                .map(
                                    runConfig ->
                                        bind(
                                            recipeId,
                                            recipe,
                                            targets,
                                            prune,
                                            executor,
                                            storage,
                                            runConfig))));
  }
}

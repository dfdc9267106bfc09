package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.Executor;
import ca.on.oicr.gsi.baker.FargateExecutor;
import ca.on.oicr.gsi.baker.KubernetesExecutor;
import ca.on.oicr.gsi.baker.PodTemplate;
import ca.on.oicr.gsi.baker.Recipe;
import ca.on.oicr.gsi.baker.Resolution;
import ca.on.oicr.gsi.baker.ResolutionError;
import ca.on.oicr.gsi.baker.ScalingEnvelope;
import ca.on.oicr.gsi.baker.Secrets;
import ca.on.oicr.gsi.baker.api.Cluster;
import ca.on.oicr.gsi.baker.api.ClusterType;
import ca.on.oicr.gsi.baker.api.FargateClusterOptions;
import ca.on.oicr.gsi.baker.api.Resources;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the worker pool a recipe's tasks run on from the bakery's cluster definition
 *
 * <p>The recipe may ask for a worker size; otherwise each cluster type has its own default. The
 * pool always scales between {@link #MINIMUM_WORKERS} and the cluster's maximum, so a cluster whose
 * maximum is smaller, including one that does not declare a maximum, is rejected.
 */
public final class ClusterExecutorBuilder {
  public static final String FARGATE_CLUSTER_CLASS = "dask_cloudprovider.aws.FargateCluster";
  public static final int FARGATE_SCHEDULER_CPU = 2048;
  public static final int FARGATE_SCHEDULER_MEM = 16384;
  public static final Duration FARGATE_SCHEDULER_TIMEOUT = Duration.ofMinutes(15);
  public static final int FARGATE_WORKER_CPU = 1024;
  public static final int FARGATE_WORKER_MEM = 4096;
  public static final String KUBERNETES_CLUSTER_CLASS = "dask_kubernetes.KubeCluster";
  public static final int KUBERNETES_WORKER_CPU = 250;
  public static final int KUBERNETES_WORKER_MEM = 512;
  public static final int MINIMUM_WORKERS = 5;
  public static final String PROJECT = "pangeo-forge";
  static final String SCHEDULER_CPU_REQUEST = "2048m";
  static final String SCHEDULER_MEMORY_REQUEST = "10000Mi";
  static final String STORAGE_CONNECTION_VARIABLE = "AZURE_STORAGE_CONNECTION_STRING";

  static Map<String, String> labels(String recipeId) {
    return Map.of("Recipe", recipeId, "Project", PROJECT);
  }

  private static Executor fargate(Cluster cluster, Optional<Resources> resources, String recipeId) {
    final var options =
        cluster.getClusterOptions() == null
            ? new FargateClusterOptions()
            : cluster.getClusterOptions();
    return new FargateExecutor(
        FARGATE_CLUSTER_CLASS,
        cluster.getWorkerImage(),
        options.getVpc(),
        options.getClusterArn(),
        options.getTaskRoleArn(),
        options.getExecutionRoleArn(),
        options.getSecurityGroups() == null ? List.of() : List.copyOf(options.getSecurityGroups()),
        FARGATE_SCHEDULER_CPU,
        FARGATE_SCHEDULER_MEM,
        resources.map(Resources::getCpu).orElse(FARGATE_WORKER_CPU),
        resources.map(Resources::getMemory).orElse(FARGATE_WORKER_MEM),
        FARGATE_SCHEDULER_TIMEOUT,
        Map.of(
            "PREFECT__LOGGING__EXTRA_LOGGERS",
            "['" + Recipe.LOGGER_NAME + "']",
            "MALLOC_TRIM_THRESHOLD_",
            "0"),
        Map.of("Project", PROJECT, "Recipe", recipeId),
        envelope(cluster));
  }

  private static ScalingEnvelope envelope(Cluster cluster) {
    return new ScalingEnvelope(MINIMUM_WORKERS, cluster.getMaxWorkers());
  }

  private static Resolution<Executor> kubernetes(
      Cluster cluster, Optional<Resources> resources, String recipeId, Secrets secrets) {
    final var secretName =
        cluster.getFlowStorageOptions() == null
            ? null
            : cluster.getFlowStorageOptions().getSecret();
    return secrets
        .get(secretName)
        .map(
            connectionString ->
                new KubernetesExecutor(
                    KUBERNETES_CLUSTER_CLASS,
                    new PodTemplate(
                        "worker",
                        cluster.getWorkerImage(),
                        labels(recipeId),
                        resources.map(Resources::getCpu).orElse(KUBERNETES_WORKER_CPU) + "m",
                        resources.map(Resources::getMemory).orElse(KUBERNETES_WORKER_MEM) + "Mi",
                        List.of("dask-worker"),
                        Map.of(STORAGE_CONNECTION_VARIABLE, connectionString)),
                    new PodTemplate(
                        "scheduler",
                        cluster.getWorkerImage(),
                        labels(recipeId),
                        SCHEDULER_CPU_REQUEST,
                        SCHEDULER_MEMORY_REQUEST,
                        List.of("dask-scheduler"),
                        Map.of()),
                    envelope(cluster)));
  }

  /**
   * Build the executor for a recipe
   *
   * @param cluster the bakery's cluster
   * @param resources the worker size the recipe asked for, if any
   * @param recipeId the identifier of the recipe, used for tagging
   * @param secrets the credentials the workers need
   */
  public Resolution<Executor> build(
      Cluster cluster, Optional<Resources> resources, String recipeId, Secrets secrets) {
    return ClusterType.of(cluster.getType())
        .map(
            type -> {
              if (cluster.getMaxWorkers() < MINIMUM_WORKERS) {
                return Resolution.<Executor>failed(
                    ResolutionError.INVALID_SCALING,
                    String.format(
                        "Cluster allows at most %d workers but needs at least %d.",
                        cluster.getMaxWorkers(), MINIMUM_WORKERS));
              }
              return switch (type) {
                case FARGATE -> Resolution.resolved(fargate(cluster, resources, recipeId));
                case AKS -> kubernetes(cluster, resources, recipeId, secrets);
              };
            })
        .orElseGet(
            () ->
                Resolution.failed(
                    ResolutionError.UNSUPPORTED_CLUSTER_TYPE,
                    String.format("Cluster type %s is not supported.", cluster.getType())));
  }
}

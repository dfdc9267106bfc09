package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.EcsRunConfig;
import ca.on.oicr.gsi.baker.KubernetesRunConfig;
import ca.on.oicr.gsi.baker.Resolution;
import ca.on.oicr.gsi.baker.ResolutionError;
import ca.on.oicr.gsi.baker.RunConfig;
import ca.on.oicr.gsi.baker.Secrets;
import ca.on.oicr.gsi.baker.api.Cluster;
import ca.on.oicr.gsi.baker.api.ClusterType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;

/**
 * Builds the environment the job's driver process runs in
 *
 * <p>The driver is labelled with the bakery identifier so that only that bakery's agent picks it
 * up.
 */
public final class RunConfigBuilder {
  public static final int DRIVER_CPU = 2048;
  public static final int DRIVER_MEMORY = 16384;
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static RunConfig ecs(Cluster cluster, String bakeryId, String recipeId) {
    final var definition = MAPPER.createObjectNode();
    definition.put("networkMode", "awsvpc");
    definition.put("cpu", DRIVER_CPU);
    definition.put("memory", DRIVER_MEMORY);
    definition.putArray("containerDefinitions").addObject().put("name", "flow");
    definition.put(
        "executionRoleArn",
        cluster.getClusterOptions() == null
            ? null
            : cluster.getClusterOptions().getExecutionRoleArn());
    return new EcsRunConfig(
        cluster.getWorkerImage(),
        List.of(bakeryId),
        definition,
        List.of(
            Map.of("key", "Project", "value", ClusterExecutorBuilder.PROJECT),
            Map.of("key", "Recipe", "value", recipeId)));
  }

  private static ObjectNode jobTemplate() {
    final var template = MAPPER.createObjectNode();
    template.put("apiVersion", "batch/v1");
    template.put("kind", "Job");
    template
        .putObject("metadata")
        .putObject("annotations")
        .put("cluster-autoscaler.kubernetes.io/safe-to-evict", "false");
    template
        .putObject("spec")
        .putObject("template")
        .putObject("spec")
        .putArray("containers")
        .addObject()
        .put("name", "flow");
    return template;
  }

  private static Resolution<RunConfig> kubernetes(
      Cluster cluster, String bakeryId, Secrets secrets) {
    final var secretName =
        cluster.getFlowStorageOptions() == null
            ? null
            : cluster.getFlowStorageOptions().getSecret();
    return secrets
        .get(secretName)
        .map(
            connectionString ->
                new KubernetesRunConfig(
                    jobTemplate(),
                    cluster.getWorkerImage(),
                    List.of(bakeryId),
                    ClusterExecutorBuilder.SCHEDULER_MEMORY_REQUEST,
                    ClusterExecutorBuilder.SCHEDULER_CPU_REQUEST,
                    Map.of(ClusterExecutorBuilder.STORAGE_CONNECTION_VARIABLE, connectionString)));
  }

  /**
   * Build the run configuration for a recipe
   *
   * @param cluster the bakery's cluster
   * @param bakeryId the identifier of the bakery, used to route the job to its agent
   * @param recipeId the identifier of the recipe, used for tagging
   * @param secrets the credentials the driver needs
   */
  public Resolution<RunConfig> build(
      Cluster cluster, String bakeryId, String recipeId, Secrets secrets) {
    return ClusterType.of(cluster.getType())
        .map(
            type ->
                switch (type) {
                  case FARGATE -> Resolution.resolved(ecs(cluster, bakeryId, recipeId));
                  case AKS -> kubernetes(cluster, bakeryId, secrets);
                })
        .orElseGet(
            () ->
                Resolution.failed(
                    ResolutionError.UNSUPPORTED_CLUSTER_TYPE,
                    String.format("Cluster type %s is not supported.", cluster.getType())));
  }
}

package ca.on.oicr.gsi.baker.prefect;

import ca.on.oicr.gsi.baker.AzureFlowStorage;
import ca.on.oicr.gsi.baker.EcsRunConfig;
import ca.on.oicr.gsi.baker.Executor;
import ca.on.oicr.gsi.baker.FargateExecutor;
import ca.on.oicr.gsi.baker.FlowStorage;
import ca.on.oicr.gsi.baker.KubernetesExecutor;
import ca.on.oicr.gsi.baker.KubernetesRunConfig;
import ca.on.oicr.gsi.baker.PipelineJob;
import ca.on.oicr.gsi.baker.PodTemplate;
import ca.on.oicr.gsi.baker.RunConfig;
import ca.on.oicr.gsi.baker.S3FlowStorage;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;

/**
 * Converts an assembled job into the serialized flow the Prefect server stores
 *
 * <p>Tasks run one after another, in the order the recipe produced them. Flow storage is written
 * by location only; agents are expected to hold their own credentials for it.
 */
final class FlowSerializer {
  static final String FLOW_TYPE = "prefect.core.flow.Flow";

  private static ObjectNode executor(Executor executor) {
    final var node = BasePrefectClient.MAPPER.createObjectNode();
    node.put("type", "DaskExecutor");
    node.put("cluster_class", executor.clusterClass());
    final var kwargs = node.putObject("cluster_kwargs");
    if (executor instanceof FargateExecutor fargate) {
      kwargs.put("image", fargate.image());
      kwargs.put("vpc", fargate.vpc());
      kwargs.put("cluster_arn", fargate.clusterArn());
      kwargs.put("task_role_arn", fargate.taskRoleArn());
      kwargs.put("execution_role_arn", fargate.executionRoleArn());
      strings(kwargs.putArray("security_groups"), fargate.securityGroups());
      kwargs.put("scheduler_cpu", fargate.schedulerCpu());
      kwargs.put("scheduler_mem", fargate.schedulerMem());
      kwargs.put("worker_cpu", fargate.workerCpu());
      kwargs.put("worker_mem", fargate.workerMem());
      kwargs.put("scheduler_timeout", fargate.schedulerTimeout().toMinutes() + " minutes");
      map(kwargs.putObject("environment"), fargate.environment());
      map(kwargs.putObject("tags"), fargate.tags());
    } else if (executor instanceof KubernetesExecutor kubernetes) {
      kwargs.set("pod_template", pod(kubernetes.podTemplate()));
      kwargs.set("scheduler_pod_template", pod(kubernetes.schedulerPodTemplate()));
    }
    final var adapt = node.putObject("adapt_kwargs");
    adapt.put("minimum", executor.adapt().minimum());
    adapt.put("maximum", executor.adapt().maximum());
    return node;
  }

  private static void map(ObjectNode node, Map<String, String> values) {
    values.entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .forEach(entry -> node.put(entry.getKey(), entry.getValue()));
  }

  private static ObjectNode pod(PodTemplate template) {
    final var node = BasePrefectClient.MAPPER.createObjectNode();
    node.put("pod_type", template.podType());
    node.put("image", template.image());
    map(node.putObject("labels"), template.labels());
    node.put("cpu_request", template.cpuRequest());
    node.put("memory_request", template.memoryRequest());
    strings(node.putArray("args"), template.args());
    map(node.putObject("env"), template.env());
    return node;
  }

  private static ObjectNode runConfig(RunConfig runConfig) {
    final var node = BasePrefectClient.MAPPER.createObjectNode();
    if (runConfig instanceof EcsRunConfig ecs) {
      node.put("type", "ECSRun");
      node.put("image", ecs.image());
      strings(node.putArray("labels"), ecs.labels());
      node.set("task_definition", ecs.taskDefinition());
      final var tags = node.putObject("run_task_kwargs").putArray("tags");
      for (final var tag : ecs.runTaskTags()) {
        map(tags.addObject(), tag);
      }
    } else if (runConfig instanceof KubernetesRunConfig kubernetes) {
      node.put("type", "KubernetesRun");
      node.put("image", kubernetes.image());
      strings(node.putArray("labels"), kubernetes.labels());
      node.set("job_template", kubernetes.jobTemplate());
      node.put("cpu_request", kubernetes.cpuRequest());
      node.put("memory_request", kubernetes.memoryRequest());
      map(node.putObject("env"), kubernetes.env());
    }
    return node;
  }

  /**
   * Produce the serialized form of a job
   *
   * @param job the job; the executor, storage, and run configuration must all be set
   */
  static ObjectNode serialize(PipelineJob job) {
    if (job.getExecutor() == null || job.getStorage() == null || job.getRunConfig() == null) {
      throw new IllegalArgumentException(
          String.format("Job %s has not been bound to a bakery.", job.getName()));
    }
    final var flow = BasePrefectClient.MAPPER.createObjectNode();
    flow.put("name", job.getName());
    flow.put("type", FLOW_TYPE);
    final var tasks = flow.putArray("tasks");
    final var edges = flow.putArray("edges");
    String previous = null;
    for (final var task : job.getTasks()) {
      final var taskNode = tasks.addObject();
      taskNode.put("name", task.getName());
      taskNode.put("max_retries", task.getMaxRetries());
      if (task.getRetryDelay() != null) {
        taskNode.put("retry_delay", task.getRetryDelay().toSeconds());
      }
      if (previous != null) {
        final var edge = edges.addObject();
        edge.put("upstream_task", previous);
        edge.put("downstream_task", task.getName());
      }
      previous = task.getName();
    }
    flow.set("storage", storage(job.getStorage()));
    flow.set("run_config", runConfig(job.getRunConfig()));
    flow.set("executor", executor(job.getExecutor()));
    return flow;
  }

  private static ObjectNode storage(FlowStorage storage) {
    final var node = BasePrefectClient.MAPPER.createObjectNode();
    if (storage instanceof S3FlowStorage s3) {
      node.put("type", "S3");
      node.put("bucket", s3.bucket());
    } else if (storage instanceof AzureFlowStorage azure) {
      node.put("type", "Azure");
      node.put("container", azure.container());
    }
    return node;
  }

  private static void strings(ArrayNode node, List<String> values) {
    values.forEach(node::add);
  }

  private FlowSerializer() {}
}

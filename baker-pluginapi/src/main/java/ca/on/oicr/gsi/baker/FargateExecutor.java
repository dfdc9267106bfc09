package ca.on.oicr.gsi.baker;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/** A worker pool of serverless containers started on demand in a cloud VPC */
public record FargateExecutor(
    String clusterClass,
    String image,
    String vpc,
    String clusterArn,
    String taskRoleArn,
    String executionRoleArn,
    List<String> securityGroups,
    int schedulerCpu,
    int schedulerMem,
    int workerCpu,
    int workerMem,
    Duration schedulerTimeout,
    Map<String, String> environment,
    Map<String, String> tags,
    ScalingEnvelope adapt)
    implements Executor {}

package ca.on.oicr.gsi.baker;

/** A worker pool of pods in a container orchestrator cluster */
public record KubernetesExecutor(
    String clusterClass,
    PodTemplate podTemplate,
    PodTemplate schedulerPodTemplate,
    ScalingEnvelope adapt)
    implements Executor {}

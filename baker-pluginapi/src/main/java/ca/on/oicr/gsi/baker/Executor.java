package ca.on.oicr.gsi.baker;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** The scalable pool of workers that a job's tasks are executed on */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = FargateExecutor.class, name = "fargate"),
  @JsonSubTypes.Type(value = KubernetesExecutor.class, name = "kubernetes")
})
public sealed interface Executor permits FargateExecutor, KubernetesExecutor {

  /** How the pool grows and shrinks */
  ScalingEnvelope adapt();

  /** The name of the cluster implementation the engine instantiates */
  String clusterClass();
}

package ca.on.oicr.gsi.baker;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

/** The execution environment for the driver process that orchestrates a job */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = EcsRunConfig.class, name = "ecs"),
  @JsonSubTypes.Type(value = KubernetesRunConfig.class, name = "kubernetes")
})
public sealed interface RunConfig permits EcsRunConfig, KubernetesRunConfig {

  /** The container image the driver runs in */
  String image();

  /** Labels that route the job to the correct agent */
  List<String> labels();
}

package ca.on.oicr.gsi.baker;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Where a job's own definition is stored for the workflow engine's agents to retrieve */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = S3FlowStorage.class, name = "S3"),
  @JsonSubTypes.Type(value = AzureFlowStorage.class, name = "Azure")
})
public sealed interface FlowStorage permits AzureFlowStorage, S3FlowStorage {

  /** The bucket or container holding the job definitions */
  String location();
}

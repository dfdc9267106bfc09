package ca.on.oicr.gsi.baker.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.List;

/** Network and permission settings for a serverless container cluster */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FargateClusterOptions {
  @JsonProperty("cluster_arn")
  private String clusterArn;

  @JsonProperty("execution_role_arn")
  private String executionRoleArn;

  @JsonProperty("security_groups")
  private List<String> securityGroups = Collections.emptyList();

  @JsonProperty("task_role_arn")
  private String taskRoleArn;

  private String vpc;

  public String getClusterArn() {
    return clusterArn;
  }

  public String getExecutionRoleArn() {
    return executionRoleArn;
  }

  public List<String> getSecurityGroups() {
    return securityGroups;
  }

  public String getTaskRoleArn() {
    return taskRoleArn;
  }

  public String getVpc() {
    return vpc;
  }

  public void setClusterArn(String clusterArn) {
    this.clusterArn = clusterArn;
  }

  public void setExecutionRoleArn(String executionRoleArn) {
    this.executionRoleArn = executionRoleArn;
  }

  public void setSecurityGroups(List<String> securityGroups) {
    this.securityGroups = securityGroups;
  }

  public void setTaskRoleArn(String taskRoleArn) {
    this.taskRoleArn = taskRoleArn;
  }

  public void setVpc(String vpc) {
    this.vpc = vpc;
  }
}

package ca.on.oicr.gsi.baker.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** The compute pool a bakery runs jobs on and where it keeps their definitions */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Cluster {
  @JsonProperty("cluster_options")
  private FargateClusterOptions clusterOptions;

  @JsonProperty("flow_storage")
  private String flowStorage;

  @JsonProperty("flow_storage_options")
  private StorageOptions flowStorageOptions;

  @JsonProperty("flow_storage_protocol")
  private String flowStorageProtocol;

  @JsonProperty("max_workers")
  private int maxWorkers;

  @JsonProperty("pangeo_forge_version")
  private String pangeoForgeVersion;

  @JsonProperty("pangeo_notebook_version")
  private String pangeoNotebookVersion;

  @JsonProperty("prefect_version")
  private String prefectVersion;

  private String type;

  @JsonProperty("worker_image")
  private String workerImage;

  public FargateClusterOptions getClusterOptions() {
    return clusterOptions;
  }

  public String getFlowStorage() {
    return flowStorage;
  }

  public StorageOptions getFlowStorageOptions() {
    return flowStorageOptions;
  }

  public String getFlowStorageProtocol() {
    return flowStorageProtocol;
  }

  public int getMaxWorkers() {
    return maxWorkers;
  }

  public String getPangeoForgeVersion() {
    return pangeoForgeVersion;
  }

  public String getPangeoNotebookVersion() {
    return pangeoNotebookVersion;
  }

  public String getPrefectVersion() {
    return prefectVersion;
  }

  public String getType() {
    return type;
  }

  public String getWorkerImage() {
    return workerImage;
  }

  public void setClusterOptions(FargateClusterOptions clusterOptions) {
    this.clusterOptions = clusterOptions;
  }

  public void setFlowStorage(String flowStorage) {
    this.flowStorage = flowStorage;
  }

  public void setFlowStorageOptions(StorageOptions flowStorageOptions) {
    this.flowStorageOptions = flowStorageOptions;
  }

  public void setFlowStorageProtocol(String flowStorageProtocol) {
    this.flowStorageProtocol = flowStorageProtocol;
  }

  public void setMaxWorkers(int maxWorkers) {
    this.maxWorkers = maxWorkers;
  }

  public void setPangeoForgeVersion(String pangeoForgeVersion) {
    this.pangeoForgeVersion = pangeoForgeVersion;
  }

  public void setPangeoNotebookVersion(String pangeoNotebookVersion) {
    this.pangeoNotebookVersion = pangeoNotebookVersion;
  }

  public void setPrefectVersion(String prefectVersion) {
    this.prefectVersion = prefectVersion;
  }

  public void setType(String type) {
    this.type = type;
  }

  public void setWorkerImage(String workerImage) {
    this.workerImage = workerImage;
  }

  /** The versions this cluster's images were built with */
  public Versions versions() {
    return new Versions(pangeoNotebookVersion, pangeoForgeVersion, prefectVersion);
  }
}

package ca.on.oicr.gsi.baker.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** How to reach a storage target */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TargetProtocol {
  private String protocol;

  @JsonProperty("storage_options")
  private StorageOptions storageOptions;

  public TargetProtocol() {}

  public TargetProtocol(String protocol, StorageOptions storageOptions) {
    this.protocol = protocol;
    this.storageOptions = storageOptions;
  }

  public String getProtocol() {
    return protocol;
  }

  public StorageOptions getStorageOptions() {
    return storageOptions;
  }

  public void setProtocol(String protocol) {
    this.protocol = protocol;
  }

  public void setStorageOptions(StorageOptions storageOptions) {
    this.storageOptions = storageOptions;
  }
}

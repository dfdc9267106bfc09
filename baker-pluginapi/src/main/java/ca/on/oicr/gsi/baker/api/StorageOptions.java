package ca.on.oicr.gsi.baker.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** The names of the secrets that hold the credentials for a blob store */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class StorageOptions {
  private String key;
  private String secret;

  public StorageOptions() {}

  public StorageOptions(String key, String secret) {
    this.key = key;
    this.secret = secret;
  }

  /** The name of the secret holding the access key, for object stores */
  public String getKey() {
    return key;
  }

  /** The name of the secret holding the secret key or connection string */
  public String getSecret() {
    return secret;
  }

  public void setKey(String key) {
    this.key = key;
  }

  public void setSecret(String secret) {
    this.secret = secret;
  }
}

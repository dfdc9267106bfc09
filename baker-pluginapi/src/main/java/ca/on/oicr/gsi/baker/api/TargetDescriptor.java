package ca.on.oicr.gsi.baker.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A storage target offered by a bakery
 *
 * <p>The public protocol is how consumers read published data; recipes always write through the
 * private protocol.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TargetDescriptor {
  private String description;

  @JsonProperty("private")
  private TargetProtocol privateProtocol;

  @JsonProperty("public")
  private TargetProtocol publicProtocol;

  private String region;

  public TargetDescriptor() {}

  public TargetDescriptor(TargetProtocol privateProtocol) {
    this.privateProtocol = privateProtocol;
  }

  public String getDescription() {
    return description;
  }

  public TargetProtocol getPrivateProtocol() {
    return privateProtocol;
  }

  public TargetProtocol getPublicProtocol() {
    return publicProtocol;
  }

  public String getRegion() {
    return region;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public void setPrivateProtocol(TargetProtocol privateProtocol) {
    this.privateProtocol = privateProtocol;
  }

  public void setPublicProtocol(TargetProtocol publicProtocol) {
    this.publicProtocol = publicProtocol;
  }

  public void setRegion(String region) {
    this.region = region;
  }
}

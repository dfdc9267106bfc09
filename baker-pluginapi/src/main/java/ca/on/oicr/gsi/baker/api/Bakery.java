package ca.on.oicr.gsi.baker.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.Map;

/** A compute and storage provider that recipes can be run on */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Bakery {
  private Cluster cluster;
  private String region;
  private Map<String, TargetDescriptor> targets = Collections.emptyMap();

  public Cluster getCluster() {
    return cluster;
  }

  public String getRegion() {
    return region;
  }

  public Map<String, TargetDescriptor> getTargets() {
    return targets;
  }

  public void setCluster(Cluster cluster) {
    this.cluster = cluster;
  }

  public void setRegion(String region) {
    this.region = region;
  }

  public void setTargets(Map<String, TargetDescriptor> targets) {
    this.targets = targets;
  }
}

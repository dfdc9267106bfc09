package ca.on.oicr.gsi.baker.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Optional;

/** The bakery and target a manifest asks to run on */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RecipeBakery {
  private String id;
  private Resources resources;
  private String target;

  public RecipeBakery() {}

  public RecipeBakery(String id, String target, Resources resources) {
    this.id = id;
    this.target = target;
    this.resources = resources;
  }

  public String getId() {
    return id;
  }

  public Optional<Resources> getResources() {
    return Optional.ofNullable(resources);
  }

  public String getTarget() {
    return target;
  }

  public void setId(String id) {
    this.id = id;
  }

  public void setResources(Resources resources) {
    this.resources = resources;
  }

  public void setTarget(String target) {
    this.target = target;
  }
}

package ca.on.oicr.gsi.baker.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.List;

/** A repository's description of its recipes and where they should run */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RecipeManifest {
  private RecipeBakery bakery;
  private String description;
  private JsonNode maintainers;

  @JsonProperty("pangeo_forge_version")
  private String pangeoForgeVersion;

  @JsonProperty("pangeo_notebook_version")
  private String pangeoNotebookVersion;

  private JsonNode provenance;
  private List<RecipeEntry> recipes = Collections.emptyList();
  private String title;

  public RecipeBakery getBakery() {
    return bakery;
  }

  public String getDescription() {
    return description;
  }

  public JsonNode getMaintainers() {
    return maintainers;
  }

  public String getPangeoForgeVersion() {
    return pangeoForgeVersion;
  }

  public String getPangeoNotebookVersion() {
    return pangeoNotebookVersion;
  }

  public JsonNode getProvenance() {
    return provenance;
  }

  public List<RecipeEntry> getRecipes() {
    return recipes;
  }

  public String getTitle() {
    return title;
  }

  public void setBakery(RecipeBakery bakery) {
    this.bakery = bakery;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public void setMaintainers(JsonNode maintainers) {
    this.maintainers = maintainers;
  }

  public void setPangeoForgeVersion(String pangeoForgeVersion) {
    this.pangeoForgeVersion = pangeoForgeVersion;
  }

  public void setPangeoNotebookVersion(String pangeoNotebookVersion) {
    this.pangeoNotebookVersion = pangeoNotebookVersion;
  }

  public void setProvenance(JsonNode provenance) {
    this.provenance = provenance;
  }

  public void setRecipes(List<RecipeEntry> recipes) {
    this.recipes = recipes;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  /** The versions the manifest's author developed against; the engine version is never set */
  public Versions versions() {
    return new Versions(pangeoNotebookVersion, pangeoForgeVersion, null);
  }
}

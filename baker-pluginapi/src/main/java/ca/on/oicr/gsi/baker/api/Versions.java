package ca.on.oicr.gsi.baker.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * The toolchain versions one party declares
 *
 * <p>The manifest author, the bakery's cluster, and the runtime performing the registration each
 * declare their own copy. A manifest does not declare an engine version.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Versions {
  @JsonProperty("prefect_version")
  private String engineVersion;

  @JsonProperty("pangeo_notebook_version")
  private String notebookVersion;

  @JsonProperty("pangeo_forge_version")
  private String recipeFrameworkVersion;

  public Versions() {}

  public Versions(String notebookVersion, String recipeFrameworkVersion, String engineVersion) {
    this.notebookVersion = notebookVersion;
    this.recipeFrameworkVersion = recipeFrameworkVersion;
    this.engineVersion = engineVersion;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final var versions = (Versions) o;
    return Objects.equals(engineVersion, versions.engineVersion)
        && Objects.equals(notebookVersion, versions.notebookVersion)
        && Objects.equals(recipeFrameworkVersion, versions.recipeFrameworkVersion);
  }

  public String getEngineVersion() {
    return engineVersion;
  }

  public String getNotebookVersion() {
    return notebookVersion;
  }

  public String getRecipeFrameworkVersion() {
    return recipeFrameworkVersion;
  }

  @Override
  public int hashCode() {
    return Objects.hash(engineVersion, notebookVersion, recipeFrameworkVersion);
  }

  public void setEngineVersion(String engineVersion) {
    this.engineVersion = engineVersion;
  }

  public void setNotebookVersion(String notebookVersion) {
    this.notebookVersion = notebookVersion;
  }

  public void setRecipeFrameworkVersion(String recipeFrameworkVersion) {
    this.recipeFrameworkVersion = recipeFrameworkVersion;
  }

  @Override
  public String toString() {
    return String.format(
        "Versions[notebook=%s, framework=%s, engine=%s]",
        notebookVersion, recipeFrameworkVersion, engineVersion);
  }
}

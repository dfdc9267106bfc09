package ca.on.oicr.gsi.baker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.stream.Stream;

/**
 * A declarative description of a data transformation
 *
 * <p>A recipe knows what it reads and how it breaks the work into tasks, but not where its output
 * goes; the storage slots are filled in from the bakery before it is converted into a job.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = XarrayZarrRecipe.class, name = "xarray-zarr"),
  @JsonSubTypes.Type(value = HdfReferenceRecipe.class, name = "hdf-reference")
})
public abstract sealed class Recipe permits HdfReferenceRecipe, XarrayZarrRecipe {
  /** The name of the logger recipes write their diagnostics to */
  public static final String LOGGER_NAME = "pangeo_forge_recipes";

  static final System.Logger LOGGER = System.getLogger(LOGGER_NAME);

  private CacheTarget inputCache;
  private MetadataTarget metadataCache;
  private OutputTarget target;

  Recipe() {}

  /**
   * Create a reduced copy of this recipe that processes only a few inputs
   *
   * <p>This is used for cheap validation runs. The copy keeps the storage slots of this recipe.
   */
  public abstract Recipe copyPruned();

  /** Copy this recipe's storage slots onto another recipe */
  protected final <R extends Recipe> R copySlotsTo(R other) {
    other.setTarget(target);
    other.setInputCache(inputCache);
    other.setMetadataCache(metadataCache);
    return other;
  }

  @JsonIgnore
  public CacheTarget getInputCache() {
    return inputCache;
  }

  @JsonIgnore
  public MetadataTarget getMetadataCache() {
    return metadataCache;
  }

  @JsonIgnore
  public OutputTarget getTarget() {
    return target;
  }

  /** The kind of this recipe */
  public abstract RecipeKind kind();

  /** Ensure the output target is set before building tasks that write to it */
  protected final OutputTarget requireTarget() {
    if (target == null) {
      throw new IllegalStateException("Recipe has no output target set.");
    }
    return target;
  }

  @JsonIgnore
  public void setInputCache(CacheTarget inputCache) {
    this.inputCache = inputCache;
  }

  @JsonIgnore
  public void setMetadataCache(MetadataTarget metadataCache) {
    this.metadataCache = metadataCache;
  }

  @JsonIgnore
  public void setTarget(OutputTarget target) {
    this.target = target;
  }

  /** Describe the problems with a file pattern, or report that it is missing */
  protected static Stream<String> validatePattern(FilePattern filePattern) {
    return filePattern == null ? Stream.of("Recipe has no file pattern.") : filePattern.validate();
  }

  /**
   * Convert this recipe into an executable job
   *
   * <p>The job only contains tasks; it has no name, storage, run config, or executor yet.
   *
   * @throws IllegalStateException if the output target has not been set
   */
  public abstract PipelineJob toJob();

  /**
   * Check that the definition can be converted into a job
   *
   * @return a description of every problem found; empty if the recipe is usable
   */
  public abstract Stream<String> validate();
}

package ca.on.oicr.gsi.baker.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A recipe declared in a manifest
 *
 * <p>Exactly one of {@link #getObject()} or {@link #getDictObject()} is expected. A dictionary
 * object refers to a family of recipes, each registered under its own identifier; the entry's
 * identifier is then ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RecipeEntry {
  @JsonProperty("dict_object")
  private String dictObject;

  private String id;
  private String object;

  public RecipeEntry() {}

  public RecipeEntry(String id, String object, String dictObject) {
    this.id = id;
    this.object = object;
    this.dictObject = dictObject;
  }

  public String getDictObject() {
    return dictObject;
  }

  public String getId() {
    return id;
  }

  public String getObject() {
    return object;
  }

  /** Whether this entry refers to a family of recipes */
  public boolean isFamily() {
    return dictObject != null && !dictObject.isBlank();
  }

  public void setDictObject(String dictObject) {
    this.dictObject = dictObject;
  }

  public void setId(String id) {
    this.id = id;
  }

  public void setObject(String object) {
    this.object = object;
  }
}

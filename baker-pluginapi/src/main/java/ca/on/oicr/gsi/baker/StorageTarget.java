package ca.on.oicr.gsi.baker;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * A location on a filesystem where a recipe reads or writes data
 *
 * <p>The three kinds of target share the same filesystem and differ only in what the recipe
 * stores there.
 */
public abstract sealed class StorageTarget permits CacheTarget, MetadataTarget, OutputTarget {
  private final FileSystemHandle fileSystem;
  private final String rootPath;

  StorageTarget(FileSystemHandle fileSystem, String rootPath) {
    this.fileSystem = Objects.requireNonNull(fileSystem);
    this.rootPath = Objects.requireNonNull(rootPath);
  }

  @JsonProperty("fs")
  public FileSystemHandle fileSystem() {
    return fileSystem;
  }

  /**
   * The full path of an item under this target
   *
   * @param name the relative name of the item
   */
  public String path(String name) {
    return rootPath + "/" + name;
  }

  @JsonProperty("root_path")
  public String rootPath() {
    return rootPath;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final var that = (StorageTarget) o;
    return fileSystem.equals(that.fileSystem) && rootPath.equals(that.rootPath);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass(), fileSystem, rootPath);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + rootPath + "]";
  }
}

package ca.on.oicr.gsi.baker;

/** Where a recipe caches its inputs before processing them */
public final class CacheTarget extends StorageTarget {
  public CacheTarget(FileSystemHandle fileSystem, String rootPath) {
    super(fileSystem, rootPath);
  }
}

package ca.on.oicr.gsi.baker;

/** Where a recipe keeps bookkeeping metadata about cached inputs */
public final class MetadataTarget extends StorageTarget {
  public MetadataTarget(FileSystemHandle fileSystem, String rootPath) {
    super(fileSystem, rootPath);
  }
}

package ca.on.oicr.gsi.baker;

/** Where a recipe writes its final dataset */
public final class OutputTarget extends StorageTarget {
  public OutputTarget(FileSystemHandle fileSystem, String rootPath) {
    super(fileSystem, rootPath);
  }
}

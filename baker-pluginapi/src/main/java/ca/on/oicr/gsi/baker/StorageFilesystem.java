package ca.on.oicr.gsi.baker;

import java.util.Map;

/** Opens a connection to a blob store that storage targets can be addressed through */
public interface StorageFilesystem {

  /**
   * Open a filesystem
   *
   * <p>This method should not perform any I/O; connections are established lazily by whatever
   * eventually reads and writes the data.
   *
   * @param protocol the protocol tag (<code>s3</code>, <code>abfs</code>)
   * @param options the filesystem options, including credentials
   * @return a handle to the filesystem
   */
  FileSystemHandle open(String protocol, Map<String, Object> options);
}

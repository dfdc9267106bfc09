package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.FileSystemHandle;
import ca.on.oicr.gsi.baker.StorageFilesystem;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Map;

/**
 * Records how to open a blob store without connecting to it
 *
 * <p>The handle is carried inside the registered job and the connection is made by the workers
 * that read and write the data.
 */
public final class DeferredStorageFilesystem implements StorageFilesystem {
  private static final Logger LOGGER = System.getLogger(DeferredStorageFilesystem.class.getName());

  @Override
  public FileSystemHandle open(String protocol, Map<String, Object> options) {
    final var handle = new FileSystemHandle(protocol, options);
    LOGGER.log(Level.DEBUG, "Opened {0}", handle);
    return handle;
  }
}

package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.CacheTarget;
import ca.on.oicr.gsi.baker.FileSystemHandle;
import ca.on.oicr.gsi.baker.MetadataTarget;
import ca.on.oicr.gsi.baker.OutputTarget;
import ca.on.oicr.gsi.baker.Resolution;
import ca.on.oicr.gsi.baker.ResolutionError;
import ca.on.oicr.gsi.baker.Secrets;
import ca.on.oicr.gsi.baker.StorageFilesystem;
import ca.on.oicr.gsi.baker.api.StorageOptions;
import ca.on.oicr.gsi.baker.api.StorageProtocol;
import ca.on.oicr.gsi.baker.api.TargetDescriptor;
import ca.on.oicr.gsi.baker.api.TargetProtocol;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives the output, input cache, and metadata cache locations for a recipe from a bakery's
 * storage target
 *
 * <p>The output is stored at <code>{protocol}://{target}/{namespace}/{recipe}.{extension}</code>
 * and the caches under <code>{protocol}://{target}/{namespace}/{recipe}/cache</code>. Writes
 * always go through the target's private protocol.
 */
public final class TargetResolver {
  private final StorageFilesystem filesystem;

  public TargetResolver(StorageFilesystem filesystem) {
    this.filesystem = filesystem;
  }

  private Resolution<FileSystemHandle> open(
      String targetName, TargetProtocol protocol, Secrets secrets) {
    return StorageProtocol.of(protocol.getProtocol())
        .map(
            storageProtocol ->
                switch (storageProtocol) {
                  case S3 -> openObjectStore(targetName, protocol.getStorageOptions(), secrets);
                  case ABFS -> openBlobStore(targetName, protocol.getStorageOptions(), secrets);
                })
        .orElseGet(
            () ->
                Resolution.failed(
                    ResolutionError.UNSUPPORTED_TARGET,
                    String.format(
                        "Target %s uses unsupported protocol %s.",
                        targetName, protocol.getProtocol())));
  }

  private Resolution<FileSystemHandle> openBlobStore(
      String targetName, StorageOptions options, Secrets secrets) {
    if (options == null || options.getSecret() == null) {
      return Resolution.failed(
          ResolutionError.UNSUPPORTED_TARGET,
          String.format("Target %s does not name a connection string secret.", targetName));
    }
    return secrets
        .get(options.getSecret())
        .map(
            connectionString ->
                filesystem.open(
                    StorageProtocol.ABFS.scheme(), Map.of("connection_string", connectionString)));
  }

  private Resolution<FileSystemHandle> openObjectStore(
      String targetName, StorageOptions options, Secrets secrets) {
    if (options == null || options.getKey() == null || options.getSecret() == null) {
      return Resolution.failed(
          ResolutionError.UNSUPPORTED_TARGET,
          String.format("Target %s does not name a key and secret.", targetName));
    }
    return secrets
        .get(options.getKey())
        .then(
            key ->
                secrets
                    .get(options.getSecret())
                    .map(
                        secret -> {
                          final var fsOptions = new LinkedHashMap<String, Object>();
                          fsOptions.put("anon", false);
                          fsOptions.put("default_cache_type", "none");
                          fsOptions.put("default_fill_cache", false);
                          fsOptions.put("key", key);
                          fsOptions.put("secret", secret);
                          return filesystem.open(StorageProtocol.S3.scheme(), fsOptions);
                        }));
  }

  /**
   * Resolve the storage locations for a recipe
   *
   * @param targetName the name of the target in the bakery, used as the bucket or container
   * @param descriptor the bakery's description of the target
   * @param namespace the path under the target shared by all of a repository's recipes
   * @param recipeId the identifier of the recipe
   * @param extension the file extension of the recipe's output
   * @param secrets the credentials to open the filesystem with
   */
  public Resolution<Targets> resolve(
      String targetName,
      TargetDescriptor descriptor,
      String namespace,
      String recipeId,
      String extension,
      Secrets secrets) {
    final var protocol = descriptor.getPrivateProtocol();
    if (protocol == null) {
      return Resolution.failed(
          ResolutionError.UNSUPPORTED_TARGET,
          String.format("Target %s has no private protocol.", targetName));
    }
    return open(targetName, protocol, secrets)
        .map(
            handle -> {
              final var root = handle.url(targetName, namespace + "/" + recipeId);
              return new Targets(
                  new OutputTarget(handle, root + "." + extension),
                  new CacheTarget(handle, root + "/cache"),
                  new MetadataTarget(handle, root + "/cache/metadata"));
            });
  }
}

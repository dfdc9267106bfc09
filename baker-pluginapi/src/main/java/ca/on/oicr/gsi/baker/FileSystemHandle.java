package ca.on.oicr.gsi.baker;

import java.util.Map;
import java.util.Set;

/**
 * A connection to a blob store
 *
 * @param protocol the URL scheme of the store
 * @param options the options used to open the store, including credentials
 */
public record FileSystemHandle(String protocol, Map<String, Object> options) {
  private static final Set<String> SENSITIVE =
      Set.of("key", "secret", "connection_string", "aws_secret_access_key");

  public FileSystemHandle {
    options = Map.copyOf(options);
  }

  /**
   * Build a fully qualified URL on this filesystem
   *
   * @param bucket the bucket or container
   * @param path the path inside the bucket
   */
  public String url(String bucket, String path) {
    return String.format("%s://%s/%s", protocol, bucket, path);
  }

  @Override
  public String toString() {
    final var builder = new StringBuilder("FileSystemHandle[").append(protocol);
    options.keySet().stream()
        .sorted()
        .forEach(
            key ->
                builder
                    .append(", ")
                    .append(key)
                    .append("=")
                    .append(SENSITIVE.contains(key) ? "****" : options.get(key)));
    return builder.append("]").toString();
  }
}

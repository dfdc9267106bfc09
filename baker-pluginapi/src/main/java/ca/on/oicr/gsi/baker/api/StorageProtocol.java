package ca.on.oicr.gsi.baker.api;

import java.util.Optional;
import java.util.stream.Stream;

/** The blob store protocols a bakery can use for targets and job storage */
public enum StorageProtocol {
  /** An object store authenticated with an access key and secret */
  S3("s3"),
  /** A blob store authenticated with a single connection string */
  ABFS("abfs");

  /**
   * Find the protocol for a name used in bakery files
   *
   * @param name the name, as written in the bakery file
   * @return the matching protocol, or empty if no such protocol exists
   */
  public static Optional<StorageProtocol> of(String name) {
    return Stream.of(values()).filter(protocol -> protocol.scheme.equals(name)).findFirst();
  }

  private final String scheme;

  StorageProtocol(String scheme) {
    this.scheme = scheme;
  }

  /** The URL scheme and the name used in bakery files */
  public String scheme() {
    return scheme;
  }
}

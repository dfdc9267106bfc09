package ca.on.oicr.gsi.baker;

import java.util.Map;

/**
 * Job definitions stored in an object store bucket
 *
 * @param bucket the bucket name
 * @param clientOptions the access key and secret used by the client
 */
public record S3FlowStorage(String bucket, Map<String, String> clientOptions)
    implements FlowStorage {
  @Override
  public String location() {
    return bucket;
  }

  @Override
  public String toString() {
    return "S3FlowStorage[" + bucket + "]";
  }
}

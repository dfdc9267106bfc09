package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.AzureFlowStorage;
import ca.on.oicr.gsi.baker.FlowStorage;
import ca.on.oicr.gsi.baker.Resolution;
import ca.on.oicr.gsi.baker.ResolutionError;
import ca.on.oicr.gsi.baker.S3FlowStorage;
import ca.on.oicr.gsi.baker.Secrets;
import ca.on.oicr.gsi.baker.api.Cluster;
import ca.on.oicr.gsi.baker.api.StorageOptions;
import ca.on.oicr.gsi.baker.api.StorageProtocol;
import java.util.Map;

/** Determines where the workflow engine stores a job's definition for a cluster */
public final class FlowStorageResolver {

  /**
   * Resolve the flow storage for a cluster
   *
   * @param cluster the bakery's cluster
   * @param secrets the credentials for the storage
   */
  public Resolution<FlowStorage> resolve(Cluster cluster, Secrets secrets) {
    final var options =
        cluster.getFlowStorageOptions() == null
            ? new StorageOptions()
            : cluster.getFlowStorageOptions();
    return StorageProtocol.of(cluster.getFlowStorageProtocol())
        .map(
            protocol ->
                switch (protocol) {
                  case S3 -> secrets
                      .get(options.getKey())
                      .then(
                          key ->
                              secrets
                                  .get(options.getSecret())
                                  .<FlowStorage>map(
                                      secret ->
                                          new S3FlowStorage(
                                              cluster.getFlowStorage(),
                                              Map.of(
                                                  "aws_access_key_id",
                                                  key,
                                                  "aws_secret_access_key",
                                                  secret))));
                  case ABFS -> secrets
                      .get(options.getSecret())
                      .<FlowStorage>map(
                          connectionString ->
                              new AzureFlowStorage(cluster.getFlowStorage(), connectionString));
                })
        .orElseGet(
            () ->
                Resolution.failed(
                    ResolutionError.UNSUPPORTED_FLOW_STORAGE,
                    String.format(
                        "Flow storage protocol %s is not supported.",
                        cluster.getFlowStorageProtocol())));
  }
}

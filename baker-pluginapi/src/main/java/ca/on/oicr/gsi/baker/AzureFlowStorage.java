package ca.on.oicr.gsi.baker;

/**
 * Job definitions stored in a blob container addressed by a connection string
 *
 * @param container the container name
 * @param connectionString the connection string, including credentials
 */
public record AzureFlowStorage(String container, String connectionString) implements FlowStorage {
  @Override
  public String location() {
    return container;
  }

  @Override
  public String toString() {
    return "AzureFlowStorage[" + container + "]";
  }
}

package ca.on.oicr.gsi.baker.api;

import java.util.Optional;
import java.util.stream.Stream;

/** The kinds of compute cluster a bakery can provide */
public enum ClusterType {
  /** Serverless containers started on demand */
  FARGATE("aws.fargate"),
  /** Pods in a managed container orchestrator */
  AKS("azure.aks");

  /**
   * Find the cluster type for a name used in bakery files
   *
   * @param name the name, as written in the bakery file
   * @return the matching type, or empty if no such type exists
   */
  public static Optional<ClusterType> of(String name) {
    return Stream.of(values()).filter(type -> type.typeName.equals(name)).findFirst();
  }

  private final String typeName;

  ClusterType(String typeName) {
    this.typeName = typeName;
  }

  /** The name used in bakery files */
  public String typeName() {
    return typeName;
  }
}

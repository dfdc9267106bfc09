package ca.on.oicr.gsi.baker;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A read-only table of credentials, looked up by name
 *
 * <p>Bakery and cluster descriptors only ever refer to credentials by name; the values come from
 * this table, which is supplied by the caller and shared, unchanged, across an entire batch.
 */
public final class Secrets {
  private static final Secrets EMPTY = new Secrets(Map.of());

  public static Secrets empty() {
    return EMPTY;
  }

  public static Secrets of(Map<String, String> values) {
    return new Secrets(Map.copyOf(values));
  }

  private final Map<String, String> values;

  private Secrets(Map<String, String> values) {
    this.values = values;
  }

  /**
   * Find a credential
   *
   * @param name the name of the credential
   * @return the credential or a {@link ResolutionError#MISSING_SECRET} failure
   */
  public Resolution<String> get(String name) {
    if (name == null) {
      return Resolution.failed(ResolutionError.MISSING_SECRET, "No secret name provided.");
    }
    final var value = values.get(name);
    return value == null
        ? Resolution.failed(
            ResolutionError.MISSING_SECRET, String.format("Secret %s is not defined.", name))
        : Resolution.resolved(value);
  }

  /** The names of all available credentials */
  public Set<String> names() {
    return new TreeSet<>(values.keySet());
  }

  @Override
  public String toString() {
    return "Secrets" + names();
  }
}

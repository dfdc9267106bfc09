package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.Resolution;
import ca.on.oicr.gsi.baker.ResolutionError;
import ca.on.oicr.gsi.baker.api.Versions;
import java.util.Objects;
import java.util.function.Function;

/**
 * Checks that the manifest, the bakery's cluster, and the registering runtime agree on toolchain
 * versions
 *
 * <p>The comparisons are made in a fixed order and the first disagreement is reported. Nothing is
 * resolved or registered for a manifest that fails this check.
 */
public final class VersionGate {
  private record Comparison(
      ResolutionError error,
      Function<Versions, String> getter,
      String label,
      boolean againstCluster,
      boolean fromManifest) {}

  private static final Comparison[] COMPARISONS = {
    new Comparison(
        ResolutionError.NOTEBOOK_VERSION_MISMATCH,
        Versions::getNotebookVersion,
        "notebook",
        false,
        true),
    new Comparison(
        ResolutionError.NOTEBOOK_VERSION_MISMATCH,
        Versions::getNotebookVersion,
        "notebook",
        true,
        true),
    new Comparison(
        ResolutionError.RECIPE_FRAMEWORK_VERSION_MISMATCH,
        Versions::getRecipeFrameworkVersion,
        "recipe framework",
        false,
        true),
    new Comparison(
        ResolutionError.RECIPE_FRAMEWORK_VERSION_MISMATCH,
        Versions::getRecipeFrameworkVersion,
        "recipe framework",
        true,
        true),
    new Comparison(
        ResolutionError.ENGINE_VERSION_MISMATCH, Versions::getEngineVersion, "engine", false, false)
  };

  /**
   * Compare all three sets of versions
   *
   * @param manifest the versions the recipe was written against
   * @param cluster the versions the bakery's cluster images provide
   * @param runtime the versions of the registering process
   * @return the cluster's versions if everything agrees, or the first mismatch
   */
  public static Resolution<Versions> check(Versions manifest, Versions cluster, Versions runtime) {
    for (final var comparison : COMPARISONS) {
      final var left = comparison.getter().apply(comparison.fromManifest() ? manifest : cluster);
      final var right = comparison.getter().apply(comparison.againstCluster() ? cluster : runtime);
      if (!Objects.equals(left, right)) {
        return Resolution.failed(
            comparison.error(),
            String.format(
                "The %s version %s in the %s does not match %s in the %s.",
                comparison.label(),
                left,
                comparison.fromManifest() ? "recipe manifest" : "cluster",
                right,
                comparison.againstCluster() ? "cluster" : "runtime"));
      }
    }
    return Resolution.resolved(cluster);
  }

  private VersionGate() {}
}

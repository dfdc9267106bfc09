package ca.on.oicr.gsi.baker;

/** The reasons a bakery, recipe or job cannot be resolved */
public enum ResolutionError {
  NOTEBOOK_VERSION_MISMATCH(Category.COMPATIBILITY),
  RECIPE_FRAMEWORK_VERSION_MISMATCH(Category.COMPATIBILITY),
  ENGINE_VERSION_MISMATCH(Category.COMPATIBILITY),
  UNSUPPORTED_TARGET(Category.DISPATCH),
  UNSUPPORTED_CLUSTER_TYPE(Category.DISPATCH),
  INVALID_SCALING(Category.DISPATCH),
  UNSUPPORTED_FLOW_STORAGE(Category.DISPATCH),
  UNSUPPORTED_RECIPE_TYPE(Category.DISPATCH),
  UNKNOWN_BAKERY(Category.LOOKUP),
  UNKNOWN_TARGET(Category.LOOKUP),
  MISSING_SECRET(Category.LOOKUP),
  MISSING_AUTOMATION(Category.LOOKUP),
  UNKNOWN_RECIPE_REFERENCE(Category.LOOKUP),
  INVALID_RECIPE_DEFINITION(Category.LOOKUP),
  ENGINE_FAILURE(Category.EXTERNAL);

  /** Broad groups of failures */
  public enum Category {
    /** The versions declared by the manifest, the cluster, and the runtime disagree */
    COMPATIBILITY,
    /** A protocol or type tag has no matching implementation */
    DISPATCH,
    /** A named bakery, target, secret, or recipe does not exist or is unusable */
    LOOKUP,
    /** The workflow engine or another external service failed */
    EXTERNAL
  }

  private final Category category;

  ResolutionError(Category category) {
    this.category = category;
  }

  public Category category() {
    return category;
  }
}

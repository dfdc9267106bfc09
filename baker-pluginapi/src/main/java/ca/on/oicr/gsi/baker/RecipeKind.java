package ca.on.oicr.gsi.baker;

/** The kinds of recipe that can be described */
public enum RecipeKind {
  /** Combines many input files into a single chunked array store */
  XARRAY_ZARR,
  /** Builds a reference index over existing hierarchical data files */
  HDF_REFERENCE
}

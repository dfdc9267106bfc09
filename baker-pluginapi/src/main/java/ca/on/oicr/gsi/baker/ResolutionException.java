package ca.on.oicr.gsi.baker;

/** A failed {@link Resolution} converted into an exception */
public final class ResolutionException extends RuntimeException {
  private final ResolutionError error;

  public ResolutionException(ResolutionError error, String message) {
    super(String.format("%s: %s", error, message));
    this.error = error;
  }

  /** The kind of failure */
  public ResolutionError error() {
    return error;
  }
}

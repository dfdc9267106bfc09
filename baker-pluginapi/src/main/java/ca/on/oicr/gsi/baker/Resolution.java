package ca.on.oicr.gsi.baker;

import java.util.Optional;
import java.util.function.Function;

/**
 * The outcome of resolving part of a bakery or recipe description into something concrete
 *
 * <p>Resolvers report unsupported or missing configuration through this type instead of throwing,
 * so that the registration loop can stop at the first failure and report exactly what went wrong.
 *
 * @param <T> the type of the resolved value
 */
public abstract sealed class Resolution<T> permits ResolutionSuccess, ResolutionFailure {

  /**
   * Consumes a resolution
   *
   * @param <T> the type of the resolved value
   * @param <R> the type produced by the visitor
   */
  public interface Visitor<T, R> {

    /**
     * The resolution could not be completed
     *
     * @param error the kind of failure
     * @param message a human-readable explanation
     */
    R failed(ResolutionError error, String message);

    /**
     * The resolution completed
     *
     * @param value the resolved value
     */
    R resolved(T value);
  }

  /**
   * Indicate that resolution failed
   *
   * @param error the kind of failure
   * @param message a human-readable explanation
   */
  public static <T> Resolution<T> failed(ResolutionError error, String message) {
    return new ResolutionFailure<>(error, message);
  }

  /**
   * Indicate that resolution succeeded
   *
   * @param value the resolved value
   */
  public static <T> Resolution<T> resolved(T value) {
    return new ResolutionSuccess<>(value);
  }

  Resolution() {}

  /**
   * Check which state the resolution is in
   *
   * @param visitor a consumer of the resolution
   * @return the value produced by the visitor
   */
  public abstract <R> R apply(Visitor<? super T, R> visitor);

  /** The kind of failure, if this resolution failed */
  public abstract Optional<ResolutionError> error();

  /** Whether a value was resolved */
  public abstract boolean isResolved();

  /**
   * Transform the resolved value, if any
   *
   * @param transformer the function to apply to a resolved value
   */
  public abstract <R> Resolution<R> map(Function<? super T, ? extends R> transformer);

  /**
   * Get the resolved value or throw the failure as a {@link ResolutionException}
   *
   * @throws ResolutionException if resolution failed
   */
  public abstract T orElseThrow();

  /**
   * Continue with another resolution step that depends on the resolved value
   *
   * <p>If this resolution failed, the next step is not performed and the failure is propagated.
   *
   * @param next the next resolution step
   */
  public abstract <R> Resolution<R> then(Function<? super T, Resolution<R>> next);
}

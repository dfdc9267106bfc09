package ca.on.oicr.gsi.baker;

import java.util.Optional;
import java.util.function.Function;

final class ResolutionFailure<T> extends Resolution<T> {
  private final ResolutionError error;
  private final String message;

  ResolutionFailure(ResolutionError error, String message) {
    super();
    this.error = error;
    this.message = message;
  }

  @Override
  public <R> R apply(Visitor<? super T, R> visitor) {
    return visitor.failed(error, message);
  }

  @Override
  public Optional<ResolutionError> error() {
    return Optional.of(error);
  }

  @Override
  public boolean isResolved() {
    return false;
  }

  @Override
  public <R> Resolution<R> map(Function<? super T, ? extends R> transformer) {
    return new ResolutionFailure<>(error, message);
  }

  @Override
  public T orElseThrow() {
    throw new ResolutionException(error, message);
  }

  @Override
  public <R> Resolution<R> then(Function<? super T, Resolution<R>> next) {
    return new ResolutionFailure<>(error, message);
  }

  @Override
  public String toString() {
    return "Failed[" + error + ": " + message + "]";
  }
}

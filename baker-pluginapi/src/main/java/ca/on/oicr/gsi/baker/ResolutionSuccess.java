package ca.on.oicr.gsi.baker;

import java.util.Optional;
import java.util.function.Function;

final class ResolutionSuccess<T> extends Resolution<T> {
  private final T value;

  ResolutionSuccess(T value) {
    super();
    this.value = value;
  }

  @Override
  public <R> R apply(Visitor<? super T, R> visitor) {
    return visitor.resolved(value);
  }

  @Override
  public Optional<ResolutionError> error() {
    return Optional.empty();
  }

  @Override
  public boolean isResolved() {
    return true;
  }

  @Override
  public <R> Resolution<R> map(Function<? super T, ? extends R> transformer) {
    return new ResolutionSuccess<>(transformer.apply(value));
  }

  @Override
  public T orElseThrow() {
    return value;
  }

  @Override
  public <R> Resolution<R> then(Function<? super T, Resolution<R>> next) {
    return next.apply(value);
  }

  @Override
  public String toString() {
    return "Resolved[" + value + "]";
  }
}

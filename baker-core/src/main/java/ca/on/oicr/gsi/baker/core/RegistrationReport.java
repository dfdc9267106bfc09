package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.ResolutionError;
import java.util.List;
import java.util.Optional;

/**
 * The outcome of registering a manifest's recipes
 *
 * <p>Registration stops at the first failure. Jobs registered before the failure stay registered
 * and are listed here.
 */
public final class RegistrationReport {
  /**
   * Why a batch stopped
   *
   * @param error the kind of failure
   * @param message a human-readable explanation
   */
  public record Failure(ResolutionError error, String message) {}

  static RegistrationReport failed(
      List<RegisteredJob> registered, ResolutionError error, String message) {
    return new RegistrationReport(registered, Optional.of(new Failure(error, message)));
  }

  static RegistrationReport succeeded(List<RegisteredJob> registered) {
    return new RegistrationReport(registered, Optional.empty());
  }

  private final Optional<Failure> failure;
  private final List<RegisteredJob> registered;

  private RegistrationReport(List<RegisteredJob> registered, Optional<Failure> failure) {
    this.registered = List.copyOf(registered);
    this.failure = failure;
  }

  /** The reason the batch stopped early, if it did */
  public Optional<Failure> failure() {
    return failure;
  }

  /** Whether every recipe was registered */
  public boolean isSuccessful() {
    return failure.isEmpty();
  }

  /** The jobs that were registered, in order */
  public List<RegisteredJob> registered() {
    return registered;
  }
}

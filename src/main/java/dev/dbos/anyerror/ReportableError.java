package dev.dbos.anyerror;

import dev.dbos.anyerror.capture.TypeNames;

import java.util.Optional;

/**
 * The minimal capability an error needs in order to be captured: a human-readable message and an
 * optional reference to the error that caused it.
 *
 * <p>Implementations are read, never modified, by capture. {@link AnyError} implements this
 * interface itself, so a captured error can be handed to anything written against it.
 */
public interface ReportableError {

  /** The rendered, human-readable description of this error. */
  String message();

  /** The error that caused this one, or empty if this is the root cause. */
  Optional<? extends ReportableError> cause();

  /**
   * A stable label identifying the declared type of this error. Used for diagnostics only. Defaults
   * to the standardized name of the runtime class.
   */
  default String typeLabel() {
    return TypeNames.standardizedName(getClass());
  }

  /** Adapts a {@link Throwable} and its {@code getCause()} chain to this capability. */
  static ReportableError of(Throwable throwable) {
    return new ThrowableError(throwable);
  }
}

package dev.dbos.anyerror;

import dev.dbos.anyerror.capture.TypeNames;
import dev.dbos.anyerror.exceptions.CapturedException;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link ReportableError} view of a {@link Throwable}. A {@link CapturedException} keeps the type
 * label it was created with, so rethrown snapshots capture back to the same labels.
 */
final class ThrowableError implements ReportableError {
  private final Throwable throwable;

  ThrowableError(Throwable throwable) {
    this.throwable = Objects.requireNonNull(throwable, "throwable must not be null");
  }

  @Override
  public String message() {
    String message = throwable.getMessage();
    return message == null ? "" : message;
  }

  @Override
  public Optional<ThrowableError> cause() {
    Throwable cause = throwable.getCause();
    return cause == null ? Optional.empty() : Optional.of(new ThrowableError(cause));
  }

  @Override
  public String typeLabel() {
    if (throwable instanceof CapturedException ce) {
      return ce.typeLabel();
    }
    return TypeNames.standardizedName(throwable.getClass());
  }
}

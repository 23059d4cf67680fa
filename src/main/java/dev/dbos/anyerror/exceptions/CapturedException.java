package dev.dbos.anyerror.exceptions;

import dev.dbos.anyerror.snapshot.ErrorSnapshot;

import java.util.List;

/**
 * {@code CapturedException} rethrows a captured error chain as Java exceptions. Each level of the
 * snapshot becomes one exception whose {@code getCause()} is the next level. The original type
 * survives only as {@link #typeLabel()}; no stack trace is recorded.
 */
public class CapturedException extends RuntimeException {
  private final String typeLabel;

  private CapturedException(String typeLabel, String message, CapturedException cause) {
    super(message, cause, true, false);
    this.typeLabel = typeLabel;
  }

  public static CapturedException fromSnapshot(ErrorSnapshot snapshot) {
    List<ErrorSnapshot> chain = snapshot.chain();
    CapturedException result = null;
    for (int i = chain.size() - 1; i >= 0; i--) {
      ErrorSnapshot level = chain.get(i);
      result = new CapturedException(level.typeLabel(), level.message(), result);
    }
    return result;
  }

  /** The type label of the error this exception stands in for */
  public String typeLabel() {
    return typeLabel;
  }

  @Override
  public String toString() {
    return typeLabel + ": " + getMessage();
  }
}

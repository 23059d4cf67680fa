package dev.dbos.anyerror.snapshot;

import dev.dbos.anyerror.Constants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Immutable capture of one error and, through {@code cause}, of every error beneath it. A snapshot
 * holds no reference to the error it was taken from.
 *
 * <p>A chain holds at most {@link Constants#MAX_ALLOWED_CAUSE_DEPTH} snapshots, the largest depth
 * any configuration can capture or read back.
 *
 * @param typeLabel standardized name of the original error's type, for diagnostics only
 * @param message the message rendered when the snapshot was taken, possibly empty
 * @param cause the next error in the chain, or null for the root cause
 */
public record ErrorSnapshot(String typeLabel, String message, @Nullable ErrorSnapshot cause) {

  public ErrorSnapshot {
    Objects.requireNonNull(typeLabel, "ErrorSnapshot.typeLabel must not be null");
    Objects.requireNonNull(message, "ErrorSnapshot.message must not be null");
    if (cause != null && cause.chainLength() >= Constants.MAX_ALLOWED_CAUSE_DEPTH) {
      throw new IllegalArgumentException(
          String.format(
              "ErrorSnapshot chain must not exceed %d levels", Constants.MAX_ALLOWED_CAUSE_DEPTH));
    }
  }

  public ErrorSnapshot(String typeLabel, String message) {
    this(typeLabel, message, null);
  }

  public boolean hasCause() {
    return cause != null;
  }

  /** Number of nodes in the chain, this one included. */
  public int chainLength() {
    int length = 0;
    for (ErrorSnapshot s = this; s != null; s = s.cause) {
      length++;
    }
    return length;
  }

  /** The innermost snapshot of the chain; {@code this} when there is no cause. */
  public ErrorSnapshot rootCause() {
    ErrorSnapshot s = this;
    while (s.cause != null) {
      s = s.cause;
    }
    return s;
  }

  /** The chain from this snapshot down to the root cause. */
  public List<ErrorSnapshot> chain() {
    List<ErrorSnapshot> chain = new ArrayList<>();
    for (ErrorSnapshot s = this; s != null; s = s.cause) {
      chain.add(s);
    }
    return Collections.unmodifiableList(chain);
  }
}

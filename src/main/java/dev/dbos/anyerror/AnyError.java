package dev.dbos.anyerror;

import dev.dbos.anyerror.capture.ErrorCapture;
import dev.dbos.anyerror.config.AnyErrorConfig;
import dev.dbos.anyerror.exceptions.CapturedException;
import dev.dbos.anyerror.json.ErrorSnapshotCodec;
import dev.dbos.anyerror.snapshot.ErrorSnapshot;

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Serializable container for a captured error of any type.
 *
 * <p>Code that boxes a foreign error into its own error type calls {@link #from(ReportableError)}
 * or {@link #from(Throwable)} exactly once, at the point the error is wrapped:
 *
 * <pre>{@code
 * } catch (SQLException e) {
 *   throw new UserServiceException.Database(AnyError.from(e));
 * }
 * }</pre>
 *
 * <p>An {@code AnyError} is itself a {@link ReportableError}: its message, type label and cause
 * chain are those of the captured error, and capturing it again yields an equal value. Through
 * Jackson it reads and writes the flat payload of {@link ErrorSnapshotCodec}, so it can be a field
 * of any Jackson-serialized type. Reading back accepts chains up to {@link
 * Constants#MAX_ALLOWED_CAUSE_DEPTH}, so every {@code AnyError} reads back its own JSON.
 */
public final class AnyError implements ReportableError {
  // accepts every chain a snapshot can hold, whatever cap it was captured with
  private static final ErrorSnapshotCodec JSON_CODEC =
      new ErrorSnapshotCodec(
          AnyErrorConfig.defaults().withMaxCauseDepth(Constants.MAX_ALLOWED_CAUSE_DEPTH));

  private final ErrorSnapshot snapshot;

  private AnyError(ErrorSnapshot snapshot) {
    this.snapshot = Objects.requireNonNull(snapshot, "snapshot must not be null");
  }

  public static AnyError of(ErrorSnapshot snapshot) {
    return new AnyError(snapshot);
  }

  public static AnyError from(ReportableError error) {
    return new AnyError(ErrorCapture.defaultCapture().capture(error));
  }

  public static AnyError from(Throwable throwable) {
    return new AnyError(ErrorCapture.defaultCapture().capture(throwable));
  }

  /** Capture with a non-default configuration. */
  public static AnyError from(ReportableError error, ErrorCapture capture) {
    return new AnyError(capture.capture(error));
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  static AnyError fromJson(JsonNode payload) {
    return new AnyError(JSON_CODEC.fromTree(payload));
  }

  @JsonValue
  ObjectNode toJson() {
    return JSON_CODEC.toTree(snapshot);
  }

  public ErrorSnapshot snapshot() {
    return snapshot;
  }

  @Override
  public String message() {
    return snapshot.message();
  }

  @Override
  public String typeLabel() {
    return snapshot.typeLabel();
  }

  @Override
  public Optional<AnyError> cause() {
    return Optional.ofNullable(snapshot.cause()).map(AnyError::new);
  }

  /** Rethrowable form of this error; see {@link CapturedException}. */
  public CapturedException toException() {
    return CapturedException.fromSnapshot(snapshot);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof AnyError other)) return false;
    return snapshot.equals(other.snapshot);
  }

  @Override
  public int hashCode() {
    return snapshot.hashCode();
  }

  /** {@code type: message(type: message(...))}, one parenthesized group per cause. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    int open = 0;
    for (ErrorSnapshot s = snapshot; s != null; s = s.cause()) {
      if (s != snapshot) {
        sb.append('(');
        open++;
      }
      sb.append(s.typeLabel()).append(": ").append(s.message());
    }
    sb.append(")".repeat(open));
    return sb.toString();
  }
}

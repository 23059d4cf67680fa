package dev.dbos.anyerror.exceptions;

/**
 * {@code MalformedPayloadException} is thrown when a serialized snapshot does not match the
 * snapshot schema. The exception identifies what was wrong and at which nesting level, where 0 is
 * the outermost error. Nothing is returned for a malformed payload, not even the valid outer
 * levels.
 */
public class MalformedPayloadException extends RuntimeException {

  public enum Kind {
    /** The payload, or a nested cause, is not an object. */
    NOT_AN_OBJECT,
    /** A required field is absent or null. */
    MISSING_FIELD,
    /** A required field has the wrong JSON type. */
    WRONG_KIND,
    /** The cause field is neither null nor an object. */
    INVALID_CAUSE,
    /** The payload nests more levels than the configured maximum cause depth. */
    TOO_DEEP,
    /** The text could not be parsed as JSON. */
    UNPARSEABLE
  }

  private final Kind kind;
  private final int depth;
  private final String field;

  public MalformedPayloadException(Kind kind, int depth, String field, String detail) {
    super(
        field == null
            ? String.format("Malformed error payload (%s) at depth %d: %s", kind, depth, detail)
            : String.format(
                "Malformed error payload (%s) at depth %d, field '%s': %s",
                kind, depth, field, detail));
    this.kind = kind;
    this.depth = depth;
    this.field = field;
  }

  public MalformedPayloadException(String detail, Throwable cause) {
    super(String.format("Malformed error payload (%s): %s", Kind.UNPARSEABLE, detail), cause);
    this.kind = Kind.UNPARSEABLE;
    this.depth = 0;
    this.field = null;
  }

  /** The classification of the malformation */
  public Kind kind() {
    return kind;
  }

  /** The nesting level at which the problem was found; 0 is the outermost error */
  public int depth() {
    return depth;
  }

  /** The offending field name in the payload's own vocabulary, or null if not field specific */
  public String field() {
    return field;
  }
}

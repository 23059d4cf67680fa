package dev.dbos.anyerror.json;

import dev.dbos.anyerror.config.AnyErrorConfig;
import dev.dbos.anyerror.exceptions.MalformedPayloadException;
import dev.dbos.anyerror.exceptions.MalformedPayloadException.Kind;
import dev.dbos.anyerror.snapshot.ErrorSnapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Maps snapshots to and from the flat error payload:
 *
 * <pre>
 * { "type_label": string, "message": string, "cause": payload | null }
 * </pre>
 *
 * <p>The three field names are the stable wire contract. Fields are always written in that order
 * and the root cause is written with {@code "cause": null}. Reading accepts an absent {@code cause}
 * as well, and ignores unknown fields. Payloads nesting more levels than {@link
 * AnyErrorConfig#maxCauseDepth()} are rejected, the same bound capture applies.
 */
public final class ErrorSnapshotCodec {

  public static final String TYPE_LABEL = "type_label";
  public static final String MESSAGE = "message";
  public static final String CAUSE = "cause";

  private static final ErrorSnapshotCodec DEFAULT =
      new ErrorSnapshotCodec(AnyErrorConfig.defaults());

  private final int maxCauseDepth;

  public ErrorSnapshotCodec(AnyErrorConfig config) {
    this.maxCauseDepth = Objects.requireNonNull(config, "config must not be null").maxCauseDepth();
  }

  public static ErrorSnapshotCodec defaultCodec() {
    return DEFAULT;
  }

  public ObjectNode toTree(ErrorSnapshot snapshot) {
    List<ErrorSnapshot> chain = snapshot.chain();
    ObjectNode result = null;
    for (int i = chain.size() - 1; i >= 0; i--) {
      ErrorSnapshot level = chain.get(i);
      ObjectNode node = JSONUtil.mapper().createObjectNode();
      node.put(TYPE_LABEL, level.typeLabel());
      node.put(MESSAGE, level.message());
      if (result == null) {
        node.putNull(CAUSE);
      } else {
        node.set(CAUSE, result);
      }
      result = node;
    }
    return result;
  }

  /** The flat payload as nested, insertion-ordered maps. */
  public Map<String, Object> toMap(ErrorSnapshot snapshot) {
    List<ErrorSnapshot> chain = snapshot.chain();
    Map<String, Object> result = null;
    for (int i = chain.size() - 1; i >= 0; i--) {
      ErrorSnapshot level = chain.get(i);
      Map<String, Object> map = new LinkedHashMap<>();
      map.put(TYPE_LABEL, level.typeLabel());
      map.put(MESSAGE, level.message());
      map.put(CAUSE, result);
      result = map;
    }
    return result;
  }

  public ErrorSnapshot fromTree(JsonNode payload) {
    List<String> typeLabels = new ArrayList<>();
    List<String> messages = new ArrayList<>();

    JsonNode node = payload;
    int depth = 0;
    while (true) {
      if (node == null || !node.isObject()) {
        throw new MalformedPayloadException(
            Kind.NOT_AN_OBJECT, depth, null, "expected an object but found " + describe(node));
      }
      if (depth >= maxCauseDepth) {
        throw new MalformedPayloadException(
            Kind.TOO_DEEP,
            depth,
            CAUSE,
            String.format("cause chain is longer than %d levels", maxCauseDepth));
      }
      typeLabels.add(requiredText(node, TYPE_LABEL, depth));
      messages.add(requiredText(node, MESSAGE, depth));

      JsonNode cause = node.get(CAUSE);
      if (cause == null || cause.isNull()) {
        break;
      }
      if (!cause.isObject()) {
        throw new MalformedPayloadException(
            Kind.INVALID_CAUSE,
            depth,
            CAUSE,
            "expected an object or null but found " + describe(cause));
      }
      node = cause;
      depth++;
    }

    ErrorSnapshot snapshot = null;
    for (int i = typeLabels.size() - 1; i >= 0; i--) {
      snapshot = new ErrorSnapshot(typeLabels.get(i), messages.get(i), snapshot);
    }
    return snapshot;
  }

  /**
   * Reads a payload given as nested maps, such as one produced by {@link #toMap}. The maps are
   * walked level by level under the same depth bound as {@link #fromTree}, so a self-referencing
   * map is reported as {@link Kind#TOO_DEEP}.
   */
  public ErrorSnapshot fromMap(Map<String, ?> payload) {
    List<String> typeLabels = new ArrayList<>();
    List<String> messages = new ArrayList<>();

    Object level = payload;
    int depth = 0;
    while (true) {
      if (!(level instanceof Map<?, ?> map)) {
        throw new MalformedPayloadException(
            Kind.NOT_AN_OBJECT, depth, null, "expected a map but found " + describeValue(level));
      }
      if (depth >= maxCauseDepth) {
        throw new MalformedPayloadException(
            Kind.TOO_DEEP,
            depth,
            CAUSE,
            String.format("cause chain is longer than %d levels", maxCauseDepth));
      }
      typeLabels.add(requiredString(map, TYPE_LABEL, depth));
      messages.add(requiredString(map, MESSAGE, depth));

      Object cause = map.get(CAUSE);
      if (cause == null) {
        break;
      }
      if (!(cause instanceof Map)) {
        throw new MalformedPayloadException(
            Kind.INVALID_CAUSE,
            depth,
            CAUSE,
            "expected a map or null but found " + describeValue(cause));
      }
      level = cause;
      depth++;
    }

    ErrorSnapshot snapshot = null;
    for (int i = typeLabels.size() - 1; i >= 0; i--) {
      snapshot = new ErrorSnapshot(typeLabels.get(i), messages.get(i), snapshot);
    }
    return snapshot;
  }

  private static String requiredString(Map<?, ?> map, String field, int depth) {
    Object value = map.get(field);
    if (value == null) {
      throw new MalformedPayloadException(
          Kind.MISSING_FIELD, depth, field, "required field is absent");
    }
    if (!(value instanceof String text)) {
      throw new MalformedPayloadException(
          Kind.WRONG_KIND, depth, field, "expected a string but found " + describeValue(value));
    }
    return text;
  }

  static String requiredText(JsonNode node, String field, int depth) {
    return requiredText(node, field, field, depth);
  }

  static String requiredText(JsonNode node, String field, String reportedAs, int depth) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new MalformedPayloadException(
          Kind.MISSING_FIELD, depth, reportedAs, "required field is absent");
    }
    if (!value.isTextual()) {
      throw new MalformedPayloadException(
          Kind.WRONG_KIND, depth, reportedAs, "expected a string but found " + describe(value));
    }
    return value.textValue();
  }

  static String describe(JsonNode node) {
    if (node == null || node.isMissingNode()) {
      return "nothing";
    }
    return node.getNodeType().name().toLowerCase(Locale.ROOT);
  }

  private static String describeValue(Object value) {
    if (value == null) {
      return "nothing";
    }
    if (value instanceof CharSequence) {
      return "string";
    }
    if (value instanceof Number) {
      return "number";
    }
    if (value instanceof Boolean) {
      return "boolean";
    }
    if (value instanceof Collection || value.getClass().isArray()) {
      return "array";
    }
    return value.getClass().getSimpleName();
  }
}

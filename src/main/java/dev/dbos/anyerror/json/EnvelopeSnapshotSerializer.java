package dev.dbos.anyerror.json;

import dev.dbos.anyerror.config.AnyErrorConfig;
import dev.dbos.anyerror.exceptions.MalformedPayloadException;
import dev.dbos.anyerror.exceptions.MalformedPayloadException.Kind;
import dev.dbos.anyerror.snapshot.ErrorSnapshot;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Tagged JSON layout used by services that wrap errors in a {@code $type}/{@code context}
 * envelope:
 *
 * <pre>
 * { "$type": string, "context": { "message": string, "innerError": envelope | null } }
 * </pre>
 *
 * <p>Malformed payloads are classified as in {@link ErrorSnapshotCodec}; reported field names use
 * the envelope's own vocabulary, e.g. {@code context.innerError}.
 */
public class EnvelopeSnapshotSerializer implements SnapshotSerializer {

  public static final String NAME = "anyerror_envelope";

  public static final String TYPE = "$type";
  public static final String CONTEXT = "context";
  public static final String MESSAGE = "message";
  public static final String INNER_ERROR = "innerError";

  private final int maxCauseDepth;

  public EnvelopeSnapshotSerializer(AnyErrorConfig config) {
    this.maxCauseDepth = config.maxCauseDepth();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String stringify(ErrorSnapshot snapshot) {
    return JSONUtil.toJson(toTree(snapshot));
  }

  @Override
  public ErrorSnapshot parse(String text) {
    if (text == null) {
      return null;
    }
    return fromTree(JSONUtil.readPayload(text));
  }

  public ObjectNode toTree(ErrorSnapshot snapshot) {
    List<ErrorSnapshot> chain = snapshot.chain();
    ObjectNode result = null;
    for (int i = chain.size() - 1; i >= 0; i--) {
      ErrorSnapshot level = chain.get(i);
      ObjectNode envelope = JSONUtil.mapper().createObjectNode();
      envelope.put(TYPE, level.typeLabel());
      ObjectNode context = envelope.putObject(CONTEXT);
      context.put(MESSAGE, level.message());
      if (result == null) {
        context.putNull(INNER_ERROR);
      } else {
        context.set(INNER_ERROR, result);
      }
      result = envelope;
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
            Kind.NOT_AN_OBJECT,
            depth,
            null,
            "expected an object but found " + ErrorSnapshotCodec.describe(node));
      }
      if (depth >= maxCauseDepth) {
        throw new MalformedPayloadException(
            Kind.TOO_DEEP,
            depth,
            CONTEXT + "." + INNER_ERROR,
            String.format("cause chain is longer than %d levels", maxCauseDepth));
      }
      typeLabels.add(ErrorSnapshotCodec.requiredText(node, TYPE, depth));

      JsonNode context = node.get(CONTEXT);
      if (context == null || context.isNull()) {
        throw new MalformedPayloadException(
            Kind.MISSING_FIELD, depth, CONTEXT, "required field is absent");
      }
      if (!context.isObject()) {
        throw new MalformedPayloadException(
            Kind.WRONG_KIND,
            depth,
            CONTEXT,
            "expected an object but found " + ErrorSnapshotCodec.describe(context));
      }
      messages.add(
          ErrorSnapshotCodec.requiredText(context, MESSAGE, CONTEXT + "." + MESSAGE, depth));

      JsonNode inner = context.get(INNER_ERROR);
      if (inner == null || inner.isNull()) {
        break;
      }
      if (!inner.isObject()) {
        throw new MalformedPayloadException(
            Kind.INVALID_CAUSE,
            depth,
            CONTEXT + "." + INNER_ERROR,
            "expected an object or null but found " + ErrorSnapshotCodec.describe(inner));
      }
      node = inner;
      depth++;
    }

    ErrorSnapshot snapshot = null;
    for (int i = typeLabels.size() - 1; i >= 0; i--) {
      snapshot = new ErrorSnapshot(typeLabels.get(i), messages.get(i), snapshot);
    }
    return snapshot;
  }
}

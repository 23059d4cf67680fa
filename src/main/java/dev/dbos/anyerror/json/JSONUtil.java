package dev.dbos.anyerror.json;

import dev.dbos.anyerror.exceptions.MalformedPayloadException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class JSONUtil {

  private static final ObjectMapper mapper = new ObjectMapper();

  public static class JsonRuntimeException extends RuntimeException {
    public JsonRuntimeException(JsonProcessingException cause) {
      super(cause.getMessage(), cause);
      setStackTrace(cause.getStackTrace());
      for (Throwable suppressed : cause.getSuppressed()) {
        addSuppressed(suppressed);
      }
    }
  }

  static ObjectMapper mapper() {
    return mapper;
  }

  public static String toJson(Object obj) {
    try {
      return mapper.writeValueAsString(obj);
    } catch (JsonProcessingException e) {
      throw new JsonRuntimeException(e);
    }
  }

  /** Parses error payload text; text that is not JSON is reported as a malformed payload. */
  static JsonNode readPayload(String text) {
    try {
      JsonNode node = mapper.readTree(text);
      if (node == null || node.isMissingNode()) {
        throw new MalformedPayloadException(
            MalformedPayloadException.Kind.NOT_AN_OBJECT, 0, null, "payload is empty");
      }
      return node;
    } catch (JsonProcessingException e) {
      throw new MalformedPayloadException(e.getOriginalMessage(), e);
    }
  }
}

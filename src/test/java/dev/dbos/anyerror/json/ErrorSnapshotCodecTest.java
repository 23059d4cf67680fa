package dev.dbos.anyerror.json;

import static org.junit.jupiter.api.Assertions.*;

import dev.dbos.anyerror.Constants;
import dev.dbos.anyerror.TestErrors;
import dev.dbos.anyerror.TestErrors.NestedError;
import dev.dbos.anyerror.TestErrors.SimpleError;
import dev.dbos.anyerror.capture.ErrorCapture;
import dev.dbos.anyerror.config.AnyErrorConfig;
import dev.dbos.anyerror.exceptions.MalformedPayloadException;
import dev.dbos.anyerror.exceptions.MalformedPayloadException.Kind;
import dev.dbos.anyerror.snapshot.ErrorSnapshot;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

@org.junit.jupiter.api.Timeout(value = 2, unit = TimeUnit.MINUTES)
class ErrorSnapshotCodecTest {

  private final ErrorSnapshotCodec codec = ErrorSnapshotCodec.defaultCodec();
  private final ObjectMapper mapper = new ObjectMapper();

  private JsonNode json(String text) throws Exception {
    return mapper.readTree(text);
  }

  @Test
  void serializesTwoLevelChain() throws Exception {
    ErrorSnapshot s =
        ErrorCapture.defaultCapture()
            .capture(new NestedError("outer", new SimpleError("inner")));

    ObjectNode tree = codec.toTree(s);

    JsonNode expected =
        json(
            """
            {
              "type_label": "dev.dbos.anyerror.TestErrors.NestedError",
              "message": "outer",
              "cause": {
                "type_label": "dev.dbos.anyerror.TestErrors.SimpleError",
                "message": "inner",
                "cause": null
              }
            }
            """);
    assertEquals(expected, tree);
    assertEquals(s, codec.fromTree(tree));
  }

  @Test
  void fieldOrderIsFixed() {
    String text = JSONUtil.toJson(codec.toTree(new ErrorSnapshot("T", "m")));
    assertEquals("{\"type_label\":\"T\",\"message\":\"m\",\"cause\":null}", text);
  }

  @Test
  void roundTripsUpToTheCap() {
    for (int length : List.of(1, 2, 7, Constants.DEFAULT_MAX_CAUSE_DEPTH)) {
      ErrorSnapshot s = ErrorCapture.defaultCapture().capture(TestErrors.chainOf(length));
      assertEquals(s, codec.fromTree(codec.toTree(s)));
      assertEquals(s, codec.fromMap(codec.toMap(s)));
    }
  }

  @Test
  void absentCauseIsRootCause() throws Exception {
    ErrorSnapshot s = codec.fromTree(json("{\"type_label\":\"T\",\"message\":\"m\"}"));
    assertEquals(new ErrorSnapshot("T", "m"), s);
  }

  @Test
  void unknownFieldsAreIgnored() throws Exception {
    ErrorSnapshot s =
        codec.fromTree(json("{\"type_label\":\"T\",\"message\":\"m\",\"cause\":null,\"extra\":1}"));
    assertEquals(new ErrorSnapshot("T", "m"), s);
  }

  @Test
  void missingMessageIsRejected() throws Exception {
    var e =
        assertThrows(
            MalformedPayloadException.class, () -> codec.fromTree(json("{\"type_label\":\"T\"}")));
    assertEquals(Kind.MISSING_FIELD, e.kind());
    assertEquals(ErrorSnapshotCodec.MESSAGE, e.field());
    assertEquals(0, e.depth());
  }

  @Test
  void nullTypeLabelIsMissing() throws Exception {
    var e =
        assertThrows(
            MalformedPayloadException.class,
            () -> codec.fromTree(json("{\"type_label\":null,\"message\":\"m\"}")));
    assertEquals(Kind.MISSING_FIELD, e.kind());
    assertEquals(ErrorSnapshotCodec.TYPE_LABEL, e.field());
  }

  @Test
  void nonStringFieldIsWrongKind() throws Exception {
    var e =
        assertThrows(
            MalformedPayloadException.class,
            () -> codec.fromTree(json("{\"type_label\":\"T\",\"message\":42}")));
    assertEquals(Kind.WRONG_KIND, e.kind());
    assertEquals(ErrorSnapshotCodec.MESSAGE, e.field());
    assertTrue(e.getMessage().contains("number"), e.getMessage());
  }

  @Test
  void stringCauseIsRejected() throws Exception {
    var e =
        assertThrows(
            MalformedPayloadException.class,
            () ->
                codec.fromTree(
                    json("{\"type_label\":\"T\",\"message\":\"m\",\"cause\":\"not nested\"}")));
    assertEquals(Kind.INVALID_CAUSE, e.kind());
    assertEquals(ErrorSnapshotCodec.CAUSE, e.field());
    assertEquals(0, e.depth());
  }

  @Test
  void failureReportsNestingDepth() throws Exception {
    String text =
        """
        {"type_label": "A", "message": "a", "cause":
          {"type_label": "B", "message": "b", "cause":
            {"type_label": "C", "cause": null}}}
        """;
    var e = assertThrows(MalformedPayloadException.class, () -> codec.fromTree(json(text)));
    assertEquals(Kind.MISSING_FIELD, e.kind());
    assertEquals(2, e.depth());
    assertTrue(e.getMessage().contains("depth 2"), e.getMessage());
  }

  @Test
  void nonObjectPayloadIsRejected() throws Exception {
    var e = assertThrows(MalformedPayloadException.class, () -> codec.fromTree(json("[1, 2]")));
    assertEquals(Kind.NOT_AN_OBJECT, e.kind());

    e = assertThrows(MalformedPayloadException.class, () -> codec.fromTree(null));
    assertEquals(Kind.NOT_AN_OBJECT, e.kind());
  }

  @Test
  void payloadDeeperThanCapIsRejected() {
    var small = new AnyErrorConfig(3, FlatSnapshotSerializer.NAME);
    ErrorSnapshot four =
        new ErrorCapture(small.withMaxCauseDepth(4)).capture(TestErrors.chainOf(4));
    ObjectNode tree = codec.toTree(four);

    var e =
        assertThrows(
            MalformedPayloadException.class, () -> new ErrorSnapshotCodec(small).fromTree(tree));
    assertEquals(Kind.TOO_DEEP, e.kind());
    assertEquals(3, e.depth());

    assertEquals(four, new ErrorSnapshotCodec(small.withMaxCauseDepth(4)).fromTree(tree));
  }

  @Test
  void toMapIsOrderedAndNested() {
    Map<String, Object> map =
        codec.toMap(new ErrorSnapshot("Outer", "outer", new ErrorSnapshot("Inner", "inner")));

    assertEquals(List.of("type_label", "message", "cause"), List.copyOf(map.keySet()));
    @SuppressWarnings("unchecked")
    Map<String, Object> cause = (Map<String, Object>) map.get("cause");
    assertEquals("inner", cause.get("message"));
    assertTrue(cause.containsKey("cause"));
    assertNull(cause.get("cause"));
  }

  @Test
  void fromMapClassifiesWrongKinds() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type_label", "T");
    payload.put("message", "m");
    payload.put("cause", "oops");
    var e = assertThrows(MalformedPayloadException.class, () -> codec.fromMap(payload));
    assertEquals(Kind.INVALID_CAUSE, e.kind());

    Map<String, Object> numeric = new HashMap<>();
    numeric.put("type_label", 7);
    numeric.put("message", "m");
    e = assertThrows(MalformedPayloadException.class, () -> codec.fromMap(numeric));
    assertEquals(Kind.WRONG_KIND, e.kind());
    assertEquals("type_label", e.field());
  }

  @Test
  void fromMapRejectsChainDeeperThanCap() {
    Map<String, Object> payload = null;
    for (int i = 4999; i >= 0; i--) {
      Map<String, Object> level = new LinkedHashMap<>();
      level.put("type_label", "T");
      level.put("message", "level " + i);
      level.put("cause", payload);
      payload = level;
    }
    Map<String, Object> deep = payload;

    var e = assertThrows(MalformedPayloadException.class, () -> codec.fromMap(deep));
    assertEquals(Kind.TOO_DEEP, e.kind());
    assertEquals(Constants.DEFAULT_MAX_CAUSE_DEPTH, e.depth());
    assertEquals(ErrorSnapshotCodec.CAUSE, e.field());
  }

  @Test
  void fromMapRejectsSelfReferencingMap() {
    Map<String, Object> payload = new HashMap<>();
    payload.put("type_label", "Loop");
    payload.put("message", "again");
    payload.put("cause", payload);

    var e = assertThrows(MalformedPayloadException.class, () -> codec.fromMap(payload));
    assertEquals(Kind.TOO_DEEP, e.kind());
  }

  @Test
  void fromMapChecksEveryLevel() {
    var e = assertThrows(MalformedPayloadException.class, () -> codec.fromMap(null));
    assertEquals(Kind.NOT_AN_OBJECT, e.kind());
    assertEquals(0, e.depth());

    Map<String, Object> inner = new LinkedHashMap<>();
    inner.put("type_label", "Inner");
    inner.put("message", "inner");
    inner.put("cause", List.of("not", "a", "map"));
    Map<String, Object> outer = new LinkedHashMap<>();
    outer.put("type_label", "Outer");
    outer.put("message", "outer");
    outer.put("cause", inner);

    e = assertThrows(MalformedPayloadException.class, () -> codec.fromMap(outer));
    assertEquals(Kind.INVALID_CAUSE, e.kind());
    assertEquals(1, e.depth());
    assertTrue(e.getMessage().contains("array"), e.getMessage());

    inner.remove("cause");
    inner.remove("message");
    e = assertThrows(MalformedPayloadException.class, () -> codec.fromMap(outer));
    assertEquals(Kind.MISSING_FIELD, e.kind());
    assertEquals(ErrorSnapshotCodec.MESSAGE, e.field());
    assertEquals(1, e.depth());
  }

  @Test
  void fromMapHonoursConfiguredCap() {
    var capture = new ErrorCapture(AnyErrorConfig.defaults().withMaxCauseDepth(40));
    Map<String, Object> map = codec.toMap(capture.capture(TestErrors.chainOf(40)));

    var e = assertThrows(MalformedPayloadException.class, () -> codec.fromMap(map));
    assertEquals(Kind.TOO_DEEP, e.kind());

    var wide = new ErrorSnapshotCodec(AnyErrorConfig.defaults().withMaxCauseDepth(40));
    assertEquals(40, wide.fromMap(map).chainLength());
  }
}

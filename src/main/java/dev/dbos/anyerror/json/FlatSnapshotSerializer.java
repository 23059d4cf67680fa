package dev.dbos.anyerror.json;

import dev.dbos.anyerror.config.AnyErrorConfig;
import dev.dbos.anyerror.snapshot.ErrorSnapshot;

/**
 * JSON serializer for the flat payload of {@link ErrorSnapshotCodec}. This is the default format
 * and the one other services are expected to read.
 */
public class FlatSnapshotSerializer implements SnapshotSerializer {

  public static final String NAME = "anyerror_flat";

  private final ErrorSnapshotCodec codec;

  public FlatSnapshotSerializer(AnyErrorConfig config) {
    this.codec = new ErrorSnapshotCodec(config);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String stringify(ErrorSnapshot snapshot) {
    return JSONUtil.toJson(codec.toTree(snapshot));
  }

  @Override
  public ErrorSnapshot parse(String text) {
    if (text == null) {
      return null;
    }
    return codec.fromTree(JSONUtil.readPayload(text));
  }
}

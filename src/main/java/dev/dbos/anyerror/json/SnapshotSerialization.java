package dev.dbos.anyerror.json;

import dev.dbos.anyerror.Constants;
import dev.dbos.anyerror.config.AnyErrorConfig;
import dev.dbos.anyerror.exceptions.MalformedPayloadException;
import dev.dbos.anyerror.snapshot.ErrorSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serialization and deserialization of error snapshots in several formats.
 *
 * <p>This class picks the serializer by the format name stored with the serialized text. It
 * supports:
 *
 * <ul>
 *   <li>{@code anyerror_flat} - the flat {@code type_label}/{@code message}/{@code cause} payload
 *   <li>{@code anyerror_envelope} - the tagged {@code $type}/{@code context} payload
 *   <li>Custom serializers registered with {@link #withSerializer(SnapshotSerializer)}
 * </ul>
 *
 * <p>Instances are immutable.
 */
public final class SnapshotSerialization {
  private static final Logger logger = LoggerFactory.getLogger(SnapshotSerialization.class);

  /** Serialization format for the flat payload. */
  public static final String FLAT = FlatSnapshotSerializer.NAME;

  /** Serialization format for the tagged envelope payload. */
  public static final String ENVELOPE = EnvelopeSnapshotSerializer.NAME;

  private final AnyErrorConfig config;
  private final Map<String, SnapshotSerializer> serializers;

  public SnapshotSerialization(AnyErrorConfig config) {
    this(config, builtIn(config));
  }

  private SnapshotSerialization(
      AnyErrorConfig config, Map<String, SnapshotSerializer> serializers) {
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.serializers = Map.copyOf(serializers);
    if (!this.serializers.containsKey(config.defaultFormat())) {
      throw new IllegalArgumentException(
          String.format("Unknown default error format '%s'", config.defaultFormat()));
    }
  }

  private static Map<String, SnapshotSerializer> builtIn(AnyErrorConfig config) {
    Map<String, SnapshotSerializer> map = new LinkedHashMap<>();
    map.put(FLAT, new FlatSnapshotSerializer(config));
    map.put(ENVELOPE, new EnvelopeSnapshotSerializer(config));
    return map;
  }

  /** A copy of this instance that also knows {@code serializer}, replacing any of the same name. */
  public SnapshotSerialization withSerializer(SnapshotSerializer serializer) {
    Map<String, SnapshotSerializer> map = new LinkedHashMap<>(serializers);
    map.put(serializer.name(), serializer);
    return new SnapshotSerialization(config, map);
  }

  public SnapshotSerializer serializer(String format) {
    String name = format == null ? config.defaultFormat() : format;
    SnapshotSerializer serializer = serializers.get(name);
    if (serializer == null) {
      throw new IllegalArgumentException(String.format("Unknown error format '%s'", name));
    }
    return serializer;
  }

  /** Serialize using the configured default format. */
  public SerializedResult serialize(ErrorSnapshot snapshot) {
    return serialize(snapshot, null);
  }

  /**
   * Serialize a snapshot using the specified format.
   *
   * @param snapshot the snapshot to serialize
   * @param format the format name, or null for the configured default
   * @return the serialized text and the name of the format used
   */
  public SerializedResult serialize(ErrorSnapshot snapshot, String format) {
    SnapshotSerializer serializer = serializer(format);
    return new SerializedResult(serializer.stringify(snapshot), serializer.name());
  }

  /**
   * Deserialize a snapshot using the format stored with it.
   *
   * @param serializedValue the serialized text
   * @param serialization the format name, or null for the configured default
   * @return the snapshot, or null if {@code serializedValue} is null
   * @throws MalformedPayloadException if the text is not a valid payload of that format
   */
  public ErrorSnapshot deserialize(String serializedValue, String serialization) {
    if (serializedValue == null) {
      return null;
    }
    return serializer(serialization).parse(serializedValue);
  }

  /**
   * Deserialize without failing. A payload that cannot be read is returned as a single snapshot
   * labelled {@value Constants#UNPARSEABLE_TYPE_LABEL} whose message is the raw text.
   */
  public ErrorSnapshot safeDeserialize(String serializedValue, String serialization) {
    try {
      return deserialize(serializedValue, serialization);
    } catch (MalformedPayloadException | IllegalArgumentException e) {
      logger.warn("Couldn't deserialize error payload ({}): {}", serialization, e.getMessage());
      return new ErrorSnapshot(Constants.UNPARSEABLE_TYPE_LABEL, serializedValue);
    }
  }

  /** Result of serialization, containing the serialized string and the format used. */
  public record SerializedResult(String serializedValue, String serialization) {
    public SerializedResult {
      Objects.requireNonNull(serializedValue);
      Objects.requireNonNull(serialization);
    }
  }
}

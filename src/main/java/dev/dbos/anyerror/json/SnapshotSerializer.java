package dev.dbos.anyerror.json;

import dev.dbos.anyerror.snapshot.ErrorSnapshot;

/**
 * Renders error snapshots as text and reads them back. Implementations must be stateless or
 * immutable so that one instance can be shared between threads.
 */
public interface SnapshotSerializer {
  /**
   * Return a name for the serialization format. The name is stored alongside the serialized text to
   * identify how it was written.
   */
  String name();

  /**
   * Serialize a snapshot to a string.
   *
   * @param snapshot the snapshot to serialize
   * @return the serialized string representation
   */
  String stringify(ErrorSnapshot snapshot);

  /**
   * Deserialize a string back to a snapshot.
   *
   * @param text a serialized string (potentially null)
   * @return the deserialized snapshot, or null if the input was null
   * @throws dev.dbos.anyerror.exceptions.MalformedPayloadException if the text does not describe a
   *     valid snapshot
   */
  ErrorSnapshot parse(String text);
}

package dev.dbos.anyerror.config;

import dev.dbos.anyerror.Constants;
import dev.dbos.anyerror.json.FlatSnapshotSerializer;

/**
 * Settings shared by capture and the codecs.
 *
 * @param maxCauseDepth the most nodes a snapshot chain may hold. Capture truncates longer chains to
 *     exactly this many nodes; deserialization rejects deeper payloads.
 * @param defaultFormat name of the serializer used when no format is given
 */
public record AnyErrorConfig(int maxCauseDepth, String defaultFormat) {

  public AnyErrorConfig {
    if (maxCauseDepth < 1) {
      throw new IllegalArgumentException("AnyErrorConfig.maxCauseDepth must be at least 1");
    }
    if (maxCauseDepth > Constants.MAX_ALLOWED_CAUSE_DEPTH) {
      throw new IllegalArgumentException(
          String.format(
              "AnyErrorConfig.maxCauseDepth must not exceed %d",
              Constants.MAX_ALLOWED_CAUSE_DEPTH));
    }
    if (defaultFormat == null || defaultFormat.isEmpty()) {
      throw new IllegalArgumentException("AnyErrorConfig.defaultFormat must not be null or empty");
    }
  }

  public static AnyErrorConfig defaults() {
    return new AnyErrorConfig(Constants.DEFAULT_MAX_CAUSE_DEPTH, FlatSnapshotSerializer.NAME);
  }

  public static AnyErrorConfig defaultsFromEnv() {
    var config = defaults();

    String depth = System.getenv(Constants.MAX_CAUSE_DEPTH_ENV_VAR);
    if (depth != null && !depth.isBlank()) {
      try {
        config = config.withMaxCauseDepth(Integer.parseInt(depth.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            String.format("%s is not a number: %s", Constants.MAX_CAUSE_DEPTH_ENV_VAR, depth), e);
      }
    }

    String format = System.getenv(Constants.FORMAT_ENV_VAR);
    if (format != null && !format.isBlank()) {
      config = config.withDefaultFormat(format.trim());
    }
    return config;
  }

  public AnyErrorConfig withMaxCauseDepth(int v) {
    return new AnyErrorConfig(v, defaultFormat);
  }

  public AnyErrorConfig withDefaultFormat(String v) {
    return new AnyErrorConfig(maxCauseDepth, v);
  }
}

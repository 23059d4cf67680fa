package dev.dbos.anyerror.capture;

import dev.dbos.anyerror.ReportableError;
import dev.dbos.anyerror.config.AnyErrorConfig;
import dev.dbos.anyerror.snapshot.ErrorSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts live errors into {@link ErrorSnapshot} chains.
 *
 * <p>The cause chain is walked iteratively and at most {@link AnyErrorConfig#maxCauseDepth()}
 * levels are kept. A longer chain, including one that cycles back on itself, is truncated: the
 * last kept snapshot simply has no cause. Truncation is not an error and is only logged at DEBUG.
 *
 * <p>Capture never throws for a non-null input. A null message is recorded as the empty string, a
 * null type label as the standardized name of the runtime class, and a null {@code Optional} from
 * {@code cause()} as no cause. Instances are immutable and may be shared between threads.
 */
public final class ErrorCapture {
  private static final Logger logger = LoggerFactory.getLogger(ErrorCapture.class);

  private static final ErrorCapture DEFAULT = new ErrorCapture(AnyErrorConfig.defaults());

  private final int maxCauseDepth;

  public ErrorCapture(AnyErrorConfig config) {
    this.maxCauseDepth = Objects.requireNonNull(config, "config must not be null").maxCauseDepth();
  }

  public static ErrorCapture defaultCapture() {
    return DEFAULT;
  }

  public int maxCauseDepth() {
    return maxCauseDepth;
  }

  public ErrorSnapshot capture(ReportableError error) {
    Objects.requireNonNull(error, "error must not be null");

    List<Level> levels = new ArrayList<>();
    ReportableError current = error;
    while (current != null && levels.size() < maxCauseDepth) {
      levels.add(new Level(typeLabelOf(current), messageOf(current)));
      current = causeOf(current);
    }

    if (current != null) {
      logger.debug(
          "Cause chain of {} truncated at {} levels", levels.get(0).typeLabel(), maxCauseDepth);
    }

    ErrorSnapshot snapshot = null;
    for (int i = levels.size() - 1; i >= 0; i--) {
      Level level = levels.get(i);
      snapshot = new ErrorSnapshot(level.typeLabel(), level.message(), snapshot);
    }
    return snapshot;
  }

  public ErrorSnapshot capture(Throwable throwable) {
    return capture(ReportableError.of(throwable));
  }

  private record Level(String typeLabel, String message) {}

  private static String typeLabelOf(ReportableError error) {
    String label = error.typeLabel();
    return label == null ? TypeNames.standardizedNameOf(error) : label;
  }

  private static String messageOf(ReportableError error) {
    String message = error.message();
    return message == null ? "" : message;
  }

  private static ReportableError causeOf(ReportableError error) {
    Optional<? extends ReportableError> cause = error.cause();
    return cause == null ? null : cause.orElse(null);
  }
}

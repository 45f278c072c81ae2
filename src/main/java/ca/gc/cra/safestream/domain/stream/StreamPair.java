package ca.gc.cra.safestream.domain.stream;

import java.util.Objects;

/**
 * <strong>What:</strong> The (data, errors) channel pair at the boundary between two stages.
 * <p><strong>Ownership:</strong> The stage that builds a pair is its only writer and closes both halves when it
 * finishes; the next stage (or the application) holds the read side. A reader may close {@link #data()} early to
 * abandon the stream.</p>
 *
 * @param data data channel; never {@code null}
 * @param errors error channel; never {@code null}
 * @since 0.1.0
 */
public record StreamPair(DataChannel<Datapack> data, ErrorChannel errors) {
  public StreamPair {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(errors, "errors");
  }

  /** Creates a fresh open pair whose error channel holds {@code errorCapacity} errors. */
  public static StreamPair open(int errorCapacity) {
    return new StreamPair(new DataChannel<>(), new ErrorChannel(errorCapacity));
  }
}

package ca.gc.cra.safestream.domain.stream;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Objects;

/**
 * <strong>What:</strong> Unit of transport moved between pipeline stages.
 * <p><strong>Why:</strong> Couples a readable byte stream with the context that governs its processing so
 * handlers receive both in one hand-off.</p>
 * <p><strong>Role:</strong> Domain value written to and read from {@link DataChannel}s.</p>
 * <p><strong>Thread-safety:</strong> The reference is handed from exactly one writer to exactly one reader; the
 * body stream itself is not safe for concurrent reads.</p>
 * <p><strong>Ownership:</strong> Whoever consumes the body is responsible for closing it.</p>
 *
 * @since 0.1.0
 */
public interface Datapack {
  /**
   * Returns the readable byte stream carried by this unit.
   *
   * @return body stream, or {@code null} when the unit carries no content and should be skipped
   */
  InputStream body();

  /**
   * Returns the context travelling with this unit.
   *
   * @return context used for cancellation and metadata; never {@code null}
   */
  StreamContext context();

  /**
   * Creates an immutable datapack around an existing stream.
   *
   * @param body body stream; may be {@code null} to build an empty unit
   * @param context context; {@code null} maps to {@link StreamContext#background()}
   * @return datapack wrapping the supplied values
   */
  static Datapack of(InputStream body, StreamContext context) {
    return new BasicDatapack(body, Objects.requireNonNullElse(context, StreamContext.background()));
  }

  /**
   * Creates an immutable datapack whose body reads the supplied bytes.
   *
   * @param payload payload bytes; copied
   * @param context context; {@code null} maps to {@link StreamContext#background()}
   * @return datapack wrapping a fresh {@link ByteArrayInputStream}
   */
  static Datapack ofBytes(byte[] payload, StreamContext context) {
    Objects.requireNonNull(payload, "payload");
    return of(new ByteArrayInputStream(payload.clone()), context);
  }
}

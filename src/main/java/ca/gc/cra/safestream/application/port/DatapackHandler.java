package ca.gc.cra.safestream.application.port;

import ca.gc.cra.safestream.domain.stream.StreamContext;
import java.io.InputStream;

/**
 * <strong>What:</strong> Per-item callback applied by {@code SafeTransformStage}.
 * <p><strong>Role:</strong> Application logic plugged into a transform stage; invoked synchronously on the stage
 * thread once per datapack with a non-null body.</p>
 * <p><strong>Failure contract:</strong> a checked exception is a handler-reported error: it is forwarded unchanged
 * and the stage stops consuming. Unchecked exceptions are runtime faults.</p>
 * <p><strong>Ownership:</strong> The handler owns {@code body} and should close it.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface DatapackHandler {
  /**
   * Processes one datapack.
   *
   * @param context context carried by the datapack
   * @param body readable byte stream of the datapack
   * @throws Exception to report a handler failure
   */
  void handle(StreamContext context, InputStream body) throws Exception;
}

package ca.gc.cra.safestream.application.port;

import ca.gc.cra.safestream.domain.stream.Datapack;

/**
 * Per-item transformation whose result is written to the stage's own output stream.
 *
 * <p>Used by {@code SafeTransformStage.mapping(...)}. Returning {@code null} drops the item; returning the input
 * forwards it untouched. Failure semantics match {@link DatapackHandler}.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface DatapackMapper {
  /**
   * Maps one datapack.
   *
   * @param datapack incoming datapack with a non-null body
   * @return datapack to emit downstream, or {@code null} to emit nothing
   * @throws Exception to report a mapping failure
   */
  Datapack map(Datapack datapack) throws Exception;

  /** Mapper that forwards every datapack unchanged. */
  static DatapackMapper identity() {
    return datapack -> datapack;
  }
}

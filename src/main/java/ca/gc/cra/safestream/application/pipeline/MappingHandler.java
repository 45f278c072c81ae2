package ca.gc.cra.safestream.application.pipeline;

import ca.gc.cra.safestream.application.port.DatapackHandler;
import ca.gc.cra.safestream.application.port.DatapackMapper;
import ca.gc.cra.safestream.domain.stream.DataChannel;
import ca.gc.cra.safestream.domain.stream.Datapack;
import ca.gc.cra.safestream.domain.stream.StreamContext;
import java.io.InputStream;
import java.util.Objects;

/** Handler that writes mapped datapacks to the output data channel of the stage running it. */
final class MappingHandler implements DatapackHandler {
  private final DatapackMapper mapper;
  private volatile DataChannel<Datapack> target;

  MappingHandler(DatapackMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  void bind(DataChannel<Datapack> output) {
    this.target = Objects.requireNonNull(output, "output");
  }

  @Override
  public void handle(StreamContext context, InputStream body) throws Exception {
    Datapack mapped = mapper.map(Datapack.of(body, context));
    if (mapped == null) {
      return;
    }
    DataChannel<Datapack> output = target;
    if (output == null) {
      throw new IllegalStateException("mapping handler has no output channel bound");
    }
    // A closed output is picked up by the stage once this call returns.
    output.write(mapped);
  }
}

package ca.gc.cra.safestream.domain.stream;

import java.io.InputStream;

/** Default {@link Datapack} built by the static factories on the interface. */
record BasicDatapack(InputStream body, StreamContext context) implements Datapack {}

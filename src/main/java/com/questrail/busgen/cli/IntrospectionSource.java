package com.questrail.busgen.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Where introspection XML comes from.
 */
public interface IntrospectionSource
{
    /** Human-readable origin, written into the generated file header. */
    String description();

    InputStream open() throws IOException;

    /** Service the data was introspected from, when it came from a live bus. */
    default Optional<String> service() {
        return Optional.empty();
    }

    /** Object path the data was introspected from, when it came from a live bus. */
    default Optional<String> path() {
        return Optional.empty();
    }
}

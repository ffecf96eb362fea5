package com.questrail.busgen.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Name and version of the generator, read from the build-filtered
 * {@code busgen.properties} classpath resource.
 */
public record GeneratorVersion(String name, String version) {
    private static final Logger log = LoggerFactory.getLogger(GeneratorVersion.class);

    static final String RESOURCE = "/busgen.properties";

    public static GeneratorVersion current() {
        Properties props = new Properties();
        try (InputStream in = GeneratorVersion.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.warn("{} not found on the classpath; using defaults", RESOURCE);
            } else {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        return new GeneratorVersion(
                props.getProperty("generator.name", "busgen-xmlgen"),
                props.getProperty("generator.version", "unknown"));
    }
}

package com.questrail.busgen.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class GeneratorConfigTest
{
    @Test
    void defaults()
    {
        GeneratorConfig config = GeneratorConfig.builder().build();

        assertEquals("", config.targetPackage());
        assertEquals("DBusBindings", config.holderClassName());
        assertEquals("org.freedesktop.DBus", config.standardInterfacePrefix());
        assertFalse(config.emitDispatchers());
        assertTrue(config.defaultService().isEmpty());
        assertTrue(config.defaultPath().isEmpty());
        assertEquals(GeneratorVersion.current().name(), config.generatorName());
    }

    @Test
    void versionComesFromFilteredResource()
    {
        GeneratorVersion version = GeneratorVersion.current();

        assertEquals("busgen-xmlgen", version.name());
        assertFalse(version.version().contains("${"), version.version());
    }

    @Test
    void rejectsInvalidNames()
    {
        assertThrows(IllegalArgumentException.class,
                () -> GeneratorConfig.builder().withHolderClassName("My-Bindings").build());
        assertThrows(IllegalArgumentException.class,
                () -> GeneratorConfig.builder().withTargetPackage("org..example").build());
    }

    @Test
    void explicitGeneratorOverridesResource()
    {
        GeneratorConfig config = GeneratorConfig.builder()
                .withGenerator(new GeneratorVersion("custom", "9.9"))
                .withTargetPackage("generated")
                .build();

        assertEquals("custom", config.generatorName());
        assertEquals("9.9", config.generatorVersion());
        assertEquals("generated", config.targetPackage());
    }
}

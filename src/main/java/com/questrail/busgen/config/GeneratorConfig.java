package com.questrail.busgen.config;

import com.questrail.busgen.model.StandardInterfaceSpecs;
import com.questrail.busgen.model.WireNames;

import java.util.Objects;
import java.util.Optional;

/**
 * Configuration of one binding-generation run.
 *
 * <ul>
 *   <li>{@code generatorName}, {@code generatorVersion}: written into the file header</li>
 *   <li>{@code targetPackage}: Java package of the generated file; empty for the default package</li>
 *   <li>{@code holderClassName}: the top-level class holding one nested class per interface</li>
 *   <li>{@code standardInterfacePrefix}: interfaces with this prefix get no generated code</li>
 *   <li>{@code emitDispatchers}: also emit server-side dispatcher skeletons</li>
 *   <li>{@code defaultService}, {@code defaultPath}: baked into generated proxies
 *       when the introspection data came from a live bus</li>
 * </ul>
 */
public record GeneratorConfig(
    String generatorName,
    String generatorVersion,
    String targetPackage,
    String holderClassName,
    String standardInterfacePrefix,
    boolean emitDispatchers,
    Optional<String> defaultService,
    Optional<String> defaultPath
) {
    public GeneratorConfig {
        Objects.requireNonNull(generatorName, "generatorName");
        Objects.requireNonNull(generatorVersion, "generatorVersion");
        Objects.requireNonNull(targetPackage, "targetPackage");
        Objects.requireNonNull(holderClassName, "holderClassName");
        Objects.requireNonNull(standardInterfacePrefix, "standardInterfacePrefix");
        Objects.requireNonNull(defaultService, "defaultService");
        Objects.requireNonNull(defaultPath, "defaultPath");
        if (!targetPackage.isEmpty() && !WireNames.isValidInterfaceName(targetPackage)
                && !WireNames.isValidIdentifier(targetPackage)) {
            throw new IllegalArgumentException("Invalid target package: '" + targetPackage + "'");
        }
        if (!WireNames.isValidIdentifier(holderClassName)) {
            throw new IllegalArgumentException("Invalid holder class name: '" + holderClassName + "'");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String generatorName;
        private String generatorVersion;
        private String targetPackage = "";
        private String holderClassName = "DBusBindings";
        private String standardInterfacePrefix = StandardInterfaceSpecs.PREFIX;
        private boolean emitDispatchers;
        private String defaultService;
        private String defaultPath;

        public Builder withGenerator(GeneratorVersion version) {
            this.generatorName = version.name();
            this.generatorVersion = version.version();
            return this;
        }

        public Builder withTargetPackage(String targetPackage) {
            this.targetPackage = targetPackage;
            return this;
        }

        public Builder withHolderClassName(String holderClassName) {
            this.holderClassName = holderClassName;
            return this;
        }

        public Builder withStandardInterfacePrefix(String prefix) {
            this.standardInterfacePrefix = prefix;
            return this;
        }

        public Builder withEmitDispatchers(boolean emitDispatchers) {
            this.emitDispatchers = emitDispatchers;
            return this;
        }

        public Builder withDefaultService(String service) {
            this.defaultService = service;
            return this;
        }

        public Builder withDefaultPath(String path) {
            this.defaultPath = path;
            return this;
        }

        /**
         * Generator name and version default to {@link GeneratorVersion#current()}.
         */
        public GeneratorConfig build() {
            if (generatorName == null || generatorVersion == null) {
                withGenerator(GeneratorVersion.current());
            }
            return new GeneratorConfig(generatorName, generatorVersion, targetPackage, holderClassName,
                    standardInterfacePrefix, emitDispatchers,
                    Optional.ofNullable(defaultService), Optional.ofNullable(defaultPath));
        }
    }
}

package com.questrail.busgen.codegen;

import com.questrail.busgen.config.GeneratorConfig;
import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.IntrospectionNode;
import com.questrail.busgen.xml.StandardInterfaces;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * BindingFileGenerator
 * =============================================================================
 * Produces one Java compilation unit with bindings for the interfaces of an
 * introspected object.
 *
 * <h2>Layout</h2>
 * <ol>
 *   <li>A header comment: the interface(s) covered, the generator name and
 *       version, and where the introspection data came from.</li>
 *   <li>When the object implements well-known interfaces, a section listing
 *       the pre-existing proxies for them. No code is generated for those.</li>
 *   <li>The package declaration and sorted imports.</li>
 *   <li>A holder class with one nested proxy class per remaining interface,
 *       each followed by its dispatcher skeleton when enabled, separated by
 *       blank lines.</li>
 * </ol>
 *
 * <p>Only the interfaces of the root node are considered; child nodes are
 * separate objects and are generated from their own introspection data.</p>
 */
public final class BindingFileGenerator
{
    private static final Logger log = LoggerFactory.getLogger(BindingFileGenerator.class);

    static final String STANDARD_INTERFACES_URL = "https://dbus.freedesktop.org/doc/dbus-specification.html";

    private final GeneratorConfig config;

    public BindingFileGenerator(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public String generate(IntrospectionNode root, String sourceDescription) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(sourceDescription, "sourceDescription");

        StandardInterfaces.Partition partition =
                StandardInterfaces.partition(root.interfaces(), config.standardInterfacePrefix());

        // Body first, so the import set is complete before the preamble is written.
        Set<String> imports = new TreeSet<>();
        SourceWriter body = new SourceWriter();
        body.javadoc("Bindings generated from " + sourceDescription + ".");
        body.open("public final class " + config.holderClassName());
        body.line("private " + config.holderClassName() + "() {}");

        JavaNames.Scope classNames = new JavaNames.Scope(config.holderClassName());
        for (InterfaceSpec spec : partition.needed()) {
            String proxyClass = classNames.claim(ProxySourceGenerator.className(spec));
            body.blank();
            ProxySourceGenerator.generate(spec, proxyClass, config, body, imports);
            if (config.emitDispatchers()) {
                body.blank();
                DispatcherSourceGenerator.generate(spec, classNames.claim(DispatcherSourceGenerator.className(spec)),
                        proxyClass, body, imports);
            }
        }
        body.close();

        StringBuilder out = new StringBuilder();
        header(partition, sourceDescription, out);
        if (!config.targetPackage().isEmpty()) {
            out.append('\n').append("package ").append(config.targetPackage()).append(";\n");
        }
        writeImports(imports, out);
        out.append('\n').append(body);

        log.debug("Generated bindings for {} interface(s) from {}; skipped {} standard interface(s)",
                partition.needed().size(), sourceDescription, partition.standard().size());
        return out.toString();
    }

    private void header(StandardInterfaces.Partition partition, String source, StringBuilder out) {
        List<String> lines = new ArrayList<>();
        List<InterfaceSpec> needed = partition.needed();
        if (!needed.isEmpty()) {
            StringBuilder title = new StringBuilder(needed.size() == 1
                    ? "DBus interface proxy for: " : "DBus interface proxies for: ");
            for (int i = 0; i < needed.size(); i++) {
                title.append(i > 0 ? ", `" : "`").append(needed.get(i).name()).append('`');
            }
            lines.add(title.toString());
            lines.add("");
        }
        lines.add("This code was generated by `" + config.generatorName() + "` `" + config.generatorVersion()
                + "` from DBus introspection data.");
        lines.add("Source: `" + source + "`.");
        lines.add("");
        lines.add("You may prefer to adapt it, instead of using it verbatim.");
        if (!partition.standard().isEmpty()) {
            lines.add("");
            lines.add("This DBus object implements");
            lines.add("[standard DBus interfaces](" + STANDARD_INTERFACES_URL + "),");
            lines.add("(`" + config.standardInterfacePrefix() + ".*`) for which the following proxies can be used:");
            lines.add("");
            for (InterfaceSpec spec : partition.standard()) {
                lines.add("* `" + StandardInterfaces.proxyClassName(spec) + "`");
            }
            lines.add("");
            lines.add("…consequently `" + config.generatorName()
                    + "` did not generate code for the above interfaces.");
        }
        for (String line : lines) {
            out.append(line.isEmpty() ? "//" : "// " + line).append('\n');
        }
    }

    private static void writeImports(Set<String> imports, StringBuilder out) {
        List<String> project = new ArrayList<>();
        List<String> jdk = new ArrayList<>();
        for (String i : imports) {
            (i.startsWith("java.") ? jdk : project).add(i);
        }
        for (List<String> group : List.of(project, jdk)) {
            if (group.isEmpty()) {
                continue;
            }
            out.append('\n');
            for (String i : group) {
                out.append("import ").append(i).append(";\n");
            }
        }
    }
}

package com.questrail.busgen.cli;

import com.questrail.busgen.codegen.BindingFileGenerator;
import com.questrail.busgen.config.GeneratorConfig;
import com.questrail.busgen.config.GeneratorVersion;
import com.questrail.busgen.model.IntrospectionNode;
import com.questrail.busgen.xml.IntrospectionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * XmlGenCommand
 * -----------------------------------------------------------------------------
 * Command-line front end: reads introspection XML from a file or a live
 * object and writes Java bindings to standard output.
 *
 * <pre>
 *   busgen-xmlgen &lt;interface.xml&gt;
 *   busgen-xmlgen --system|--session &lt;service&gt; &lt;object_path&gt;
 *   busgen-xmlgen --address &lt;address&gt; &lt;service&gt; &lt;object_path&gt;
 * </pre>
 *
 * <p>Without arguments the usage is printed to standard error and the exit
 * status is 0. Bad arguments, unreadable or malformed input and introspection
 * failures exit with status 1 and a message on standard error. An interface
 * that fails validation is reported on standard error and left out; its
 * siblings are still generated.</p>
 */
@Command(name = "busgen-xmlgen",
         mixinStandardHelpOptions = true,
         versionProvider = XmlGenCommand.VersionProvider.class,
         description = "Generates Java bindings from D-Bus introspection data.")
public class XmlGenCommand implements Callable<Integer>
{
    private static final Logger log = LoggerFactory.getLogger(XmlGenCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @Option(names = "--system", description = "Introspect <service> <object_path> on the system bus.")
    boolean system;

    @Option(names = "--session", description = "Introspect <service> <object_path> on the session bus.")
    boolean session;

    @Option(names = "--address", paramLabel = "<address>",
            description = "Introspect <service> <object_path> on the bus at this address.")
    String address;

    @Option(names = "--package", paramLabel = "<package>", defaultValue = "",
            description = "Java package of the generated file (default: none).")
    String targetPackage;

    @Option(names = "--class-name", paramLabel = "<name>", defaultValue = "DBusBindings",
            description = "Name of the generated holder class (default: ${DEFAULT-VALUE}).")
    String className;

    @Option(names = "--dispatchers", description = "Also generate server-side dispatcher skeletons.")
    boolean dispatchers;

    @Parameters(paramLabel = "<arg>", description = "<interface.xml>, or <service> <object_path> with a bus option.")
    List<String> params = new ArrayList<>();

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        CommandLine cmd = spec.commandLine();
        if (!system && !session && address == null && params.isEmpty()) {
            cmd.usage(cmd.getErr());
            return EXIT_OK;
        }

        IntrospectionSource source = resolveSource();
        IntrospectionNode node;
        PrintWriter err = cmd.getErr();
        try (InputStream in = source.open()) {
            node = IntrospectionParser.parse(in, rejected -> {
                log.warn("Skipping invalid interface: {}", rejected.getMessage());
                err.println("warning: skipping " + rejected.getMessage());
            });
        }
        err.flush();
        log.debug("Parsed {} interface(s) from {}", node.interfaces().size(), source.description());

        GeneratorConfig.Builder config = GeneratorConfig.builder()
                .withTargetPackage(targetPackage)
                .withHolderClassName(className)
                .withEmitDispatchers(dispatchers);
        source.service().ifPresent(config::withDefaultService);
        source.path().ifPresent(config::withDefaultPath);

        String generated = new BindingFileGenerator(config.build()).generate(node, source.description());
        PrintWriter out = cmd.getOut();
        out.print(generated);
        out.flush();
        return EXIT_OK;
    }

    private IntrospectionSource resolveSource() {
        int modes = (system ? 1 : 0) + (session ? 1 : 0) + (address != null ? 1 : 0);
        if (modes > 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Only one of --system, --session and --address may be given");
        }
        if (modes == 0) {
            if (params.size() != 1) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Expected a single introspection file, got " + params.size() + " arguments");
            }
            return new FileIntrospectionSource(Path.of(params.get(0)));
        }
        if (params.size() < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing param for service");
        }
        if (params.size() < 2) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing param for object path");
        }
        if (params.size() > 2) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Unexpected arguments after object path: " + params.subList(2, params.size()));
        }
        String service = params.get(0);
        String path = params.get(1);
        if (system) {
            return BusctlIntrospectionSource.system(service, path);
        }
        if (session) {
            return BusctlIntrospectionSource.session(service, path);
        }
        return BusctlIntrospectionSource.address(address, service, path);
    }

    /**
     * A configured command line: every failure, including argument errors,
     * exits with {@value #EXIT_FAILURE}.
     */
    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new XmlGenCommand());
        cmd.setParameterExceptionHandler((ex, args) -> {
            PrintWriter err = ex.getCommandLine().getErr();
            err.println("error: " + ex.getMessage());
            err.flush();
            return EXIT_FAILURE;
        });
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            log.debug("Generation failed", ex);
            PrintWriter err = commandLine.getErr();
            err.println("error: " + ex.getMessage());
            err.flush();
            return EXIT_FAILURE;
        });
        return cmd;
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static final class VersionProvider implements CommandLine.IVersionProvider
    {
        @Override
        public String[] getVersion() {
            GeneratorVersion v = GeneratorVersion.current();
            return new String[] { v.name() + " " + v.version() };
        }
    }
}

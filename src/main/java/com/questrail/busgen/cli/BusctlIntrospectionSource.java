package com.questrail.busgen.cli;

import com.questrail.busgen.value.ObjectPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * BusctlIntrospectionSource
 * -----------------------------------------------------------------------------
 * Introspection XML of a live object, obtained by running
 * {@code busctl --xml-interface introspect SERVICE PATH} against the system
 * bus, the session bus or an explicit bus address.
 *
 * <p>The bus protocol itself is left to {@code busctl}; this class only
 * builds the command line, collects its standard output and turns a non-zero
 * exit status into an {@link IOException} carrying the tool's diagnostics.</p>
 */
public final class BusctlIntrospectionSource implements IntrospectionSource
{
    private static final Logger log = LoggerFactory.getLogger(BusctlIntrospectionSource.class);

    public enum Bus
    {
        SYSTEM("--system", "system"),
        SESSION("--user", "session"),
        ADDRESS(null, null);

        private final String flag;
        private final String label;

        Bus(String flag, String label) {
            this.flag = flag;
            this.label = label;
        }
    }

    private final Bus bus;
    private final String address;
    private final String service;
    private final String path;

    private BusctlIntrospectionSource(Bus bus, String address, String service, String path) {
        if (!isValidBusName(service)) {
            throw new IllegalArgumentException("Invalid service name: '" + service + "'");
        }
        if (!ObjectPath.isValid(path)) {
            throw new IllegalArgumentException("Invalid object path: '" + path + "'");
        }
        this.bus = bus;
        this.address = address;
        this.service = service;
        this.path = path;
    }

    public static BusctlIntrospectionSource system(String service, String path) {
        return new BusctlIntrospectionSource(Bus.SYSTEM, null, service, path);
    }

    public static BusctlIntrospectionSource session(String service, String path) {
        return new BusctlIntrospectionSource(Bus.SESSION, null, service, path);
    }

    public static BusctlIntrospectionSource address(String address, String service, String path) {
        Objects.requireNonNull(address, "address");
        if (address.isBlank()) {
            throw new IllegalArgumentException("Bus address must not be empty");
        }
        return new BusctlIntrospectionSource(Bus.ADDRESS, address, service, path);
    }

    @Override
    public String description() {
        String base = "Interface '" + path + "' from service '" + service + "'";
        return bus == Bus.ADDRESS ? base : base + " on " + bus.label + " bus";
    }

    @Override
    public Optional<String> service() {
        return Optional.of(service);
    }

    @Override
    public Optional<String> path() {
        return Optional.of(path);
    }

    List<String> command() {
        List<String> cmd = new ArrayList<>();
        cmd.add("busctl");
        cmd.add(bus == Bus.ADDRESS ? "--address=" + address : bus.flag);
        cmd.add("--xml-interface");
        cmd.add("introspect");
        cmd.add(service);
        cmd.add(path);
        return cmd;
    }

    @Override
    public InputStream open() throws IOException {
        return new ByteArrayInputStream(run(command()));
    }

    /**
     * Runs {@code cmd} and returns its standard output. Standard error goes to
     * a temporary file so that neither pipe can fill up and block the tool.
     *
     * @throws IOException if the tool cannot be started or exits with a
     *         non-zero status
     */
    static byte[] run(List<String> cmd) throws IOException {
        log.debug("Running {}", cmd);
        Path errors = Files.createTempFile("busgen-busctl", ".err");
        try {
            Process process = new ProcessBuilder(cmd)
                    .redirectError(errors.toFile())
                    .start();
            byte[] output;
            try (InputStream stdout = process.getInputStream()) {
                output = stdout.readAllBytes();
            }
            int status;
            try {
                status = process.waitFor();
            } catch (InterruptedException e) {
                process.destroy();
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting for " + cmd.get(0), e);
            }
            if (status != 0) {
                throw new IOException(cmd.get(0) + " exited with status " + status + ": "
                        + Files.readString(errors, StandardCharsets.UTF_8).trim());
            }
            return output;
        } finally {
            Files.deleteIfExists(errors);
        }
    }

    /**
     * Unique ({@code :1.42}) or well-known ({@code org.example.Service}) bus
     * name.
     */
    static boolean isValidBusName(String name) {
        if (name == null || name.isEmpty() || name.length() > 255) {
            return false;
        }
        boolean unique = name.startsWith(":");
        String[] elements = (unique ? name.substring(1) : name).split("\\.", -1);
        if (elements.length < 2) {
            return false;
        }
        for (String element : elements) {
            if (element.isEmpty()) {
                return false;
            }
            for (int i = 0; i < element.length(); i++) {
                char c = element.charAt(i);
                boolean ok = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_' || c == '-'
                        || (c >= '0' && c <= '9' && (unique || i > 0));
                if (!ok) {
                    return false;
                }
            }
        }
        return true;
    }
}

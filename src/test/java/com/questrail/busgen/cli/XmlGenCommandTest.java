package com.questrail.busgen.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class XmlGenCommandTest
{
    private static final String XML = "<!DOCTYPE node PUBLIC \"-//freedesktop//DTD D-BUS Object Introspection 1.0//EN\"\n"
            + " \"http://www.freedesktop.org/standards/dbus/1.0/introspect.dtd\">\n"
            + "<node>\n"
            + "  <interface name=\"org.freedesktop.DBus.Peer\">\n"
            + "    <method name=\"Ping\"/>\n"
            + "  </interface>\n"
            + "  <interface name=\"org.example.Clock\">\n"
            + "    <method name=\"Now\">\n"
            + "      <arg name=\"epoch_seconds\" type=\"t\" direction=\"out\"/>\n"
            + "    </method>\n"
            + "    <signal name=\"Tick\"/>\n"
            + "  </interface>\n"
            + "</node>\n";

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine cmd;

    @BeforeEach
    void setUp()
    {
        cmd = XmlGenCommand.commandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    private Path write(String name, String content) throws IOException
    {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void noArgumentsPrintsUsageAndSucceeds()
    {
        assertEquals(XmlGenCommand.EXIT_OK, cmd.execute());

        assertTrue(err.toString().contains("busgen-xmlgen"), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    void generatesBindingsFromFile() throws IOException
    {
        Path file = write("clock.xml", XML);

        int status = cmd.execute("--package", "org.example.clock", file.toString());

        assertEquals(XmlGenCommand.EXIT_OK, status, err.toString());
        String generated = out.toString();
        assertTrue(generated.startsWith("// DBus interface proxy for: `org.example.Clock`\n"), generated);
        assertTrue(generated.contains("// Source: `clock.xml`."));
        assertTrue(generated.contains("// * `com.questrail.busgen.proxy.standard.PeerProxy`"));
        assertTrue(generated.contains("package org.example.clock;"));
        assertTrue(generated.contains("public CompletableFuture<Long> now()"));
        assertTrue(generated.contains("public SignalSubscription receiveTick()"));
        assertFalse(generated.contains("DEFAULT_SERVICE"));
    }

    @Test
    void dispatcherOptionAddsSkeleton() throws IOException
    {
        Path file = write("clock.xml", XML);

        assertEquals(XmlGenCommand.EXIT_OK, cmd.execute("--dispatchers", "--class-name", "Clocks", file.toString()));

        assertTrue(out.toString().contains("public final class Clocks"));
        assertTrue(out.toString().contains("public abstract static class ClockDispatcher"));
    }

    @Test
    void missingFileFails()
    {
        int status = cmd.execute(dir.resolve("absent.xml").toString());

        assertEquals(XmlGenCommand.EXIT_FAILURE, status);
        assertTrue(err.toString().startsWith("error: "), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    void malformedXmlFails() throws IOException
    {
        Path file = write("broken.xml", "<node><interface name=\"org.example.Clock\"></node>");

        assertEquals(XmlGenCommand.EXIT_FAILURE, cmd.execute(file.toString()));
        assertEquals("", out.toString());
    }

    @Test
    void busModesNeedServiceAndPath()
    {
        assertEquals(XmlGenCommand.EXIT_FAILURE, cmd.execute("--system"));
        assertTrue(err.toString().contains("Missing param for service"), err.toString());

        assertEquals(XmlGenCommand.EXIT_FAILURE, cmd.execute("--session", "org.example.Clock"));
        assertTrue(err.toString().contains("Missing param for object path"), err.toString());
    }

    @Test
    void conflictingModesFail()
    {
        assertEquals(XmlGenCommand.EXIT_FAILURE,
                cmd.execute("--system", "--address", "unix:path=/tmp/bus", "org.example.Clock", "/org/example/Clock"));
        assertTrue(err.toString().contains("Only one of"));
    }

    @Test
    void fileModeTakesExactlyOneArgument()
    {
        assertEquals(XmlGenCommand.EXIT_FAILURE, cmd.execute("a.xml", "b.xml"));
    }

    @Test
    void invalidObjectPathFailsBeforeRunningBusctl()
    {
        assertEquals(XmlGenCommand.EXIT_FAILURE, cmd.execute("--system", "org.example.Clock", "not/a/path"));
        assertTrue(err.toString().contains("Invalid object path"), err.toString());
    }

    @Test
    void invalidInterfaceIsSkippedAndSiblingsGenerated() throws IOException
    {
        Path file = write("mixed.xml", "<node>\n"
                + "  <interface name=\"org.example.Broken\">\n"
                + "    <method name=\"Twice\"/>\n"
                + "    <method name=\"Twice\"/>\n"
                + "  </interface>\n"
                + "  <interface name=\"org.example.Clock\">\n"
                + "    <method name=\"Now\"/>\n"
                + "  </interface>\n"
                + "</node>\n");

        assertEquals(XmlGenCommand.EXIT_OK, cmd.execute(file.toString()));

        assertTrue(err.toString().contains("warning: skipping Interface 'org.example.Broken'"), err.toString());
        assertTrue(out.toString().contains("class ClockProxy"), out.toString());
        assertFalse(out.toString().contains("BrokenProxy"));
    }
}

package com.questrail.busgen.dispatch;

import com.questrail.busgen.bus.FakeBusConnection;
import com.questrail.busgen.bus.Message;
import com.questrail.busgen.bus.MessageType;
import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.IntrospectionNode;
import com.questrail.busgen.model.MethodSpec;
import com.questrail.busgen.model.PropertyAccess;
import com.questrail.busgen.model.PropertySpec;
import com.questrail.busgen.observability.DispatchErrorEvent;
import com.questrail.busgen.observability.RecordingObservabilitySink;
import com.questrail.busgen.value.ObjectPath;
import com.questrail.busgen.value.Variant;
import com.questrail.busgen.xml.IntrospectionParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class ObjectServerTest
{
    private static final String IFACE = "org.example.Lamp";
    private static final ObjectPath PATH = ObjectPath.of("/org/example/Lamp");

    private static final InterfaceSpec SPEC = InterfaceSpec.builder(IFACE)
            .method(MethodSpec.wire("Toggle").out("b").build())
            .property(PropertySpec.wire("Brightness", "y").access(PropertyAccess.READWRITE).build())
            .build();

    private final FakeBusConnection connection = new FakeBusConnection(":1.1");
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final AtomicReference<Object> brightness = new AtomicReference<>((byte) 40);
    private final ObjectServer server = new ObjectServer(sink).serve(PATH, InterfaceDispatcher.builder(SPEC)
            .method("Toggle", call -> true)
            .property("Brightness", PropertyHandler.readWrite(brightness::get, brightness::set))
            .build());

    private Message roundTrip(Message.Builder call)
    {
        connection.clear();
        server.handle(call.serial(9).sender(":1.2").build(), connection);
        List<Message> sent = connection.sent();
        Message reply = sent.get(sent.size() - 1);
        assertEquals(9L, reply.replySerial().orElseThrow());
        return reply;
    }

    @Test
    void peerInterfaceAnswersOnAnyPath()
    {
        Message ping = roundTrip(Message.methodCall(ObjectPath.of("/nowhere"), "org.freedesktop.DBus.Peer", "Ping"));
        assertEquals(MessageType.METHOD_RETURN, ping.type());
        assertTrue(ping.body().isEmpty());

        Message id = roundTrip(Message.methodCall(PATH, "org.freedesktop.DBus.Peer", "GetMachineId"));
        assertEquals(List.of(server.machineId()), id.body());
        assertEquals(32, server.machineId().length());
    }

    @Test
    void routesCallsToServedInterface()
    {
        Message reply = roundTrip(Message.methodCall(PATH, IFACE, "Toggle"));

        assertEquals(List.of(true), reply.body());
    }

    @Test
    void callWithoutInterfaceFindsDeclaringInterface()
    {
        Message reply = roundTrip(Message.builder(MessageType.METHOD_CALL).path(PATH).member("Toggle"));

        assertEquals(List.of(true), reply.body());
    }

    @Test
    void unknownObjectAndInterfaceAreErrors()
    {
        Message object = roundTrip(Message.methodCall(ObjectPath.of("/org/example/Fan"), IFACE, "Toggle"));
        assertEquals(MethodErrorException.UNKNOWN_OBJECT, object.errorName().orElseThrow());

        Message iface = roundTrip(Message.methodCall(PATH, "org.example.Fan", "Spin"));
        assertEquals(MethodErrorException.UNKNOWN_INTERFACE, iface.errorName().orElseThrow());

        assertEquals(2, sink.getEvents(DispatchErrorEvent.class).size());
    }

    @Test
    void introspectionListsStandardAndServedInterfaces()
    {
        Message reply = roundTrip(Message.methodCall(PATH, "org.freedesktop.DBus.Introspectable", "Introspect"));

        IntrospectionNode node = IntrospectionParser.parse((String) reply.body().get(0));
        List<String> names = node.interfaces().stream().map(InterfaceSpec::name).toList();
        assertEquals(List.of("org.freedesktop.DBus.Peer", "org.freedesktop.DBus.Introspectable",
                "org.freedesktop.DBus.Properties", IFACE), names);
    }

    @Test
    void intermediatePathsIntrospectAsChildren()
    {
        Message reply = roundTrip(Message.methodCall(ObjectPath.of("/org/example"),
                "org.freedesktop.DBus.Introspectable", "Introspect"));

        IntrospectionNode node = IntrospectionParser.parse((String) reply.body().get(0));
        assertTrue(node.interfaces().isEmpty());
        assertEquals("Lamp", node.children().get(0).name().orElseThrow());
    }

    @Test
    void propertiesInterfaceReachesDispatcher()
    {
        String props = "org.freedesktop.DBus.Properties";

        Message get = roundTrip(Message.methodCall(PATH, props, "Get").body("ss", IFACE, "Brightness"));
        assertEquals(List.of(Variant.of((byte) 40)), get.body());

        Message set = roundTrip(Message.methodCall(PATH, props, "Set")
                .body("ssv", IFACE, "Brightness", Variant.of((byte) 80)));
        assertEquals(MessageType.METHOD_RETURN, set.type());
        assertEquals((byte) 80, brightness.get());

        Message all = roundTrip(Message.methodCall(PATH, props, "GetAll").body("s", IFACE));
        assertEquals(List.of(Map.of("Brightness", Variant.of((byte) 80))), all.body());
    }

    @Test
    void propertySetWithWrongTypeIsInvalidArgs()
    {
        Message set = roundTrip(Message.methodCall(PATH, "org.freedesktop.DBus.Properties", "Set")
                .body("ssv", IFACE, "Brightness", Variant.of("bright")));

        assertEquals(MethodErrorException.INVALID_ARGS, set.errorName().orElseThrow());
        assertEquals((byte) 40, brightness.get());
    }

    @Test
    void removedInterfaceIsNoLongerServed()
    {
        assertTrue(server.remove(PATH, IFACE));
        assertFalse(server.remove(PATH, IFACE));
        assertTrue(server.dispatcher(PATH, IFACE).isEmpty());

        Message reply = roundTrip(Message.methodCall(PATH, IFACE, "Toggle"));
        assertEquals(MethodErrorException.UNKNOWN_OBJECT, reply.errorName().orElseThrow());
    }

    @Test
    void servingSameInterfaceTwiceFails()
    {
        InterfaceDispatcher again = InterfaceDispatcher.builder(SPEC)
                .method("Toggle", call -> false)
                .property("Brightness", PropertyHandler.readWrite(() -> (byte) 0, value -> { }))
                .build();

        assertThrows(IllegalStateException.class, () -> server.serve(PATH, again));
    }

    @Test
    void failingPropertyHandlersAnswerFailed()
    {
        ObjectPath sensorPath = ObjectPath.of("/org/example/Sensor");
        InterfaceSpec sensor = InterfaceSpec.builder("org.example.Sensor")
                .property(PropertySpec.wire("Reading", "d").build())
                .property(PropertySpec.wire("Threshold", "d").access(PropertyAccess.READWRITE).build())
                .build();
        server.serve(sensorPath, InterfaceDispatcher.builder(sensor)
                .property("Reading", PropertyHandler.readOnly(() -> {
                    throw new IllegalStateException("sensor offline");
                }))
                .property("Threshold", PropertyHandler.readWrite(() -> 1.5, value -> {
                    throw new IllegalStateException("locked");
                }))
                .build());
        String props = "org.freedesktop.DBus.Properties";

        Message get = roundTrip(Message.methodCall(sensorPath, props, "Get").body("ss", "org.example.Sensor", "Reading"));
        assertEquals(MethodErrorException.FAILED, get.errorName().orElseThrow());
        assertTrue(get.errorMessage().orElseThrow().contains("sensor offline"));

        Message all = roundTrip(Message.methodCall(sensorPath, props, "GetAll").body("s", "org.example.Sensor"));
        assertEquals(MethodErrorException.FAILED, all.errorName().orElseThrow());

        Message set = roundTrip(Message.methodCall(sensorPath, props, "Set")
                .body("ssv", "org.example.Sensor", "Threshold", Variant.of(2.5)));
        assertEquals(MethodErrorException.FAILED, set.errorName().orElseThrow());
        assertTrue(set.errorMessage().orElseThrow().contains("locked"));

        List<DispatchErrorEvent> events = sink.getEvents(DispatchErrorEvent.class);
        assertEquals(3, events.size());
        assertInstanceOf(IllegalStateException.class, events.get(0).cause());
    }

    @Test
    void getterValueNotMatchingTypeAnswersFailed()
    {
        ObjectPath gaugePath = ObjectPath.of("/org/example/Gauge");
        InterfaceSpec gauge = InterfaceSpec.builder("org.example.Gauge")
                .property(PropertySpec.wire("Level", "u").build())
                .build();
        server.serve(gaugePath, InterfaceDispatcher.builder(gauge)
                .property("Level", PropertyHandler.readOnly(() -> "full"))
                .build());

        Message get = roundTrip(Message.methodCall(gaugePath, "org.freedesktop.DBus.Properties", "Get")
                .body("ss", "org.example.Gauge", "Level"));

        assertEquals(MethodErrorException.FAILED, get.errorName().orElseThrow());
    }
}

package com.questrail.busgen.bus;

import com.questrail.busgen.signature.TypeSignature;
import com.questrail.busgen.value.ObjectPath;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MessageTest
{
    private static final ObjectPath PATH = ObjectPath.of("/org/example/Calc");

    @Test
    void methodCallRequiresPathAndMember()
    {
        assertThrows(IllegalArgumentException.class,
                () -> Message.builder(MessageType.METHOD_CALL).member("Add").build());
        assertThrows(IllegalArgumentException.class,
                () -> Message.builder(MessageType.METHOD_CALL).path(PATH).build());
        assertDoesNotThrow(() -> Message.methodCall(PATH, null, "Add").build());
    }

    @Test
    void signalRequiresInterface()
    {
        assertThrows(IllegalArgumentException.class, () -> Message.signal(PATH, null, "Changed").build());
    }

    @Test
    void bodyMustConformToSignature()
    {
        assertThrows(IllegalArgumentException.class,
                () -> Message.methodCall(PATH, "org.example.Calc", "Add").body("ii", 1, "two").build());
        assertThrows(IllegalArgumentException.class,
                () -> Message.methodCall(PATH, "org.example.Calc", "Add").body("ii", 1).build());
    }

    @Test
    void repliesAreAddressedToTheCaller()
    {
        Message call = Message.methodCall(PATH, "org.example.Calc", "Add")
                .body("ii", 1, 2)
                .build()
                .withSerial(7)
                .withSender(":1.3");

        Message reply = Message.methodReturn(call, TypeSignature.parse("i"), List.of(3));
        assertEquals(7L, reply.replySerial().orElseThrow());
        assertEquals(":1.3", reply.destination().orElseThrow());
        assertEquals(List.of(3), reply.body());

        Message error = Message.error(call, "org.example.Error.Overflow", "too big");
        assertEquals(MessageType.ERROR, error.type());
        assertEquals("org.example.Error.Overflow", error.errorName().orElseThrow());
        assertEquals("too big", error.errorMessage().orElseThrow());
    }
}

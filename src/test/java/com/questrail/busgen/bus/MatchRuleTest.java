package com.questrail.busgen.bus;

import com.questrail.busgen.value.ObjectPath;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class MatchRuleTest
{
    private static final ObjectPath PATH = ObjectPath.of("/org/example/Thing");

    @Test
    void rendersRuleText()
    {
        MatchRule rule = MatchRule.builder()
                .type(MessageType.SIGNAL)
                .interfaceName("org.example.Thing")
                .member("Changed")
                .path(PATH)
                .build();

        assertEquals("type='signal',interface='org.example.Thing',member='Changed',path='/org/example/Thing'",
                rule.toString());
    }

    @Test
    void absentFieldsMatchAnything()
    {
        MatchRule rule = MatchRule.builder().interfaceName("org.example.Thing").build();
        Message signal = Message.signal(PATH, "org.example.Thing", "Changed").build();
        Message other = Message.signal(PATH, "org.example.Other", "Changed").build();

        assertTrue(rule.matches(signal));
        assertFalse(rule.matches(other));
    }

    @Test
    void senderMustBePresentWhenRequired()
    {
        MatchRule rule = MatchRule.builder().sender(":1.7").build();
        Message anonymous = Message.signal(PATH, "org.example.Thing", "Changed").build();

        assertFalse(rule.matches(anonymous));
        assertTrue(rule.matches(anonymous.withSender(":1.7")));
    }
}

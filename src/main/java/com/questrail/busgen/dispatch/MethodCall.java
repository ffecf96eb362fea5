package com.questrail.busgen.dispatch;

import com.questrail.busgen.bus.Message;
import com.questrail.busgen.model.MethodSpec;
import com.questrail.busgen.value.ValueShapes;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An inbound call as seen by a {@link MethodHandler}: the declared method, its
 * arguments (already checked against the input signature), the raw message and
 * the context for emitting signals from the called object.
 */
public record MethodCall(MethodSpec method, List<Object> args, Message message, SignalContext context)
{
    public MethodCall {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(context, "context");
        args = List.copyOf(args);
    }

    public <T> T arg(int index) {
        return ValueShapes.cast(args.get(index));
    }

    public Optional<String> sender() {
        return message.sender();
    }
}

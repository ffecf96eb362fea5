package com.questrail.busgen.signal;

import com.questrail.busgen.model.ArgSpec;
import com.questrail.busgen.model.SignalSpec;
import com.questrail.busgen.value.ValueShapes;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Decoded arguments of one signal, accessible by position and, where the
 * signal declares argument names, by name.
 */
public final class SignalArgs
{
    private final SignalSpec signal;
    private final List<Object> values;

    SignalArgs(SignalSpec signal, List<Object> values) {
        this.signal = Objects.requireNonNull(signal, "signal");
        this.values = List.copyOf(values);
    }

    public SignalSpec signal() {
        return signal;
    }

    public int size() {
        return values.size();
    }

    public List<Object> values() {
        return values;
    }

    public <T> T get(int index) {
        return ValueShapes.cast(values.get(index));
    }

    /**
     * @throws NoSuchElementException if the signal declares no argument with that name
     */
    public <T> T get(String name) {
        List<ArgSpec> args = signal.args();
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i).name().map(name::equals).orElse(false)) {
                return ValueShapes.cast(values.get(i));
            }
        }
        throw new NoSuchElementException("Signal " + signal.wireName() + " has no argument named '" + name + "'");
    }

    @Override
    public String toString() {
        return signal.wireName() + values;
    }
}

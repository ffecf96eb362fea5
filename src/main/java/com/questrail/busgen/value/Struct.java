package com.questrail.busgen.value;

import java.util.Arrays;
import java.util.List;

/**
 * Native value of a struct-typed argument (wire code {@code (...)}).
 *
 * <p>Fields are positional. A method with several output arguments returns
 * its reply as one {@code Struct} whose fields are the outputs in order.</p>
 */
public record Struct(List<Object> fields)
{
    public Struct {
        fields = List.copyOf(fields);
    }

    public static Struct of(Object... fields) {
        return new Struct(Arrays.asList(fields));
    }

    public <T> T get(int index) {
        return ValueShapes.cast(fields.get(index));
    }

    public int size() {
        return fields.size();
    }
}

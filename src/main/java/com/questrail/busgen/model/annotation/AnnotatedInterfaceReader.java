package com.questrail.busgen.model.annotation;

import com.questrail.busgen.model.ArgSpec;
import com.questrail.busgen.model.ChangeNotify;
import com.questrail.busgen.model.Direction;
import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.MethodSpec;
import com.questrail.busgen.model.ModelValidationException;
import com.questrail.busgen.model.PropertyAccess;
import com.questrail.busgen.model.PropertySpec;
import com.questrail.busgen.model.SignalSpec;
import com.questrail.busgen.signature.SignatureException;
import com.questrail.busgen.signature.SignatureType;
import com.questrail.busgen.signature.TypeSignature;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * AnnotatedInterfaceReader
 * =============================================================================
 * Builds an {@link InterfaceSpec} from a Java type annotated with
 * {@link BusInterface}.
 *
 * <h2>Members</h2>
 * <ul>
 *   <li>{@link BusMethod}: parameters are inputs, the return value is the output
 *       (none for {@code void}, several when a {@link BusSignature} on the method
 *       lists several complete types)</li>
 *   <li>{@link BusProperty}: getters and setters of the same property are merged;
 *       their wire types must agree</li>
 *   <li>{@link BusSignal}: parameters are the signal arguments; a return value
 *       would be an output argument and is rejected</li>
 * </ul>
 *
 * <h2>Ordering</h2>
 * Reflection does not report declaration order. The members of each kind are
 * ordered by the {@code order} attribute of their annotation, then by wire
 * name; a property takes the lower order of its getter and setter.
 *
 * <h2>Errors</h2>
 * Every defect is reported as a {@link ModelValidationException} naming the
 * interface and the offending member.
 */
public final class AnnotatedInterfaceReader
{
    private AnnotatedInterfaceReader() {}

    public static InterfaceSpec read(Class<?> type) {
        Objects.requireNonNull(type, "type");
        BusInterface iface = type.getAnnotation(BusInterface.class);
        if (iface == null) {
            throw ModelValidationException.forInterface(type.getName(), "Type is not annotated with @BusInterface");
        }
        String name = iface.name();
        try {
            List<Ordered<MethodSpec>> methods = new ArrayList<>();
            List<Ordered<SignalSpec>> signals = new ArrayList<>();
            Map<String, PropertyAccessors> properties = new LinkedHashMap<>();

            for (Method m : type.getMethods()) {
                if (m.isAnnotationPresent(BusMethod.class)) {
                    methods.add(new Ordered<>(m.getAnnotation(BusMethod.class).order(), readMethod(m)));
                } else if (m.isAnnotationPresent(BusSignal.class)) {
                    signals.add(new Ordered<>(m.getAnnotation(BusSignal.class).order(), readSignal(m)));
                } else if (m.isAnnotationPresent(BusProperty.class)) {
                    Accessor accessor = accessor(m);
                    properties.computeIfAbsent(accessor.propertyName(), PropertyAccessors::new).add(accessor);
                }
            }

            InterfaceSpec.Builder builder = InterfaceSpec.builder(name);
            if (!iface.doc().isEmpty()) {
                builder.doc(iface.doc());
            }
            methods.stream().sorted(Ordered.by(MethodSpec::wireName)).forEach(o -> builder.method(o.spec()));
            signals.stream().sorted(Ordered.by(SignalSpec::wireName)).forEach(o -> builder.signal(o.spec()));
            properties.values().stream()
                    .map(p -> new Ordered<>(p.order(), p.toSpec()))
                    .sorted(Ordered.by(PropertySpec::wireName))
                    .forEach(o -> builder.property(o.spec()));
            return builder.build();
        } catch (ModelValidationException e) {
            if (e.interfaceName().isPresent()) {
                throw e;
            }
            throw e.withInterface(name);
        }
    }

    private static MethodSpec readMethod(Method m) {
        BusMethod a = m.getAnnotation(BusMethod.class);
        MethodSpec.Builder b = MethodSpec.builder(m.getName());
        if (!a.name().isEmpty()) {
            b.rename(a.name());
        }
        if (!a.doc().isEmpty()) {
            b.doc(a.doc());
        }
        for (Parameter p : m.getParameters()) {
            b.arg(argument(m, p, Direction.IN));
        }
        if (m.getReturnType() != void.class) {
            BusSignature sig = m.getAnnotation(BusSignature.class);
            if (sig != null) {
                for (SignatureType t : parse(m.getName(), sig.value()).types()) {
                    b.arg(new ArgSpec(Optional.empty(), Direction.OUT, TypeSignature.of(t), List.of()));
                }
            } else {
                b.arg(new ArgSpec(Optional.empty(), Direction.OUT,
                        infer(m.getName(), m.getGenericReturnType()), List.of()));
            }
        }
        return b.build();
    }

    private static SignalSpec readSignal(Method m) {
        BusSignal a = m.getAnnotation(BusSignal.class);
        if (m.getReturnType() != void.class) {
            throw ModelValidationException.forMember(m.getName(),
                    "Signal argument declared with direction 'out' (signal methods must return void)");
        }
        SignalSpec.Builder b = SignalSpec.builder(m.getName());
        if (!a.name().isEmpty()) {
            b.rename(a.name());
        }
        if (!a.doc().isEmpty()) {
            b.doc(a.doc());
        }
        for (Parameter p : m.getParameters()) {
            b.arg(argument(m, p, Direction.IN));
        }
        return b.build();
    }

    private static ArgSpec argument(Method m, Parameter p, Direction direction) {
        BusArg named = p.getAnnotation(BusArg.class);
        Optional<String> name = named != null
                ? Optional.of(named.value())
                : p.isNamePresent() ? Optional.of(p.getName()) : Optional.empty();
        BusSignature sig = p.getAnnotation(BusSignature.class);
        TypeSignature type = sig != null
                ? parseSingle(m.getName(), sig.value())
                : infer(m.getName(), p.getParameterizedType());
        return new ArgSpec(name, direction, type, List.of());
    }

    private static Accessor accessor(Method m) {
        String javaName = m.getName();
        boolean setter = javaName.startsWith("set") && javaName.length() > 3
                && m.getParameterCount() == 1 && m.getReturnType() == void.class;
        boolean getter = m.getParameterCount() == 0 && m.getReturnType() != void.class
                && ((javaName.startsWith("get") && javaName.length() > 3)
                    || (javaName.startsWith("is") && javaName.length() > 2));
        if (!setter && !getter) {
            throw ModelValidationException.forMember(javaName,
                    "@BusProperty must annotate a getter (getX/isX) or a setter (setX(value))");
        }
        String stripped = javaName.substring(javaName.startsWith("is") ? 2 : 3);
        String propertyName = Character.toLowerCase(stripped.charAt(0)) + stripped.substring(1);

        BusSignature sig = setter
                ? m.getParameters()[0].getAnnotation(BusSignature.class)
                : m.getAnnotation(BusSignature.class);
        Type javaType = setter ? m.getGenericParameterTypes()[0] : m.getGenericReturnType();
        TypeSignature type = sig != null ? parseSingle(javaName, sig.value()) : infer(javaName, javaType);
        return new Accessor(propertyName, setter, type, m.getAnnotation(BusProperty.class));
    }

    private static TypeSignature infer(String member, Type javaType) {
        return JavaSignatures.infer(javaType)
                .map(TypeSignature::of)
                .orElseThrow(() -> ModelValidationException.forMember(member,
                        "Cannot infer a wire type for " + javaType.getTypeName() + "; declare it with @BusSignature"));
    }

    private static TypeSignature parse(String member, String text) {
        try {
            return TypeSignature.parse(text);
        } catch (SignatureException e) {
            throw new ModelValidationException(null, member, e.getMessage());
        }
    }

    private static TypeSignature parseSingle(String member, String text) {
        try {
            return TypeSignature.parseSingle(text);
        } catch (SignatureException e) {
            throw new ModelValidationException(null, member, e.getMessage());
        }
    }

    private record Ordered<T>(int order, T spec)
    {
        static <T> Comparator<Ordered<T>> by(Function<T, String> wireName) {
            return Comparator.<Ordered<T>>comparingInt(Ordered::order)
                    .thenComparing(o -> wireName.apply(o.spec()));
        }
    }

    private record Accessor(String propertyName, boolean setter, TypeSignature type, BusProperty annotation) {}

    private static final class PropertyAccessors
    {
        private final String nativeName;
        private Accessor getter;
        private Accessor setter;

        PropertyAccessors(String nativeName) {
            this.nativeName = nativeName;
        }

        int order() {
            int order = Integer.MAX_VALUE;
            if (getter != null) {
                order = getter.annotation().order();
            }
            if (setter != null) {
                order = Math.min(order, setter.annotation().order());
            }
            return order;
        }

        void add(Accessor accessor) {
            if (accessor.setter()) {
                setter = accessor;
            } else {
                getter = accessor;
            }
        }

        PropertySpec toSpec() {
            Accessor primary = getter != null ? getter : setter;
            if (getter != null && setter != null) {
                if (!getter.type().equals(setter.type())) {
                    throw ModelValidationException.forMember(nativeName,
                            "Getter type '" + getter.type() + "' conflicts with setter type '" + setter.type() + "'");
                }
                if (!getter.annotation().name().equals(setter.annotation().name())
                        && !getter.annotation().name().isEmpty() && !setter.annotation().name().isEmpty()) {
                    throw ModelValidationException.forMember(nativeName,
                            "Getter and setter declare different wire names");
                }
            }
            ChangeNotify notify = primary.annotation().emitsChangedSignal();
            if (setter != null && notify == ChangeNotify.CONST) {
                throw ModelValidationException.forMember(nativeName, "Constant property must not declare a setter");
            }

            PropertySpec.Builder b = PropertySpec.builder(nativeName, primary.type().toText())
                    .access(PropertyAccess.of(getter != null, setter != null))
                    .changeNotify(notify);
            String rename = wireNameOverride();
            if (!rename.isEmpty()) {
                b.rename(rename);
            }
            String doc = getter != null && !getter.annotation().doc().isEmpty()
                    ? getter.annotation().doc()
                    : setter != null ? setter.annotation().doc() : "";
            if (!doc.isEmpty()) {
                b.doc(doc);
            }
            return b.build();
        }

        private String wireNameOverride() {
            if (getter != null && !getter.annotation().name().isEmpty()) {
                return getter.annotation().name();
            }
            return setter != null ? setter.annotation().name() : "";
        }
    }
}

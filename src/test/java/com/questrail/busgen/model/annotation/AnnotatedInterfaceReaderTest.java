package com.questrail.busgen.model.annotation;

import com.questrail.busgen.model.ChangeNotify;
import com.questrail.busgen.model.InterfaceSpec;
import com.questrail.busgen.model.MethodSpec;
import com.questrail.busgen.model.ModelValidationException;
import com.questrail.busgen.model.PropertyAccess;
import com.questrail.busgen.model.PropertySpec;
import com.questrail.busgen.model.SignalSpec;
import com.questrail.busgen.value.ObjectPath;
import com.questrail.busgen.value.Struct;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AnnotatedInterfaceReaderTest
 * -----------------------------------------------------------------------------
 * Interface descriptions read from annotated Java types: wire name derivation,
 * natural-type signature inference, property accessor merging and the defects
 * that must be reported instead of silently accepted.
 */
final class AnnotatedInterfaceReaderTest
{
    @BusInterface(name = "org.example.busgen.MyIface", doc = "A test interface.")
    interface MyIface
    {
        @BusMethod
        void noArg();

        @BusMethod
        @BusSignature("u")
        long aTest(@BusArg("val") String val);

        @BusMethod(name = "CheckRENAMING")
        List<Byte> checkRenaming();

        @BusMethod
        @BusSignature("us")
        Struct pairOutput();

        @BusMethod
        Map<String, ObjectPath> lookup(@BusArg("keys") List<String> keys);

        @BusSignal(doc = "Fired on change.")
        void changed(@BusArg("counter") @BusSignature("u") long counter);

        @BusProperty(doc = "The answer.")
        @BusSignature("q")
        int getMyProp();

        @BusProperty
        void setMyProp(@BusSignature("q") int value);

        @BusProperty(emitsChangedSignal = ChangeNotify.CONST)
        boolean isReady();
    }

    @Test
    void readsMethodsWithDerivedWireNames()
    {
        InterfaceSpec spec = AnnotatedInterfaceReader.read(MyIface.class);

        assertEquals("org.example.busgen.MyIface", spec.name());
        assertEquals("A test interface.", spec.doc().orElseThrow());

        MethodSpec aTest = spec.method("ATest").orElseThrow();
        assertEquals("aTest", aTest.nativeName());
        assertEquals("s", aTest.inputSignature().toText());
        assertEquals("val", aTest.inputs().get(0).name().orElseThrow());
        assertEquals("u", aTest.outputSignature().toText());

        assertTrue(spec.method("NoArg").orElseThrow().inputs().isEmpty());
        assertEquals("ay", spec.method("CheckRENAMING").orElseThrow().outputSignature().toText());
        assertEquals("a{so}", spec.method("Lookup").orElseThrow().outputSignature().toText());
        assertEquals("as", spec.method("Lookup").orElseThrow().inputSignature().toText());
    }

    @Test
    void methodSignatureWithSeveralTypesDeclaresSeveralOutputs()
    {
        MethodSpec pair = AnnotatedInterfaceReader.read(MyIface.class).method("PairOutput").orElseThrow();
        assertEquals(2, pair.outputs().size());
        assertEquals("(us)", pair.returnSignature().orElseThrow().toText());
    }

    @Test
    void membersWithoutOrderAreSortedByWireName()
    {
        InterfaceSpec spec = AnnotatedInterfaceReader.read(MyIface.class);
        assertEquals(List.of("ATest", "CheckRENAMING", "Lookup", "NoArg", "PairOutput"),
                spec.methods().stream().map(MethodSpec::wireName).toList());
    }

    @Test
    void getterAndSetterMergeIntoOneProperty()
    {
        InterfaceSpec spec = AnnotatedInterfaceReader.read(MyIface.class);

        PropertySpec myProp = spec.property("MyProp").orElseThrow();
        assertEquals("q", myProp.type().toText());
        assertEquals(PropertyAccess.READWRITE, myProp.access());
        assertEquals("The answer.", myProp.doc().orElseThrow());
        assertTrue(myProp.hasSetter());

        PropertySpec ready = spec.property("Ready").orElseThrow();
        assertEquals("b", ready.type().toText());
        assertEquals(PropertyAccess.READ, ready.access());
        assertEquals(ChangeNotify.CONST, ready.changeNotify());
    }

    @Test
    void readsSignals()
    {
        SignalSpec changed = AnnotatedInterfaceReader.read(MyIface.class).signal("Changed").orElseThrow();
        assertEquals("u", changed.signature().toText());
        assertEquals("counter", changed.args().get(0).name().orElseThrow());
        assertEquals("Fired on change.", changed.doc().orElseThrow());
    }

    @BusInterface(name = "org.example.BadSignal")
    interface SignalWithReturn
    {
        @BusSignal
        int broken();
    }

    @Test
    void signalWithReturnValueIsRejected()
    {
        ModelValidationException e = assertThrows(ModelValidationException.class,
                () -> AnnotatedInterfaceReader.read(SignalWithReturn.class));
        assertEquals("org.example.BadSignal", e.interfaceName().orElseThrow());
        assertEquals("broken", e.member().orElseThrow());
        assertTrue(e.reason().contains("direction 'out'"));
    }

    @BusInterface(name = "org.example.ConstSetter")
    interface ConstWithSetter
    {
        @BusProperty(emitsChangedSignal = ChangeNotify.CONST)
        String getName();

        @BusProperty(emitsChangedSignal = ChangeNotify.CONST)
        void setName(String name);
    }

    @Test
    void constPropertyWithSetterIsRejected()
    {
        ModelValidationException e = assertThrows(ModelValidationException.class,
                () -> AnnotatedInterfaceReader.read(ConstWithSetter.class));
        assertEquals("name", e.member().orElseThrow());
    }

    @BusInterface(name = "org.example.Conflict")
    interface ConflictingAccessors
    {
        @BusProperty
        int getLevel();

        @BusProperty
        void setLevel(String level);
    }

    @Test
    void conflictingAccessorTypesAreRejected()
    {
        ModelValidationException e = assertThrows(ModelValidationException.class,
                () -> AnnotatedInterfaceReader.read(ConflictingAccessors.class));
        assertTrue(e.reason().contains("conflicts"));
    }

    @BusInterface(name = "org.example.Duplicate")
    interface DuplicateWireNames
    {
        @BusMethod(name = "Same")
        void first();

        @BusMethod(name = "Same")
        void second();
    }

    @Test
    void duplicateWireNamesAreRejected()
    {
        ModelValidationException e = assertThrows(ModelValidationException.class,
                () -> AnnotatedInterfaceReader.read(DuplicateWireNames.class));
        assertEquals("Same", e.member().orElseThrow());
    }

    interface NotAnnotated {}

    @Test
    void typeWithoutInterfaceAnnotationIsRejected()
    {
        assertThrows(ModelValidationException.class, () -> AnnotatedInterfaceReader.read(NotAnnotated.class));
    }

    @BusInterface(name = "org.example.Uninferable")
    interface Uninferable
    {
        @BusMethod
        void take(Object anything);
    }

    @Test
    void uninferableTypeNeedsExplicitSignature()
    {
        ModelValidationException e = assertThrows(ModelValidationException.class,
                () -> AnnotatedInterfaceReader.read(Uninferable.class));
        assertTrue(e.reason().contains("@BusSignature"));
    }

    @BusInterface(name = "org.example.Ordered")
    interface Ordered
    {
        @BusMethod(order = 2)
        void stop();

        @BusMethod(order = 1)
        void start();

        @BusMethod
        void abort();

        @BusSignal(order = 1)
        void stopped();

        @BusSignal(order = 0)
        void started();

        @BusProperty(order = 3)
        String getZone();

        @BusProperty(order = 0)
        void setZone(String zone);

        @BusProperty(order = 1)
        int getAlpha();
    }

    @Test
    void explicitOrderComesBeforeWireName()
    {
        InterfaceSpec spec = AnnotatedInterfaceReader.read(Ordered.class);

        assertEquals(List.of("Start", "Stop", "Abort"), spec.methods().stream().map(MethodSpec::wireName).toList());
        assertEquals(List.of("Started", "Stopped"), spec.signals().stream().map(SignalSpec::wireName).toList());
        assertEquals(List.of("Zone", "Alpha"), spec.properties().stream().map(PropertySpec::wireName).toList());
    }
}

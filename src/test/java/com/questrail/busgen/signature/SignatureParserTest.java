package com.questrail.busgen.signature;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SignatureParserTest
 * -----------------------------------------------------------------------------
 * Parsing of wire signature text into complete types, the textual round trip
 * and the failure kinds for malformed or over-deep signatures.
 */
final class SignatureParserTest
{
    @Test
    void parsesBodyOfSeveralCompleteTypes()
    {
        TypeSignature sig = TypeSignature.parse("sa{sv}(ii)");

        assertEquals(3, sig.size());
        assertEquals(SignatureType.basic(TypeCode.STRING), sig.types().get(0));
        assertEquals(SignatureType.array(SignatureType.dictEntry(
                SignatureType.basic(TypeCode.STRING), SignatureType.variant())), sig.types().get(1));
        assertEquals(SignatureType.struct(List.of(
                SignatureType.basic(TypeCode.INT32), SignatureType.basic(TypeCode.INT32))), sig.types().get(2));
    }

    @Test
    void emptyTextIsTheEmptySignature()
    {
        TypeSignature sig = TypeSignature.parse("");
        assertTrue(sig.isEmpty());
        assertSame(TypeSignature.EMPTY, sig);
    }

    @Test
    void textRoundTripsForWellFormedSignatures()
    {
        for (String text : List.of("y", "as", "a{oa{sa{sv}}}", "(us)", "a(yv)", "((i)(s))", "ggo", "hxtqnbd")) {
            assertEquals(text, TypeSignature.parse(text).toText(), text);
        }
    }

    @Test
    void asStructWrapsAllTypes()
    {
        assertEquals("(us)", TypeSignature.parse("us").asStruct().toText());
    }

    @Test
    void arrayWithoutElementIsUnexpectedEnd()
    {
        SignatureException e = assertThrows(SignatureException.class, () -> TypeSignature.parse("a"));
        assertEquals(SignatureException.Kind.UNEXPECTED_END, e.kind());
        assertEquals(1, e.position());
    }

    @Test
    void unknownCodeIsRejectedAtItsPosition()
    {
        SignatureException e = assertThrows(SignatureException.class, () -> TypeSignature.parse("sz"));
        assertEquals(SignatureException.Kind.UNKNOWN_TYPE_CODE, e.kind());
        assertEquals(1, e.position());
        assertEquals("sz", e.signature());
    }

    @Test
    void unbalancedContainersAreRejected()
    {
        assertEquals(SignatureException.Kind.UNMATCHED_CONTAINER,
                assertThrows(SignatureException.class, () -> TypeSignature.parse("(ii")).kind());
        assertEquals(SignatureException.Kind.UNMATCHED_CONTAINER,
                assertThrows(SignatureException.class, () -> TypeSignature.parse("ii)")).kind());
        assertEquals(SignatureException.Kind.UNMATCHED_CONTAINER,
                assertThrows(SignatureException.class, () -> TypeSignature.parse("{sv}")).kind());
        assertEquals(SignatureException.Kind.UNMATCHED_CONTAINER,
                assertThrows(SignatureException.class, () -> TypeSignature.parse("a{sii}")).kind());
    }

    @Test
    void emptyStructIsRejected()
    {
        assertEquals(SignatureException.Kind.EMPTY_CONTAINER,
                assertThrows(SignatureException.class, () -> TypeSignature.parse("()")).kind());
    }

    @Test
    void dictKeyMustBeBasic()
    {
        SignatureException e = assertThrows(SignatureException.class, () -> TypeSignature.parse("a{vs}"));
        assertEquals(SignatureException.Kind.INVALID_DICT_KEY, e.kind());
        assertEquals(2, e.position());
    }

    @Test
    void nestingBeyondArrayLimitIsRejected()
    {
        String ok = "a".repeat(SignatureParser.MAX_ARRAY_DEPTH) + "y";
        assertEquals(ok, TypeSignature.parse(ok).toText());

        String deep = "a".repeat(SignatureParser.MAX_ARRAY_DEPTH + 1) + "y";
        assertEquals(SignatureException.Kind.NESTING_TOO_DEEP,
                assertThrows(SignatureException.class, () -> TypeSignature.parse(deep)).kind());
    }

    @Test
    void nestingBeyondStructLimitIsRejected()
    {
        String deep = "(".repeat(SignatureParser.MAX_STRUCT_DEPTH + 1) + "y"
                + ")".repeat(SignatureParser.MAX_STRUCT_DEPTH + 1);
        assertEquals(SignatureException.Kind.NESTING_TOO_DEEP,
                assertThrows(SignatureException.class, () -> TypeSignature.parse(deep)).kind());
    }

    @Test
    void overlongSignatureIsRejected()
    {
        String text = "y".repeat(SignatureParser.MAX_LENGTH + 1);
        assertEquals(SignatureException.Kind.TOO_LONG,
                assertThrows(SignatureException.class, () -> TypeSignature.parse(text)).kind());
    }

    @Test
    void parseSingleRequiresExactlyOneType()
    {
        assertTrue(TypeSignature.parseSingle("a{sv}").isSingle());
        assertEquals(SignatureException.Kind.NOT_SINGLE_TYPE,
                assertThrows(SignatureException.class, () -> TypeSignature.parseSingle("ii")).kind());
        assertEquals(SignatureException.Kind.NOT_SINGLE_TYPE,
                assertThrows(SignatureException.class, () -> TypeSignature.parseSingle("")).kind());
    }

    @Test
    void singleOnMultiTypeSignatureFails()
    {
        assertThrows(IllegalStateException.class, () -> TypeSignature.parse("ii").single());
    }
}

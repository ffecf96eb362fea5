package com.questrail.busgen.xml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class DocCommentsTest
{
    @Test
    void rendersEachLineWithIndentAndSpace()
    {
        StringBuilder out = new StringBuilder();
        DocComments.render("One.\n\nTwo.", "    ", out);
        assertEquals("    <!--\n     One.\n\n     Two.\n     -->\n", out.toString());
    }

    @Test
    void readingStripsFramingAndCommonIndent()
    {
        assertEquals("One.\n\n  Indented.", DocComments.fromComment("\n   One.\n\n     Indented.\n   ").orElseThrow());
        assertEquals("Inline", DocComments.fromComment(" Inline ").orElseThrow());
        assertTrue(DocComments.fromComment("  \n \n").isEmpty());
    }

    @Test
    void doubleHyphensAreSplit()
    {
        assertEquals("a - - - - b - -", DocComments.commentSafe("a ---- b --"));
        assertEquals("x- -y", DocComments.commentSafe("x--y"));
        assertEquals("x- - -y", DocComments.commentSafe("x---y"));
    }
}

package com.questrail.busgen.xml;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DocComments
 * -----------------------------------------------------------------------------
 * Conversion between member documentation and the XML comment block that
 * precedes the member's element.
 *
 * <p>A documentation text is rendered one line per source line, each
 * non-empty line prefixed with the element indent plus one space and empty
 * lines left empty:</p>
 * <pre>
 *   &lt;!--
 *    First line.
 *
 *    Second paragraph.
 *    --&gt;
 * </pre>
 * <p>Reading a comment strips the blank first and last lines and the common
 * leading whitespace of the remaining lines, so rendering what was read gives
 * the same block again. A double hyphen cannot appear inside an XML comment
 * and is written as {@code - -}.</p>
 */
public final class DocComments
{
    private DocComments() {}

    public static void render(String doc, String indent, StringBuilder out) {
        out.append(indent).append("<!--\n");
        for (String line : commentSafe(doc).split("\n", -1)) {
            if (!line.isEmpty()) {
                out.append(indent).append(' ').append(line);
            }
            out.append('\n');
        }
        out.append(indent).append(" -->\n");
    }

    /**
     * {@code doc} with every {@code --} split into {@code - -}; XML comments
     * may not contain a double hyphen.
     */
    static String commentSafe(String doc) {
        String safe = doc;
        while (safe.contains("--")) {
            safe = safe.replace("--", "- -");
        }
        return safe;
    }

    /**
     * Documentation carried by the text of an XML comment, or empty when the
     * comment holds only whitespace.
     */
    public static Optional<String> fromComment(String commentText) {
        List<String> lines = new ArrayList<>(List.of(commentText.replace("\r\n", "\n").split("\n", -1)));
        while (!lines.isEmpty() && lines.get(0).isBlank()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }
        if (lines.isEmpty()) {
            return Optional.empty();
        }
        int common = Integer.MAX_VALUE;
        for (String line : lines) {
            if (!line.isBlank()) {
                common = Math.min(common, leadingWhitespace(line));
            }
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (i > 0) {
                sb.append('\n');
            }
            if (!line.isBlank()) {
                sb.append(line.substring(common).stripTrailing());
            }
        }
        return Optional.of(sb.toString());
    }

    private static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }
}

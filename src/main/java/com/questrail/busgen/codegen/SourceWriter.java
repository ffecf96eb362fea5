package com.questrail.busgen.codegen;

/**
 * Line-oriented Java source buffer with four-space indentation.
 */
public final class SourceWriter
{
    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int level;

    public SourceWriter line(String text) {
        if (!text.isEmpty()) {
            out.append(INDENT.repeat(level)).append(text);
        }
        out.append('\n');
        return this;
    }

    public SourceWriter blank() {
        out.append('\n');
        return this;
    }

    public SourceWriter indent() {
        level++;
        return this;
    }

    public SourceWriter outdent() {
        if (level == 0) {
            throw new IllegalStateException("Indentation below zero");
        }
        level--;
        return this;
    }

    /** Opens a block: writes {@code header} followed by a brace line and indents. */
    public SourceWriter open(String header) {
        line(header);
        line("{");
        return indent();
    }

    public SourceWriter close() {
        outdent();
        return line("}");
    }

    /**
     * Writes a Javadoc comment for {@code doc}, one source line per doc line.
     */
    public SourceWriter javadoc(String doc) {
        line("/**");
        for (String l : doc.split("\n", -1)) {
            String escaped = l.replace("*/", "*&#47;");
            line(escaped.isEmpty() ? " *" : " * " + escaped);
        }
        return line(" */");
    }

    @Override
    public String toString() {
        return out.toString();
    }
}

package com.shapeml.script.parser;

/** Source position attached to AST nodes and errors. An invalid locator prints nothing. */
public final class Locator {
    public static final Locator NONE = new Locator(-1, null);

    public final int line;
    public final String file;

    public Locator(int line, String file) {
        this.line = line;
        this.file = file;
    }

    public static Locator of(Token token) {
        return new Locator(token.line, token.file);
    }

    public boolean isValid() {
        return line >= 0 && file != null;
    }

    /** Renders {@code " (file: F, line: N)"} or the empty string. */
    public String where() {
        if (!isValid()) return "";
        return " (file: " + file + ", line: " + line + ")";
    }

    @Override
    public String toString() {
        return where();
    }
}

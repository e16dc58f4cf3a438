package org.pragmatica.tscn.parser;

/**
 * Tracks open brackets, braces, parentheses and strings across the lines of one value.
 *
 * <p>A closing delimiter that does not match the innermost opener ends tracking: the value is
 * handed to the value parser as-is, which reports the mismatch with its own location.
 */
final class Nesting {
    private final StringBuilder open = new StringBuilder();
    private boolean inString;
    private boolean escaped;
    private boolean mismatched;

    private Nesting() {}

    static Nesting empty() {
        return new Nesting();
    }

    Nesting feed(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            feed(text.charAt(i));
        }
        return this;
    }

    Nesting feed(char c) {
        if (mismatched) {
            return this;
        }
        if (inString) {
            if (escaped) {
                escaped = false;
            }else if (c == '\\') {
                escaped = true;
            }else if (c == '"') {
                inString = false;
            }
            return this;
        }
        switch (c) {
            case '"' -> inString = true;
            case '(', '[', '{' -> open.append(c);
            case ')', ']', '}' -> close(c);
            default -> {}
        }
        return this;
    }

    private void close(char c) {
        int last = open.length() - 1;
        if (last < 0 || open.charAt(last) != opener(c)) {
            mismatched = true;
            return;
        }
        open.setLength(last);
    }

    boolean isBalanced() {
        return mismatched || (open.length() == 0 && !inString);
    }

    /**
     * Inside a string literal, where brackets and header-looking text are plain content.
     */
    boolean inString() {
        return inString && !mismatched;
    }

    /**
     * What is still open, innermost first, e.g. {@code "missing ']' and ')'"}.
     */
    String describe() {
        if (inString) {
            return "unterminated string";
        }
        if (open.length() == 0) {
            return "balanced";
        }
        var sb = new StringBuilder("missing ");
        for (int i = open.length() - 1; i >= 0; i--) {
            sb.append('\'').append(closer(open.charAt(i))).append('\'');
            if (i > 0) {
                sb.append(i == 1 ? " and " : ", ");
            }
        }
        return sb.toString();
    }

    private static char opener(char closer) {
        return switch (closer) {
            case ')' -> '(';
            case ']' -> '[';
            default -> '{';
        };
    }

    private static char closer(char opener) {
        return switch (opener) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
    }
}

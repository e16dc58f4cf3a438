package org.pragmatica.tscn.value;

/**
 * Value literal that the value grammar cannot fully interpret.
 */
public final class ValueParseException extends RuntimeException {
    private static final int MAX_FRAGMENT = 32;

    private final String reason;
    private final String fragment;
    private final int offset;

    ValueParseException(String reason, String fragment, int offset) {
        super("Parse error: " + reason + " at offset " + offset + " near '" + fragment + "'");
        this.reason = reason;
        this.fragment = fragment;
        this.offset = offset;
    }

    static ValueParseException at(String input, int offset, String reason) {
        return new ValueParseException(reason, fragment(input, offset), offset);
    }

    private static String fragment(String input, int offset) {
        int start = Math.min(Math.max(0, offset), input.length());
        int end = Math.min(input.length(), start + MAX_FRAGMENT);
        var text = input.substring(start, end);
        return end < input.length() ? text + "..." : text;
    }

    public String reason() {
        return reason;
    }

    /**
     * The unparsed text starting at the failure offset, truncated for display.
     */
    public String fragment() {
        return fragment;
    }

    public int offset() {
        return offset;
    }
}

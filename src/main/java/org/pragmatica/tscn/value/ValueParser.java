package org.pragmatica.tscn.value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Recursive descent parser for the right-hand side of a scene property.
 *
 * <p>Accepts strings, numbers, booleans, {@code null}, arrays, records, constructor calls and
 * resource references:
 * <pre>{@code
 * ValueParser.parse("Vector2(1, 2)");          // Constructor("Vector2", [1, 2])
 * ValueParser.parse("ExtResource(\"1_abc\")"); // ExtRef("1_abc")
 * ValueParser.parse("{ \"a\": [1, 2] }");      // RecordLit
 * }</pre>
 * The whole input must be consumed; anything left over is an error. Arrays, records and
 * argument lists may nest up to a depth limit. Instances hold only the cursor of a single call.
 */
public final class ValueParser {
    public static final int DEFAULT_MAX_DEPTH = 256;

    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private static final String EXT_RESOURCE = "ExtResource";
    private static final String SUB_RESOURCE = "SubResource";

    private final String input;
    private final int maxDepth;
    private int pos;
    private int depth;

    private ValueParser(String input, int maxDepth) {
        this.input = input;
        this.maxDepth = maxDepth;
        this.pos = 0;
    }

    /**
     * Parse a complete value literal, nested at most {@link #DEFAULT_MAX_DEPTH} levels.
     *
     * @throws ValueParseException if the text is empty, unbalanced, too deeply nested, or not a value
     */
    public static Value parse(String text) {
        return parse(text, DEFAULT_MAX_DEPTH);
    }

    /**
     * Parse a complete value literal whose arrays, records and argument lists nest at most
     * {@code maxDepth} levels.
     *
     * @throws ValueParseException if the text is empty, unbalanced, too deeply nested, or not a value
     */
    public static Value parse(String text, int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        if (text == null || text.isBlank()) {
            throw ValueParseException.at("", 0, "empty value");
        }
        var parser = new ValueParser(text.strip(), maxDepth);
        var value = parser.parseValue(false);
        parser.skipWhitespace();
        if (!parser.isAtEnd()) {
            throw parser.error("unexpected trailing input");
        }
        return value;
    }

    /**
     * Decode the backslash escapes in the body of a quoted string, without its quotes.
     *
     * @throws ValueParseException on a malformed {@code \\u} escape
     */
    public static String unescape(String body) {
        var parser = new ValueParser(body, DEFAULT_MAX_DEPTH);
        var sb = new StringBuilder(body.length());
        while (!parser.isAtEnd()) {
            char c = parser.advance();
            if (c == '\\' && !parser.isAtEnd()) {
                sb.append(parser.scanEscapeSequence());
            }else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private Value parseValue(boolean bareWords) {
        skipWhitespace();
        if (isAtEnd()) {
            throw error("expected a value");
        }
        char c = peek();
        if (c == '"') {
            return Value.string(scanString());
        }
        // &"StringName" and ^"NodePath"
        if ((c == '&' || c == '^') && peekNext() == '"') {
            advance();
            return Value.string(scanString());
        }
        if (c == '[') {
            return nested(this::parseArray);
        }
        if (c == '{') {
            return nested(this::parseRecord);
        }
        if (isDigit(c) || c == '.' || ((c == '-' || c == '+') && isNumberContinuation(peekNext()))) {
            return parseNumber();
        }
        if (isIdentifierStart(c)) {
            return parseWord(bareWords);
        }
        throw error("unrecognized token");
    }

    private Value nested(Supplier<Value> body) {
        enter();
        var value = body.get();
        depth-- ;
        return value;
    }

    private List<Value> nestedArguments() {
        enter();
        var args = parseArguments();
        depth-- ;
        return args;
    }

    private void enter() {
        if (++depth > maxDepth) {
            throw error("nesting too deep, limit is " + maxDepth + " levels");
        }
    }

    private Value parseArray() {
        advance();
        // skip [
        var elements = new ArrayList<Value>();
        while (true) {
            skipWhitespace();
            if (isAtEnd()) {
                throw error("unterminated array, expected ']'");
            }
            if (peek() == ']') {
                advance();
                return Value.array(elements);
            }
            elements.add(parseValue(false));
            if (!consumeSeparator(']')) {
                throw error(isAtEnd() ? "unterminated array, expected ']'" : "expected ',' or ']' in array");
            }
        }
    }

    private Value parseRecord() {
        advance();
        // skip {
        var entries = new LinkedHashMap<String, Value>();
        while (true) {
            skipWhitespace();
            if (isAtEnd()) {
                throw error("unterminated record, expected '}'");
            }
            if (peek() == '}') {
                advance();
                return Value.record(entries);
            }
            var key = parseKey();
            skipWhitespace();
            if (isAtEnd() || peek() != ':') {
                throw error("expected ':' after record key '" + key + "'");
            }
            advance();
            entries.put(key, parseValue(false));
            if (!consumeSeparator('}')) {
                throw error(isAtEnd() ? "unterminated record, expected '}'" : "expected ',' or '}' in record");
            }
        }
    }

    private String parseKey() {
        int start = pos;
        var key = parseValue(true);
        if (key instanceof Value.StringLit string) {
            return string.value();
        }
        return input.substring(start, pos).strip();
    }

    private Value parseNumber() {
        int start = pos;
        if (peek() == '-' || peek() == '+') {
            advance();
        }
        if (!isAtEnd() && Character.isLetter(peek())) {
            // -inf, +inf
            var word = scanIdentifier();
            if (!word.equals("inf")) {
                throw errorAt(start, "unrecognized token");
            }
            return Value.number(input.charAt(start) == '-' ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
        }
        boolean digits = skipDigits();
        if (!isAtEnd() && peek() == '.') {
            advance();
            digits |= skipDigits();
        }
        if (!digits) {
            throw errorAt(start, "malformed number");
        }
        if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
            advance();
            if (!isAtEnd() && (peek() == '-' || peek() == '+')) {
                advance();
            }
            if (!skipDigits()) {
                throw errorAt(start, "malformed number exponent");
            }
        }
        if (!isAtEnd() && isIdentifierPart(peek())) {
            throw errorAt(start, "malformed number");
        }
        return Value.number(Double.parseDouble(input.substring(start, pos)));
    }

    private Value parseWord(boolean bareWords) {
        int start = pos;
        var name = new StringBuilder(scanIdentifier());
        // Typed containers: Array[int](...), Dictionary[String, int](...)
        if (!isAtEnd() && peek() == '[') {
            name.append(scanTypeParameters());
            skipWhitespace();
            if (isAtEnd() || peek() != '(') {
                throw errorAt(start, "expected '(' after typed container '" + name + "'");
            }
        }
        int afterName = pos;
        skipWhitespace();
        if (!isAtEnd() && peek() == '(') {
            advance();
            var args = nestedArguments();
            return constructor(name.toString(), args, start);
        }
        pos = afterName;
        return switch (name.toString()) {
            case "true" -> Value.bool(true);
            case "false" -> Value.bool(false);
            case "null" -> Value.nullValue();
            case "inf" -> Value.number(Double.POSITIVE_INFINITY);
            case "inf_neg" -> Value.number(Double.NEGATIVE_INFINITY);
            case "nan" -> Value.number(Double.NaN);
            default -> {
                if (!bareWords) {
                    throw errorAt(start, "unrecognized token");
                }
                yield Value.string(name.toString());
            }
        };
    }

    private String scanTypeParameters() {
        int start = pos;
        int depth = 0;
        while (!isAtEnd()) {
            char c = advance();
            if (c == '[') {
                depth++ ;
            }else if (c == ']') {
                depth-- ;
                if (depth == 0) {
                    return input.substring(start, pos);
                }
            }
        }
        throw errorAt(start, "unterminated type parameters, expected ']'");
    }

    /**
     * Arguments up to the closing parenthesis. Runs of {@code key: value} pairs collapse into a
     * single record argument, as in {@code Object(InputEventKey, "keycode": 65)}.
     */
    private List<Value> parseArguments() {
        var args = new ArrayList<Value>();
        Map<String, Value> pairs = new LinkedHashMap<>();
        while (true) {
            skipWhitespace();
            if (isAtEnd()) {
                throw error("unterminated argument list, expected ')'");
            }
            if (peek() == ')') {
                advance();
                flushPairs(args, pairs);
                return args;
            }
            int start = pos;
            var value = parseValue(true);
            skipWhitespace();
            if (!isAtEnd() && peek() == ':') {
                advance();
                var key = value instanceof Value.StringLit string
                          ? string.value()
                          : input.substring(start, pos - 1).strip();
                pairs.put(key, parseValue(false));
            }else {
                flushPairs(args, pairs);
                args.add(value);
            }
            if (!consumeSeparator(')')) {
                throw error(isAtEnd() ? "unterminated argument list, expected ')'" : "expected ',' or ')' in argument list");
            }
        }
    }

    private static void flushPairs(List<Value> args, Map<String, Value> pairs) {
        if (!pairs.isEmpty()) {
            args.add(Value.record(pairs));
            pairs.clear();
        }
    }

    private Value constructor(String name, List<Value> args, int start) {
        if (!name.equals(EXT_RESOURCE) && !name.equals(SUB_RESOURCE)) {
            return Value.constructor(name, args);
        }
        if (args.size() != 1) {
            throw errorAt(start, name + " expects exactly one id argument");
        }
        var id = resourceId(args.get(0));
        if (id == null) {
            throw errorAt(start, name + " id must be a string or an integer");
        }
        return name.equals(EXT_RESOURCE) ? Value.extRef(id) : Value.subRef(id);
    }

    private static String resourceId(Value arg) {
        if (arg instanceof Value.StringLit string) {
            return string.value();
        }
        // Pre-Godot 4 scenes use numeric ids: ExtResource( 1 )
        if (arg instanceof Value.NumberLit number && number.isIntegral()) {
            return Long.toString(number.asLong());
        }
        return null;
    }

    /**
     * After an element: consume a ',' (trailing commas allowed) or leave the closing delimiter.
     */
    private boolean consumeSeparator(char closing) {
        skipWhitespace();
        if (isAtEnd()) {
            return false;
        }
        if (peek() == ',') {
            advance();
            return true;
        }
        return peek() == closing;
    }

    private String scanString() {
        int start = pos;
        advance();
        // skip opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
                // skip backslash
                sb.append(scanEscapeSequence());
            }else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            throw errorAt(start, "unterminated string");
        }
        advance();
        // skip closing quote
        return sb.toString();
    }

    private char scanEscapeSequence() {
        char c = advance();
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case 'b' -> '\b';
            case 'f' -> '\f';
            case 'u' -> scanUnicodeEscape();
            default -> c;
        };
    }

    private char scanUnicodeEscape() {
        if (pos + 4 > input.length()) {
            throw error("truncated unicode escape");
        }
        var hex = input.substring(pos, pos + 4);
        try {
            pos += 4;
            return (char) Integer.parseInt(hex, 16);
        } catch (NumberFormatException e) {
            throw errorAt(pos - 4, "invalid unicode escape '\\u" + hex + "'");
        }
    }

    private String scanIdentifier() {
        int start = pos;
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        return input.substring(start, pos);
    }

    private boolean skipDigits() {
        int start = pos;
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
        return pos > start;
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private ValueParseException error(String reason) {
        return errorAt(pos, reason);
    }

    private ValueParseException errorAt(int offset, String reason) {
        return ValueParseException.at(input, offset, reason);
    }

    private static boolean isNumberContinuation(char c) {
        return isDigit(c) || c == '.' || c == 'i';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}

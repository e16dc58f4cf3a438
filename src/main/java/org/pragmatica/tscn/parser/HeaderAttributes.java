package org.pragmatica.tscn.parser;

import org.pragmatica.tscn.error.ParseError;
import org.pragmatica.tscn.error.SceneParseException;
import org.pragmatica.tscn.value.Value;
import org.pragmatica.tscn.value.ValueParseException;
import org.pragmatica.tscn.value.ValueParser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Attributes of one section header, in declaration order.
 *
 * <p>Quoted values are stored unquoted and unescaped; everything else ({@code 3},
 * {@code ExtResource("1")}, {@code ["a", "b"]}) is stored as written.
 */
public final class HeaderAttributes {
    private final String section;
    private final SourceLocation location;
    private final Map<String, String> values;

    HeaderAttributes(String section, SourceLocation location, Map<String, String> values) {
        this.section = section;
        this.location = location;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public String getOrDefault(String key, String defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    public String require(String key) {
        var value = values.get(key);
        if (value == null) {
            throw new SceneParseException(new ParseError.MissingAttribute(location, section, key));
        }
        return value;
    }

    public Optional<Integer> integer(String key) {
        return get(key).map(text -> parseInteger(key, text));
    }

    /**
     * Value-parse an attribute written as a literal, such as {@code groups=["enemies"]}.
     */
    public Optional<Value> value(String key) {
        return get(key).map(text -> parseValue(key, text));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Map<String, String> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    private int parseInteger(String key, String text) {
        try {
            return Integer.parseInt(text.strip());
        } catch (NumberFormatException e) {
            throw new SceneParseException(new ParseError.InvalidAttribute(location, section, key, text, "is not an integer"));
        }
    }

    private Value parseValue(String key, String text) {
        try {
            return ValueParser.parse(text);
        } catch (ValueParseException e) {
            throw new SceneParseException(new ParseError.InvalidAttribute(location,
                                                                          section,
                                                                          key,
                                                                          text,
                                                                          "is not a valid literal: " + e.reason()));
        }
    }
}

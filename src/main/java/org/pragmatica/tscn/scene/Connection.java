package org.pragmatica.tscn.scene;

import org.pragmatica.tscn.value.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code [connection ...]}: a signal wired from one node path to a method on another.
 */
public record Connection(
    String signal,
    String from,
    String to,
    String method,
    Optional<Integer> flags,
    List<Value> binds,
    Map<String, String> attributes
) {
    public Connection {
        binds = List.copyOf(binds);
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Connection of(String signal, String from, String to, String method) {
        return new Connection(signal, from, to, method, Optional.empty(), List.of(), Map.of());
    }
}

package org.pragmatica.tscn.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Literal value on the right-hand side of a scene property.
 *
 * <p>Consumers match on the variants through {@link ValueVisitor}, so a new variant breaks
 * every consumer at compile time instead of falling through at runtime.
 */
public sealed interface Value {

    <R> R accept(ValueVisitor<R> visitor);

    static Value string(String value) {
        return new StringLit(value);
    }

    static Value number(double value) {
        return new NumberLit(value);
    }

    static Value bool(boolean value) {
        return value ? BoolLit.TRUE : BoolLit.FALSE;
    }

    static Value nullValue() {
        return NullLit.INSTANCE;
    }

    static Value array(List<Value> elements) {
        return new ArrayLit(elements);
    }

    static Value record(Map<String, Value> entries) {
        return new RecordLit(entries);
    }

    static Value constructor(String name, List<Value> args) {
        return new Constructor(name, args);
    }

    static Value extRef(String id) {
        return new ExtRef(id);
    }

    static Value subRef(String id) {
        return new SubRef(id);
    }

    /**
     * Quoted string, {@code &"StringName"} or {@code ^"NodePath"} literal, unescaped.
     */
    record StringLit(String value) implements Value {
        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    /**
     * Integer or floating point literal; Godot does not distinguish them in text form.
     */
    record NumberLit(double value) implements Value {
        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitNumber(this);
        }

        public boolean isIntegral() {
            return Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 0x1p53;
        }

        public long asLong() {
            return (long) value;
        }
    }

    record BoolLit(boolean value) implements Value {
        static final BoolLit TRUE = new BoolLit(true);
        static final BoolLit FALSE = new BoolLit(false);

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitBool(this);
        }
    }

    record NullLit() implements Value {
        static final NullLit INSTANCE = new NullLit();

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitNull(this);
        }
    }

    record ArrayLit(List<Value> elements) implements Value {
        public ArrayLit {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitArray(this);
        }
    }

    /**
     * Key/value record. Keys keep their declaration order; non-string keys are kept as their source text.
     */
    record RecordLit(Map<String, Value> entries) implements Value {
        public RecordLit {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitRecord(this);
        }
    }

    /**
     * Typed constructor call such as {@code Vector2(1, 2)} or {@code Array[int]([1, 2])}.
     */
    record Constructor(String name, List<Value> args) implements Value {
        public Constructor {
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitConstructor(this);
        }
    }

    /**
     * {@code ExtResource("id")} reference to an {@code ext_resource} section.
     */
    record ExtRef(String id) implements Value {
        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitExtRef(this);
        }
    }

    /**
     * {@code SubResource("id")} reference to a {@code sub_resource} section.
     */
    record SubRef(String id) implements Value {
        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitSubRef(this);
        }
    }
}

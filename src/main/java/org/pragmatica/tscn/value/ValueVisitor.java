package org.pragmatica.tscn.value;

/**
 * Exhaustive match over {@link Value} variants.
 *
 * @param <R> result of each visit
 */
public interface ValueVisitor<R> {
    R visitString(Value.StringLit value);

    R visitNumber(Value.NumberLit value);

    R visitBool(Value.BoolLit value);

    R visitNull(Value.NullLit value);

    R visitArray(Value.ArrayLit value);

    R visitRecord(Value.RecordLit value);

    R visitConstructor(Value.Constructor value);

    R visitExtRef(Value.ExtRef value);

    R visitSubRef(Value.SubRef value);
}

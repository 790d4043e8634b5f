package org.kumeo.dsl.ast;

/**
 * One entry of a tag-call argument list: {@code value} or {@code key: value}.
 */
public sealed interface Argument {
    Value value();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitPositional(Positional argument);

        R visitNamed(Named argument);
    }

    static Argument positional(Value value) {
        return new Positional(value);
    }

    static Argument named(String key, Value value) {
        return new Named(key, value);
    }

    record Positional(Value value) implements Argument {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPositional(this);
        }
    }

    record Named(String key, Value value) implements Argument {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNamed(this);
        }
    }
}

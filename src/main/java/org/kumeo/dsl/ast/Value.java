package org.kumeo.dsl.ast;

import java.util.List;
import java.util.Map;

/**
 * Literal and structured values appearing in arguments, option bags and metadata.
 */
public sealed interface Value {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitString(StringValue value);

        R visitNumber(NumberValue value);

        R visitBoolean(BooleanValue value);

        R visitNull(NullValue value);

        R visitObject(ObjectValue value);

        R visitArray(ArrayValue value);

        R visitPath(PathValue value);
    }

    static Value string(String value) {
        return new StringValue(value);
    }

    static Value number(double value) {
        return new NumberValue(value);
    }

    static Value bool(boolean value) {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static Value nullValue() {
        return NullValue.INSTANCE;
    }

    static Value object(Map<String, Value> entries) {
        return new ObjectValue(entries);
    }

    static Value array(List<Value> elements) {
        return new ArrayValue(elements);
    }

    static Value path(PathExpr path) {
        return new PathValue(path);
    }

    record StringValue(String value) implements Value {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    record NumberValue(double value) implements Value {
        /**
         * True when the number has no fractional part and fits a long.
         */
        public boolean isIntegral() {
            return value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 9.0e15;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    record BooleanValue(boolean value) implements Value {
        static final BooleanValue TRUE = new BooleanValue(true);
        static final BooleanValue FALSE = new BooleanValue(false);

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    record NullValue() implements Value {
        static final NullValue INSTANCE = new NullValue();

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNull(this);
        }
    }

    /**
     * Object literal; entries keep source order.
     */
    record ObjectValue(Map<String, Value> entries) implements Value {
        public ObjectValue {
            entries = AstMaps.orderedCopy(entries);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitObject(this);
        }
    }

    record ArrayValue(List<Value> elements) implements Value {
        public ArrayValue {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArray(this);
        }
    }

    record PathValue(PathExpr path) implements Value {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPath(this);
        }
    }
}

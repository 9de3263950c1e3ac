package jsonutils.internal.json;

import jsonutils.json.JsonNumber;

/// Holds either an `Integer` or a `BigDecimal`; equality is by stored value,
/// so `1` and `1.0` are different numbers.
record JsonNumberImpl(Number value, int sourceLine) implements JsonNumber {

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonNumber other && value.equals(other.value());
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}

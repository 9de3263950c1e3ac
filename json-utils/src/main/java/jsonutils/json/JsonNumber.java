package jsonutils.json;

import java.math.BigDecimal;

/// The interface that represents a JSON number.
///
/// A literal without a fraction or exponent whose value fits a 32-bit `int`
/// is held as an {@link Integer}; every other literal is held as a
/// {@link BigDecimal}. The distinction is visible through {@link #value()}
/// and {@link #isIntegral()}.
///
/// @apiNote `10000000000` is not integral in this sense: it exceeds `int`
/// range and is held as a `BigDecimal`. Use {@link #decimalValue()} when the
/// storage type does not matter.
public non-sealed interface JsonNumber extends JsonNode {

    /// {@return the stored value, either an `Integer` or a `BigDecimal`}
    Number value();

    /// {@return `true` if the value is held as an `Integer`}
    default boolean isIntegral() {
        return value() instanceof Integer;
    }

    /// {@return the value as an `int`}
    ///
    /// @throws IllegalStateException if the value is not held as an `Integer`
    default int intValue() {
        if (value() instanceof Integer i) {
            return i;
        }
        throw new IllegalStateException("JsonNumber " + value() + " is not an int.");
    }

    /// {@return the value as a `BigDecimal`, whichever way it is stored}
    default BigDecimal decimalValue() {
        final Number v = value();
        return v instanceof BigDecimal bd ? bd : BigDecimal.valueOf(v.longValue());
    }

    @Override
    default JsonNumber number() {
        return this;
    }

    @Override
    default JsonKind kind() {
        return JsonKind.NUMBER;
    }
}

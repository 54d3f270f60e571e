package jcs;

/**
 * A JSON number held as an IEEE-754 double.
 *
 * <p> Any double is accepted here; {@code NaN} and the infinities are rejected when the value is canonicalized.
 *
 * @since 0.1.0
 */
public record JsonNumber(double value) implements JsonValue {

    @Override
    public String stringify() {
        return NumberFormatter.format(value);
    }
}

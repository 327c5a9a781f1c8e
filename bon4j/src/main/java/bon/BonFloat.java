package bon;

/**
 * An IEEE-754 double. Infinities are allowed since an overflowing exponent produces them, NaN is not.
 *
 * @since 0.1.0
 */
public record BonFloat(double value) implements BonValue {

    public BonFloat {
        if (Double.isNaN(value)) throw new IllegalArgumentException("NaN has no BON representation");
    }

    @Override
    public String stringify() {
        return Bon.compactWriter.write(this);
    }

    @Override
    public String kind() {
        return "float";
    }
}

package bon;

/**
 * A signed 64-bit integer. Literals outside the {@code long} range never reach this type.
 *
 * @since 0.1.0
 */
public record BonInteger(long value) implements BonValue {

    @Override
    public String stringify() {
        return Bon.compactWriter.write(this);
    }

    @Override
    public String kind() {
        return "integer";
    }
}

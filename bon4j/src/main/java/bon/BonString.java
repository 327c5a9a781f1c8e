package bon;

import java.util.Objects;

/**
 * @since 0.1.0
 */
public record BonString(String value) implements BonValue {

    public BonString {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String stringify() {
        return Bon.compactWriter.write(this);
    }

    @Override
    public String kind() {
        return "string";
    }
}

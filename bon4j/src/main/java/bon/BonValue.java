package bon;

/**
 * A parsed BON value.
 *
 * <p> Values are immutable trees: a {@link BonList} owns its elements and a {@link BonObject} owns its nodes.
 * {@link #equals(Object)} is structural and order-sensitive on every variant.
 *
 * @since 0.1.0
 */
public sealed interface BonValue permits BonString, BonInteger, BonFloat, BonList, BonObject {

    /**
     * Compact canonical text of this value, e.g. {@code {key:[1,2.0,"x"];}}.
     *
     * @return non-null BON text
     */
    String stringify();

    /**
     * Short name of the variant, used in error messages.
     */
    String kind();

    default String asString() {
        if (this instanceof BonString s) return s.value();
        throw BonException.TypeMismatchException.of(this, "string");
    }

    default long asLong() {
        if (this instanceof BonInteger i) return i.value();
        throw BonException.TypeMismatchException.of(this, "integer");
    }

    /**
     * Numeric value as a double; integers are widened.
     */
    default double asDouble() {
        if (this instanceof BonFloat f) return f.value();
        if (this instanceof BonInteger i) return i.value();
        throw BonException.TypeMismatchException.of(this, "float");
    }

    default BonList asList() {
        if (this instanceof BonList l) return l;
        throw BonException.TypeMismatchException.of(this, "list");
    }

    default BonObject asObject() {
        if (this instanceof BonObject o) return o;
        throw BonException.TypeMismatchException.of(this, "object");
    }

    static BonString of(String value) {
        return new BonString(value);
    }

    static BonInteger of(long value) {
        return new BonInteger(value);
    }

    static BonFloat of(double value) {
        return new BonFloat(value);
    }
}

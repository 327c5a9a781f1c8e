package bon;

import java.util.Iterator;
import java.util.List;

/**
 * An ordered sequence of values, possibly of mixed kinds.
 *
 * @since 0.1.0
 */
public record BonList(List<BonValue> values) implements BonValue, Iterable<BonValue> {

    public BonList {
        values = List.copyOf(values);
    }

    public static BonList of(BonValue... values) {
        return new BonList(List.of(values));
    }

    public BonValue get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public Iterator<BonValue> iterator() {
        return values.iterator();
    }

    @Override
    public String stringify() {
        return Bon.compactWriter.write(this);
    }

    @Override
    public String kind() {
        return "list";
    }
}

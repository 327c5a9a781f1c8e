package bon;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An ordered sequence of {@link BonNode}s.
 *
 * <p> Keys are not required to be unique. All nodes are kept in document order and no key wins over another;
 * {@link #get(String)} returns the first match and {@link #getAll(String)} returns every match.
 *
 * @since 0.1.0
 */
public record BonObject(List<BonNode> nodes) implements BonValue, Iterable<BonNode> {

    public BonObject {
        nodes = List.copyOf(nodes);
    }

    public static BonObject of(BonNode... nodes) {
        return new BonObject(List.of(nodes));
    }

    /**
     * Value of the first node with the given key.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * var object = (BonObject) Bon.parse("{nested: {hello: \"world\";};}");
     * object.get("nested").map(v -> v.asObject().get("hello")); // -> Optional[Optional[BonString[value=world]]]
     * }</pre>
     *
     * @param key node key, not {@code null}
     * @return the value, or empty if no node has this key
     */
    public Optional<BonValue> get(String key) {
        Objects.requireNonNull(key, "key");
        for (var node : nodes) {
            if (node.key().equals(key)) return Optional.of(node.value());
        }
        return Optional.empty();
    }

    /**
     * Values of every node with the given key, in document order.
     */
    public List<BonValue> getAll(String key) {
        Objects.requireNonNull(key, "key");
        return nodes.stream().filter(n -> n.key().equals(key)).map(BonNode::value).toList();
    }

    public boolean containsKey(String key) {
        return get(key).isPresent();
    }

    /**
     * Keys in document order, duplicates included.
     */
    public List<String> keys() {
        return nodes.stream().map(BonNode::key).toList();
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public Iterator<BonNode> iterator() {
        return nodes.iterator();
    }

    @Override
    public String stringify() {
        return Bon.compactWriter.write(this);
    }

    @Override
    public String kind() {
        return "object";
    }
}

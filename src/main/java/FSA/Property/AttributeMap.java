package FSA.Property;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Associates a value with a key (a state, a transition, a pair of states...), independently of how the value is
 * stored. Algorithms receive their inputs (finality, labels) and their scratch data (colors, heights) through this
 * interface, so callers decide the backing storage.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface AttributeMap<K, V> {
    V get(K key);

    /**
     * Stores a value. Read-only maps (function-backed, constant) throw {@link UnsupportedOperationException}.
     */
    default void put(K key, V value) {
        throw new UnsupportedOperationException("Setting a value in a read-only attribute map is not allowed");
    }

    static <K, V> AssocAttributeMap<K, V> assoc(V defaultValue) {
        return new AssocAttributeMap<>(new HashMap<>(), defaultValue);
    }

    static <K, V> AssocAttributeMap<K, V> assoc(Map<K, V> map, V defaultValue) {
        return new AssocAttributeMap<>(map, defaultValue);
    }

    static <K, V> AttributeMap<K, V> func(Function<? super K, ? extends V> function) {
        return new FuncAttributeMap<>(function);
    }

    static <K, V> AttributeMap<K, V> constant(V value) {
        return new ConstantAttributeMap<>(value);
    }

    static <K> AttributeMap<K, K> identity() {
        return key -> key;
    }
}

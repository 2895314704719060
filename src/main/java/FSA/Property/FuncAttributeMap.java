package FSA.Property;

import java.util.function.Function;

public class FuncAttributeMap<K, V> implements AttributeMap<K, V> {
    private final Function<? super K, ? extends V> function;

    public FuncAttributeMap(Function<? super K, ? extends V> function) {
        this.function = function;
    }

    @Override
    public V get(K key) {
        return function.apply(key);
    }
}

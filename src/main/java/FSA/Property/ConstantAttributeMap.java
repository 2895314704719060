package FSA.Property;

public class ConstantAttributeMap<K, V> implements AttributeMap<K, V> {
    private final V value;

    public ConstantAttributeMap(V value) {
        this.value = value;
    }

    @Override
    public V get(K key) {
        return value;
    }

    @Override
    public String toString() {
        return "Constant(" + value + ")";
    }
}

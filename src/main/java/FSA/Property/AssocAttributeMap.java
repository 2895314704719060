package FSA.Property;

import java.util.Map;

/**
 * Read-write attribute map backed by a {@link Map}. Absent keys read as the default value, which is not inserted.
 */
public class AssocAttributeMap<K, V> implements AttributeMap<K, V> {
    private final Map<K, V> map;
    private final V defaultValue;

    public AssocAttributeMap(Map<K, V> map, V defaultValue) {
        this.map = map;
        this.defaultValue = defaultValue;
    }

    @Override
    public V get(K key) {
        return map.getOrDefault(key, defaultValue);
    }

    @Override
    public void put(K key, V value) {
        map.put(key, value);
    }

    public boolean containsKey(K key) {
        return map.containsKey(key);
    }

    public void remove(K key) {
        map.remove(key);
    }

    /**
     * @return the backing map (keys explicitly written so far)
     */
    public Map<K, V> asMap() {
        return map;
    }
}

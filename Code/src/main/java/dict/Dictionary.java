package dict;

/**
 * Collection of keys, each associated with one value.
 *
 * A key is either in the dictionary or not, solely as determined by
 * key equality. There is no concept of multiple equivalent keys.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface Dictionary<K, V> extends Iterable<K> {

    /**
     * @return true if key is currently an element, false otherwise
     */
    boolean has(K key);

    /**
     * Add the given key with its value. A key that is already present keeps its
     * current value.
     * POST: has(key) is true
     */
    void add(K key, V value);

    /**
     * Remove the given key, whether or not it is currently an element.
     * POST: has(key) is false
     */
    void remove(K key);

    /**
     * Value associated with key. A missing key is inserted with a default value first.
     * POST: has(key) is true
     */
    V get(K key);
}

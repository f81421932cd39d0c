package dict;

import java.util.Optional;

/**
 * Read-only access to a {@link Dictionary}. Nothing reachable from here mutates the
 * underlying structure.
 */
public interface ReadOnlyDictionary<K, V> extends Iterable<K> {

    boolean has(K key);

    /**
     * @throws KeyNotFoundException if key is not an element
     */
    V get(K key);

    Optional<V> find(K key);

    int size();
}

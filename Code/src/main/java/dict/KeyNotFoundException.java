package dict;

import java.util.NoSuchElementException;

/**
 * Thrown by a read-only lookup of a key that is not in the dictionary.
 */
public class KeyNotFoundException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    private final transient Object key;

    public KeyNotFoundException(final Object key) {
        super("Not in dictionary: " + key);
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}

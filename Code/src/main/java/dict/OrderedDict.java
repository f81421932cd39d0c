package dict;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Ordered dictionary backed by an unbalanced binary search tree.
 *
 * Keys are ordered by {@link Comparable#compareTo}; two keys are the same key when
 * compareTo returns 0. Iteration visits keys in ascending order. No rebalancing is done,
 * so depth degrades to O(n) for sorted insertion order.
 *
 * Not thread-safe. Callers sharing an instance must serialize access themselves.
 */
public class OrderedDict<K extends Comparable<? super K>, V> implements Dictionary<K, V> {
    //--------------------------------------------------------------------------------
    // Class: Node
    //--------------------------------------------------------------------------------
    protected static final class Node<E extends Comparable<? super E>, V> {
        E key;
        V value;
        Node<E,V> left;     // owned
        Node<E,V> right;    // owned
        Node<E,V> parent;   // lookup only, never an ownership edge

        Node(final E key, final V value, final Node<E,V> parent) {
            this.key = key;
            this.value = value;
            this.parent = parent;
        }

        boolean isLeaf() {
            return left == null && right == null;
        }

        Node<E,V> minNode() {
            Node<E,V> p = this;
            while (p.left != null) p = p.left;
            return p;
        }

        Node<E,V> maxNode() {
            Node<E,V> p = this;
            while (p.right != null) p = p.right;
            return p;
        }

        void detach() {
            left = null;
            right = null;
            parent = null;
        }
    }

    //--------------------------------------------------------------------------------
    // Class: Cursor
    //--------------------------------------------------------------------------------

    /**
     * A position in the in-order sequence of a dictionary: either a node or "end".
     *
     * Two cursors are equal when they refer to the same node, or are both at end.
     * PRECONDITION for key(), value() and advance(): the cursor is not at end.
     * Any add, remove, get of a missing key, clear or assign on the dictionary
     * invalidates its outstanding cursors.
     */
    public static final class Cursor<K extends Comparable<? super K>, V> {
        private Node<K,V> current;

        Cursor(final Node<K,V> node) {
            this.current = node;
        }

        public K key() {
            return current.key;
        }

        public V value() {
            return current.value;
        }

        public boolean isEnd() {
            return current == null;
        }

        /** Moves to the in-order successor, or to end after the largest key. */
        public Cursor<K,V> advance() {
            if (current.right != null) {
                current = current.right.minNode();
            } else {
                while (current.parent != null && current == current.parent.right)
                    current = current.parent;
                current = current.parent;
            }
            return this;
        }

        public Cursor<K,V> copy() {
            return new Cursor<>(current);
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (!(o instanceof Cursor)) return false;
            return current == ((Cursor<?,?>) o).current;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(current);
        }

        @Override
        public String toString() {
            return isEnd() ? "Cursor[end]" : "Cursor[" + current.key + "]";
        }
    }

    private static final class KeyIterator<K extends Comparable<? super K>, V> implements Iterator<K> {
        private final Cursor<K,V> cursor;

        KeyIterator(final Cursor<K,V> cursor) {
            this.cursor = cursor;
        }

        @Override
        public boolean hasNext() {
            return !cursor.isEnd();
        }

        @Override
        public K next() {
            if (cursor.isEnd()) throw new NoSuchElementException();
            K key = cursor.key();
            cursor.advance();
            return key;
        }
    }

    //--------------------------------------------------------------------------------
    // DICTIONARY
    //--------------------------------------------------------------------------------
    private final Supplier<? extends V> defaultValue;

    Node<K,V> root;

    public OrderedDict() {
        this(() -> null);
    }

    /**
     * @param defaultValue produces the value stored by {@link #get} for a missing key
     */
    public OrderedDict(final Supplier<? extends V> defaultValue) {
        this.defaultValue = Objects.requireNonNull(defaultValue, "defaultValue");
        this.root = null;
    }

    /** Deep copy of other, sharing its default-value supplier. */
    public OrderedDict(final OrderedDict<K,V> other) {
        this.defaultValue = other.defaultValue;
        this.root = copyTree(other.root);
    }

    /** Takes over the tree of other, leaving other empty. O(1). */
    public static <K extends Comparable<? super K>, V> OrderedDict<K,V> moveOf(final OrderedDict<K,V> other) {
        return new OrderedDict<K,V>(other.defaultValue).moveFrom(other);
    }

//--------------------------------------------------------------------------------
// PUBLIC METHODS:
// - has / find           : lookup, never mutates
// - add                  : insert, keeps an existing value
// - get                  : lookup-or-insert-default
// - put                  : insert or overwrite
// - remove               : delete by copying up an in-order neighbour
//--------------------------------------------------------------------------------

    /** PRECONDITION: key CANNOT BE NULL **/
    @Override
    public final boolean has(final K key) {
        return search(key) != null;
    }

    // Non-mutating lookup. A key mapped to null is reported as empty;
    // has() tells it apart from a missing key.
    /** PRECONDITION: key CANNOT BE NULL **/
    public final Optional<V> find(final K key) {
        Node<K,V> n = search(key);
        return (n == null) ? Optional.empty() : Optional.ofNullable(n.value);
    }

    // Re-adding a key that is already present leaves its value untouched;
    // use put() to overwrite.
    /** PRECONDITION: key CANNOT BE NULL **/
    @Override
    public final void add(final K key, final V value) {
        insert(key, value);
    }

    /** PRECONDITION: key CANNOT BE NULL **/
    @Override
    public final V get(final K key) {
        return getOrInsertDefault(key);
    }

    /**
     * Returns the value of key. A missing key is first inserted with a value from the
     * default-value supplier, so this mutates the tree when key is absent.
     * PRECONDITION: key CANNOT BE NULL
     */
    public final V getOrInsertDefault(final K key) {
        Node<K,V> n = search(key);
        if (n == null) n = insert(key, defaultValue.get());
        return n.value;
    }

    // Insert or overwrite, return the previous value associated with the key,
    // or null if there was no mapping for the key
    /** PRECONDITION: key CANNOT BE NULL **/
    public final V put(final K key, final V value) {
        Node<K,V> n = search(key);
        if (n == null) {
            insert(key, value);
            return null;
        }
        V old = n.value;
        n.value = value;
        return old;
    }

    /**
     * Removes key if present. A node with children is never unlinked directly: its entry
     * is replaced by the largest key of its left subtree (or, without a left child, the
     * smallest key of its right subtree), and that donor is removed in turn until the
     * donor is a leaf. Removing an absent key does nothing.
     * PRECONDITION: key CANNOT BE NULL
     */
    @Override
    public final void remove(final K key) {
        Node<K,V> n = search(key);
        if (n == null) return;

        // every node on the donor chain receives the entry of the next one
        ArrayDeque<Node<K,V>> chain = new ArrayDeque<>();
        while (!n.isLeaf()) {
            chain.push(n);
            n = (n.left != null) ? n.left.maxNode() : n.right.minNode();
        }
        K movedKey = n.key;
        V movedValue = n.value;
        unlink(n);

        while (!chain.isEmpty()) {
            Node<K,V> target = chain.pop();
            K k = target.key;
            V v = target.value;
            target.key = movedKey;
            target.value = movedValue;
            movedKey = k;
            movedValue = v;
        }
    }

    /** Cursor at the smallest key, or end() when empty. */
    public final Cursor<K,V> begin() {
        return new Cursor<>(root == null ? null : root.minNode());
    }

    // cursor at key, or end() when key is absent
    /** PRECONDITION: key CANNOT BE NULL **/
    public final Cursor<K,V> begin(final K key) {
        return new Cursor<>(search(key));
    }

    public final Cursor<K,V> end() {
        return new Cursor<>(null);
    }

    /** Keys in ascending order. */
    @Override
    public final Iterator<K> iterator() {
        return new KeyIterator<>(begin());
    }

    /** Keys in ascending order starting at fromKey; empty when fromKey is absent. */
    public final Iterator<K> iterator(final K fromKey) {
        return new KeyIterator<>(begin(fromKey));
    }

    /** Read-only view whose get() throws {@link KeyNotFoundException} instead of inserting. */
    public final ReadOnlyDictionary<K,V> readOnly() {
        return new ReadOnlyView();
    }

    public OrderedDict<K,V> copy() {
        return new OrderedDict<>(this);
    }

    /**
     * Replaces the contents of this dictionary with a deep copy of other.
     * The default-value supplier of this dictionary is kept.
     */
    public final OrderedDict<K,V> assign(final OrderedDict<K,V> other) {
        if (other != this) {
            clear();
            root = copyTree(other.root);
        }
        return this;
    }

    /** Exchanges trees with other in O(1); other ends up with the former contents of this. */
    public final OrderedDict<K,V> moveFrom(final OrderedDict<K,V> other) {
        Node<K,V> tmp = root;
        root = other.root;
        other.root = tmp;
        return this;
    }

    /** Releases every node, clearing child and parent links. */
    public final void clear() {
        if (root == null) return;
        ArrayDeque<Node<K,V>> work = new ArrayDeque<>();
        work.push(root);
        root = null;
        while (!work.isEmpty()) {
            Node<K,V> n = work.pop();
            if (n.left != null) work.push(n.left);
            if (n.right != null) work.push(n.right);
            n.detach();
        }
    }

    public final boolean isEmpty() {
        return root == null;
    }

//--------------------------------------------------------------------------------
// PRIVATE METHODS
// - search
// - insert
// - unlink
// - copyTree
//--------------------------------------------------------------------------------

    private Node<K,V> search(final K key) {
        if (key == null) throw new NullPointerException();
        Node<K,V> p = root;
        while (p != null) {
            int c = key.compareTo(p.key);
            if (c == 0) return p;
            p = (c < 0) ? p.left : p.right;
        }
        return null;
    }

    // returns the node holding key: the existing one, or the newly attached leaf
    private Node<K,V> insert(final K key, final V value) {
        if (key == null) throw new NullPointerException();
        if (root == null) {
            root = new Node<>(key, value, null);
            return root;
        }
        Node<K,V> p = root;
        int c;
        while ((c = key.compareTo(p.key)) != 0) {
            if (c < 0) {
                if (p.left == null) {
                    p.left = new Node<>(key, value, p);
                    return p.left;
                }
                p = p.left;
            } else {
                if (p.right == null) {
                    p.right = new Node<>(key, value, p);
                    return p.right;
                }
                p = p.right;
            }
        }
        return p;
    }

    private void unlink(final Node<K,V> leaf) {
        Node<K,V> p = leaf.parent;
        if (p == null) root = null;
        else if (p.left == leaf) p.left = null;
        else p.right = null;
        leaf.detach();
    }

    private static <E extends Comparable<? super E>, T> Node<E,T> copyTree(final Node<E,T> source) {
        if (source == null) return null;
        Node<E,T> copyRoot = new Node<>(source.key, source.value, null);
        ArrayDeque<Node<E,T>> from = new ArrayDeque<>();
        ArrayDeque<Node<E,T>> to = new ArrayDeque<>();
        from.push(source);
        to.push(copyRoot);
        while (!from.isEmpty()) {
            Node<E,T> s = from.pop();
            Node<E,T> c = to.pop();
            if (s.left != null) {
                c.left = new Node<>(s.left.key, s.left.value, c);
                from.push(s.left);
                to.push(c.left);
            }
            if (s.right != null) {
                c.right = new Node<>(s.right.key, s.right.value, c);
                from.push(s.right);
                to.push(c.right);
            }
        }
        return copyRoot;
    }

    private final class ReadOnlyView implements ReadOnlyDictionary<K,V> {
        @Override
        public boolean has(final K key) {
            return OrderedDict.this.has(key);
        }

        @Override
        public V get(final K key) {
            Node<K,V> n = search(key);
            if (n == null) throw new KeyNotFoundException(key);
            return n.value;
        }

        @Override
        public Optional<V> find(final K key) {
            return OrderedDict.this.find(key);
        }

        @Override
        public int size() {
            return sizeStructural();
        }

        @Override
        public Iterator<K> iterator() {
            return OrderedDict.this.iterator();
        }
    }

    /**
     *
     * DEBUG CODE (FOR TESTBED)
     *
     */

    public int sizeStructural() {
        int n = 0;
        for (Cursor<K,V> it = begin(); !it.isEnd(); it.advance()) n++;
        return n;
    }

    // nodes on the longest root-to-leaf path, 0 when empty
    public int height() {
        if (root == null) return 0;
        int h = 0;
        ArrayDeque<Node<K,V>> level = new ArrayDeque<>();
        level.add(root);
        while (!level.isEmpty()) {
            h++;
            for (int i = level.size(); i > 0; i--) {
                Node<K,V> n = level.poll();
                if (n.left != null) level.add(n.left);
                if (n.right != null) level.add(n.right);
            }
        }
        return h;
    }

    /**
     * Checks parent back-references on every node and that the in-order key
     * sequence is strictly ascending.
     */
    public boolean checkInvariants() {
        if (root == null) return true;
        if (root.parent != null) return false;
        ArrayDeque<Node<K,V>> work = new ArrayDeque<>();
        work.push(root);
        int count = 0;
        while (!work.isEmpty()) {
            Node<K,V> n = work.pop();
            count++;
            if (n.left != null) {
                if (n.left.parent != n) return false;
                work.push(n.left);
            }
            if (n.right != null) {
                if (n.right.parent != n) return false;
                work.push(n.right);
            }
        }
        K prev = null;
        int visited = 0;
        for (Cursor<K,V> it = begin(); !it.isEnd(); it.advance()) {
            if (prev != null && prev.compareTo(it.key()) >= 0) return false;
            prev = it.key();
            visited++;
        }
        return visited == count;
    }

    /**
     * One line per node in key order, prefixed by its path from the root:
     * "0" for each left step, "1" for each right step, indented by depth.
     */
    public String toTreeString() {
        StringBuilder sb = new StringBuilder();
        printR(sb, "", root);
        return sb.toString();
    }

    private static void printR(final StringBuilder out, final String prefix, final Node<?,?> node) {
        if (node == null) return;
        if (node.left != null) printR(out, " " + prefix + "0", node.left);
        out.append(prefix).append(": ").append(node.key).append('\n');
        if (node.right != null) printR(out, " " + prefix + "1", node.right);
    }
}

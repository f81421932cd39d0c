package dict;

import org.junit.jupiter.api.Test;

import java.util.*;
import static org.junit.jupiter.api.Assertions.*;

class CursorTest {

    private static OrderedDict<Integer,String> sample() {
        OrderedDict<Integer,String> d = new OrderedDict<>();
        for (int k : new int[]{5, 3, 8, 1, 4, 7, 9}) d.add(k, "v" + k);
        return d;
    }

    @Test
    void begin_equals_end_on_empty_tree() {
        OrderedDict<Integer,String> d = new OrderedDict<>();
        assertEquals(d.end(), d.begin());
        assertTrue(d.begin().isEnd());
        assertFalse(d.iterator().hasNext());
        assertThrows(NoSuchElementException.class, () -> d.iterator().next());
    }

    @Test
    void cursor_walks_keys_in_ascending_order() {
        OrderedDict<Integer,String> d = sample();
        List<Integer> seen = new ArrayList<>();
        List<String> values = new ArrayList<>();
        for (OrderedDict.Cursor<Integer,String> it = d.begin(); !it.equals(d.end()); it.advance()) {
            seen.add(it.key());
            values.add(it.value());
        }
        assertEquals(List.of(1, 3, 4, 5, 7, 8, 9), seen);
        assertEquals(List.of("v1", "v3", "v4", "v5", "v7", "v8", "v9"), values);
    }

    @Test
    void begin_at_key_starts_mid_sequence() {
        OrderedDict<Integer,String> d = sample();
        List<Integer> seen = new ArrayList<>();
        Iterator<Integer> it = d.iterator(4);
        while (it.hasNext()) seen.add(it.next());
        assertEquals(List.of(4, 5, 7, 8, 9), seen);

        assertEquals(d.end(), d.begin(6));
        assertFalse(d.iterator(6).hasNext());
    }

    @Test
    void advance_from_largest_reaches_end() {
        OrderedDict<Integer,String> d = sample();
        OrderedDict.Cursor<Integer,String> c = d.begin(9);
        assertEquals(9, c.key());
        assertTrue(c.advance().isEnd());
        assertEquals(d.end(), c);
    }

    @Test
    void successor_climbs_through_right_children() {
        OrderedDict<Integer,String> d = sample();
        // 4 is the right child of 3, its successor is the root
        assertEquals(5, d.begin(4).advance().key());
        // 5 has a right subtree, its successor is that subtree's minimum
        assertEquals(7, d.begin(5).advance().key());
    }

    @Test
    void equality_is_by_position() {
        OrderedDict<Integer,String> d = sample();
        assertEquals(d.begin(), d.begin(1));
        assertEquals(d.begin().hashCode(), d.begin(1).hashCode());
        assertNotEquals(d.begin(), d.begin(3));
        assertNotEquals(d.begin(), d.end());

        // same key in another dictionary is another position
        OrderedDict<Integer,String> other = sample();
        assertNotEquals(d.begin(1), other.begin(1));
    }

    @Test
    void copy_of_cursor_advances_independently() {
        OrderedDict<Integer,String> d = sample();
        OrderedDict.Cursor<Integer,String> a = d.begin();
        OrderedDict.Cursor<Integer,String> b = a.copy();
        b.advance();
        assertEquals(1, a.key());
        assertEquals(3, b.key());
        assertEquals("Cursor[1]", a.toString());
        assertEquals("Cursor[end]", d.end().toString());
    }

    @Test
    void iterator_throws_past_end() {
        OrderedDict<Integer,String> d = new OrderedDict<>();
        d.add(1, "a");
        Iterator<Integer> it = d.iterator();
        assertEquals(1, it.next());
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void iteration_is_sorted_for_random_insertions() {
        OrderedDict<Integer,Integer> d = new OrderedDict<>();
        TreeSet<Integer> ref = new TreeSet<>();
        Random rnd = new Random(99);
        for (int i = 0; i < 500; i++) {
            int k = rnd.nextInt(10_000);
            d.add(k, k);
            ref.add(k);
        }
        List<Integer> seen = new ArrayList<>();
        for (int k : d) seen.add(k);
        assertEquals(new ArrayList<>(ref), seen);

        // starting from any present key yields the tail set
        int from = new ArrayList<>(ref).get(ref.size() / 2);
        List<Integer> tail = new ArrayList<>();
        d.iterator(from).forEachRemaining(tail::add);
        assertEquals(new ArrayList<>(ref.tailSet(from)), tail);
    }
}

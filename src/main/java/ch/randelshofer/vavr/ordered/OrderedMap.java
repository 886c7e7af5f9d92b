/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2024 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.ordered;

import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.Iterator;
import io.vavr.collection.List;
import io.vavr.collection.Seq;
import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.Supplier;
import java.util.stream.Collector;

/**
 * Implements a mutable map that iterates in the order in which keys were
 * first inserted, using a red-black tree that is ordered by insertion
 * sequence numbers.
 * <p>
 * Features:
 * <ul>
 *     <li>iterates in the order, in which keys were inserted</li>
 *     <li>does not allow null keys, allows null values</li>
 *     <li>is mutable</li>
 *     <li>is not thread-safe</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>insert, getOrInsert, remove: O(log N)</li>
 *     <li>get, find, containsKey: O(log N)</li>
 *     <li>copy: O(N log N)</li>
 *     <li>iterator creation: O(log N)</li>
 *     <li>iterator.next: O(1) in an amortized sense</li>
 *     <li>keysSnapshot, values: O(N)</li>
 * </ul>
 * <p>
 * Implementation details:
 * <p>
 * This map consists of two trees.
 * <p>
 * The index tracker maps each key to the sequence number under which the
 * key was first inserted. It is sorted by key. A counter supplies the sequence
 * numbers. The counter only grows, even across {@link #clear()}. If a key is
 * removed and inserted again, it receives a new sequence number and moves to
 * the end of the iteration order.
 * <p>
 * The primary store maps each key to its value. Its comparator does not compare
 * the keys, it looks up their sequence numbers in the index tracker and compares
 * those. Therefore, a key must be registered in the index tracker before the
 * primary store sees it, and it may only be dropped from the index tracker after
 * the primary store has dropped it. All mutations go through {@code track} and
 * {@code untrack}, which perform both steps in this order.
 * <p>
 * Range queries:
 * <p>
 * {@link #lowerBound}, {@link #upperBound} and {@link #equalRange} locate positions
 * in the primary store. Since the primary store is ordered by sequence number,
 * these methods find the insertion slot of the given key, not the smallest key
 * that is greater than or equal to it in key order. They are only meaningful
 * for keys that are contained in the map; for any other key they return the
 * end position.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class OrderedMap<K, V> implements Iterable<Tuple2<K, V>> {
    private static final Comparator<Long> UNSIGNED_ASCENDING = Long::compareUnsigned;

    private IndexTracker<K> tracker;
    private InsertionOrderComparator<K> comparator;
    private TreeMap<K, V> store;

    private OrderedMap(IndexTracker<K> tracker, InsertionOrderComparator<K> comparator) {
        this.tracker = tracker;
        this.comparator = comparator;
        this.store = new TreeMap<>(comparator);
    }

    private static <K, V> OrderedMap<K, V> create(Comparator<? super K> keyComparator,
                                                  Comparator<? super Long> indexComparator) {
        final IndexTracker<K> tracker = new IndexTracker<>(keyComparator);
        return new OrderedMap<>(tracker, new InsertionOrderComparator<>(tracker, indexComparator));
    }

    /**
     * Returns a new empty map, which uses the natural ordering of its keys
     * to track their sequence numbers.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return A new empty map
     */
    public static <K, V> OrderedMap<K, V> empty() {
        return create(null, UNSIGNED_ASCENDING);
    }

    /**
     * Returns a new empty map, which uses the given comparator to track the
     * sequence numbers of its keys.
     *
     * @param keyComparator the key comparator
     * @param <K>           The key type
     * @param <V>           The value type
     * @return A new empty map
     */
    public static <K, V> OrderedMap<K, V> empty(Comparator<? super K> keyComparator) {
        Objects.requireNonNull(keyComparator, "keyComparator is null");
        return create(keyComparator, UNSIGNED_ASCENDING);
    }

    /**
     * Returns a new empty map with a custom order over sequence numbers.
     * <p>
     * With {@code Comparator.reverseOrder()}, the map iterates the most
     * recently inserted key first.
     *
     * @param keyComparator   the key comparator, or {@code null} for the natural ordering of the keys
     * @param indexComparator the comparator over sequence numbers
     * @param <K>             The key type
     * @param <V>             The value type
     * @return A new empty map
     */
    public static <K, V> OrderedMap<K, V> empty(Comparator<? super K> keyComparator,
                                                Comparator<? super Long> indexComparator) {
        Objects.requireNonNull(indexComparator, "indexComparator is null");
        return create(keyComparator, indexComparator);
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain an {@link OrderedMap}.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return An {@link OrderedMap} Collector.
     */
    public static <K, V> Collector<Tuple2<K, V>, ArrayList<Tuple2<K, V>>, OrderedMap<K, V>> collector() {
        return Collector.of(ArrayList::new, ArrayList::add,
                (left, right) -> {
                    left.addAll(right);
                    return left;
                },
                list -> OrderedMap.<K, V>ofEntries(list));
    }

    public static <K, V> OrderedMap<K, V> of(K key, V value) {
        final OrderedMap<K, V> m = empty();
        m.insert(key, value);
        return m;
    }

    public static <K, V> OrderedMap<K, V> of(K k1, V v1, K k2, V v2) {
        final OrderedMap<K, V> m = of(k1, v1);
        m.insert(k2, v2);
        return m;
    }

    public static <K, V> OrderedMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3) {
        final OrderedMap<K, V> m = of(k1, v1, k2, v2);
        m.insert(k3, v3);
        return m;
    }

    public static <K, V> OrderedMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3, K k4, V v4) {
        final OrderedMap<K, V> m = of(k1, v1, k2, v2, k3, v3);
        m.insert(k4, v4);
        return m;
    }

    public static <K, V> OrderedMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3, K k4, V v4, K k5, V v5) {
        final OrderedMap<K, V> m = of(k1, v1, k2, v2, k3, v3, k4, v4);
        m.insert(k5, v5);
        return m;
    }

    /**
     * Creates an OrderedMap of the given entries. The entries are inserted in
     * the given order. If a key occurs more than once, the first entry wins.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new Map containing the given entries
     */
    @SafeVarargs
    public static <K, V> OrderedMap<K, V> ofEntries(Tuple2<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        return ofEntries(Arrays.asList(entries));
    }

    /**
     * Creates an OrderedMap of the given entries. The entries are inserted in
     * the given order. If a key occurs more than once, the first entry wins.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new Map containing the given entries
     */
    public static <K, V> OrderedMap<K, V> ofEntries(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        final OrderedMap<K, V> m = empty();
        m.insertAll(entries);
        return m;
    }

    /**
     * Creates an OrderedMap of the given entries.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new Map containing the given entries
     */
    @SafeVarargs
    public static <K, V> OrderedMap<K, V> ofEntries(Map.Entry<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        final OrderedMap<K, V> m = empty();
        for (Map.Entry<? extends K, ? extends V> e : entries) {
            m.insert(e.getKey(), e.getValue());
        }
        return m;
    }

    /**
     * Returns an {@code OrderedMap} from a source java.util.Map. The entries
     * are inserted in the iteration order of the source map.
     *
     * @param map A map
     * @param <K> The key type
     * @param <V> The value type
     * @return A new Map containing the given map
     */
    public static <K, V> OrderedMap<K, V> ofAll(Map<? extends K, ? extends V> map) {
        Objects.requireNonNull(map, "map is null");
        final OrderedMap<K, V> m = empty();
        m.insertAll(map);
        return m;
    }

    /**
     * Returns a comparator that compares two maps lexicographically by their
     * entries in iteration order. Entries are compared by key first, then by value.
     * A map that is a proper prefix of another map is less than the other map.
     *
     * @param keyComparator   the key comparator
     * @param valueComparator the value comparator
     * @param <K>             The key type
     * @param <V>             The value type
     * @return a lexicographic comparator
     */
    public static <K, V> Comparator<OrderedMap<K, V>> lexicographic(Comparator<? super K> keyComparator,
                                                                    Comparator<? super V> valueComparator) {
        final Comparator<Tuple2<K, V>> entryComparator = Tuple2.comparator(
                Objects.requireNonNull(keyComparator, "keyComparator is null"),
                Objects.requireNonNull(valueComparator, "valueComparator is null"));
        return (a, b) -> {
            final Iterator<Tuple2<K, V>> i = a.iterator();
            final Iterator<Tuple2<K, V>> j = b.iterator();
            while (i.hasNext() && j.hasNext()) {
                final int c = entryComparator.compare(i.next(), j.next());
                if (c != 0) {
                    return c;
                }
            }
            return Boolean.compare(i.hasNext(), j.hasNext());
        };
    }

    public static <K extends Comparable<? super K>, V extends Comparable<? super V>> Comparator<OrderedMap<K, V>> naturalOrder() {
        return lexicographic(Comparator.<K>naturalOrder(), Comparator.<V>naturalOrder());
    }

    // -- lockstep mutation of index tracker and primary store

    private boolean track(K key, V value) {
        if (!tracker.assign(key)) {
            return false;
        }
        store.put(key, value);
        return true;
    }

    private boolean untrack(K key) {
        if (!tracker.contains(key)) {
            return false;
        }
        store.remove(key);
        tracker.retract(key);
        return true;
    }

    // -- lookup

    /**
     * Returns the value of the given key.
     *
     * @param key a key
     * @return the value of the key
     * @throws KeyNotFoundException if the map does not contain the key
     */
    public V get(K key) {
        Objects.requireNonNull(key, "key is null");
        if (!tracker.contains(key)) {
            throw new KeyNotFoundException(key);
        }
        return store.get(key);
    }

    public Option<V> find(K key) {
        Objects.requireNonNull(key, "key is null");
        return containsKey(key) ? Option.some(store.get(key)) : Option.none();
    }

    public V getOrElse(K key, V defaultValue) {
        return find(key).getOrElse(defaultValue);
    }

    public boolean containsKey(K key) {
        Objects.requireNonNull(key, "key is null");
        return tracker.contains(key);
    }

    /**
     * Returns the number of entries with the given key.
     *
     * @param key a key
     * @return 1 if the map contains the key, 0 otherwise
     */
    public int count(K key) {
        return containsKey(key) ? 1 : 0;
    }

    public int size() {
        return store.size();
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    // -- insertion

    /**
     * Returns the value of the given key. If the map does not contain the key,
     * inserts the key at the end with a value obtained from {@code defaultValue}.
     * <p>
     * Calling this method again for the same key returns the same value and
     * does not change the position of the key.
     *
     * @param key          a key
     * @param defaultValue supplies the value for a new key
     * @return the value of the key
     */
    public V getOrInsert(K key, Supplier<? extends V> defaultValue) {
        Objects.requireNonNull(key, "key is null");
        Objects.requireNonNull(defaultValue, "defaultValue is null");
        if (tracker.contains(key)) {
            return store.get(key);
        }
        final V value = defaultValue.get();
        // the supplier may have inserted the key itself
        return track(key, value) ? value : store.get(key);
    }

    /**
     * Inserts the given key with the given value at the end of the map,
     * unless the map already contains the key.
     * <p>
     * An existing key keeps its value and its position. To move a key to the
     * end, remove it first.
     *
     * @param key   a key
     * @param value a value
     * @return true if the key has been inserted
     */
    public boolean insert(K key, V value) {
        Objects.requireNonNull(key, "key is null");
        return track(key, value);
    }

    public boolean insert(Tuple2<? extends K, ? extends V> entry) {
        Objects.requireNonNull(entry, "entry is null");
        return insert(entry._1, entry._2);
    }

    /**
     * Inserts the given entries in the given order, skipping keys that are
     * already present.
     *
     * @param entries the entries
     * @return the number of inserted entries
     */
    public int insertAll(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        int inserted = 0;
        for (Tuple2<? extends K, ? extends V> e : entries) {
            if (insert(e._1, e._2)) {
                inserted++;
            }
        }
        return inserted;
    }

    public int insertAll(Map<? extends K, ? extends V> map) {
        Objects.requireNonNull(map, "map is null");
        int inserted = 0;
        for (Map.Entry<? extends K, ? extends V> e : map.entrySet()) {
            if (insert(e.getKey(), e.getValue())) {
                inserted++;
            }
        }
        return inserted;
    }

    /**
     * Replaces the value of the given key, without changing its position.
     * Does nothing if the map does not contain the key.
     *
     * @param key   a key
     * @param value the new value
     * @return the old value, or {@code none} if the map does not contain the key
     */
    public Option<V> replace(K key, V value) {
        Objects.requireNonNull(key, "key is null");
        if (!tracker.contains(key)) {
            return Option.none();
        }
        return Option.some(store.put(key, value));
    }

    // -- removal

    /**
     * Removes the given key.
     *
     * @param key a key
     * @return the number of removed entries, 0 or 1
     */
    public int remove(K key) {
        Objects.requireNonNull(key, "key is null");
        return untrack(key) ? 1 : 0;
    }

    /**
     * Removes all entries from {@code fromKey} (inclusive) up to {@code toKey}
     * (exclusive) in iteration order.
     * <p>
     * If the map does not contain {@code fromKey}, nothing is removed. If the map
     * does not contain {@code toKey}, all entries from {@code fromKey} up to the end
     * are removed. If {@code toKey} comes before {@code fromKey}, nothing is removed.
     *
     * @param fromKey the first key to remove
     * @param toKey   the first key to keep
     * @return the number of removed entries
     */
    public int removeRange(K fromKey, K toKey) {
        Objects.requireNonNull(fromKey, "fromKey is null");
        Objects.requireNonNull(toKey, "toKey is null");
        if (!tracker.contains(fromKey)) {
            return 0;
        }
        final NavigableMap<K, V> range;
        if (tracker.contains(toKey)) {
            if (comparator.compare(fromKey, toKey) > 0) {
                return 0;
            }
            range = store.subMap(fromKey, true, toKey, false);
        } else {
            range = store.tailMap(fromKey, true);
        }
        final List<K> keys = List.ofAll(range.keySet());
        keys.forEach(this::untrack);
        return keys.size();
    }

    /**
     * Removes all entries. Keys that are inserted afterwards receive sequence
     * numbers that are greater than all sequence numbers handed out before.
     */
    public void clear() {
        store.clear();
        tracker.clear();
    }

    // -- positions in insertion order

    /**
     * Returns the first entry that does not come before the insertion slot of
     * the given key. For a contained key, this is the entry of the key itself.
     *
     * @param key a key
     * @return the entry, or {@code none} for the end position
     */
    public Option<Tuple2<K, V>> lowerBound(K key) {
        Objects.requireNonNull(key, "key is null");
        return tracker.contains(key) ? Option.of(store.ceilingEntry(key)).map(OrderedMap::toTuple) : Option.none();
    }

    /**
     * Returns the first entry that comes after the insertion slot of the given key.
     * For a contained key, this is the entry that was inserted next.
     *
     * @param key a key
     * @return the entry, or {@code none} for the end position
     */
    public Option<Tuple2<K, V>> upperBound(K key) {
        Objects.requireNonNull(key, "key is null");
        return tracker.contains(key) ? Option.of(store.higherEntry(key)).map(OrderedMap::toTuple) : Option.none();
    }

    /**
     * Returns the entries between {@link #lowerBound} and {@link #upperBound}
     * of the given key.
     *
     * @param key a key
     * @return the entry of the key, or an empty sequence
     */
    public Seq<Tuple2<K, V>> equalRange(K key) {
        Objects.requireNonNull(key, "key is null");
        if (!tracker.contains(key)) {
            return List.empty();
        }
        return List.ofAll(store.subMap(key, true, key, true).entrySet()).map(OrderedMap::toTuple);
    }

    // -- traversal

    /**
     * Returns an iterator over the entries in insertion order.
     * <p>
     * The iterator does not support removal. It fails with a
     * {@link java.util.ConcurrentModificationException} if the map is
     * structurally modified during iteration.
     *
     * @return an iterator
     */
    @Override
    public Iterator<Tuple2<K, V>> iterator() {
        return Iterator.ofAll(store.entrySet().iterator()).map(OrderedMap::toTuple);
    }

    /**
     * Returns an iterator over the entries in reverse insertion order.
     *
     * @return an iterator
     */
    public Iterator<Tuple2<K, V>> reverseIterator() {
        return Iterator.ofAll(store.descendingMap().entrySet().iterator()).map(OrderedMap::toTuple);
    }

    public void forEach(BiConsumer<? super K, ? super V> action) {
        Objects.requireNonNull(action, "action is null");
        store.forEach(action);
    }

    /**
     * Returns the keys in their current iteration order. The returned sequence
     * is not affected by later changes of this map.
     *
     * @return the keys
     */
    public Seq<K> keysSnapshot() {
        return List.ofAll(store.keySet());
    }

    public Seq<V> values() {
        return List.ofAll(store.values());
    }

    public Tuple2<K, V> head() {
        if (isEmpty()) {
            throw new NoSuchElementException("head of empty OrderedMap");
        }
        return toTuple(store.firstEntry());
    }

    public Option<Tuple2<K, V>> headOption() {
        return isEmpty() ? Option.none() : Option.some(head());
    }

    public Tuple2<K, V> last() {
        if (isEmpty()) {
            throw new NoSuchElementException("last of empty OrderedMap");
        }
        return toTuple(store.lastEntry());
    }

    public Option<Tuple2<K, V>> lastOption() {
        return isEmpty() ? Option.none() : Option.some(last());
    }

    // -- copying

    /**
     * Returns an independent copy of this map. The copy has the same entries,
     * sequence numbers and iteration order, and continues counting where this
     * map stands.
     *
     * @return a copy of this map
     */
    public OrderedMap<K, V> copy() {
        final IndexTracker<K> trackerCopy = tracker.copy();
        final OrderedMap<K, V> copy = new OrderedMap<>(trackerCopy, comparator.rebind(trackerCopy));
        for (Map.Entry<K, V> e : store.entrySet()) {
            copy.store.put(e.getKey(), e.getValue());
        }
        return copy;
    }

    /**
     * Exchanges the contents of this map with the contents of the given map.
     *
     * @param that another map
     */
    public void swap(OrderedMap<K, V> that) {
        Objects.requireNonNull(that, "that is null");
        final IndexTracker<K> t = tracker;
        final InsertionOrderComparator<K> c = comparator;
        final TreeMap<K, V> s = store;
        tracker = that.tracker;
        comparator = that.comparator;
        store = that.store;
        that.tracker = t;
        that.comparator = c;
        that.store = s;
    }

    /**
     * Returns the order over sequence numbers that this map uses.
     *
     * @return the index comparator
     */
    public Comparator<? super Long> indexComparator() {
        return comparator.indexComparator();
    }

    public java.util.LinkedHashMap<K, V> toJavaMap() {
        return new java.util.LinkedHashMap<>(store);
    }

    IndexTracker<K> tracker() {
        return tracker;
    }

    InsertionOrderComparator<K> orderComparator() {
        return comparator;
    }

    /**
     * Two ordered maps are equal if they contain equal entries in the same order.
     */
    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof OrderedMap)) {
            return false;
        }
        final OrderedMap<?, ?> that = (OrderedMap<?, ?>) o;
        if (size() != that.size()) {
            return false;
        }
        final java.util.Iterator<? extends Map.Entry<?, ?>> i = store.entrySet().iterator();
        final java.util.Iterator<? extends Map.Entry<?, ?>> j = that.store.entrySet().iterator();
        while (i.hasNext()) {
            final Map.Entry<?, ?> a = i.next();
            final Map.Entry<?, ?> b = j.next();
            if (!Objects.equals(a.getKey(), b.getKey()) || !Objects.equals(a.getValue(), b.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (Map.Entry<K, V> e : store.entrySet()) {
            hash = 31 * hash + Objects.hash(e.getKey(), e.getValue());
        }
        return hash;
    }

    @Override
    public String toString() {
        return iterator().mkString("OrderedMap(", ", ", ")");
    }

    private static <K, V> Tuple2<K, V> toTuple(Map.Entry<K, V> entry) {
        return Tuple.of(entry.getKey(), entry.getValue());
    }
}

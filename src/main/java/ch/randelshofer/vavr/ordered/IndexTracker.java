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

import io.vavr.control.Option;

import java.util.Comparator;
import java.util.NoSuchElementException;
import java.util.TreeMap;

/**
 * Records the sequence number under which each key of an {@link OrderedMap}
 * was first inserted.
 * <p>
 * The tracker is a key-sorted map from key to sequence number, plus a counter.
 * A key that is assigned for the first time receives the current counter value,
 * and the counter is incremented. Sequence numbers are never handed out twice:
 * the counter is not reset by {@link #retract} or {@link #clear()}, so a key that
 * is removed and assigned again receives a new, larger number.
 * <p>
 * Sequence numbers are unsigned 64-bit values. The counter would have to be
 * incremented 2<sup>64</sup> times before it wraps around.
 * <p>
 * This class is not thread-safe.
 *
 * @param <K> the key type
 */
final class IndexTracker<K> {
    private final TreeMap<K, Long> indices;
    /**
     * The sequence number that the next newly assigned key receives.
     */
    private long counter;

    /**
     * Creates an empty tracker.
     *
     * @param keyComparator the key order of the tracker, or {@code null}
     *                      for the natural ordering of the keys
     */
    IndexTracker(Comparator<? super K> keyComparator) {
        this.indices = new TreeMap<>(keyComparator);
    }

    private IndexTracker(IndexTracker<K> that) {
        this.indices = new TreeMap<>(that.indices);
        this.counter = that.counter;
    }

    /**
     * Assigns the next sequence number to the given key, unless the key
     * already has one.
     *
     * @param key a key
     * @return true if the key was not tracked before
     */
    boolean assign(K key) {
        if (indices.containsKey(key)) {
            return false;
        }
        indices.put(key, counter++);
        return true;
    }

    /**
     * Forgets the sequence number of the given key.
     *
     * @param key a key
     * @return true if the key was tracked
     */
    boolean retract(K key) {
        return indices.remove(key) != null;
    }

    /**
     * Returns the sequence number of the given key.
     *
     * @param key a tracked key
     * @return the sequence number of the key
     * @throws NoSuchElementException if the key is not tracked
     */
    long lookup(K key) {
        final Long index = indices.get(key);
        if (index == null) {
            throw new NoSuchElementException("key is not tracked: " + key);
        }
        return index;
    }

    Option<Long> find(K key) {
        return Option.of(indices.get(key));
    }

    boolean contains(K key) {
        return indices.containsKey(key);
    }

    int size() {
        return indices.size();
    }

    boolean isEmpty() {
        return indices.isEmpty();
    }

    /**
     * Forgets all keys. The counter keeps its value.
     */
    void clear() {
        indices.clear();
    }

    long nextSequenceNumber() {
        return counter;
    }

    Comparator<? super K> keyComparator() {
        return indices.comparator();
    }

    /**
     * Returns an independent tracker with the same keys, sequence numbers
     * and counter.
     *
     * @return a copy of this tracker
     */
    IndexTracker<K> copy() {
        return new IndexTracker<>(this);
    }
}

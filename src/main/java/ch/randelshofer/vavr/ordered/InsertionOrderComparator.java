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

import java.util.Comparator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Orders keys by the sequence numbers that an {@link IndexTracker} assigned to them.
 * <p>
 * The comparator does not own the tracker. It must only be used by the primary
 * store of the {@link OrderedMap} that owns the tracker, and that map must assign
 * a sequence number to a key before the store compares it.
 * <p>
 * A map that copies itself must {@link #rebind} the comparator to the tracker of
 * the copy. A comparator that is shared between two maps makes the second map
 * consult the sequence numbers of the first one.
 *
 * @param <K> the key type
 */
final class InsertionOrderComparator<K> implements Comparator<K> {
    private final IndexTracker<K> tracker;
    private final Comparator<? super Long> indexComparator;

    InsertionOrderComparator(IndexTracker<K> tracker, Comparator<? super Long> indexComparator) {
        this.tracker = Objects.requireNonNull(tracker, "tracker is null");
        this.indexComparator = Objects.requireNonNull(indexComparator, "indexComparator is null");
    }

    /**
     * Compares two keys by their sequence numbers.
     *
     * @throws IllegalStateException if one of the keys is not tracked
     */
    @Override
    public int compare(K a, K b) {
        return indexComparator.compare(sequenceOf(a), sequenceOf(b));
    }

    private long sequenceOf(K key) {
        try {
            return tracker.lookup(key);
        } catch (NoSuchElementException e) {
            throw new IllegalStateException("Inconsistent ordered map: key " + key + " has no insertion index", e);
        }
    }

    Comparator<? super Long> indexComparator() {
        return indexComparator;
    }

    /**
     * Returns a comparator with the same index order that consults the given tracker.
     *
     * @param other the tracker of another map
     * @return a comparator bound to {@code other}
     */
    InsertionOrderComparator<K> rebind(IndexTracker<K> other) {
        return new InsertionOrderComparator<>(other, indexComparator);
    }

    boolean isBoundTo(IndexTracker<K> other) {
        return tracker == other;
    }
}

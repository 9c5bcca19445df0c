package com.farmerworking.datyl.in.java.stream;

import com.farmerworking.datyl.in.java.api.JoinedEntry;
import com.farmerworking.datyl.in.java.api.KeyValue;
import com.farmerworking.datyl.in.java.api.SortedStream;
import com.google.common.base.Preconditions;

import java.util.Comparator;
import java.util.function.Consumer;

/**
 * Walks two sorted streams side by side, like a full outer join on the key:
 *
 * <pre>
 *   key on both streams        - (key, left, right)
 *   key on the left stream only  - (key, left, null)
 *   key on the right stream only - (key, null, right)
 * </pre>
 *
 * Both inputs must carry unique keys; wrap them in a {@link UniqueStream} or a
 * {@link FoldedStream} first if they may not. Duplicated keys still terminate,
 * but their pairing is unspecified. Filters belong to the two inputs, there
 * are none here.
 */
public class ComparisonStream<K, L, R> {
    private final SortedStream<K, L> left;
    private final SortedStream<K, R> right;
    private final Comparator<? super K> comparator;

    public ComparisonStream(SortedStream<K, L> left, SortedStream<K, R> right, Comparator<? super K> comparator) {
        this.left = Preconditions.checkNotNull(left, "left");
        this.right = Preconditions.checkNotNull(right, "right");
        this.comparator = Preconditions.checkNotNull(comparator, "comparator");
    }

    public ComparisonStream(SortedStream<K, L> left, SortedStream<K, R> right) {
        this(left, right, Preconditions.checkNotNull(left, "left").comparator());
    }

    // Return the next entry, or null when both sides are exhausted or when
    // neither side produced a pair on this step.
    public JoinedEntry<K, L, R> get() {
        if (atEnd()) {
            return null;
        }

        KeyValue<K, L> first = left.pull();
        KeyValue<K, R> second = right.pull();

        if (second == null) {
            return first == null ? null : JoinedEntry.leftOnly(first.getKey(), first.getValue());
        } else if (first == null) {
            return JoinedEntry.rightOnly(second.getKey(), second.getValue());
        }

        int cmp = comparator.compare(first.getKey(), second.getKey());
        if (cmp < 0) {
            right.pushback();
            return JoinedEntry.leftOnly(first.getKey(), first.getValue());
        } else if (cmp > 0) {
            left.pushback();
            return JoinedEntry.rightOnly(second.getKey(), second.getValue());
        } else {
            return JoinedEntry.both(first.getKey(), first.getValue(), second.getValue());
        }
    }

    public boolean atEnd() {
        return left.atEnd() && right.atEnd();
    }

    public void each(Consumer<? super JoinedEntry<K, L, R>> visitor) {
        while (!atEnd()) {
            JoinedEntry<K, L, R> entry = get();
            if (entry != null) {
                visitor.accept(entry);
            }
        }
    }

    public ComparisonStream<K, L, R> rewind() {
        left.rewind();
        right.rewind();
        return this;
    }

    public SortedStream<K, L> getLeft() {
        return left;
    }

    public SortedStream<K, R> getRight() {
        return right;
    }

    @Override
    public String toString() {
        return String.format("%s comparing %s with %s", getClass().getSimpleName(), left, right);
    }
}

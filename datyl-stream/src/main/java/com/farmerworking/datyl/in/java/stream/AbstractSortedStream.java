package com.farmerworking.datyl.in.java.stream;

import com.farmerworking.datyl.in.java.api.KeyValue;
import com.farmerworking.datyl.in.java.api.SortedStream;
import com.farmerworking.datyl.in.java.api.StreamFilter;
import com.farmerworking.datyl.in.java.common.Status;
import com.farmerworking.datyl.in.java.common.StreamException;
import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Pushback, filtering and iteration shared by every sorted stream. A subclass
 * supplies the raw source: {@link #read()}, {@link #isSourceExhausted()} and
 * {@link #rewindSource()}.
 */
public abstract class AbstractSortedStream<K, V> implements SortedStream<K, V> {
    protected final Comparator<? super K> comparator;
    private final List<StreamFilter<K, V>> filters = new ArrayList<>();

    private KeyValue<K, V> last;
    private boolean pushbackPending;

    protected AbstractSortedStream(Comparator<? super K> comparator) {
        this.comparator = Preconditions.checkNotNull(comparator, "comparator");
        this.last = null;
        this.pushbackPending = false;
    }

    // Consume and return the next pair from the source, or null if there is none.
    protected abstract KeyValue<K, V> read();

    protected abstract boolean isSourceExhausted();

    protected abstract void rewindSource();

    @Override
    public final KeyValue<K, V> pull() {
        if (pushbackPending) {
            pushbackPending = false;
            return last;
        }

        // the end marker leaves the last pair in place, so it can still be pushed back
        if (isSourceExhausted()) {
            return null;
        }
        last = read();
        return last;
    }

    @Override
    public final void pushback() {
        if (pushbackPending) {
            throw new StreamException(Status.UsageError(String.format("%s: cannot push back twice in a row", this)));
        }
        pushbackPending = true;
    }

    @Override
    public final boolean isPushbackPending() {
        return pushbackPending;
    }

    @Override
    public final boolean atEnd() {
        return !pushbackPending && isSourceExhausted();
    }

    @Override
    public final SortedStream<K, V> rewind() {
        pushbackPending = false;
        last = null;
        rewindSource();
        return this;
    }

    @Override
    public Comparator<? super K> comparator() {
        return comparator;
    }

    @Override
    public final List<StreamFilter<K, V>> filters() {
        return filters;
    }

    @Override
    public SortedStream<K, V> addFilter(StreamFilter<K, V> filter) {
        filters.add(Preconditions.checkNotNull(filter, "filter"));
        return this;
    }

    @Override
    public void each(BiConsumer<? super K, ? super V> visitor) {
        while (!atEnd()) {
            KeyValue<K, V> keyValue = pull();
            if (passesFilters(keyValue)) {
                visitor.accept(keyValue.getKey(), keyValue.getValue());
            }
        }
    }

    @Override
    public <W> ComparisonStream<K, V, W> diffAgainst(SortedStream<K, W> other) {
        return new ComparisonStream<>(this, other, comparator);
    }

    private boolean passesFilters(KeyValue<K, V> keyValue) {
        if (keyValue == null || keyValue.getKey() == null) {
            return false;
        }

        for (StreamFilter<K, V> filter : filters) {
            if (!filter.accept(keyValue.getKey(), keyValue.getValue())) {
                return false;
            }
        }
        return true;
    }
}

package com.farmerworking.datyl.in.java.stream;

import com.farmerworking.datyl.in.java.api.Fields;
import com.farmerworking.datyl.in.java.api.KeyValue;
import com.farmerworking.datyl.in.java.common.Status;
import com.farmerworking.datyl.in.java.common.StreamException;
import com.farmerworking.datyl.in.java.file.LineSource;
import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Reads whitespace-delimited records, one per line, from an already-open
 * {@link LineSource}. The first field is the key, the rest make up the value
 * (see {@link Fields#of}). Lines should share one arity, but a mismatch is
 * passed through as is. A line without any field reads as the end of the
 * source for that pull.
 *
 * <p>The caller owns the source and closes it.
 */
public class DataFileStream extends AbstractSortedStream<String, Fields> {
    private final LineSource source;

    public DataFileStream(LineSource source) {
        super(Comparator.naturalOrder());
        this.source = Preconditions.checkNotNull(source, "source");
    }

    @Override
    protected KeyValue<String, Fields> read() {
        Pair<Status, String> pair = source.readLine();
        if (pair.getKey().isNotOk()) {
            throw new StreamException(pair.getKey());
        }

        return parse(pair.getValue());
    }

    // Split a line on runs of whitespace into key and value.
    // Returns null for a null line or a line without any field.
    public static KeyValue<String, Fields> parse(String line) {
        String[] parts = StringUtils.split(line);
        if (parts == null || parts.length == 0) {
            return null;
        }
        return KeyValue.of(parts[0], Fields.of(Arrays.asList(parts).subList(1, parts.length)));
    }

    @Override
    protected boolean isSourceExhausted() {
        return source.isEof();
    }

    @Override
    protected void rewindSource() {
        if (source.isClosed()) {
            throw new StreamException(Status.UsageError(String.format("%s can't be rewound: it has been closed", source)));
        }

        Status status = source.rewind();
        if (status.isNotOk()) {
            throw new StreamException(status);
        }
    }

    @Override
    public String toString() {
        return String.format("%s from %s", getClass().getSimpleName(), source);
    }
}

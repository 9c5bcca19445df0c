package com.farmerworking.datyl.in.java.stream;

import com.farmerworking.datyl.in.java.api.KeyValue;
import com.farmerworking.datyl.in.java.api.SortedStream;
import com.farmerworking.datyl.in.java.utils.ListStream;
import com.farmerworking.datyl.in.java.utils.StringLineSource;
import com.farmerworking.datyl.in.java.utils.TestUtils;
import com.google.common.collect.Lists;
import org.junit.Test;

import java.util.List;
import java.util.Random;

import static com.farmerworking.datyl.in.java.utils.TestUtils.kv;
import static org.junit.Assert.*;

public class UniqueStreamTest extends SortedStreamTest {
    @Override
    protected SortedStream<String, ?> getImpl() {
        return new UniqueStream<>(new DataFileStream(new StringLineSource("a 1\na 2\nb 3\nc 4\nc 5\nc 6\n")));
    }

    @Override
    protected List<String> expectedKeys() {
        return Lists.newArrayList("a", "b", "c");
    }

    @Test
    public void testFirstSeenWins() {
        UniqueStream<Integer, String> stream = new UniqueStream<>(ListStream.of(
                kv(1, "first"), kv(1, "second"), kv(2, "x"), kv(3, "y"), kv(3, "z")));

        assertEquals(Lists.newArrayList(kv(1, "first"), kv(2, "x"), kv(3, "y")), Streams.toList(stream));
    }

    @Test
    public void testIdempotentOnUniqueInput() {
        Random random = new Random();
        List<KeyValue<String, String>> data = TestUtils.randomSortedData(random, 1 + random.nextInt(50), "u");

        assertEquals(data, Streams.toList(new UniqueStream<>(new ListStream<>(data))));
        assertEquals(data, Streams.toList(new UniqueStream<>(new UniqueStream<>(new ListStream<>(data)))));
    }

    @Test
    public void testSingleRun() {
        UniqueStream<Integer, String> stream = new UniqueStream<>(ListStream.of(kv(7, "a"), kv(7, "b"), kv(7, "c")));
        assertEquals(kv(7, "a"), stream.pull());
        assertTrue(stream.atEnd());
        assertNull(stream.pull());
    }

    @Test
    public void testEmptyInner() {
        UniqueStream<Integer, String> stream = new UniqueStream<>(new ListStream<Integer, String>(Lists.newArrayList()));
        assertTrue(stream.atEnd());
        assertNull(stream.pull());
    }

    @Test
    public void testLeavesNextKeyPendingOnInner() {
        ListStream<Integer, String> inner = ListStream.of(kv(1, "a"), kv(2, "b"));
        UniqueStream<Integer, String> stream = new UniqueStream<>(inner);

        assertEquals(kv(1, "a"), stream.pull());
        assertTrue(inner.isPushbackPending());
        assertFalse(stream.atEnd());
        assertEquals(kv(2, "b"), stream.pull());
        assertTrue(stream.atEnd());
    }

    @Test
    public void testComparatorFollowsInner() {
        ListStream<Integer, String> inner = ListStream.of(kv(1, "a"));
        assertSame(inner.comparator(), new UniqueStream<>(inner).comparator());
    }
}

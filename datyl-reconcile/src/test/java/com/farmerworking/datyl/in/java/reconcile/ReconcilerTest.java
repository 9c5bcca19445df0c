package com.farmerworking.datyl.in.java.reconcile;

import com.farmerworking.datyl.in.java.api.Fields;
import com.farmerworking.datyl.in.java.api.KeyValue;
import com.farmerworking.datyl.in.java.api.SortedStream;
import com.farmerworking.datyl.in.java.common.Status;
import com.farmerworking.datyl.in.java.file.Env;
import com.farmerworking.datyl.in.java.file.LineSource;
import com.farmerworking.datyl.in.java.file.impl.DefaultEnv;
import com.farmerworking.datyl.in.java.report.Reporter;
import com.farmerworking.datyl.in.java.stream.AbstractSortedStream;
import com.farmerworking.datyl.in.java.stream.Streams;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public class ReconcilerTest {
    private Env env;
    private Reporter reporter;
    private List<String> files;
    private List<LineSource> sources;

    @Before
    public void setUp() throws Exception {
        env = new DefaultEnv();
        reporter = mock(Reporter.class);
        files = new ArrayList<>();
        sources = new ArrayList<>();
    }

    @After
    public void tearDown() throws Exception {
        for (LineSource source : sources) {
            source.close();
        }
        for (String file : files) {
            env.delete(file);
        }
    }

    private SortedStream<String, Fields> inventory(String name, String content) {
        String filename = env.getTestDirectory().getValue() + "/" + name;
        files.add(filename);
        assertTrue(Env.writeStringToFileSync(env, content, filename).isOk());

        Pair<Status, LineSource> pair = env.newLineSource(filename);
        assertTrue(pair.getKey().isOk());
        sources.add(pair.getValue());
        return Streams.unique(Streams.dataFile(pair.getValue()));
    }

    // A one-pair stream whose value may be null.
    private static class SingleStream extends AbstractSortedStream<String, String> {
        private final KeyValue<String, String> keyValue;
        private boolean consumed;

        SingleStream(String key, String value) {
            super(Comparator.naturalOrder());
            this.keyValue = KeyValue.of(key, value);
            this.consumed = false;
        }

        @Override
        protected KeyValue<String, String> read() {
            consumed = true;
            return keyValue;
        }

        @Override
        protected boolean isSourceExhausted() {
            return consumed;
        }

        @Override
        protected void rewindSource() {
            consumed = false;
        }
    }

    @Test
    public void testReconcile() {
        SortedStream<String, Fields> expected = inventory("expected.txt", "f1 md5a 10\nf2 md5b 20\nf3 md5c 30\nf5 md5e 50\n");
        SortedStream<String, Fields> found = inventory("found.txt", "f1 md5a 10\nf1 md5z 10\nf3 md5x 30\nf4 md5d 40\nf5 md5e 50\n");

        ReconcileStats stats = new Reconciler(reporter).reconcile("expected", expected, "found", found);

        assertEquals(2, stats.getMatched());
        assertEquals(1, stats.getChanged());
        assertEquals(1, stats.getLeftOnly());
        assertEquals(1, stats.getRightOnly());
        assertEquals(3, stats.getDifferences());
        assertFalse(stats.isIdentical());

        verify(reporter).info("f2 only in expected: [md5b, 20]");
        verify(reporter).warn("f3 changed: [md5c, 30] in expected, [md5x, 30] in found");
        verify(reporter).info("f4 only in found: [md5d, 40]");
        verifyNoMoreInteractions(reporter);
    }

    @Test
    public void testIdentical() {
        SortedStream<String, Fields> left = inventory("left.txt", "a 1\nb\nc 3 4\n");
        SortedStream<String, Fields> right = inventory("right.txt", "a 1\nb\nc 3 4\n");

        ReconcileStats stats = new Reconciler(reporter).reconcile(left, right);
        assertTrue(stats.isIdentical());
        assertEquals(3, stats.getMatched());
        verifyNoInteractions(reporter);
    }

    @Test
    public void testStreamNames() {
        SortedStream<String, Fields> left = inventory("named-left.txt", "a 1\n");
        SortedStream<String, Fields> right = inventory("named-right.txt", "");

        new Reconciler(reporter).reconcile(left, right);
        verify(reporter).info("a only in " + left + ": 1");
        verify(reporter, never()).warn(anyString());
    }

    @Test
    public void testNullValuesOnBothSidesMatch() {
        ReconcileStats stats = new Reconciler(reporter).reconcile(
                "left", new SingleStream("a", null), "right", new SingleStream("a", null));

        assertEquals(1, stats.getMatched());
        assertEquals(0, stats.getRightOnly());
        assertTrue(stats.isIdentical());
        verifyNoInteractions(reporter);
    }

    @Test
    public void testNullValueAgainstValueIsChanged() {
        ReconcileStats stats = new Reconciler(reporter).reconcile(
                "left", new SingleStream("a", null), "right", new SingleStream("a", "1"));

        assertEquals(1, stats.getChanged());
        verify(reporter).warn("a changed: null in left, 1 in right");
    }
}

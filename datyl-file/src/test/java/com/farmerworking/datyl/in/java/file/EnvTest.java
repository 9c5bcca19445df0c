package com.farmerworking.datyl.in.java.file;

import com.farmerworking.datyl.in.java.common.Status;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public abstract class EnvTest {
    Env env;

    protected abstract Env getImpl();

    @Before
    public void setUp() throws Exception {
        env = getImpl();
    }

    private String testFileName(String name) {
        Pair<Status, String> pair = env.getTestDirectory();
        assertTrue(pair.getKey().isOk());
        String filename = pair.getValue() + "/" + name;
        assertTrue(env.delete(filename).getKey().isOk());
        return filename;
    }

    @Test
    public void testWriteThenReadLines() {
        String filename = testFileName("lines.txt");

        Pair<Status, WritableFile> filePair = env.newWritableFile(filename);
        assertTrue(filePair.getKey().isOk());
        WritableFile file = filePair.getValue();
        assertTrue(file.append("alpha 1 2\n").isOk());
        assertTrue(file.append("beta 3\n").isOk());
        assertTrue(file.flush().isOk());
        assertTrue(file.sync().isOk());
        assertTrue(file.close().isOk());

        Pair<Status, LineSource> sourcePair = env.newLineSource(filename);
        assertTrue(sourcePair.getKey().isOk());
        LineSource source = sourcePair.getValue();

        assertFalse(source.isEof());
        assertEquals("alpha 1 2", source.readLine().getValue());
        assertFalse(source.isEof());
        assertEquals("beta 3", source.readLine().getValue());
        assertTrue(source.isEof());

        Pair<Status, String> atEnd = source.readLine();
        assertTrue(atEnd.getKey().isOk());
        assertNull(atEnd.getValue());

        assertTrue(source.close().isOk());
        env.delete(filename);
    }

    @Test
    public void testRewindLineSource() {
        String filename = testFileName("rewind.txt");
        assertTrue(Env.writeStringToFileSync(env, "a\nb\nc\n", filename).isOk());

        LineSource source = env.newLineSource(filename).getValue();
        assertEquals("a", source.readLine().getValue());
        assertEquals("b", source.readLine().getValue());

        assertTrue(source.rewind().isOk());
        assertFalse(source.isEof());
        assertEquals("a", source.readLine().getValue());
        assertEquals("b", source.readLine().getValue());
        assertEquals("c", source.readLine().getValue());
        assertTrue(source.isEof());

        assertTrue(source.rewind().isOk());
        assertEquals("a", source.readLine().getValue());

        source.close();
        env.delete(filename);
    }

    @Test
    public void testClosedLineSource() {
        String filename = testFileName("closed.txt");
        assertTrue(Env.writeStringToFileSync(env, "a\n", filename).isOk());

        LineSource source = env.newLineSource(filename).getValue();
        assertFalse(source.isClosed());
        assertTrue(source.close().isOk());
        assertTrue(source.isClosed());

        assertTrue(source.isEof());
        assertTrue(source.rewind().isIOError());
        assertTrue(source.readLine().getKey().isIOError());

        // closing twice is harmless
        assertTrue(source.close().isOk());
        env.delete(filename);
    }

    @Test
    public void testEmptyFile() {
        String filename = testFileName("empty.txt");
        assertTrue(Env.writeStringToFileSync(env, "", filename).isOk());

        LineSource source = env.newLineSource(filename).getValue();
        assertTrue(source.isEof());
        assertNull(source.readLine().getValue());
        source.close();
        env.delete(filename);
    }

    @Test
    public void testOpenNonExistentFile() {
        String filename = testFileName("non_existent_file");
        assertFalse(env.isFileExists(filename));
        assertFalse(env.isFileReadable(filename));

        Pair<Status, LineSource> pair = env.newLineSource(filename);
        assertTrue(pair.getKey().isNotFound());
        assertNull(pair.getValue());
    }

    @Test
    public void testReopenAppendableFile() {
        String filename = testFileName("appendable.txt");

        WritableFile file = env.newAppendableFile(filename).getValue();
        assertTrue(file.append("hello world!").isOk());
        assertTrue(file.close().isOk());

        file = env.newAppendableFile(filename).getValue();
        assertTrue(file.append("42").isOk());
        assertTrue(file.close().isOk());

        Pair<Status, String> contentPair = Env.readFileToString(env, filename);
        assertTrue(contentPair.getKey().isOk());
        assertEquals("hello world!42\n", contentPair.getValue());

        file = env.newWritableFile(filename).getValue();
        assertTrue(file.append("7").isOk());
        assertTrue(file.close().isOk());
        assertEquals("7\n", Env.readFileToString(env, filename).getValue());
        env.delete(filename);
    }

    @Test
    public void testWriteStringToFileAndReadFileToString() {
        String filename = testFileName(RandomStringUtils.randomAlphabetic(8));

        String s = "abcdefg\n";
        assertTrue(Env.writeStringToFileSync(env, s, filename).isOk());
        assertTrue(env.isFileReadable(filename));
        assertEquals(s, Env.readFileToString(env, filename).getValue());

        String s2 = StringUtils.repeat(s, 10000);
        assertTrue(Env.writeStringToFileSync(env, s2, filename).isOk());
        assertEquals(s2, Env.readFileToString(env, filename).getValue());
        env.delete(filename);
    }

    @Test
    public void testWriteStringToFileErrorCase() {
        String filename = testFileName(RandomStringUtils.randomAlphabetic(8));

        Env spyEnv = spy(env);
        doReturn(Pair.of(Status.IOError("force new writable file error"), null)).
                when(spyEnv).newWritableFile(anyString());
        Status status = Env.writeStringToFileSync(spyEnv, "abc", filename);
        assertTrue(status.isIOError());
        assertEquals("force new writable file error", status.getMessage());

        WritableFile writableFile = mock(WritableFile.class);
        doReturn(Pair.of(Status.OK(), writableFile)).when(spyEnv).newWritableFile(anyString());

        when(writableFile.append(anyString())).thenReturn(Status.IOError("force append error"));
        status = Env.writeStringToFileSync(spyEnv, "abc", filename);
        assertEquals("force append error", status.getMessage());
        assertFalse(spyEnv.isFileExists(filename));

        when(writableFile.append(anyString())).thenReturn(Status.OK());
        when(writableFile.sync()).thenReturn(Status.OK());
        when(writableFile.close()).thenReturn(Status.IOError("force close error"));
        status = Env.writeStringToFileSync(spyEnv, "abc", filename);
        assertEquals("force close error", status.getMessage());
        verify(spyEnv, atLeastOnce()).delete(filename);
    }

    @Test
    public void testNewTempFile() {
        Pair<Status, String> pair = env.newTempFile("report-unit-");
        assertTrue(pair.getKey().isOk());
        assertTrue(env.isFileExists(pair.getValue()));
        assertTrue(pair.getValue().contains("report-unit-"));

        Pair<Status, Boolean> deleted = env.delete(pair.getValue());
        assertTrue(deleted.getKey().isOk());
        assertTrue(deleted.getValue());
        assertFalse(env.isFileExists(pair.getValue()));
    }
}

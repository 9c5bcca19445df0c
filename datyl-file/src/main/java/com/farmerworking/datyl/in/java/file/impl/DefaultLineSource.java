package com.farmerworking.datyl.in.java.file.impl;

import com.farmerworking.datyl.in.java.common.Status;
import com.farmerworking.datyl.in.java.file.LineSource;
import org.apache.commons.lang3.tuple.Pair;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

// UTF-8 text file read one line ahead, so that isEof() is exact.
public class DefaultLineSource implements LineSource {
    private final String filename;
    private final FileInputStream fileInputStream;
    private BufferedReader reader;

    private boolean filled;
    private String lookahead;
    private Status lookaheadStatus;
    private boolean closed;

    public DefaultLineSource(String filename, FileInputStream fileInputStream) {
        this.filename = filename;
        this.fileInputStream = fileInputStream;
        this.reader = newReader();
        this.filled = false;
        this.lookahead = null;
        this.lookaheadStatus = Status.OK();
        this.closed = false;
    }

    @Override
    public Pair<Status, String> readLine() {
        if (closed) {
            return Pair.of(Status.IOError(filename, "line source is closed"), null);
        }

        fill();
        Pair<Status, String> result = Pair.of(lookaheadStatus, lookahead);
        if (lookaheadStatus.isNotOk() || lookahead != null) {
            filled = false;
            lookahead = null;
            lookaheadStatus = Status.OK();
        }
        return result;
    }

    @Override
    public boolean isEof() {
        if (closed) {
            return true;
        }

        fill();
        return lookahead == null && lookaheadStatus.isOk();
    }

    @Override
    public Status rewind() {
        if (closed) {
            return Status.IOError(filename, "line source is closed");
        }

        try {
            // the old reader is dropped without closing, it shares the file handle
            fileInputStream.getChannel().position(0);
            reader = newReader();
            filled = false;
            lookahead = null;
            lookaheadStatus = Status.OK();
            return Status.OK();
        } catch (IOException e) {
            return Status.IOError(filename, e.getMessage());
        }
    }

    @Override
    public Status close() {
        if (closed) {
            return Status.OK();
        }

        closed = true;
        try {
            reader.close();
            return Status.OK();
        } catch (IOException e) {
            return Status.IOError(filename, e.getMessage());
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public String toString() {
        return String.format("%s(%s)", getClass().getSimpleName(), filename);
    }

    private void fill() {
        if (filled) {
            return;
        }

        try {
            lookahead = reader.readLine();
            lookaheadStatus = Status.OK();
        } catch (IOException e) {
            lookahead = null;
            lookaheadStatus = Status.IOError(filename, e.getMessage());
        }
        filled = true;
    }

    private BufferedReader newReader() {
        return new BufferedReader(new InputStreamReader(fileInputStream, StandardCharsets.UTF_8));
    }
}

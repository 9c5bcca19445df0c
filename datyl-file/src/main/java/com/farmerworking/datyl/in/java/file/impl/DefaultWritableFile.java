package com.farmerworking.datyl.in.java.file.impl;

import com.farmerworking.datyl.in.java.common.Status;
import com.farmerworking.datyl.in.java.file.WritableFile;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class DefaultWritableFile implements WritableFile {
    private final String filename;
    private final FileOutputStream fileOutputStream;
    private final BufferedOutputStream outputStream;

    public DefaultWritableFile(String filename, FileOutputStream fileOutputStream) {
        this.filename = filename;
        this.fileOutputStream = fileOutputStream;
        this.outputStream = new BufferedOutputStream(fileOutputStream);
    }

    @Override
    public Status append(String data) {
        try {
            outputStream.write(data.getBytes(StandardCharsets.UTF_8));
            return Status.OK();
        } catch (IOException e) {
            return Status.IOError(filename, e.getMessage());
        }
    }

    @Override
    public Status close() {
        try {
            outputStream.close();
            return Status.OK();
        } catch (IOException e) {
            return Status.IOError(filename, e.getMessage());
        }
    }

    @Override
    public Status flush() {
        try {
            outputStream.flush();
            return Status.OK();
        } catch (IOException e) {
            return Status.IOError(filename, e.getMessage());
        }
    }

    @Override
    public Status sync() {
        try {
            outputStream.flush();
            fileOutputStream.getFD().sync();
            return Status.OK();
        } catch (IOException e) {
            return Status.IOError(filename, e.getMessage());
        }
    }
}

package com.farmerworking.datyl.in.java.file.impl;

import com.farmerworking.datyl.in.java.common.Status;
import com.farmerworking.datyl.in.java.file.Env;
import com.farmerworking.datyl.in.java.file.LineSource;
import com.farmerworking.datyl.in.java.file.WritableFile;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class DefaultEnv implements Env {
    private static final Logger logger = LoggerFactory.getLogger(DefaultEnv.class);

    @Override
    public Pair<Status, LineSource> newLineSource(String filename) {
        try {
            FileInputStream fileInputStream = new FileInputStream(filename);
            return Pair.of(Status.OK(), new DefaultLineSource(filename, fileInputStream));
        } catch (FileNotFoundException e) {
            logger.warn("open line source {} failed: {}", filename, e.getMessage());
            return Pair.of(Status.NotFound(e.getMessage()), null);
        }
    }

    @Override
    public Pair<Status, WritableFile> newWritableFile(String filename) {
        return openWritableFile(filename, false);
    }

    @Override
    public Pair<Status, WritableFile> newAppendableFile(String filename) {
        return openWritableFile(filename, true);
    }

    @Override
    public Pair<Status, String> newTempFile(String prefix) {
        try {
            Path path = Files.createTempFile(prefix, ".tmp");
            return Pair.of(Status.OK(), path.toString());
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("create temp file with prefix {} failed: {}", prefix, e.getMessage());
            return Pair.of(Status.IOError(prefix, e.getMessage()), null);
        }
    }

    @Override
    public Pair<Status, String> getTestDirectory() {
        String directory = String.format("%s/datyltest-%s",
                System.getProperty("java.io.tmpdir"),
                ManagementFactory.getRuntimeMXBean().getName().split("@")[0]);
        try {
            Path path = Paths.get(directory);
            if (!Files.exists(path)) {
                Files.createDirectories(path);
            }
            return Pair.of(Status.OK(), path.toString());
        } catch (IOException e) {
            return Pair.of(Status.IOError(e.getMessage()), null);
        }
    }

    @Override
    public Pair<Status, Boolean> delete(String filename) {
        try {
            return Pair.of(Status.OK(), Files.deleteIfExists(Paths.get(filename)));
        } catch (IOException e) {
            logger.warn("delete {} failed: {}", filename, e.getMessage());
            return Pair.of(Status.IOError(filename, e.getMessage()), null);
        }
    }

    @Override
    public boolean isFileExists(String filename) {
        return Files.exists(Paths.get(filename));
    }

    @Override
    public boolean isFileReadable(String filename) {
        Path path = Paths.get(filename);
        return Files.isRegularFile(path) && Files.isReadable(path);
    }

    private Pair<Status, WritableFile> openWritableFile(String filename, boolean append) {
        try {
            FileOutputStream fileOutputStream = new FileOutputStream(filename, append);
            return Pair.of(Status.OK(), new DefaultWritableFile(filename, fileOutputStream));
        } catch (IOException e) {
            logger.warn("open writable file {} failed: {}", filename, e.getMessage());
            return Pair.of(Status.IOError(filename, e.getMessage()), null);
        }
    }
}

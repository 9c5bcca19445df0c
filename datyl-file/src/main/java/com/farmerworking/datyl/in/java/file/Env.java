package com.farmerworking.datyl.in.java.file;

import com.farmerworking.datyl.in.java.common.Status;
import org.apache.commons.lang3.tuple.Pair;

public interface Env {
    Pair<Status, LineSource> newLineSource(String filename);

    Pair<Status, WritableFile> newWritableFile(String filename);

    Pair<Status, WritableFile> newAppendableFile(String filename);

    // Create an empty file in the system temporary directory and return its name.
    Pair<Status, String> newTempFile(String prefix);

    Pair<Status, String> getTestDirectory();

    Pair<Status, Boolean> delete(String filename);

    boolean isFileExists(String filename);

    boolean isFileReadable(String filename);

    static Pair<Status, String> readFileToString(Env env, String fname) {
        Pair<Status, LineSource> pair = env.newLineSource(fname);
        Status status = pair.getKey();

        if (status.isNotOk()) {
            return Pair.of(status, null);
        }
        LineSource source = pair.getValue();

        StringBuilder result = new StringBuilder();
        while (!source.isEof()) {
            Pair<Status, String> readPair = source.readLine();
            status = readPair.getKey();

            if (status.isNotOk() || readPair.getValue() == null) {
                break;
            }
            result.append(readPair.getValue()).append('\n');
        }

        Status closeStatus = source.close();
        if (status.isOk()) {
            status = closeStatus;
        }
        return Pair.of(status, status.isOk() ? result.toString() : null);
    }

    static Status writeStringToFileSync(Env env, String s, String fname) {
        return doWriteStringToFile(env, s, fname, true);
    }

    static Status doWriteStringToFile(Env env, String data, String fname, boolean shouldSync) {
        Pair<Status, WritableFile> pair = env.newWritableFile(fname);
        Status status = pair.getKey();
        if (status.isNotOk()) {
            return pair.getKey();
        }

        WritableFile file = pair.getValue();
        status = file.append(data);

        if (status.isOk() && shouldSync) {
            status = file.sync();
        }

        if (status.isOk()) {
            status = file.close();
        }

        if (status.isNotOk()) {
            env.delete(fname);
        }

        return status;
    }
}

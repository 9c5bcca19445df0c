package com.farmerworking.datyl.in.java.common;

import org.apache.commons.lang3.StringUtils;

// Outcome of a file, configuration or stream operation: OK, or an error code
// with a message.
public class Status {
    private final Code code;
    private final String message;

    private Status(Code code, String message) {
        this.code = code;
        this.message = message;
    }

    // Returns true iff the status indicates success.
    public boolean isOk() { return code == Code.kOk; }

    public boolean isNotOk() { return code != Code.kOk; }

    public boolean isNotFound() { return code == Code.kNotFound; }

    public boolean isInvalidArgument() { return code == Code.kInvalidArgument; }

    public boolean isIOError() { return code == Code.kIOError; }

    // Returns true iff the status reports a caller breaking the calling protocol
    // of an object, e.g. pushing back twice on a stream.
    public boolean isUsageError() { return code == Code.kUsageError; }

    public String getMessage() {
        return message;
    }

    // Returns the string "OK" for success, "<code>: <message>" otherwise.
    @Override
    public String toString() {
        return code.display + (StringUtils.isEmpty(message) ? "" : ": " + message);
    }

    public static Status OK() {
        return new Status(Code.kOk, null);
    }

    public static Status NotFound(String msg) {
        return new Status(Code.kNotFound, msg);
    }

    public static Status InvalidArgument(String msg) {
        return new Status(Code.kInvalidArgument, msg);
    }

    public static Status IOError(String msg) {
        return new Status(Code.kIOError, msg);
    }

    // The file name or context goes first: "<context>: <detail>".
    public static Status IOError(String context, String detail) {
        return new Status(Code.kIOError, context + ": " + detail);
    }

    public static Status UsageError(String msg) {
        return new Status(Code.kUsageError, msg);
    }

    private enum Code {
        kOk("OK"),
        kNotFound("NotFound"),
        kInvalidArgument("Invalid argument"),
        kIOError("IO error"),
        kUsageError("Usage error");

        private final String display;

        Code(String display) {
            this.display = display;
        }
    }
}

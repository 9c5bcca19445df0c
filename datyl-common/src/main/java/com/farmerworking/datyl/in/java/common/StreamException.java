package com.farmerworking.datyl.in.java.common;

// Raised synchronously by stream operations that cannot report a Status
// through their return value (pull, pushback, rewind).
public class StreamException extends RuntimeException {
    private final Status status;

    public StreamException(Status status) {
        super(status.toString());
        assert status.isNotOk();
        this.status = status;
    }

    public Status getStatus() {
        return status;
    }
}

package com.farmerworking.datyl.in.java.file;

import com.farmerworking.datyl.in.java.common.Status;
import org.apache.commons.lang3.tuple.Pair;

// An already-open, rewindable source of text lines.
//
// REQUIRES: External synchronization
public interface LineSource {
    // Read the next line without its line terminator.
    // Returns a null line once the source is exhausted.
    // If an error was encountered, returns a non-OK status.
    Pair<Status, String> readLine();

    // True iff no line remains to be read. A source that failed to look
    // ahead is not at eof: the failure is reported by the next readLine().
    boolean isEof();

    // Reposition to the first line.
    Status rewind();

    // Release the underlying handle. A closed source can not be rewound.
    Status close();

    boolean isClosed();
}

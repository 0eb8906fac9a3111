package org.calista.r3.store;

import java.io.IOException;

/**
 * Accepts finalized records keyed by a generated id. Records must be JSON-compatible.
 */
public interface RecordSink {

    void append(String id, Object record) throws IOException;

    /** Records appended through this sink instance. */
    long appended();
}

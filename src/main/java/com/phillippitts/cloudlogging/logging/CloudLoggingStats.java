package com.phillippitts.cloudlogging.logging;

import java.util.concurrent.atomic.LongAdder;

/**
 * Running counters of one {@link CloudLoggingAppender}. Read by the health indicator and
 * the Micrometer binder.
 */
public final class CloudLoggingStats {

    private final LongAdder flushedEntries = new LongAdder();
    private final LongAdder passthroughLines = new LongAdder();
    private final LongAdder encodingFallbacks = new LongAdder();
    private final LongAdder writeErrors = new LongAdder();
    private final LongAdder appendFailures = new LongAdder();

    void entryFlushed() {
        flushedEntries.increment();
    }

    void linePassedThrough() {
        passthroughLines.increment();
    }

    void encodingFellBack() {
        encodingFallbacks.increment();
    }

    void writeFailed() {
        writeErrors.increment();
    }

    void appendFailed() {
        appendFailures.increment();
    }

    public long getFlushedEntries() {
        return flushedEntries.sum();
    }

    public long getPassthroughLines() {
        return passthroughLines.sum();
    }

    public long getEncodingFallbacks() {
        return encodingFallbacks.sum();
    }

    public long getWriteErrors() {
        return writeErrors.sum();
    }

    public long getAppendFailures() {
        return appendFailures.sum();
    }
}

package com.tenda.debug;

import java.io.PrintStream;

/** Writes one line per message: {@code LEVEL [tag] message}. */
public final class StreamDebugSink implements DebugSink {

    private final PrintStream out;

    public StreamDebugSink(PrintStream out) {
        if (out == null) throw new IllegalArgumentException("out");
        this.out = out;
    }

    @Override
    public synchronized void log(DebugLevel level, String tag, String message, Throwable error) {
        out.println(level + " [" + tag + "] " + message);
        if (error != null) error.printStackTrace(out);
    }
}

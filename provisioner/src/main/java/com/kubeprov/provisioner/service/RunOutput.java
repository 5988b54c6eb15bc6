package com.kubeprov.provisioner.service;

import java.io.Writer;

/**
 * Append-only progress buffer for one run.
 *
 * The run's worker writes through a {@link java.io.PrintWriter}; API threads
 * read {@link #contents()} while the run is still going.
 */
public class RunOutput extends Writer {

    private final StringBuilder buffer = new StringBuilder();

    @Override
    public synchronized void write(char[] cbuf, int off, int len) {
        buffer.append(cbuf, off, len);
    }

    @Override
    public void flush() {}

    @Override
    public void close() {}

    public synchronized String contents() {
        return buffer.toString();
    }
}

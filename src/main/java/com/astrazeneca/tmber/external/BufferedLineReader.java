package com.astrazeneca.tmber.external;

import java.io.BufferedReader;
import java.io.IOException;

/**
 * Line reader over an in-process stream.
 */
public class BufferedLineReader implements LineReader {
    private final BufferedReader reader;

    public BufferedLineReader(BufferedReader reader) {
        this.reader = reader;
    }

    @Override
    public String read() throws IOException {
        return reader.readLine();
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}

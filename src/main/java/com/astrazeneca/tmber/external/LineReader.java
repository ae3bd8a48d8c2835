package com.astrazeneca.tmber.external;

import java.io.IOException;

/**
 * Source of text lines from a (possibly compressed) input.
 */
public interface LineReader extends AutoCloseable {
    /**
     * @return next line without the line terminator, or null at the end of input
     * @throws IOException if the input can't be read
     */
    String read() throws IOException;

    @Override
    void close() throws IOException;
}

package com.sqconfig.core.writer;

import java.io.IOException;
import java.io.Writer;

/**
 * Serialization of a record stream. An instance is used by a single consumer
 * thread for a single stream: {@link #begin}, any number of {@link #write}, then {@link #end}.
 */
public interface RecordFormat<T> {

    void begin(Writer out) throws IOException;

    void write(T record) throws IOException;

    /**
     * Writes the closing syntax and flushes; does not close {@code out}.
     */
    void end() throws IOException;
}

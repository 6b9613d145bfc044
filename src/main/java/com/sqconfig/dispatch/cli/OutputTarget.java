package com.sqconfig.dispatch.cli;

import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.SqConfigException;

import java.io.FilterWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens the sink of a command's output: a file, or stdout when no file is given.
 */
final class OutputTarget {

    private OutputTarget() {}

    static Writer open(String file) {
        if (file == null || "-".equals(file)) {
            return new StdoutWriter(System.out);
        }
        try {
            var path = Path.of(file);
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            return Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SqConfigException(ErrorCode.OS_ERROR, "Cannot open " + file + ": " + e.getMessage(), e);
        }
    }

    static boolean isJson(String file) {
        return file != null && file.toLowerCase().endsWith(".json");
    }

    /**
     * Flushes but never closes the process's stdout.
     */
    private static final class StdoutWriter extends FilterWriter {

        StdoutWriter(PrintStream stdout) {
            super(new OutputStreamWriter(stdout, StandardCharsets.UTF_8));
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}

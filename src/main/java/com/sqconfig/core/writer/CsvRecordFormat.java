package com.sqconfig.core.writer;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.function.Function;

/**
 * CSV output: one header row, then one row per record.
 */
public class CsvRecordFormat<T> implements RecordFormat<T> {

    private final CSVFormat format;
    private final Function<T, List<?>> toRow;
    private CSVPrinter printer;

    public CsvRecordFormat(List<String> header, char delimiter, Function<T, List<?>> toRow) {
        this.format = CSVFormat.DEFAULT.builder()
                .setHeader(header.toArray(String[]::new))
                .setDelimiter(delimiter)
                .setRecordSeparator('\n')
                .build();
        this.toRow = toRow;
    }

    @Override
    public void begin(Writer out) throws IOException {
        printer = new CSVPrinter(out, format);
    }

    @Override
    public void write(T record) throws IOException {
        printer.printRecord(toRow.apply(record));
    }

    @Override
    public void end() throws IOException {
        printer.flush();
    }
}

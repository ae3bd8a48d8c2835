package com.astrazeneca.tmber.printers;

import htsjdk.samtools.util.BlockCompressedOutputStream;
import htsjdk.samtools.util.Log;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Prints output rows to a stream. Tables written to files go to a temporary file in the destination directory
 * first and are moved in place once complete, so a failed run leaves no partial table.
 */
public class TablePrinter {
    private static final Log log = Log.getInstance(TablePrinter.class);

    private final PrintStream out;

    public TablePrinter(PrintStream out) {
        this.out = out;
    }

    public void print(OutputRow row) {
        out.print(row.toString());
        out.print('\n');
    }

    public void printHeader(List<String> columns) {
        out.print(String.join("\t", columns));
        out.print('\n');
    }

    /**
     * Writes a table file.
     * @param target file to create or replace
     * @param header column names or null to write no header
     * @param rows rows in output order
     * @param bgzip compress the file with BGZF
     * @throws IOException if the file can't be written
     */
    public static void writeTable(Path target, List<String> header, List<? extends OutputRow> rows, boolean bgzip)
            throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            OutputStream stream = bgzip
                    ? new BlockCompressedOutputStream(tmp.toFile())
                    : new BufferedOutputStream(Files.newOutputStream(tmp));
            try (PrintStream printStream = new PrintStream(stream, false, StandardCharsets.UTF_8.name())) {
                TablePrinter printer = new TablePrinter(printStream);
                if (header != null) {
                    printer.printHeader(header);
                }
                for (OutputRow row : rows) {
                    printer.print(row);
                }
                if (printStream.checkError()) {
                    throw new IOException("Can't write " + tmp);
                }
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Write a table: ", target, " (", rows.size(), " rows)");
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}

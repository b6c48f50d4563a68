package io.github.yok.flexpipeline.util;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;

/**
 * Helpers for the CSV files the pipeline emits.
 *
 * <p>
 * Files are UTF-8, comma-delimited, with a header row and minimal quoting. {@code null} cells are
 * written as empty strings.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CsvUtils {

    private CsvUtils() {
        // Utility class; do not instantiate.
    }

    /**
     * Writes a header and rows to a CSV file, creating parent directories as needed.
     *
     * @param csvFile destination (created or overwritten)
     * @param headers header row
     * @param rows data rows; each inner list is one record
     * @throws IOException if the file cannot be written
     */
    public static void writeCsvUtf8(Path csvFile, List<String> headers,
            List<? extends List<?>> rows) throws IOException {
        if (csvFile.getParent() != null) {
            Files.createDirectories(csvFile.getParent());
        }
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setHeader(headers.toArray(new String[0]))
                .setQuoteMode(QuoteMode.MINIMAL).setRecordSeparator("\n").get();
        try (Writer w = new OutputStreamWriter(Files.newOutputStream(csvFile),
                StandardCharsets.UTF_8); CSVPrinter printer = new CSVPrinter(w, fmt)) {
            for (List<?> row : rows) {
                printer.printRecord(row);
            }
        }
    }

    /**
     * Formats one cell value for output.
     *
     * @param value cell value
     * @return text, or {@code ""} for {@code null}
     */
    public static String formatCell(Object value) {
        return value == null ? "" : value.toString();
    }
}

package io.github.yok.flexpipeline.dataset;

import io.github.yok.flexpipeline.exception.SourceUnreadableException;
import io.github.yok.flexpipeline.model.DataRecord;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;

/**
 * Reads a delimited file with a header row into an {@link InMemoryTabularDataset}.
 *
 * <p>
 * The whole file is read into memory. Empty cells become {@code null}, short rows are padded with
 * {@code null}, and a UTF-8 BOM is ignored. Row indexes start at 1 for the first data row.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvDatasetReader {

    private final char delimiter;

    public CsvDatasetReader() {
        this(',');
    }

    public CsvDatasetReader(char delimiter) {
        this.delimiter = delimiter;
    }

    /**
     * Loads the given file.
     *
     * @param path CSV file
     * @return loaded dataset
     * @throws SourceUnreadableException if the file is missing or malformed
     */
    public TabularDataset read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new SourceUnreadableException("Source file not found: " + path);
        }
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setDelimiter(delimiter).setHeader()
                .setSkipHeaderRecord(true).setIgnoreEmptyLines(true).setTrim(false).get();

        try (Reader reader = new InputStreamReader(
                BOMInputStream.builder().setPath(path).get(), StandardCharsets.UTF_8);
                CSVParser parser = CSVParser.parse(reader, fmt)) {

            List<String> columns = new ArrayList<>(parser.getHeaderNames());
            List<DataRecord> records = new ArrayList<>();
            int rowIndex = 0;
            for (CSVRecord csv : parser) {
                rowIndex++;
                Map<String, Object> values = new LinkedHashMap<>();
                for (String column : columns) {
                    String cell = csv.isSet(column) ? csv.get(column) : null;
                    values.put(column, (cell == null || cell.isEmpty()) ? null : cell);
                }
                records.add(new DataRecord(rowIndex, values));
            }
            log.info("Loaded source '{}': columns={}, rows={}", path, columns.size(),
                    records.size());
            return new InMemoryTabularDataset(columns, records);

        } catch (IOException | UncheckedIOException | IllegalArgumentException
                | IllegalStateException e) {
            throw new SourceUnreadableException(
                    "Failed to read source file: " + path + " (" + e.getMessage() + ")", e);
        }
    }
}

package edu.washu.tag.extractor.pathosys.source;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import edu.washu.tag.extractor.pathosys.model.CaseTable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads a CSV file with a header line into a {@link CaseTable}.
 *
 * <p>Cells are kept as text; no numeric types are inferred. Empty cells and the usual missing-value markers
 * ({@code NA}, {@code N/A}, {@code NaN}, {@code null}, {@code None} and similar) are read as missing values.
 * A repeated column name gets a numeric suffix, so {@code a,a,a} becomes {@code a, a.1, a.2}.
 */
@Component
public class CaseTableReader {

    private static final Logger logger = LoggerFactory.getLogger(CaseTableReader.class);

    private static final String BYTE_ORDER_MARK = "\uFEFF";
    private static final Set<String> MISSING_VALUE_MARKERS = Set.of(
        "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN",
        "<NA>", "N/A", "NA", "NULL", "NaN", "None", "n/a", "nan", "null"
    );
    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
        .enable(CsvParser.Feature.WRAP_AS_ARRAY)
        .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
        .build();

    /**
     * Reads a CSV file. The first line is the header. Empty cells and cells missing from short lines
     * are read as missing values; cells beyond the header width are dropped.
     *
     * @param csvFile The file to read
     * @return The table. A file without a header line gives a table without columns.
     * @throws UncheckedIOException If the file cannot be read or parsed
     */
    public CaseTable read(Path csvFile) {
        List<String[]> lines;
        try (MappingIterator<String[]> iterator = CSV_MAPPER.readerFor(String[].class).readValues(csvFile.toFile())) {
            lines = iterator.readAll();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read CSV file " + csvFile, e);
        }

        if (lines.isEmpty()) {
            logger.warn("CSV file {} has no header line", csvFile);
            return CaseTable.empty(List.of());
        }

        List<String> header = new ArrayList<>(Arrays.asList(lines.get(0)));
        header.set(0, StringUtils.removeStart(header.get(0), BYTE_ORDER_MARK));
        header = deduplicate(header);

        List<Map<String, String>> rows = new ArrayList<>(lines.size() - 1);
        for (String[] line : lines.subList(1, lines.size())) {
            if (line.length > header.size()) {
                logger.debug("CSV file {} line has {} cells but header has {}, extra cells dropped",
                    csvFile, line.length, header.size());
            }
            Map<String, String> row = new HashMap<>();
            for (int i = 0; i < header.size(); i++) {
                row.put(header.get(i), i < line.length ? cellValue(line[i]) : null);
            }
            rows.add(row);
        }
        logger.debug("Read {} rows with columns {} from {}", rows.size(), header, csvFile);
        return new CaseTable(header, rows);
    }

    private static String cellValue(String cell) {
        return StringUtils.isEmpty(cell) || MISSING_VALUE_MARKERS.contains(cell) ? null : cell;
    }

    /**
     * Renames repeated column names to {@code name.1}, {@code name.2} and so on, skipping names already taken.
     *
     * @param header Column names as read
     * @return Unique column names in the same order
     */
    static List<String> deduplicate(List<String> header) {
        Set<String> taken = new HashSet<>(header);
        Set<String> used = new HashSet<>();
        Map<String, Integer> counters = new HashMap<>();
        List<String> columns = new ArrayList<>(header.size());
        for (String name : header) {
            String column = name;
            if (!used.add(column)) {
                int counter = counters.getOrDefault(name, 1);
                do {
                    column = name + "." + counter++;
                } while (taken.contains(column) || used.contains(column));
                counters.put(name, counter);
                used.add(column);
            }
            columns.add(column);
        }
        return columns;
    }
}

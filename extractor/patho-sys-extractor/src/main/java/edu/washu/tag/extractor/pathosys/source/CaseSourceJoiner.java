package edu.washu.tag.extractor.pathosys.source;

import static edu.washu.tag.extractor.pathosys.util.Constants.CASE_NO;
import static edu.washu.tag.extractor.pathosys.util.Constants.DIAGNOSIS_REQUIRED_COLUMNS;
import static edu.washu.tag.extractor.pathosys.util.Constants.LEFT_COLUMN_SUFFIX;
import static edu.washu.tag.extractor.pathosys.util.Constants.RIGHT_COLUMN_SUFFIX;
import static edu.washu.tag.extractor.pathosys.util.Constants.SLIDE_REQUIRED_COLUMNS;
import static edu.washu.tag.extractor.pathosys.util.Constants.THUMBNAIL_PATH;

import edu.washu.tag.extractor.pathosys.exception.AmbiguousSiblingException;
import edu.washu.tag.extractor.pathosys.exception.MissingColumnsException;
import edu.washu.tag.extractor.pathosys.exception.MissingSlideFileException;
import edu.washu.tag.extractor.pathosys.model.CaseTable;
import edu.washu.tag.extractor.pathosys.model.MergedCases;
import edu.washu.tag.extractor.pathosys.util.FileHandler;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads the diagnosis table of a sample together with the slide table stored next to it,
 * and joins them on case number.
 */
@Component
public class CaseSourceJoiner {

    private static final Logger logger = LoggerFactory.getLogger(CaseSourceJoiner.class);

    private final FileHandler fileHandler;
    private final CaseTableReader caseTableReader;

    /**
     * Constructor for CaseSourceJoiner.
     *
     * @param fileHandler     Lists the directory holding the diagnosis table.
     * @param caseTableReader Reads the CSV tables.
     */
    public CaseSourceJoiner(FileHandler fileHandler, CaseTableReader caseTableReader) {
        this.fileHandler = fileHandler;
        this.caseTableReader = caseTableReader;
    }

    /**
     * Loads both tables of a sample and inner joins them on {@code case_no}.
     *
     * @param diagnosisFile The diagnosis CSV file
     * @return The joined table and what was learned about the slide table
     * @throws MissingColumnsException    If either table lacks a required column
     * @throws MissingSlideFileException  If there is no slide table next to the diagnosis table
     * @throws AmbiguousSiblingException  If there is more than one candidate slide table
     */
    public MergedCases load(Path diagnosisFile) throws MissingColumnsException, MissingSlideFileException {
        String sampleName = diagnosisFile.getFileName().toString();

        CaseTable diagnoses = caseTableReader.read(diagnosisFile);
        requireColumns(diagnosisFile, diagnoses, DIAGNOSIS_REQUIRED_COLUMNS);

        Path slideFile = findSlideFile(diagnosisFile);
        CaseTable slides = caseTableReader.read(slideFile);
        requireColumns(slideFile, slides, SLIDE_REQUIRED_COLUMNS);

        boolean thumbnailColumnPresent = slides.hasColumn(THUMBNAIL_PATH);
        if (!thumbnailColumnPresent) {
            logger.warn("Sample {} - No '{}' column found in slide CSV file {}. All SDPC files will be ignored.",
                sampleName, THUMBNAIL_PATH, slideFile);
        }

        logger.info("Sample {} - File read: diagnosis CSV {} rows x {} columns", sampleName, diagnoses.size(), diagnoses.columns().size());
        logger.info("Sample {} - File read: slide CSV {} rows x {} columns", sampleName, slides.size(), slides.columns().size());

        CaseTable merged = innerJoin(diagnoses, slides, CASE_NO);
        return new MergedCases(merged, slideFile, thumbnailColumnPresent);
    }

    /**
     * Finds the one other file in the diagnosis table's directory.
     *
     * @param diagnosisFile The diagnosis CSV file
     * @return The slide table file
     * @throws MissingSlideFileException If there is no other file
     * @throws AmbiguousSiblingException If there is more than one other file
     */
    Path findSlideFile(Path diagnosisFile) throws MissingSlideFileException {
        Path directory = diagnosisFile.toAbsolutePath().getParent();
        List<Path> siblings;
        try {
            siblings = fileHandler.ls(directory).stream()
                .filter(path -> !path.getFileName().equals(diagnosisFile.getFileName()))
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list directory " + directory, e);
        }

        if (siblings.isEmpty()) {
            throw new MissingSlideFileException(directory);
        }
        if (siblings.size() > 1) {
            throw new AmbiguousSiblingException(directory, siblings);
        }
        return siblings.get(0);
    }

    /**
     * Inner join of two tables on a key column. Rows with a missing key never match.
     * Non-key columns present in both tables are suffixed with {@code _x} (left) and {@code _y} (right).
     * Output columns are the left columns followed by the right non-key columns; output rows follow
     * left row order, then right row order within a key.
     *
     * @param left  Left table
     * @param right Right table
     * @param key   Key column present in both tables
     * @return The joined table
     */
    static CaseTable innerJoin(CaseTable left, CaseTable right, String key) {
        Set<String> shared = left.columns().stream()
            .filter(column -> !column.equals(key) && right.hasColumn(column))
            .collect(Collectors.toSet());

        Map<String, String> leftNames = new LinkedHashMap<>();
        for (String column : left.columns()) {
            leftNames.put(column, shared.contains(column) ? column + LEFT_COLUMN_SUFFIX : column);
        }
        Map<String, String> rightNames = new LinkedHashMap<>();
        for (String column : right.columns()) {
            if (!column.equals(key)) {
                rightNames.put(column, shared.contains(column) ? column + RIGHT_COLUMN_SUFFIX : column);
            }
        }

        Map<String, List<Map<String, String>>> rightByKey = new LinkedHashMap<>();
        for (Map<String, String> row : right.rows()) {
            String value = row.get(key);
            if (value != null) {
                rightByKey.computeIfAbsent(value, k -> new ArrayList<>()).add(row);
            }
        }

        List<Map<String, String>> rows = new ArrayList<>();
        for (Map<String, String> leftRow : left.rows()) {
            String value = leftRow.get(key);
            if (value == null) {
                continue;
            }
            for (Map<String, String> rightRow : rightByKey.getOrDefault(value, List.of())) {
                Map<String, String> joined = new LinkedHashMap<>();
                leftNames.forEach((column, name) -> joined.put(name, leftRow.get(column)));
                rightNames.forEach((column, name) -> joined.put(name, rightRow.get(column)));
                rows.add(joined);
            }
        }

        List<String> columns = new ArrayList<>(leftNames.values());
        columns.addAll(rightNames.values());
        return new CaseTable(columns, rows);
    }

    private static void requireColumns(Path file, CaseTable table, List<String> required) throws MissingColumnsException {
        List<String> missing = table.missingColumns(required);
        if (!missing.isEmpty()) {
            throw new MissingColumnsException(file, missing);
        }
    }
}

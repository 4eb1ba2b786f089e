package edu.washu.tag.extractor.pathosys.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * Exception thrown when a table does not contain all the columns it is required to have.
 */
public class MissingColumnsException extends SkippedSampleException {

    private final Path file;
    private final List<String> missingColumns;

    /**
     * Constructs a new MissingColumnsException.
     *
     * @param file           the table file
     * @param missingColumns the required columns that were not found
     */
    public MissingColumnsException(Path file, List<String> missingColumns) {
        super(String.format("File %s is missing required columns %s", file, missingColumns));
        this.file = file;
        this.missingColumns = List.copyOf(missingColumns);
    }

    public Path getFile() {
        return file;
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}

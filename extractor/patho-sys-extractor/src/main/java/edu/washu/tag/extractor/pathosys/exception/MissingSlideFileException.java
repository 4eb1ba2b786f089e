package edu.washu.tag.extractor.pathosys.exception;

import java.nio.file.Path;

/**
 * Exception thrown when no slide table is found next to a diagnosis table.
 */
public class MissingSlideFileException extends SkippedSampleException {
    /**
     * Constructs a new MissingSlideFileException.
     *
     * @param directory the directory that was searched
     */
    public MissingSlideFileException(Path directory) {
        super("No slide CSV file found in directory " + directory);
    }
}

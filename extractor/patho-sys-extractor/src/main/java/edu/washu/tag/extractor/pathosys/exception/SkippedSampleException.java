package edu.washu.tag.extractor.pathosys.exception;

/**
 * Exception thrown when the tables of a sample are not in a shape the pipeline can process.
 * The sample is skipped and handed back untouched.
 */
public class SkippedSampleException extends Exception {
    /**
     * Constructs a new SkippedSampleException with the specified detail message.
     *
     * @param message the detail message explaining why the sample is skipped
     */
    public SkippedSampleException(String message) {
        super(message);
    }
}

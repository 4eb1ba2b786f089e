package edu.washu.tag.extractor.pathosys.exception;

/**
 * Exception thrown when a sample descriptor violates the operator's input contract.
 */
public class InvalidSampleException extends IllegalArgumentException {
    /**
     * Constructs a new InvalidSampleException with the specified detail message.
     *
     * @param message the detail message
     */
    public InvalidSampleException(String message) {
        super(message);
    }
}

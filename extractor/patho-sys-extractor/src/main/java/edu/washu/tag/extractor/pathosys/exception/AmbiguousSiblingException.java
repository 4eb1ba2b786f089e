package edu.washu.tag.extractor.pathosys.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * Exception thrown when more than one candidate slide table sits next to a diagnosis table.
 */
public class AmbiguousSiblingException extends InvalidSampleException {

    private final List<Path> candidates;

    /**
     * Constructs a new AmbiguousSiblingException.
     *
     * @param directory  the directory holding the diagnosis table
     * @param candidates the files that could each be the slide table
     */
    public AmbiguousSiblingException(Path directory, List<Path> candidates) {
        super(String.format("Expected exactly one slide CSV file in %s but found %d: %s",
            directory, candidates.size(), candidates));
        this.candidates = List.copyOf(candidates);
    }

    public List<Path> getCandidates() {
        return candidates;
    }
}

package edu.washu.tag.extractor.pathosys.operator;

/**
 * Stages a sample moves through in {@link PathoSysPreprocess}.
 */
public enum PipelineStage {
    START,
    LOADED,
    MERGED,
    PROCESSED,
    PUBLISHED,
    DONE,
    ABORTED
}

package edu.washu.tag.extractor.pathosys.model;

/**
 * Resolved options of the preprocessing operator.
 *
 * @param pathTransformer Path transform rule. Blank or {@code <>} leaves paths unchanged, {@code old:new} replaces
 *                        a path prefix, anything else is a mount point directory that paths are placed under.
 * @param ignoreSdpc      Drop every SDPC slide, with or without a thumbnail.
 */
public record PreprocessOptions(String pathTransformer, boolean ignoreSdpc) {}

package edu.washu.tag.extractor.pathosys.model;

import java.nio.file.Path;

/**
 * Diagnosis and slide tables of a sample joined on case number.
 *
 * @param table                  The joined table.
 * @param slideFile              The slide table file found next to the diagnosis table.
 * @param thumbnailColumnPresent Whether the slide table has a thumbnail path column.
 */
public record MergedCases(CaseTable table, Path slideFile, boolean thumbnailColumnPresent) {}

package edu.washu.tag.extractor.pathosys.model;

import java.util.List;

/**
 * Body of a request to add files to a dataset.
 *
 * @param files Files to add.
 */
public record UploadRequest(List<UploadFile> files) {}

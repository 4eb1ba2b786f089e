package edu.washu.tag.extractor.pathosys.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * A file entry in a dataset upload request.
 *
 * @param filePath Path of the file to add to the dataset.
 * @param metadata Metadata stored with the file. Omitted from the request when null.
 */
public record UploadFile(
    String filePath,
    @JsonInclude(JsonInclude.Include.NON_NULL) Map<String, String> metadata
) {

    /**
     * Creates an entry without metadata.
     *
     * @param filePath Path of the file
     * @return an UploadFile with no metadata
     */
    public static UploadFile of(String filePath) {
        return new UploadFile(filePath, null);
    }
}

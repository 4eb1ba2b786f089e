package edu.washu.tag.extractor.pathosys.upload;

import edu.washu.tag.extractor.pathosys.exception.DatasetUploadException;
import edu.washu.tag.extractor.pathosys.model.UploadRequest;
import java.io.IOException;
import java.net.URI;

/**
 * Client for the dataset management API.
 */
public interface DatasetApiClient {

    /**
     * Endpoint that adds files to a dataset.
     *
     * @param datasetName Name of the dataset
     * @return The endpoint URI
     */
    URI addFilesUri(String datasetName);

    /**
     * Adds files to a dataset. Makes a single attempt.
     *
     * @param datasetName Name of the dataset
     * @param request     Files to add
     * @throws DatasetUploadException If the API answers with a non-2xx status
     * @throws IOException            If the request cannot be serialized or sent
     * @throws InterruptedException   If interrupted while waiting for the response
     */
    void addFiles(String datasetName, UploadRequest request) throws DatasetUploadException, IOException, InterruptedException;
}

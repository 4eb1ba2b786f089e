package edu.washu.tag.extractor.pathosys.exception;

/**
 * Exception thrown when the dataset management API answers an upload with a non-2xx status.
 */
public class DatasetUploadException extends Exception {

    private final int statusCode;
    private final String responseBody;

    /**
     * Constructs a new DatasetUploadException.
     *
     * @param statusCode   the HTTP status code of the response
     * @param responseBody the body of the response, may be empty
     */
    public DatasetUploadException(int statusCode, String responseBody) {
        super("Dataset API responded with HTTP status " + statusCode);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}

package edu.washu.tag.extractor.pathosys.upload;

import static edu.washu.tag.extractor.pathosys.util.Constants.UPLOAD_ADD_PATH_TEMPLATE;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.washu.tag.extractor.pathosys.exception.DatasetUploadException;
import edu.washu.tag.extractor.pathosys.model.UploadRequest;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Dataset management API client backed by {@link HttpClient}.
 */
@Component
public class HttpDatasetApiClient implements DatasetApiClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpDatasetApiClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    /**
     * Constructor for HttpDatasetApiClient.
     *
     * @param httpClient   The HTTP client.
     * @param objectMapper Serializes request bodies.
     * @param baseUrl      Base URL of the dataset management API.
     */
    public HttpDatasetApiClient(
        HttpClient httpClient,
        ObjectMapper objectMapper,
        @Value("${scout.datasetApi.baseUrl}") String baseUrl
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
    }

    @Override
    public URI addFilesUri(String datasetName) {
        String encodedName = URLEncoder.encode(datasetName, StandardCharsets.UTF_8).replace("+", "%20");
        return URI.create(baseUrl + String.format(UPLOAD_ADD_PATH_TEMPLATE, encodedName));
    }

    @Override
    public void addFiles(String datasetName, UploadRequest request) throws DatasetUploadException, IOException, InterruptedException {
        URI uri = addFilesUri(datasetName);
        byte[] body = objectMapper.writeValueAsBytes(request);

        HttpRequest httpRequest = HttpRequest.newBuilder()
            .uri(uri)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofByteArray(body))
            .build();

        logger.debug("Posting {} files to {}", request.files().size(), uri);
        HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new DatasetUploadException(response.statusCode(), response.body());
        }
    }
}

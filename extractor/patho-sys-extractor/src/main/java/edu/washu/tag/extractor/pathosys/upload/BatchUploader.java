package edu.washu.tag.extractor.pathosys.upload;

import static edu.washu.tag.extractor.pathosys.util.Constants.SLIDE_PATH;
import static edu.washu.tag.extractor.pathosys.util.Constants.THUMBNAIL_PATH;
import static edu.washu.tag.extractor.pathosys.util.Constants.UPLOAD_BATCH_COUNTER;
import static edu.washu.tag.extractor.pathosys.util.Constants.UPLOAD_BATCH_SIZE;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.washu.tag.extractor.pathosys.exception.DatasetUploadException;
import edu.washu.tag.extractor.pathosys.model.CaseTable;
import edu.washu.tag.extractor.pathosys.model.RecordKind;
import edu.washu.tag.extractor.pathosys.model.UploadFile;
import edu.washu.tag.extractor.pathosys.model.UploadRequest;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Publishes a processed case table to a dataset in batches.
 *
 * <p>Every row yields a slide record (slide path plus all other columns as metadata) and a thumbnail record.
 * Each batch posts its slide records, then its thumbnail records. A failed post is logged and skipped;
 * it never stops the remaining posts and nothing is retried.
 */
@Component
public class BatchUploader {

    private static final Logger logger = LoggerFactory.getLogger(BatchUploader.class);

    private static final String STATUS_SUCCESS = "success";
    private static final String STATUS_FAILED = "failed";

    private final DatasetApiClient datasetApiClient;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    /**
     * Constructor for BatchUploader.
     *
     * @param datasetApiClient The dataset management API client.
     * @param objectMapper     Serializes requests for the logged reproduction command.
     * @param meterRegistry    The meter registry for batch outcome metrics.
     */
    public BatchUploader(DatasetApiClient datasetApiClient, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.datasetApiClient = datasetApiClient;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;

        Stream.of(RecordKind.values())
            .forEach(kind -> Stream.of(STATUS_SUCCESS, STATUS_FAILED)
                .forEach(status -> meterRegistry.counter(UPLOAD_BATCH_COUNTER, tags(kind, status)).increment(0)));
    }

    /**
     * Publishes a table to the dataset named by the last component of {@code exportPath}.
     *
     * @param sampleName Name of the sample, for logging
     * @param table      Processed table
     * @param exportPath Dataset location
     * @return The table, unchanged
     */
    public CaseTable publish(String sampleName, CaseTable table, String exportPath) {
        String datasetName = datasetName(exportPath);
        URI endpoint = datasetApiClient.addFilesUri(datasetName);
        logger.info("Sample {} - Dataset API URL: {} | Batch size: {}", sampleName, endpoint, UPLOAD_BATCH_SIZE);

        int failures = 0;
        for (int start = 0; start < table.size(); start += UPLOAD_BATCH_SIZE) {
            int end = Math.min(start + UPLOAD_BATCH_SIZE, table.size());
            CaseTable batch = table.slice(start, end);

            List<UploadFile> slideRecords = new ArrayList<>(batch.size());
            List<UploadFile> thumbnailRecords = new ArrayList<>(batch.size());
            for (Map<String, String> row : batch.rows()) {
                Map<String, String> metadata = new LinkedHashMap<>(row);
                metadata.remove(SLIDE_PATH);
                slideRecords.add(new UploadFile(row.get(SLIDE_PATH), metadata));
                thumbnailRecords.add(UploadFile.of(row.get(THUMBNAIL_PATH)));
            }

            for (RecordKind kind : RecordKind.values()) {
                List<UploadFile> records = kind == RecordKind.SLIDE ? slideRecords : thumbnailRecords;
                if (!uploadBatch(sampleName, datasetName, endpoint, kind, new UploadRequest(records), start, end)) {
                    failures++;
                }
            }
        }

        if (failures > 0) {
            logger.warn("Sample {} - {} batch uploads failed for dataset {}", sampleName, failures, datasetName);
        }
        return table;
    }

    private boolean uploadBatch(String sampleName, String datasetName, URI endpoint, RecordKind kind, UploadRequest request,
                                int start, int end) {
        logger.info("Sample {} - Uploading batch {}-{}: {} {} records", sampleName, start, end, request.files().size(), kind.getKind());
        String status = STATUS_FAILED;
        try {
            if (logger.isDebugEnabled()) {
                logger.debug("Sample {} - Reproduce {} upload of batch {}-{} with: {}",
                    sampleName, kind.getKind(), start, end, curlCommand(endpoint, request));
            }
            datasetApiClient.addFiles(datasetName, request);
            status = STATUS_SUCCESS;
            logger.info("Sample {} - Successfully uploaded {} records for batch {}-{}", sampleName, kind.getKind(), start, end);
        } catch (DatasetUploadException e) {
            logger.error("Sample {} - HTTP error uploading {} records (batch {}-{}) to {}: status {}",
                sampleName, kind.getKind(), start, end, endpoint, e.getStatusCode());
            logger.error("Sample {} - Response body: {}", sampleName, e.getResponseBody());
        } catch (IOException e) {
            logger.error("Sample {} - I/O error uploading {} records (batch {}-{}) to {}",
                sampleName, kind.getKind(), start, end, endpoint, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Sample {} - Interrupted uploading {} records (batch {}-{}) to {}",
                sampleName, kind.getKind(), start, end, endpoint, e);
        } catch (RuntimeException e) {
            logger.error("Sample {} - Failed to upload {} records (batch {}-{}) to {}",
                sampleName, kind.getKind(), start, end, endpoint, e);
        }
        meterRegistry.counter(UPLOAD_BATCH_COUNTER, tags(kind, status)).increment();
        return STATUS_SUCCESS.equals(status);
    }

    private String curlCommand(URI endpoint, UploadRequest request) throws JsonProcessingException {
        String body = objectMapper.writeValueAsString(request).replace("'", "'\\''");
        return String.format("curl -X POST \"%s\" -H \"Content-Type: application/json\" -d '%s'", endpoint, body);
    }

    static String datasetName(String exportPath) {
        String trimmed = exportPath.strip().replaceAll("[/\\\\]+$", "");
        int lastSeparator = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        return trimmed.substring(lastSeparator + 1);
    }

    private static Tags tags(RecordKind kind, String status) {
        return Tags.of("kind", kind.getKind(), "status", status);
    }
}

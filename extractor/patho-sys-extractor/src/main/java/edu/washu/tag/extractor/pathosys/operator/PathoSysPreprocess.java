package edu.washu.tag.extractor.pathosys.operator;

import static edu.washu.tag.extractor.pathosys.util.Constants.CSV_EXTENSION;
import static edu.washu.tag.extractor.pathosys.util.Constants.OUTPUT_FILE_NAME;
import static edu.washu.tag.extractor.pathosys.util.Constants.OUTPUT_FILE_TYPE;
import static edu.washu.tag.extractor.pathosys.util.Constants.SAMPLE_EXPORT_PATH;
import static edu.washu.tag.extractor.pathosys.util.Constants.SAMPLE_FILE_NAME;
import static edu.washu.tag.extractor.pathosys.util.Constants.SAMPLE_FILE_PATH;
import static edu.washu.tag.extractor.pathosys.util.Constants.SAMPLE_FILE_TYPE;
import static edu.washu.tag.extractor.pathosys.util.Constants.SAMPLE_TEXT;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.washu.tag.extractor.pathosys.exception.InvalidSampleException;
import edu.washu.tag.extractor.pathosys.exception.SkippedSampleException;
import edu.washu.tag.extractor.pathosys.model.CaseTable;
import edu.washu.tag.extractor.pathosys.model.MergedCases;
import edu.washu.tag.extractor.pathosys.model.PreprocessOptions;
import edu.washu.tag.extractor.pathosys.processing.CaseDataProcessor;
import edu.washu.tag.extractor.pathosys.source.CaseSourceJoiner;
import edu.washu.tag.extractor.pathosys.upload.BatchUploader;
import edu.washu.tag.extractor.pathosys.util.DefaultArgs;
import edu.washu.tag.extractor.pathosys.util.RecordsPrettyPrinter;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Preprocessing operator for pathology system exports.
 *
 * <p>A sample points at a diagnosis CSV file. The slide CSV file next to it is joined on case number, unusable
 * rows are dropped, slide and thumbnail paths are rewritten, the rows are added to the dataset named by the
 * sample's export path, and the sample's text is replaced with the rows as JSON.
 *
 * <p>The JSON text is an array with one object per row, keyed by column name. Every cell is written as a
 * string, so {@code case_no} reads {@code "1"} rather than {@code 1}; missing cells are {@code null} and a
 * missing thumbnail path is {@code ""}.
 *
 * <p>An invalid sample descriptor raises {@link InvalidSampleException}. Any other failure before the rows are
 * published hands back the sample untouched. Failed upload batches are only logged.
 */
@Component
public class PathoSysPreprocess implements Mapper {

    private static final Logger logger = LoggerFactory.getLogger(PathoSysPreprocess.class);

    private final DefaultArgs defaultArgs;
    private final CaseSourceJoiner caseSourceJoiner;
    private final CaseDataProcessor caseDataProcessor;
    private final BatchUploader batchUploader;
    private final ObjectMapper objectMapper;

    private volatile PreprocessOptions options;

    /**
     * Constructor for PathoSysPreprocess. Options start out at the application defaults.
     *
     * @param defaultArgs       Default option values.
     * @param caseSourceJoiner  Loads and joins the sample's tables.
     * @param caseDataProcessor Filters rows and transforms paths.
     * @param batchUploader     Publishes rows to the dataset.
     * @param objectMapper      Serializes the output rows.
     */
    public PathoSysPreprocess(
        DefaultArgs defaultArgs,
        CaseSourceJoiner caseSourceJoiner,
        CaseDataProcessor caseDataProcessor,
        BatchUploader batchUploader,
        ObjectMapper objectMapper
    ) {
        this.defaultArgs = defaultArgs;
        this.caseSourceJoiner = caseSourceJoiner;
        this.caseDataProcessor = caseDataProcessor;
        this.batchUploader = batchUploader;
        this.objectMapper = objectMapper;
        this.options = defaultArgs.resolve(null);
    }

    @Override
    public void configure(Map<String, Object> options) {
        PreprocessOptions resolved = defaultArgs.resolve(options);
        logger.info("Configured with path transformer '{}' and ignoreSdpc {}", resolved.pathTransformer(), resolved.ignoreSdpc());
        this.options = resolved;
    }

    public PreprocessOptions getOptions() {
        return options;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> sample) {
        PreprocessOptions runOptions = options;
        Path diagnosisFile = validateSample(sample);
        String sampleName = diagnosisFile.getFileName().toString();
        logger.info("Sample {} - Processing file {}", sampleName, diagnosisFile);

        // Load and join
        MergedCases merged;
        try {
            merged = caseSourceJoiner.load(diagnosisFile);
        } catch (SkippedSampleException e) {
            return abort(sample, sampleName, PipelineStage.START, e.getMessage());
        }
        logger.info("Sample {} - Stage {}: diagnosis and slide tables loaded", sampleName, PipelineStage.LOADED);
        logger.info("Sample {} - Stage {}: data merged with {}, {} rows x {} columns", sampleName, PipelineStage.MERGED,
            merged.slideFile().getFileName(), merged.table().size(), merged.table().columns().size());

        // A slide table without thumbnails cannot support SDPC slides. This only applies to this run.
        boolean ignoreSdpc = runOptions.ignoreSdpc() || !merged.thumbnailColumnPresent();

        // Filter and transform
        CaseTable processed;
        try {
            processed = caseDataProcessor.process(merged.table(), runOptions.pathTransformer(), ignoreSdpc);
        } catch (RuntimeException e) {
            logger.error("Sample {} - Data processing failed", sampleName, e);
            return abort(sample, sampleName, PipelineStage.MERGED, "Data processing failed: " + e.getMessage());
        }
        logger.info("Sample {} - Stage {}: {} rows x {} columns", sampleName, PipelineStage.PROCESSED,
            processed.size(), processed.columns().size());

        // Publish
        Object exportPath = sample.get(SAMPLE_EXPORT_PATH);
        if (exportPath == null || exportPath.toString().isBlank()) {
            return abort(sample, sampleName, PipelineStage.PROCESSED, "Sample missing '" + SAMPLE_EXPORT_PATH + "' key or value");
        }
        try {
            batchUploader.publish(sampleName, processed, exportPath.toString());
        } catch (RuntimeException e) {
            logger.error("Sample {} - Failed to insert records into dataset", sampleName, e);
            return abort(sample, sampleName, PipelineStage.PROCESSED, "Failed to insert records into dataset: " + e.getMessage());
        }
        logger.info("Sample {} - Stage {}: {} rows sent to dataset {}", sampleName, PipelineStage.PUBLISHED, processed.size(), exportPath);

        // Update the sample
        String text;
        try {
            text = objectMapper.writer(new RecordsPrettyPrinter()).writeValueAsString(processed.rows());
        } catch (JsonProcessingException e) {
            logger.error("Sample {} - Could not serialize processed rows", sampleName, e);
            return abort(sample, sampleName, PipelineStage.PUBLISHED, "Could not serialize processed rows: " + e.getMessage());
        }
        sample.put(SAMPLE_TEXT, text);
        sample.put(SAMPLE_FILE_NAME, OUTPUT_FILE_NAME);
        sample.put(SAMPLE_FILE_TYPE, OUTPUT_FILE_TYPE);
        logger.info("Sample {} - Stage {}: sample updated with processed data", sampleName, PipelineStage.DONE);
        return sample;
    }

    /**
     * Checks that the sample points at an existing CSV file.
     *
     * @param sample Sample descriptor
     * @return Path of the diagnosis CSV file
     * @throws InvalidSampleException If the sample does not point at an existing CSV file
     */
    private static Path validateSample(Map<String, Object> sample) {
        if (sample == null) {
            throw new InvalidSampleException("Sample must not be null.");
        }
        Object filePath = sample.get(SAMPLE_FILE_PATH);
        if (filePath == null || "".equals(filePath)) {
            throw new InvalidSampleException("Sample must contain valid '" + SAMPLE_FILE_PATH + "' key and value.");
        }
        if (!(filePath instanceof String path)) {
            throw new InvalidSampleException("'" + SAMPLE_FILE_PATH + "' must be a string.");
        }
        if (!path.endsWith(CSV_EXTENSION)) {
            throw new InvalidSampleException("'" + SAMPLE_FILE_PATH + "' must point to a CSV file.");
        }

        Path diagnosisFile;
        try {
            diagnosisFile = Path.of(path);
        } catch (InvalidPathException e) {
            throw new InvalidSampleException("'" + SAMPLE_FILE_PATH + "' is not a valid path: " + e.getMessage());
        }
        if (!Files.isRegularFile(diagnosisFile)) {
            throw new InvalidSampleException("'" + SAMPLE_FILE_PATH + "' does not point to an existing file: " + path);
        }
        return diagnosisFile;
    }

    private static Map<String, Object> abort(Map<String, Object> sample, String sampleName, PipelineStage reached, String reason) {
        logger.error("Sample {} - Stage {} after {}: {}. Returning sample unchanged.", sampleName, PipelineStage.ABORTED, reached, reason);
        return sample;
    }
}

package edu.washu.tag.extractor.pathosys.operator;

import static edu.washu.tag.extractor.pathosys.util.Constants.OUTPUT_FILE_NAME;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.washu.tag.extractor.pathosys.exception.AmbiguousSiblingException;
import edu.washu.tag.extractor.pathosys.exception.DatasetUploadException;
import edu.washu.tag.extractor.pathosys.exception.InvalidSampleException;
import edu.washu.tag.extractor.pathosys.model.UploadRequest;
import edu.washu.tag.extractor.pathosys.processing.CaseDataProcessor;
import edu.washu.tag.extractor.pathosys.processing.ExtraRecordFilter;
import edu.washu.tag.extractor.pathosys.processing.PathTransformer;
import edu.washu.tag.extractor.pathosys.processing.RecordFilter;
import edu.washu.tag.extractor.pathosys.source.CaseSourceJoiner;
import edu.washu.tag.extractor.pathosys.source.CaseTableReader;
import edu.washu.tag.extractor.pathosys.upload.BatchUploader;
import edu.washu.tag.extractor.pathosys.upload.DatasetApiClient;
import edu.washu.tag.extractor.pathosys.util.DefaultArgs;
import edu.washu.tag.extractor.pathosys.util.LocalFileHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathoSysPreprocessTest {

    private static final String MOUNT_POINT = "/mnt/ruipath/hospital_data/";

    @TempDir Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DatasetApiClient datasetApiClient;
    private Path sourceDir;
    private Path diagnosisFile;

    @BeforeEach
    void setUp() throws IOException {
        datasetApiClient = mock(DatasetApiClient.class);
        when(datasetApiClient.addFilesUri(anyString()))
            .thenAnswer(invocation -> URI.create("http://localhost/datasets/" + invocation.getArgument(0) + "/files/upload/add"));
        sourceDir = Files.createDirectory(tempDir.resolve("source"));
        diagnosisFile = write("diagnosis.csv", "case_no,diagnosis\n1,腺癌\n2,benign\n");
    }

    private PathoSysPreprocess operator(List<ExtraRecordFilter> extraFilters) {
        return new PathoSysPreprocess(
            new DefaultArgs(MOUNT_POINT, false),
            new CaseSourceJoiner(new LocalFileHandler(), new CaseTableReader()),
            new CaseDataProcessor(new RecordFilter(), new PathTransformer(), extraFilters),
            new BatchUploader(datasetApiClient, objectMapper, new SimpleMeterRegistry()),
            objectMapper
        );
    }

    private PathoSysPreprocess operator() {
        return operator(List.of());
    }

    private Path write(String name, String contents) throws IOException {
        return Files.writeString(sourceDir.resolve(name), contents, StandardCharsets.UTF_8);
    }

    private Map<String, Object> sample() {
        Map<String, Object> sample = new HashMap<>();
        sample.put("text", "");
        sample.put("fileName", diagnosisFile.getFileName().toString());
        sample.put("fileType", "csv");
        sample.put("fileId", "1234567890");
        sample.put("filePath", diagnosisFile.toString());
        sample.put("export_path", tempDir.resolve("output").toString());
        return sample;
    }

    private List<Map<String, String>> rows(Map<String, Object> result) throws IOException {
        return objectMapper.readValue((String) result.get("text"), new TypeReference<>() {});
    }

    @Test
    void testExecute_joinsTransformsAndPublishes() throws Exception {
        write("slides.csv", "case_no,slide_path,thumbnail_path\n1,/slides/1.svs,/thumbs/1.png\n3,/slides/3.svs,\n");
        Map<String, Object> sample = sample();

        Map<String, Object> result = operator().execute(sample);

        assertSame(sample, result);
        assertEquals(OUTPUT_FILE_NAME, result.get("fileName"));
        assertEquals("json", result.get("fileType"));
        assertEquals("1234567890", result.get("fileId"));

        List<Map<String, String>> rows = rows(result);
        assertEquals(1, rows.size());
        assertThat(rows.get(0).keySet(), contains("case_no", "diagnosis", "slide_path", "thumbnail_path"));
        assertEquals("/mnt/ruipath/hospital_data/slides/1.svs", rows.get(0).get("slide_path"));
        assertEquals("/mnt/ruipath/hospital_data/thumbs/1.png", rows.get(0).get("thumbnail_path"));

        verify(datasetApiClient, times(2)).addFiles(eq("output"), any(UploadRequest.class));
    }

    @Test
    void testExecute_outputIsPrettyPrintedWithNonAsciiPreserved() throws Exception {
        write("slides.csv", "case_no,slide_path,thumbnail_path\n1,a.svs,\n");

        String text = (String) operator().execute(sample()).get("text");

        assertThat(text, startsWith("[\n  {\n    \"case_no\": \"1\",\n    \"diagnosis\": \"腺癌\","));
        assertThat(text, containsString("\"thumbnail_path\": \"\""));
    }

    @Test
    void testExecute_cellsWrittenAsStringsAndMissingAsNull() throws Exception {
        diagnosisFile = write("diagnosis.csv", "case_no,diagnosis,grade\n7,benign,\n");
        write("slides.csv", "case_no,slide_path,thumbnail_path\n7,a.svs,NA\n");

        String text = (String) operator().execute(sample()).get("text");

        assertThat(text, containsString("\"case_no\": \"7\""));
        assertThat(text, containsString("\"grade\": null"));
        assertThat(text, containsString("\"thumbnail_path\": \"\""));
    }

    @Test
    void testExecute_emptySlidePathGivesEmptyArray() throws Exception {
        write("slides.csv", "case_no,slide_path,thumbnail_path\n1,,/thumbs/1.png\n3,/slides/3.svs,/thumbs/3.png\n");

        Map<String, Object> result = operator().execute(sample());

        assertEquals("[]", result.get("text"));
        assertEquals(OUTPUT_FILE_NAME, result.get("fileName"));
        verify(datasetApiClient, never()).addFiles(anyString(), any(UploadRequest.class));
    }

    @Test
    void testExecute_missingThumbnailColumnIgnoresSdpcForThisRunOnly() throws Exception {
        write("slides.csv", "case_no,slide_path\n1,/slides/1.sdpc\n2,/slides/2.svs\n");
        PathoSysPreprocess operator = operator();

        List<Map<String, String>> rows = rows(operator.execute(sample()));

        assertEquals(1, rows.size());
        assertEquals("2", rows.get(0).get("case_no"));
        assertEquals("", rows.get(0).get("thumbnail_path"));
        assertFalse(operator.getOptions().ignoreSdpc(), "Configured option is not changed by a run");
    }

    @Test
    void testExecute_sdpcKeptOnlyWithThumbnail() throws Exception {
        write("slides.csv", "case_no,slide_path,thumbnail_path\n1,/slides/1.sdpc,/thumbs/1.png\n2,/slides/2.sdpc,\n");

        List<Map<String, String>> rows = rows(operator().execute(sample()));

        assertEquals(1, rows.size());
        assertEquals("1", rows.get(0).get("case_no"));
    }

    @Test
    void testExecute_configuredIgnoreSdpcDropsAllSdpc() throws Exception {
        write("slides.csv", "case_no,slide_path,thumbnail_path\n1,/slides/1.sdpc,/thumbs/1.png\n2,/slides/2.svs,\n");
        PathoSysPreprocess operator = operator();
        operator.configure(Map.of("ignoreSdpc", true, "pathTransformer", "/slides/:/archive/"));

        List<Map<String, String>> rows = rows(operator.execute(sample()));

        assertEquals(1, rows.size());
        assertEquals("/archive/2.svs", rows.get(0).get("slide_path"));
    }

    @Test
    void testExecute_missingColumnsReturnsSampleUnchanged() throws Exception {
        write("slides.csv", "case_no,path\n1,/slides/1.svs\n");
        Map<String, Object> sample = sample();
        Map<String, Object> original = new HashMap<>(sample);

        Map<String, Object> result = operator().execute(sample);

        assertEquals(original, result);
        verify(datasetApiClient, never()).addFiles(anyString(), any(UploadRequest.class));
    }

    @Test
    void testExecute_noSlideFileReturnsSampleUnchanged() {
        Map<String, Object> sample = sample();
        Map<String, Object> original = new HashMap<>(sample);

        assertEquals(original, operator().execute(sample));
    }

    @Test
    void testExecute_multipleSlideFilesThrows() throws IOException {
        write("slides_a.csv", "case_no,slide_path\n1,/slides/1.svs\n");
        write("slides_b.csv", "case_no,slide_path\n1,/slides/1.svs\n");

        assertThrows(AmbiguousSiblingException.class, () -> operator().execute(sample()));
    }

    @Test
    void testExecute_missingExportPathReturnsSampleUnchanged() throws Exception {
        write("slides.csv", "case_no,slide_path,thumbnail_path\n1,/slides/1.svs,/thumbs/1.png\n");
        Map<String, Object> sample = sample();
        sample.remove("export_path");
        Map<String, Object> original = new HashMap<>(sample);

        assertEquals(original, operator().execute(sample));
        verify(datasetApiClient, never()).addFiles(anyString(), any(UploadRequest.class));
    }

    @Test
    void testExecute_processingErrorReturnsSampleUnchanged() throws IOException {
        write("slides.csv", "case_no,slide_path,thumbnail_path\n1,/slides/1.svs,/thumbs/1.png\n");
        Map<String, Object> sample = sample();
        Map<String, Object> original = new HashMap<>(sample);
        ExtraRecordFilter failing = table -> {
            throw new IllegalStateException("filter failed");
        };

        assertEquals(original, operator(List.of(failing)).execute(sample));
    }

    @Test
    void testExecute_uploadFailureStillUpdatesSample() throws Exception {
        write("slides.csv", "case_no,slide_path,thumbnail_path\n1,/slides/1.svs,/thumbs/1.png\n");
        doThrow(new DatasetUploadException(503, "unavailable"))
            .when(datasetApiClient).addFiles(anyString(), any(UploadRequest.class));

        Map<String, Object> result = operator().execute(sample());

        assertEquals(1, rows(result).size());
        assertEquals(OUTPUT_FILE_NAME, result.get("fileName"));
        verify(datasetApiClient, times(2)).addFiles(anyString(), any(UploadRequest.class));
    }

    @Test
    void testExecute_invalidFilePath() throws IOException {
        PathoSysPreprocess operator = operator();
        Path textFile = write("notes.txt", "not a table");

        Map<String, Object> missing = sample();
        missing.remove("filePath");
        assertThrows(InvalidSampleException.class, () -> operator.execute(missing));

        Map<String, Object> notString = sample();
        notString.put("filePath", 42);
        assertThrows(InvalidSampleException.class, () -> operator.execute(notString));

        Map<String, Object> notCsv = sample();
        notCsv.put("filePath", textFile.toString());
        assertThrows(InvalidSampleException.class, () -> operator.execute(notCsv));

        Map<String, Object> absent = sample();
        absent.put("filePath", sourceDir.resolve("absent.csv").toString());
        assertThrows(InvalidSampleException.class, () -> operator.execute(absent));
    }
}

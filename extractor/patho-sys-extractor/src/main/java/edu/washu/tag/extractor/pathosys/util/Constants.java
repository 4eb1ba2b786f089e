package edu.washu.tag.extractor.pathosys.util;

import java.util.List;

public class Constants {
    // Sample descriptor keys
    public static final String SAMPLE_FILE_PATH = "filePath";
    public static final String SAMPLE_EXPORT_PATH = "export_path";
    public static final String SAMPLE_FILE_NAME = "fileName";
    public static final String SAMPLE_FILE_TYPE = "fileType";
    public static final String SAMPLE_TEXT = "text";

    // Operator options
    public static final String OPTION_PATH_TRANSFORMER = "pathTransformer";
    public static final String OPTION_IGNORE_SDPC = "ignoreSdpc";

    // Table columns
    public static final String CASE_NO = "case_no";
    public static final String DIAGNOSIS = "diagnosis";
    public static final String SLIDE_PATH = "slide_path";
    public static final String THUMBNAIL_PATH = "thumbnail_path";
    public static final List<String> DIAGNOSIS_REQUIRED_COLUMNS = List.of(CASE_NO, DIAGNOSIS);
    public static final List<String> SLIDE_REQUIRED_COLUMNS = List.of(CASE_NO, SLIDE_PATH);
    public static final String LEFT_COLUMN_SUFFIX = "_x";
    public static final String RIGHT_COLUMN_SUFFIX = "_y";

    public static final String CSV_EXTENSION = ".csv";
    public static final String SDPC_EXTENSION = ".sdpc";
    public static final String IDENTITY_PATH_RULE = "<>";

    // Output sample
    public static final String OUTPUT_FILE_NAME = "case_diagnosis_slides.json";
    public static final String OUTPUT_FILE_TYPE = "json";

    // Dataset API
    public static final int UPLOAD_BATCH_SIZE = 1000;
    public static final String UPLOAD_ADD_PATH_TEMPLATE = "/datasets/%s/files/upload/add";
    public static final String UPLOAD_BATCH_COUNTER = "scout.pathosys.upload.batch.count";
}

package edu.washu.tag.extractor.pathosys;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the pathology system preprocessing extractor.
 */
@SpringBootApplication
public class PathoSysExtractorApplication {

    /**
     * Main method to run the pathology system preprocessing extractor.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(PathoSysExtractorApplication.class, args);
    }

}

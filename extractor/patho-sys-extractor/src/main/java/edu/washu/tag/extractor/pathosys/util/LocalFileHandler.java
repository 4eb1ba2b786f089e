package edu.washu.tag.extractor.pathosys.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalFileHandler implements FileHandler {

    private static final Logger logger = LoggerFactory.getLogger(LocalFileHandler.class);

    @Override
    public List<Path> ls(Path directory) throws IOException {
        logger.debug("Listing files in directory {}", directory);
        try (Stream<Path> paths = Files.list(directory)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> !path.getFileName().toString().startsWith("."))
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .toList();
        }
    }
}

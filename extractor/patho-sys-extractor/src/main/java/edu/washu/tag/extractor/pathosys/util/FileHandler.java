package edu.washu.tag.extractor.pathosys.util;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * File handling operations needed to locate the tables of a sample.
 */
public interface FileHandler {

    /**
     * Lists the regular, non-hidden files directly inside a directory.
     *
     * @param directory The directory to list.
     * @return Paths of the files in the directory, ordered by file name.
     * @throws IOException If the directory cannot be listed.
     */
    List<Path> ls(Path directory) throws IOException;
}

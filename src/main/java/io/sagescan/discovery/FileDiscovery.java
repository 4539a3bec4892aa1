package io.sagescan.discovery;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Finds the candidate files of a project.
 * The analysis engine treats the returned list as ground truth.
 */
public interface FileDiscovery {

    /**
     * Returns a sorted, duplicate-free list of files under {@code root}.
     * If {@code root} is a regular file, the list holds at most that file.
     *
     * @throws IOException when the tree cannot be enumerated
     */
    List<Path> discover(Path root) throws IOException;
}

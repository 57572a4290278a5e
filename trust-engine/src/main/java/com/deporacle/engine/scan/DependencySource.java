package com.deporacle.engine.scan;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Supplies the resolved dependency list of a project, typically by reading
 * its manifest and lock files.
 *
 * @author Naveed Gung
 */
public interface DependencySource {

    /**
     * @return the dependencies, or empty when the directory holds no project
     *         format this source understands
     */
    Optional<List<Dependency>> resolve(Path projectDir);
}

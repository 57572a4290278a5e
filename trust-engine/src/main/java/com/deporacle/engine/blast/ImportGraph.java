package com.deporacle.engine.blast;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Package name to the project files that import it, plus the number of
 * source files scanned. Built once per project scan and discarded afterwards.
 *
 * @author Naveed Gung
 */
public final class ImportGraph {

    private final Map<String, SortedSet<String>> importers;
    private final int totalFiles;

    ImportGraph(Map<String, SortedSet<String>> importers, int totalFiles) {
        Map<String, SortedSet<String>> copy = new TreeMap<>();
        importers.forEach((pkg, files) -> copy.put(pkg, Collections.unmodifiableSortedSet(new TreeSet<>(files))));
        this.importers = Collections.unmodifiableMap(copy);
        this.totalFiles = totalFiles;
    }

    public static ImportGraph empty() {
        return new ImportGraph(Map.of(), 0);
    }

    public int totalFiles() {
        return totalFiles;
    }

    public Map<String, SortedSet<String>> asMap() {
        return importers;
    }

    /**
     * Files importing {@code packageName}. Python files are matched through the
     * distribution's module name as well.
     */
    public SortedSet<String> filesImporting(String packageName) {
        SortedSet<String> files = new TreeSet<>(importers.getOrDefault(packageName, Collections.emptySortedSet()));
        String module = ImportSpecifiers.pythonModuleOf(packageName);
        if (!module.equals(packageName)) {
            files.addAll(importers.getOrDefault(module, Collections.emptySortedSet()));
        }
        return files;
    }

    public BlastRadiusResult blastRadius(String packageName) {
        return BlastRadiusResult.of(List.copyOf(filesImporting(packageName)), totalFiles);
    }
}

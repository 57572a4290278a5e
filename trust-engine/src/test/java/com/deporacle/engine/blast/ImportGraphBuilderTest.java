package com.deporacle.engine.blast;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ImportGraphBuilderTest {

    @TempDir
    Path root;

    private final ImportGraphBuilder builder = new ImportGraphBuilder();

    @Test
    void shouldMapPackagesToImportingFiles() throws Exception {
        ProjectTree.write(root);

        StepVerifier.create(builder.build(root))
                .assertNext(graph -> {
                    assertEquals(ProjectTree.SOURCE_FILES, graph.totalFiles());
                    assertEquals(Set.of("lib/d.ts", "src/a.ts"), graph.filesImporting("chalk"));
                    assertEquals(Set.of("src/b.js"), graph.filesImporting("chalk-animation"));
                    assertEquals(Set.of("src/c.mjs"), graph.filesImporting("lodash"));
                    assertEquals(Set.of("src/c.mjs"), graph.filesImporting("@babel/polyfill"));
                    assertEquals(Set.of("app.py", "util.py"), graph.filesImporting("requests"));
                    assertEquals(Set.of("util.py"), graph.filesImporting("numpy"));
                    assertTrue(graph.filesImporting("left-pad").isEmpty());
                })
                .verifyComplete();
    }

    @Test
    void shouldComputeBlastRadiusFromGraph() throws Exception {
        ProjectTree.write(root);

        StepVerifier.create(builder.build(root))
                .assertNext(graph -> {
                    BlastRadiusResult radius = graph.blastRadius("chalk");
                    assertEquals(2, radius.affectedFileCount());
                    assertEquals(List.of("lib/d.ts", "src/a.ts"), radius.affectedFilePaths());
                    assertEquals(33.33, radius.percentage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMatchPythonDistributionThroughModuleName() throws Exception {
        Files.writeString(root.resolve("main.py"), "from typing_extensions import Literal\n");

        StepVerifier.create(builder.build(root))
                .assertNext(graph -> assertEquals(Set.of("main.py"), graph.filesImporting("typing-extensions")))
                .verifyComplete();
    }

    @Test
    void shouldReturnEmptyGraphForMissingDirectory() {
        StepVerifier.create(builder.build(root.resolve("does-not-exist")))
                .assertNext(graph -> {
                    assertEquals(0, graph.totalFiles());
                    assertTrue(graph.asMap().isEmpty());
                    assertEquals(0.0, graph.blastRadius("chalk").percentage());
                })
                .verifyComplete();
    }

    @Test
    void shouldKeepFilesWithMalformedUtf8() throws Exception {
        ProjectTree.writeWithLatin1Header(root);

        StepVerifier.create(builder.build(root))
                .assertNext(graph -> {
                    assertEquals(2, graph.totalFiles());
                    assertEquals(Set.of("src/legacy.js", "src/ok.js"), graph.filesImporting("lodash"));
                })
                .verifyComplete();
    }
}

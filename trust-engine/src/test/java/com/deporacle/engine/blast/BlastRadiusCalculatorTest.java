package com.deporacle.engine.blast;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlastRadiusCalculatorTest {

    @TempDir
    Path root;

    private final BlastRadiusCalculator calculator = new BlastRadiusCalculator();

    @Test
    void shouldCountImportingFilesWithoutPrefixMatches() throws Exception {
        ProjectTree.write(root);

        StepVerifier.create(calculator.calculate("chalk", root))
                .assertNext(result -> {
                    assertEquals(2, result.affectedFileCount());
                    assertEquals(List.of("lib/d.ts", "src/a.ts"), result.affectedFilePaths());
                    assertEquals(33.33, result.percentage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMatchSubPathImports() throws Exception {
        ProjectTree.write(root);

        StepVerifier.create(calculator.calculate("lodash", root))
                .assertNext(result -> assertEquals(List.of("src/c.mjs"), result.affectedFilePaths()))
                .verifyComplete();
    }

    @Test
    void shouldMatchPythonImportForms() throws Exception {
        ProjectTree.write(root);

        StepVerifier.create(calculator.calculate("requests", root))
                .assertNext(result -> assertEquals(List.of("app.py", "util.py"), result.affectedFilePaths()))
                .verifyComplete();
    }

    @Test
    void shouldReturnEmptyForProjectWithoutSources() {
        StepVerifier.create(calculator.calculate("chalk", root))
                .assertNext(result -> {
                    assertEquals(0, result.affectedFileCount());
                    assertEquals(0.0, result.percentage());
                })
                .verifyComplete();
    }

    @Test
    void shouldCountFilesWithMalformedUtf8() throws Exception {
        ProjectTree.writeWithLatin1Header(root);

        StepVerifier.create(calculator.calculate("lodash", root))
                .assertNext(result -> {
                    assertEquals(List.of("src/legacy.js", "src/ok.js"), result.affectedFilePaths());
                    assertEquals(100.0, result.percentage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMatchPythonImportsFollowedByCommentOrSemicolon() throws Exception {
        ProjectTree.file(root, "app.py", "import requests  # noqa\nimport yaml;\n");

        StepVerifier.create(calculator.calculate("requests", root))
                .assertNext(result -> assertEquals(List.of("app.py"), result.affectedFilePaths()))
                .verifyComplete();
        StepVerifier.create(calculator.calculate("yaml", root))
                .assertNext(result -> assertEquals(1, result.affectedFileCount()))
                .verifyComplete();
    }

    @Test
    void shouldAgreeWithImportGraph() throws Exception {
        ProjectTree.write(root);
        ProjectTree.file(root, "tools/sync.py", "import requests  # noqa\nimport yaml;\nimport os, attrs as a\n");
        ProjectTree.writeWithLatin1Header(root);
        ImportGraph graph = new ImportGraphBuilder().build(root).block();

        for (String pkg : List.of("chalk", "chalk-animation", "lodash", "requests", "PyYAML", "attrs", "numpy", "left-pad")) {
            BlastRadiusResult direct = calculator.calculate(pkg, root).block();
            assertEquals(direct, calculator.fromGraph(pkg, graph), pkg);
        }
    }

    @Test
    void shouldBuildPatternsThatRespectNameBoundaries() {
        assertTrue(BlastRadiusCalculator.scriptPattern("react").matcher("import React from 'react'").find());
        assertTrue(BlastRadiusCalculator.scriptPattern("react").matcher("require('react/jsx-runtime')").find());
        assertFalse(BlastRadiusCalculator.scriptPattern("react").matcher("import x from 'react-dom'").find());
        assertTrue(BlastRadiusCalculator.scriptPattern("@types/node").matcher("import '@types/node'").find());

        assertTrue(BlastRadiusCalculator.importsPython("import pyyaml", "pyyaml"));
        assertTrue(BlastRadiusCalculator.importsPython("import requests as r", "requests"));
        assertTrue(BlastRadiusCalculator.importsPython("import requests;", "requests"));
        assertFalse(BlastRadiusCalculator.importsPython("import requests_toolbelt", "requests"));
    }
}

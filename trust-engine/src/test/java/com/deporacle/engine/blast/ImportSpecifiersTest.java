package com.deporacle.engine.blast;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ImportSpecifiersTest {

    @Test
    void shouldResolvePackageNames() {
        assertEquals("express", ImportSpecifiers.packageNameOf("express/lib/router"));
        assertEquals("@scope/name", ImportSpecifiers.packageNameOf("@scope/name/sub/path"));
        assertNull(ImportSpecifiers.packageNameOf("@scope"));
        assertNull(ImportSpecifiers.packageNameOf("./local"));
        assertNull(ImportSpecifiers.packageNameOf("../up"));
        assertNull(ImportSpecifiers.packageNameOf("/abs/path"));
        assertNull(ImportSpecifiers.packageNameOf("node:fs"));
    }

    @Test
    void shouldExtractAllScriptImportForms() {
        String source = """
                import a from "alpha";
                import { b } from 'beta/sub';
                export * from "gamma";
                import "delta";
                const e = require( 'epsilon' );
                const f = await import("zeta");
                import local from "./local";
                """;

        assertEquals(Set.of("alpha", "beta", "gamma", "delta", "epsilon", "zeta"),
                ImportSpecifiers.extractScript(source));
    }

    @Test
    void shouldExtractTopLevelPythonModules() {
        String source = """
                import os, Flask.views
                from requests.adapters import HTTPAdapter
                    import yaml
                """;

        assertEquals(Set.of("os", "flask", "requests", "yaml"), ImportSpecifiers.extractPython(source));
    }

    @Test
    void shouldNormalizePythonModuleNames() {
        assertEquals("python_dateutil", ImportSpecifiers.pythonModuleOf("python-dateutil"));
        assertEquals("zope_interface", ImportSpecifiers.pythonModuleOf("zope.interface"));
    }
}

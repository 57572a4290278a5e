package com.deporacle.engine.blast;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts imported package names from JavaScript/TypeScript and Python source.
 *
 * @author Naveed Gung
 */
final class ImportSpecifiers {

    private static final List<Pattern> SCRIPT_PATTERNS = List.of(
            Pattern.compile("(?:import|export)\\s+[^;]*?\\s+from\\s+[\"']([^\"']+)[\"']"),
            Pattern.compile("import\\s+[\"']([^\"']+)[\"']"),
            Pattern.compile("require\\s*\\(\\s*[\"']([^\"']+)[\"']\\s*\\)"),
            Pattern.compile("import\\s*\\(\\s*[\"']([^\"']+)[\"']\\s*\\)"));

    private static final Pattern PYTHON_IMPORT = Pattern.compile(
            "^\\s*import\\s+([A-Za-z_][\\w.]*(?:\\s*,\\s*[A-Za-z_][\\w.]*)*)", Pattern.MULTILINE);
    private static final Pattern PYTHON_FROM = Pattern.compile(
            "^\\s*from\\s+([A-Za-z_][\\w.]*)\\s+import\\b", Pattern.MULTILINE);

    private ImportSpecifiers() {
    }

    static Set<String> extractScript(String content) {
        Set<String> packages = new LinkedHashSet<>();
        for (Pattern pattern : SCRIPT_PATTERNS) {
            Matcher m = pattern.matcher(content);
            while (m.find()) {
                String name = packageNameOf(m.group(1));
                if (name != null) {
                    packages.add(name);
                }
            }
        }
        return packages;
    }

    static Set<String> extractPython(String content) {
        Set<String> modules = new LinkedHashSet<>();
        Matcher imports = PYTHON_IMPORT.matcher(content);
        while (imports.find()) {
            for (String module : imports.group(1).split(",")) {
                modules.add(topLevel(module.trim()));
            }
        }
        Matcher froms = PYTHON_FROM.matcher(content);
        while (froms.find()) {
            modules.add(topLevel(froms.group(1)));
        }
        return modules;
    }

    /**
     * Package name of a module specifier: {@code @scope/name/sub} gives
     * {@code @scope/name}, {@code name/sub} gives {@code name}. Relative paths,
     * absolute paths and {@code node:} built-ins give null.
     */
    static String packageNameOf(String specifier) {
        if (specifier.isEmpty() || specifier.startsWith(".") || specifier.startsWith("/")
                || specifier.startsWith("node:")) {
            return null;
        }
        String[] parts = specifier.split("/");
        if (specifier.startsWith("@")) {
            return parts.length < 2 ? null : parts[0] + "/" + parts[1];
        }
        return parts[0];
    }

    /** Importable module name for a PyPI distribution, e.g. {@code python-dateutil} to {@code python_dateutil}. */
    static String pythonModuleOf(String packageName) {
        return packageName.toLowerCase(Locale.ROOT).replace('-', '_').replace('.', '_');
    }

    private static String topLevel(String module) {
        int dot = module.indexOf('.');
        return (dot < 0 ? module : module.substring(0, dot)).toLowerCase(Locale.ROOT);
    }
}

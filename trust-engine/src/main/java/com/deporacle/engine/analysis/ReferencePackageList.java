package com.deporacle.engine.analysis;

import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the bundled list of well-known package names, one per line; blank lines and # comments are skipped.
 *
 * @author Naveed Gung
 */
public final class ReferencePackageList {

    private ReferencePackageList() {
    }

    public static List<String> load(String resource) {
        ClassPathResource file = new ClassPathResource(resource);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8))) {
            List<String> names = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                String name = line.trim();
                if (!name.isEmpty() && !name.startsWith("#")) {
                    names.add(name);
                }
            }
            return names;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read typosquat reference list " + resource, e);
        }
    }
}

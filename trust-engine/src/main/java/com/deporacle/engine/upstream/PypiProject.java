package com.deporacle.engine.upstream;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static com.deporacle.engine.upstream.JsonValues.instantOrNull;
import static com.deporacle.engine.upstream.JsonValues.textOrNull;

/**
 * Read-only view over the PyPI JSON API document
 * ({@code GET pypi.org/pypi/<name>/json}).
 *
 * @author Naveed Gung
 */
public class PypiProject {

    private static final List<String> REPOSITORY_KEYS = List.of(
            "Source", "Source Code", "Repository", "GitHub", "Code", "Homepage",
            "source", "source_code", "repository", "github", "code", "homepage");

    private final JsonNode root;

    public PypiProject(JsonNode root) {
        this.root = root;
    }

    private JsonNode info() {
        return root.path("info");
    }

    public String summary() {
        return textOrNull(info().path("summary"));
    }

    public String latestVersion() {
        return textOrNull(info().path("version"));
    }

    /** Resolves the "latest" placeholder to the current release. */
    public String resolveVersion(String requested) {
        if (requested == null || "latest".equals(requested)) {
            String latest = latestVersion();
            return latest != null ? latest : requested;
        }
        return requested;
    }

    public int releaseCount() {
        return root.path("releases").size();
    }

    public Instant lastPublishDate() {
        Instant latest = null;
        Iterator<JsonNode> releases = root.path("releases").elements();
        while (releases.hasNext()) {
            for (JsonNode file : releases.next()) {
                String raw = textOrNull(file.path("upload_time_iso_8601"));
                if (raw == null) {
                    raw = textOrNull(file.path("upload_time"));
                }
                Instant t = instantOrNull(raw);
                if (t != null && (latest == null || t.isAfter(latest))) {
                    latest = t;
                }
            }
        }
        return latest;
    }

    /** Yank reason of the requested release, null when it is not yanked. */
    public String yankReason(String version) {
        if (version == null || "latest".equals(version)) {
            return null;
        }
        for (JsonNode file : root.path("releases").path(version)) {
            if (file.path("yanked").asBoolean(false)) {
                String reason = textOrNull(file.path("yanked_reason"));
                return reason == null || reason.isBlank() ? "This version has been yanked" : reason;
            }
        }
        return null;
    }

    /**
     * License as declared: the PEP 639 expression when present, then the
     * free-text field, then the first {@code License ::} trove classifier.
     */
    public String license() {
        String expression = textOrNull(info().path("license_expression"));
        if (expression != null && !expression.isBlank()) {
            return expression;
        }
        String license = textOrNull(info().path("license"));
        if (license != null && !license.isBlank() && license.length() <= 100) {
            return license;
        }
        for (JsonNode classifier : info().path("classifiers")) {
            String text = classifier.asText();
            if (text.startsWith("License ::")) {
                String[] parts = text.split("::");
                return parts[parts.length - 1].trim();
            }
        }
        return license;
    }

    public String repositoryUrl() {
        JsonNode urls = info().path("project_urls");
        for (String key : REPOSITORY_KEYS) {
            String url = textOrNull(urls.path(key));
            if (RepositoryUrls.isSourceHost(url)) {
                return url.replaceFirst("\\.git$", "");
            }
        }
        Iterator<Map.Entry<String, JsonNode>> it = urls.fields();
        while (it.hasNext()) {
            String url = textOrNull(it.next().getValue());
            if (RepositoryUrls.isSourceHost(url)) {
                return url.replaceFirst("\\.git$", "");
            }
        }
        String homePage = textOrNull(info().path("home_page"));
        if (homePage != null && (homePage.contains("github.com") || homePage.contains("gitlab.com"))) {
            return homePage.replaceFirst("\\.git$", "");
        }
        return null;
    }
}

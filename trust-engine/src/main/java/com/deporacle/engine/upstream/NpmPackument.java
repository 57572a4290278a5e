package com.deporacle.engine.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static com.deporacle.engine.upstream.JsonValues.instantOrNull;
import static com.deporacle.engine.upstream.JsonValues.textOrNull;

/**
 * Read-only view over an npm registry packument
 * ({@code GET registry.npmjs.org/<name>}).
 *
 * @author Naveed Gung
 */
public class NpmPackument {

    private final JsonNode root;

    public NpmPackument(JsonNode root) {
        this.root = root;
    }

    public String name() {
        return textOrNull(root.path("name"));
    }

    public String description() {
        return textOrNull(root.path("description"));
    }

    public int versionCount() {
        return root.path("versions").size();
    }

    /** The {@code latest} dist-tag, used when the caller asked for "latest". */
    public String latestVersion() {
        return textOrNull(root.path("dist-tags").path("latest"));
    }

    /** Newest release time, ignoring the {@code created} and {@code modified} bookkeeping keys. */
    public Instant lastPublishDate() {
        Instant latest = null;
        Iterator<Map.Entry<String, JsonNode>> it = root.path("time").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if ("created".equals(e.getKey()) || "modified".equals(e.getKey())) {
                continue;
            }
            Instant t = instantOrNull(e.getValue().asText(null));
            if (t != null && (latest == null || t.isAfter(latest))) {
                latest = t;
            }
        }
        return latest;
    }

    /** Deprecation message of the given version, null when not deprecated. */
    public String deprecation(String version) {
        JsonNode deprecated = versionNode(version).path("deprecated");
        if (deprecated.isMissingNode() || deprecated.isNull()) {
            return null;
        }
        if (deprecated.isBoolean()) {
            return deprecated.asBoolean() ? "deprecated" : null;
        }
        String text = deprecated.asText();
        return text.isEmpty() ? null : text;
    }

    /** License of the requested version, falling back to the top-level field. */
    public String license(String version) {
        String versioned = licenseText(versionNode(version).path("license"));
        return versioned != null ? versioned : licenseText(root.path("license"));
    }

    public String repositoryUrl() {
        JsonNode repo = root.path("repository");
        String raw = repo.isTextual() ? repo.asText() : textOrNull(repo.path("url"));
        return RepositoryUrls.normalize(raw);
    }

    /**
     * Funding URLs from the manifest {@code funding} field, which may be a
     * string, an object with a {@code url}, or an array of either.
     */
    public List<String> fundingUrls() {
        JsonNode funding = root.path("funding");
        if (funding.isMissingNode() || funding.isNull()) {
            funding = versionNode(null).path("funding");
        }
        List<String> urls = new ArrayList<>();
        if (funding.isArray()) {
            funding.forEach(f -> addFundingEntry(f, urls));
        } else {
            addFundingEntry(funding, urls);
        }
        return urls;
    }

    private JsonNode versionNode(String version) {
        if (version == null || "latest".equals(version)) {
            version = latestVersion();
        }
        return version == null ? MissingNode.getInstance() : root.path("versions").path(version);
    }

    private static void addFundingEntry(JsonNode entry, List<String> urls) {
        String url = entry.isTextual() ? entry.asText() : textOrNull(entry.path("url"));
        if (url != null && !url.isBlank()) {
            urls.add(url.trim());
        }
    }

    private static String licenseText(JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isObject()) {
            return textOrNull(node.path("type"));
        }
        if (node.isArray() && node.size() > 0) {
            // legacy "licenses" arrays: first entry wins
            return licenseText(node.get(0));
        }
        return null;
    }
}

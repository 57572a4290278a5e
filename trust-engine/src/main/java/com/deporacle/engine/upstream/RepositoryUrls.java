package com.deporacle.engine.upstream;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalization of the many repository URL spellings found in package
 * manifests ({@code git+https://…}, {@code git://…}, {@code git@github.com:…}).
 *
 * @author Naveed Gung
 */
public final class RepositoryUrls {

    private static final Pattern GITHUB_PATH = Pattern.compile("github\\.com/([^/]+)/([^/#?]+)");
    private static final Pattern GITHUB_NAME = Pattern.compile("^[a-zA-Z0-9]([a-zA-Z0-9._-]*[a-zA-Z0-9])?$");

    private RepositoryUrls() {
    }

    /** Rewrite a manifest repository value to a plain https URL. */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String url = raw.trim();
        if (url.startsWith("github:")) {
            url = "https://github.com/" + url.substring("github:".length());
        }
        url = url.replaceFirst("^git\\+", "")
                .replaceFirst("^git://", "https://")
                .replaceFirst("^ssh://git@github\\.com", "https://github.com")
                .replaceFirst("^git@github\\.com:", "https://github.com/")
                .replaceFirst("\\.git$", "");
        return url.isEmpty() ? null : url;
    }

    /**
     * Extract a GitHub owner/repo pair. Both parts must be valid GitHub names,
     * which also keeps path tricks out of API URLs built from them.
     */
    public static Optional<GitHubSlug> parseGitHub(String url) {
        String normalized = normalize(url);
        if (normalized == null) {
            return Optional.empty();
        }
        Matcher m = GITHUB_PATH.matcher(normalized);
        if (!m.find()) {
            return Optional.empty();
        }
        String owner = m.group(1);
        String repo = m.group(2).replaceFirst("\\.git$", "");
        if (!GITHUB_NAME.matcher(owner).matches() || !GITHUB_NAME.matcher(repo).matches()) {
            return Optional.empty();
        }
        return Optional.of(new GitHubSlug(owner, repo));
    }

    /** Whether the URL points at a known source-hosting service. */
    public static boolean isSourceHost(String url) {
        return url != null
                && (url.contains("github.com") || url.contains("gitlab.com") || url.contains("bitbucket.org"));
    }
}

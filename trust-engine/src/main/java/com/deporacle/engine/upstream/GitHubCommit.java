package com.deporacle.engine.upstream;

import java.time.Instant;

/**
 * Head commit of a repository's default branch.
 *
 * @author Naveed Gung
 */
public record GitHubCommit(String sha, Instant date) {
}

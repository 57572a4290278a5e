package com.deporacle.engine.upstream;

/**
 * Owner and repository name of a GitHub project.
 *
 * @author Naveed Gung
 */
public record GitHubSlug(String owner, String repo) {

    @Override
    public String toString() {
        return owner + "/" + repo;
    }
}

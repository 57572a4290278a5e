package com.deporacle.engine.upstream;

import com.deporacle.engine.model.Ecosystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Finds the GitHub repository a package is published from, using the
 * registry metadata of its ecosystem.
 *
 * @author Naveed Gung
 */
@Component
public class RepositoryLocator {

    private static final Logger log = LoggerFactory.getLogger(RepositoryLocator.class);

    private final NpmRegistryClient npmRegistryClient;
    private final PypiClient pypiClient;

    public RepositoryLocator(NpmRegistryClient npmRegistryClient, PypiClient pypiClient) {
        this.npmRegistryClient = npmRegistryClient;
        this.pypiClient = pypiClient;
    }

    /**
     * Resolve the GitHub slug. Completes empty when the package has no GitHub
     * repository or the registry cannot be reached.
     */
    public Mono<GitHubSlug> locate(String packageName, Ecosystem ecosystem) {
        Mono<String> repositoryUrl = switch (ecosystem) {
            case NPM -> npmRegistryClient.fetchPackument(packageName).mapNotNull(NpmPackument::repositoryUrl);
            case PYPI -> pypiClient.fetchProject(packageName).mapNotNull(PypiProject::repositoryUrl);
        };
        return repositoryUrl
                .flatMap(url -> Mono.justOrEmpty(RepositoryUrls.parseGitHub(url)))
                .onErrorResume(e -> {
                    log.debug("Repository lookup failed for {}: {}", packageName, e.getMessage());
                    return Mono.empty();
                });
    }
}

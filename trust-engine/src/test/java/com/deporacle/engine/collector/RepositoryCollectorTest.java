package com.deporacle.engine.collector;

import com.deporacle.engine.MockUpstreams;
import com.deporacle.engine.MutableClock;
import com.deporacle.engine.cache.ResultCache;
import com.deporacle.engine.config.EngineConfig;
import com.deporacle.engine.config.UpstreamConfig;
import com.deporacle.engine.model.Ecosystem;
import com.deporacle.engine.model.RepositoryData;
import com.deporacle.engine.ratelimit.UpstreamRateLimiters;
import com.deporacle.engine.upstream.GitHubClient;
import com.deporacle.engine.upstream.NpmRegistryClient;
import com.deporacle.engine.upstream.PypiClient;
import com.deporacle.engine.upstream.RepositoryLocator;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryCollectorTest {

    private static final String PACKUMENT = """
            {
              "name": "express",
              "dist-tags": {"latest": "4.18.2"},
              "versions": {"4.18.2": {}},
              "repository": {"type": "git", "url": "git+https://github.com/expressjs/express.git"}
            }
            """;

    private static final String REPO = """
            {
              "stargazers_count": 64000,
              "forks_count": 14000,
              "open_issues_count": 120,
              "updated_at": "2025-05-30T10:00:00Z",
              "archived": false,
              "default_branch": "master"
            }
            """;

    private static final String LATEST_COMMIT = """
            [{"sha": "abc123", "commit": {"committer": {"date": "2025-05-28T08:30:00Z"}}}]
            """;

    @TempDir
    Path dir;

    private MockWebServer server;
    private final Map<String, MockResponse> routes = new ConcurrentHashMap<>();
    private RepositoryCollector collector;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getRequestUrl().encodedPath();
                String query = request.getRequestUrl().encodedQuery();
                if (query != null && query.contains("since=")) {
                    path = path + "?since";
                }
                return routes.getOrDefault(path, new MockResponse().setResponseCode(404));
            }
        });
        server.start();

        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        UpstreamConfig config = MockUpstreams.config(server);
        UpstreamRateLimiters limiters = MockUpstreams.limiters(config);
        MutableClock clock = MutableClock.at("2025-06-01T00:00:00Z");
        ResultCache cache = new ResultCache(dir.resolve("cache.json"), objectMapper, clock, 3600);

        NpmRegistryClient registry = new NpmRegistryClient(config, limiters, objectMapper);
        PypiClient pypi = new PypiClient(config, limiters, objectMapper);
        GitHubClient gitHub = new GitHubClient(config, new EngineConfig(), limiters, objectMapper);
        collector = new RepositoryCollector(gitHub, new RepositoryLocator(registry, pypi), cache, clock);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    private void routeRepository() {
        routes.put("/registry/express", json(PACKUMENT));
        routes.put("/github/repos/expressjs/express", json(REPO));
    }

    @Test
    void shouldCombineRepositoryActivity() {
        routeRepository();
        routes.put("/github/repos/expressjs/express/contributors", json("[{\"login\": \"a\"}]")
                .setHeader("Link", "<http://x/repos/expressjs/express/contributors?page=12>; rel=\"last\""));
        routes.put("/github/repos/expressjs/express/commits?since", json("[{}, {}, {}]"));
        routes.put("/github/repos/expressjs/express/commits", json(LATEST_COMMIT));
        routes.put("/github/repos/expressjs/express/contents/.github/FUNDING.yml",
                new MockResponse().setBody("open_collective: express\n"));

        StepVerifier.create(collector.collect("express", "4.18.2", Ecosystem.NPM))
                .assertNext(result -> {
                    assertEquals(CollectorStatus.SUCCESS, result.status());
                    RepositoryData data = result.data();
                    assertEquals("expressjs", data.owner());
                    assertEquals("express", data.repo());
                    assertEquals(64000, data.stars());
                    assertEquals(14000, data.forks());
                    assertEquals("master", data.defaultBranch());
                    assertEquals(12, data.contributorCount());
                    assertEquals(3, data.recentCommitCount());
                    assertEquals(Instant.parse("2025-05-28T08:30:00Z"), data.lastCommitDate());
                    assertEquals("abc123", data.lastCommitSha());
                    assertTrue(data.hasFundingFile());
                })
                .verifyComplete();
    }

    @Test
    void shouldDegradeOptionalLookups() {
        routeRepository();
        routes.put("/github/repos/expressjs/express/contributors", new MockResponse().setResponseCode(500));
        routes.put("/github/repos/expressjs/express/commits", json("[]"));

        StepVerifier.create(collector.collect("express", "4.18.2", Ecosystem.NPM))
                .assertNext(result -> {
                    assertEquals(CollectorStatus.SUCCESS, result.status());
                    RepositoryData data = result.data();
                    assertEquals(0, data.contributorCount());
                    assertEquals(0, data.recentCommitCount());
                    assertNull(data.lastCommitDate());
                    assertNull(data.lastCommitSha());
                    assertFalse(data.hasFundingFile());
                })
                .verifyComplete();
    }

    @Test
    void shouldFailWhenRepositoryInfoIsMissing() {
        routes.put("/registry/express", json(PACKUMENT));

        StepVerifier.create(collector.collect("express", "4.18.2", Ecosystem.NPM))
                .assertNext(result -> {
                    assertEquals(CollectorStatus.ERROR, result.status());
                    assertNull(result.data());
                })
                .verifyComplete();
    }

    @Test
    void shouldFailWithoutGitHubRepository() {
        routes.put("/registry/left-pad", json("{\"name\": \"left-pad\", \"versions\": {}}"));

        StepVerifier.create(collector.collect("left-pad", "1.3.0", Ecosystem.NPM))
                .assertNext(result -> {
                    assertEquals(CollectorStatus.ERROR, result.status());
                    assertTrue(result.error().contains("No GitHub repository"));
                })
                .verifyComplete();
    }
}

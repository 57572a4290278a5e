package com.deporacle.engine.upstream;

import com.deporacle.engine.MockUpstreams;
import com.deporacle.engine.config.EngineConfig;
import com.deporacle.engine.config.UpstreamConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GitHubClientTest {

    private static final GitHubSlug SLUG = new GitHubSlug("expressjs", "express");

    private MockWebServer server;
    private GitHubClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        UpstreamConfig config = MockUpstreams.config(server);
        EngineConfig engineConfig = new EngineConfig();
        engineConfig.setGithubToken("test-token");
        client = new GitHubClient(config, engineConfig, MockUpstreams.limiters(config), new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldReadLastPageFromLinkHeader() {
        String link = "<https://api.github.com/repositories/1/contributors?per_page=1&page=2>; rel=\"next\", "
                + "<https://api.github.com/repositories/1/contributors?per_page=1&page=317>; rel=\"last\"";

        assertEquals(317, GitHubClient.lastPage(link));
        assertNull(GitHubClient.lastPage("<https://api.github.com/x?page=2>; rel=\"next\""));
        assertNull(GitHubClient.lastPage(null));
    }

    @Test
    void shouldCountFromLinkHeader() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Link", "<http://x/repos/a/b/contributors?per_page=1&anon=true&page=42>; rel=\"last\"")
                .setBody("[{\"login\": \"a\"}]"));

        StepVerifier.create(client.countContributors(SLUG)).expectNext(42).verifyComplete();

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("Bearer test-token", request.getHeader("Authorization"));
        assertEquals("2022-11-28", request.getHeader("X-GitHub-Api-Version"));
    }

    @Test
    void shouldCountBodyWithoutPagination() {
        server.enqueue(new MockResponse().setBody("[{\"sha\": \"1\"}]"));
        server.enqueue(new MockResponse().setBody("[]"));

        StepVerifier.create(client.countCommitsSince(SLUG, Instant.parse("2025-05-01T00:00:00Z")))
                .expectNext(1)
                .verifyComplete();
        StepVerifier.create(client.countCommitsSince(SLUG, Instant.parse("2025-05-01T00:00:00Z")))
                .expectNext(0)
                .verifyComplete();
    }

    @Test
    void shouldReadLatestCommit() {
        server.enqueue(new MockResponse().setBody(
                "[{\"sha\": \"abc123\", \"commit\": {\"committer\": {\"date\": \"2025-05-20T10:00:00Z\"}}}]"));

        StepVerifier.create(client.fetchLatestCommit(SLUG))
                .assertNext(commit -> {
                    assertEquals("abc123", commit.sha());
                    assertEquals(Instant.parse("2025-05-20T10:00:00Z"), commit.date());
                })
                .verifyComplete();
    }

    @Test
    void shouldTreatMissingFundingFileAsEmpty() {
        server.enqueue(new MockResponse().setResponseCode(404));

        StepVerifier.create(client.fetchFundingFile(SLUG)).verifyComplete();
    }

    @Test
    void shouldPropagateRepositoryFailure() {
        server.enqueue(new MockResponse().setResponseCode(403));

        StepVerifier.create(client.fetchRepository(SLUG)).expectError().verify();
    }
}

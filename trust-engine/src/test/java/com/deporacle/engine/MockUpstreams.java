package com.deporacle.engine;

import com.deporacle.engine.config.UpstreamConfig;
import com.deporacle.engine.ratelimit.UpstreamRateLimiters;
import okhttp3.mockwebserver.MockWebServer;
import reactor.core.scheduler.Schedulers;

/**
 * Routes every upstream host to one {@link MockWebServer}, each under its own
 * path prefix: {@code /registry}, {@code /downloads}, {@code /pypi},
 * {@code /pypistats}, {@code /github}, {@code /osv}, {@code /opencollective}.
 */
public final class MockUpstreams {

    private MockUpstreams() {
    }

    public static UpstreamConfig config(MockWebServer server) {
        UpstreamConfig config = new UpstreamConfig();
        point(config.getNpmRegistry(), server, "/registry");
        point(config.getNpmDownloads(), server, "/downloads");
        point(config.getPypi(), server, "/pypi");
        point(config.getPypiStats(), server, "/pypistats");
        point(config.getGithub(), server, "/github");
        point(config.getOsv(), server, "/osv");
        point(config.getOpenCollective(), server, "/opencollective");
        return config;
    }

    public static UpstreamRateLimiters limiters(UpstreamConfig config) {
        return new UpstreamRateLimiters(config, Schedulers.parallel());
    }

    private static void point(UpstreamConfig.Endpoint endpoint, MockWebServer server, String prefix) {
        endpoint.setBaseUrl(server.url(prefix).toString());
        endpoint.setTimeoutMs(2_000);
    }
}

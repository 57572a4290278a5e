package com.deporacle.engine.collector;

import com.deporacle.engine.model.FundingData;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FundingCollectorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldParseFundingFileChannels() {
        String yml = """
                # These are supported funding model platforms
                github: [sindresorhus, 'another-dev']
                open_collective: webpack
                ko_fi: # Replace with a single Ko-fi username
                patreon: ~
                """;

        List<String> urls = FundingCollector.parseFundingFile(yml);

        assertEquals(List.of(
                "https://github.com/sponsors/sindresorhus",
                "https://github.com/sponsors/another-dev",
                "https://opencollective.com/webpack"), urls);
    }

    @Test
    void shouldIgnoreInvalidSponsorNames() {
        assertEquals(List.of(), FundingCollector.parseFundingFile("github: ../../evil"));
        assertEquals(List.of(), FundingCollector.parseFundingFile(""));
        assertEquals(List.of(), FundingCollector.parseFundingFile(null));
    }

    @Test
    void shouldCombineAllChannels() throws Exception {
        JsonNode collective = objectMapper.readTree("""
                {"slug": "webpack", "isActive": true, "backersCount": 1200, "yearlyBudget": 45000000}
                """);

        FundingData data = FundingCollector.toFundingData("webpack",
                List.of("https://opencollective.com/webpack"), "github: sokra", collective);

        assertTrue(data.hasSponsors());
        assertTrue(data.hasOpenCollective());
        assertTrue(data.hasRegistryFunding());
        assertEquals("webpack", data.openCollectiveSlug());
        assertEquals(1200, data.openCollectiveBackers());
        // reported in cents above the threshold
        assertEquals(450_000, data.estimatedAnnualFunding());
        assertEquals(List.of("https://opencollective.com/webpack", "https://github.com/sponsors/sokra"),
                data.fundingUrls());
    }

    @Test
    void shouldReportNoFundingWhenNothingFound() {
        FundingData data = FundingCollector.toFundingData("tiny-lib", List.of(), "", MissingNode.getInstance());

        assertFalse(data.hasSponsors());
        assertFalse(data.hasOpenCollective());
        assertFalse(data.hasRegistryFunding());
        assertNull(data.openCollectiveSlug());
        assertEquals(0, data.estimatedAnnualFunding());
        assertTrue(data.fundingUrls().isEmpty());
    }

    @Test
    void shouldNotCountInactiveCollective() throws Exception {
        JsonNode collective = objectMapper.readTree("{\"slug\": \"old-lib\", \"isActive\": false, \"yearlyBudget\": 300}");

        FundingData data = FundingCollector.toFundingData("old-lib", List.of(), "", collective);

        assertFalse(data.hasOpenCollective());
        assertEquals(300, data.estimatedAnnualFunding());
    }
}

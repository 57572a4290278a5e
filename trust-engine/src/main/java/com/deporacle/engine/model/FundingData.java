package com.deporacle.engine.model;

import java.util.List;

/**
 * Funding channels found for a package.
 *
 * @param hasSponsors            a non-empty FUNDING.yml was found
 * @param hasOpenCollective      an active OpenCollective profile exists
 * @param hasRegistryFunding     the registry manifest declares a funding field
 * @param estimatedAnnualFunding rough USD estimate, 0 when unknown
 *
 * @author Naveed Gung
 */
public record FundingData(
        String packageName,
        boolean hasSponsors,
        boolean hasOpenCollective,
        boolean hasRegistryFunding,
        String openCollectiveSlug,
        int openCollectiveBackers,
        double estimatedAnnualFunding,
        List<String> fundingUrls) {

    /** Most packages legitimately have no funding; this is a valid result, not a failure. */
    public static FundingData none(String packageName) {
        return new FundingData(packageName, false, false, false, null, 0, 0, List.of());
    }
}

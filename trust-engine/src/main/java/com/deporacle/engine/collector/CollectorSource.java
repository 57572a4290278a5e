package com.deporacle.engine.collector;

import com.deporacle.engine.model.Ecosystem;
import com.deporacle.engine.model.FundingData;
import com.deporacle.engine.model.LicenseData;
import com.deporacle.engine.model.PopularityData;
import com.deporacle.engine.model.RegistryData;
import com.deporacle.engine.model.RepositoryData;
import com.deporacle.engine.model.SecurityData;

/**
 * The six signal sources, each with the data shape it produces.
 *
 * @author Naveed Gung
 */
public enum CollectorSource {
    REGISTRY("registry", RegistryData.class),
    REPOSITORY("repository", RepositoryData.class),
    SECURITY("security", SecurityData.class),
    FUNDING("funding", FundingData.class),
    POPULARITY("popularity", PopularityData.class),
    LICENSE("license", LicenseData.class);

    private final String id;
    private final Class<?> dataType;

    CollectorSource(String id, Class<?> dataType) {
        this.id = id;
        this.dataType = dataType;
    }

    public String id() {
        return id;
    }

    public Class<?> dataType() {
        return dataType;
    }

    /** Deterministic cache key, e.g. {@code registry:npm:express@4.18.2}. */
    public String cacheKey(Ecosystem ecosystem, String packageName, String version) {
        return id + ":" + ecosystem.key() + ":" + packageName + "@" + version;
    }
}

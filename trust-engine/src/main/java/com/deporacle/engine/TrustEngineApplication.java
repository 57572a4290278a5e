package com.deporacle.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Dependency trust engine.
 *
 * <p>
 * Gathers registry, repository, vulnerability, funding, popularity and
 * license signals for third-party packages and reduces them to a trust score
 * with abandonment, typosquat, trend and blast-radius diagnostics.
 * </p>
 *
 * @author Naveed Gung
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class TrustEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrustEngineApplication.class, args);
    }
}

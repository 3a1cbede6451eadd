package com.transferhub.pricing.config;

import com.transferhub.shared.featureflag.FeatureFlagService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Seeds the pricing tier flags at startup. FeatureFlagService comes from auto-configuration,
 * which is processed after this class, so it is looked up lazily when the runner fires.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "pricing.feature-flags.seed-defaults", havingValue = "true", matchIfMissing = true)
public class FeatureFlagInitializer {

    @Bean
    public ApplicationRunner seedPricingFeatureFlags(ObjectProvider<FeatureFlagService> featureFlags) {
        return args -> {
            FeatureFlagService featureFlagService = featureFlags.getIfAvailable();
            if (featureFlagService == null) {
                log.warn("No FeatureFlagService (Redis not configured); pricing tier flags not seeded");
                return;
            }
            featureFlagService.initDefaults(FeatureFlagService.DEFAULT_SCOPE);
            log.info("Pricing tier feature flags initialised for scope '{}'", FeatureFlagService.DEFAULT_SCOPE);
        };
    }
}

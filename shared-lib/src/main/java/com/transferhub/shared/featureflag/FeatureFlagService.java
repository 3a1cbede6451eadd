package com.transferhub.shared.featureflag;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Pricing tier switches kept in Redis hashes.
 *
 * Key pattern:  feature-flags:{scope}
 * Field:        {flagName}
 * Value:        "true" | "false"
 *
 * Lookups read the {@value #DEFAULT_SCOPE} scope, then the global scope, then the caller's default.
 * Switch a tier off from the Redis CLI:
 *   HSET feature-flags:default geo_fixed_routes_enabled false
 *   HSET feature-flags:global  night_surcharge_enabled false
 */
@Slf4j
@RequiredArgsConstructor
public class FeatureFlagService {

    private static final String FLAG_KEY_PREFIX = "feature-flags:";
    private static final String GLOBAL_SCOPE    = "global";
    private static final Duration SEED_TTL      = Duration.ofDays(365);

    public static final String DEFAULT_SCOPE = "default";

    public static final String GEO_FIXED_ROUTES_ENABLED   = "geo_fixed_routes_enabled";
    public static final String LEGACY_TEXT_ROUTES_ENABLED = "legacy_text_routes_enabled";
    public static final String MILEAGE_BRACKETS_ENABLED   = "mileage_brackets_enabled";
    public static final String LEGACY_RATE_RULES_ENABLED  = "legacy_rate_rules_enabled";
    public static final String NIGHT_SURCHARGE_ENABLED    = "night_surcharge_enabled";

    public static final List<String> PRICING_FLAGS = List.of(
            GEO_FIXED_ROUTES_ENABLED,
            LEGACY_TEXT_ROUTES_ENABLED,
            MILEAGE_BRACKETS_ENABLED,
            LEGACY_RATE_RULES_ENABLED,
            NIGHT_SURCHARGE_ENABLED);

    private final RedisTemplate<String, String> redisTemplate;

    public boolean isEnabled(String flagName, boolean defaultValue) {
        return read(DEFAULT_SCOPE, flagName)
                .or(() -> read(GLOBAL_SCOPE, flagName))
                .orElseGet(() -> {
                    log.debug("Feature flag '{}' not set, using default={}", flagName, defaultValue);
                    return defaultValue;
                });
    }

    /**
     * Writes every pricing flag as enabled unless already present, so operator overrides survive restarts.
     */
    public void initDefaults(String scope) {
        String key = FLAG_KEY_PREFIX + scope;
        for (String flag : PRICING_FLAGS) {
            redisTemplate.opsForHash().putIfAbsent(key, flag, "true");
        }
        redisTemplate.expire(key, SEED_TTL);
    }

    private Optional<Boolean> read(String scope, String flagName) {
        Object value = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + scope, flagName);
        return Optional.ofNullable(value).map(v -> Boolean.parseBoolean(v.toString()));
    }
}

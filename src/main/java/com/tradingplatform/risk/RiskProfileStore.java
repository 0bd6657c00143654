package com.tradingplatform.risk;

import com.tradingplatform.exception.ErrorCode;
import com.tradingplatform.exception.OrderExecutionException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory keyed store of risk profiles. Update replaces the whole record; there is no
 * partial merge. Stored profiles are immutable copies.
 */
public class RiskProfileStore {

    private static final Logger log = LoggerFactory.getLogger(RiskProfileStore.class);

    static final String SOURCE = "risk-profile-store";

    private final Clock clock;
    private final Map<String, RiskProfile> profiles = new ConcurrentHashMap<>();

    public RiskProfileStore(Clock clock) {
        this.clock = clock;
    }

    public RiskProfile create(RiskProfile profile) {
        requireId(profile);
        Instant now = clock.instant();
        RiskProfile stored = normalize(profile, 1, now, now);
        if (profiles.putIfAbsent(stored.getId(), stored) != null) {
            throw OrderExecutionException.validation(
                    ErrorCode.INVALID_PARAMETER,
                    String.format("Risk profile with ID %s already exists", stored.getId()),
                    SOURCE);
        }
        log.info("Risk profile created: {} ({} limits)", stored.getId(), stored.getLimits().size());
        return stored;
    }

    public RiskProfile get(String profileId) {
        RiskProfile profile = profileId == null ? null : profiles.get(profileId);
        if (profile == null) {
            throw notFound(profileId);
        }
        return profile;
    }

    /** Replaces the stored profile with {@code profile}. */
    public RiskProfile update(RiskProfile profile) {
        requireId(profile);
        RiskProfile updated = profiles.computeIfPresent(profile.getId(), (id, existing) ->
                normalize(profile, existing.getVersion() + 1, existing.getCreatedAt(), clock.instant()));
        if (updated == null) {
            throw notFound(profile.getId());
        }
        log.info("Risk profile updated: {} (version {})", updated.getId(), updated.getVersion());
        return updated;
    }

    public void delete(String profileId) {
        if (profileId == null || profiles.remove(profileId) == null) {
            throw notFound(profileId);
        }
        log.info("Risk profile deleted: {}", profileId);
    }

    public List<RiskProfile> list() {
        return profiles.values().stream()
                .sorted(Comparator.comparing(RiskProfile::getId))
                .collect(Collectors.toList());
    }

    private static void requireId(RiskProfile profile) {
        if (profile == null || profile.getId() == null || profile.getId().isBlank()) {
            throw OrderExecutionException.validation(
                    ErrorCode.INVALID_PARAMETER, "Risk profile ID cannot be empty", SOURCE);
        }
    }

    private static RiskProfile normalize(RiskProfile profile, long version, Instant createdAt, Instant updatedAt) {
        Map<RiskLimitType, RiskLimit> limits = new EnumMap<>(RiskLimitType.class);
        if (profile.getLimits() != null) {
            profile.getLimits().forEach((type, limit) -> {
                if (limit.getValue() == null) {
                    throw OrderExecutionException.validation(
                            ErrorCode.INVALID_PARAMETER,
                            String.format("Risk limit %s of profile %s has no value", type, profile.getId()),
                            SOURCE);
                }
                limits.put(type, limit.getType() == type ? limit : limit.toBuilder().type(type).build());
            });
        }
        return profile.toBuilder()
                .limits(Collections.unmodifiableMap(limits))
                .version(version)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    private static OrderExecutionException notFound(String profileId) {
        return OrderExecutionException.validation(
                ErrorCode.NOT_FOUND, String.format("Risk profile with ID %s not found", profileId), SOURCE);
    }
}

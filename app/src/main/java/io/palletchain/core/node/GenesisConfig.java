package io.palletchain.core.node;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.palletchain.core.staking.StakingParams;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Genesis state and runtime tunables, bound from JSON. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GenesisConfig {
    private static final ObjectMapper JSON = new ObjectMapper();
    static final String BUNDLED_RESOURCE = "/genesis.json";

    public final Map<String, Long> allocations;
    public final long baseFee;
    public final String feeRecipient;
    public final Map<String, Integer> validators;   // id -> commission percent
    public final StakingParams staking;

    @JsonCreator
    public GenesisConfig(@JsonProperty("allocations") Map<String, Long> allocations,
                         @JsonProperty("baseFee") Long baseFee,
                         @JsonProperty("feeRecipient") String feeRecipient,
                         @JsonProperty("validators") Map<String, Integer> validators,
                         @JsonProperty("minimumStake") Long minimumStake,
                         @JsonProperty("rewardRate") Long rewardRate,
                         @JsonProperty("unstakingPeriod") Long unstakingPeriod,
                         @JsonProperty("maxValidators") Integer maxValidators) {
        StakingParams defaults = StakingParams.defaults();
        this.allocations = allocations == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(allocations));
        this.baseFee = baseFee == null ? 0L : baseFee;
        this.feeRecipient = (feeRecipient == null || feeRecipient.isBlank()) ? null : feeRecipient;
        this.validators = validators == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(validators));
        this.staking = new StakingParams(
                minimumStake == null ? defaults.minimumStake : minimumStake,
                rewardRate == null ? defaults.rewardRate : rewardRate,
                unstakingPeriod == null ? defaults.unstakingPeriod : unstakingPeriod,
                maxValidators == null ? defaults.maxValidators : maxValidators
        );
        if (this.baseFee < 0) throw new IllegalArgumentException("baseFee must be >= 0");
        for (Map.Entry<String, Long> e : this.allocations.entrySet()) {
            if (e.getValue() == null || e.getValue() < 0) {
                throw new IllegalArgumentException("Invalid allocation for " + e.getKey());
            }
        }
    }

    /** Empty genesis: no balances, no fee, default staking parameters. */
    public static GenesisConfig empty() {
        return new GenesisConfig(null, null, null, null, null, null, null, null);
    }

    public static GenesisConfig load(Path path) {
        try {
            return JSON.readValue(path.toFile(), GenesisConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read genesis config from " + path, e);
        }
    }

    /** The genesis shipped with the jar. */
    public static GenesisConfig bundled() {
        try (InputStream in = GenesisConfig.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + BUNDLED_RESOURCE);
            }
            return JSON.readValue(in, GenesisConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read bundled genesis config", e);
        }
    }

    /** The given file, or the bundled genesis when no file is named. A named file must exist. */
    public static GenesisConfig loadOrBundled(Path path) {
        if (path == null) {
            return bundled();
        }
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Genesis config not found: " + path);
        }
        return load(path);
    }

    @Override public String toString() {
        return "GenesisConfig{accounts=" + allocations.size() + ", baseFee=" + baseFee
                + ", feeRecipient=" + feeRecipient + ", validators=" + validators.keySet() + ", " + staking + "}";
    }
}

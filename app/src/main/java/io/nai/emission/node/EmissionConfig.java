package io.nai.emission.node;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nai.emission.actions.StakingConfig;
import io.nai.emission.ledger.Emission;
import io.nai.emission.ledger.EpochTracker;
import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.AddressFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/** Ledger and staking parameters of a node. */
public final class EmissionConfig {
    private static final Logger LOG = Logger.getLogger(EmissionConfig.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final long DEFAULT_TOTAL_SUPPLY = 853_000_000L * Emission.ONE_NAI;
    public static final Address DEFAULT_EMISSION_ADDRESS = Address.derive("nai-emission-account");

    public final long totalSupply;
    /** 0 means {@link #supplyCap}. */
    public final long maxSupply;
    public final long supplyCap;
    public final Address emissionAddress;
    public final EpochTracker epochTracker;
    public final StakingConfig staking;

    public EmissionConfig(long totalSupply, long maxSupply, long supplyCap, Address emissionAddress,
                          EpochTracker epochTracker, StakingConfig staking) {
        this.totalSupply = totalSupply;
        this.maxSupply = maxSupply;
        this.supplyCap = supplyCap;
        this.emissionAddress = emissionAddress;
        this.epochTracker = epochTracker;
        this.staking = staking;
    }

    public static EmissionConfig defaultLocal() {
        return new EmissionConfig(
                DEFAULT_TOTAL_SUPPLY,
                0L,                          // use the supply cap
                Emission.DEFAULT_SUPPLY_CAP,
                DEFAULT_EMISSION_ADDRESS,
                EpochTracker.defaults(),
                StakingConfig.defaults()
        );
    }

    public EmissionConfig withStaking(StakingConfig staking) {
        return new EmissionConfig(totalSupply, maxSupply, supplyCap, emissionAddress, epochTracker, staking);
    }

    public EmissionConfig withEpochTracker(EpochTracker epochTracker) {
        return new EmissionConfig(totalSupply, maxSupply, supplyCap, emissionAddress, epochTracker, staking);
    }

    /**
     * Reads a JSON config. Missing keys keep their defaults; a missing file
     * yields {@link #defaultLocal()}.
     */
    public static EmissionConfig load(Path path) {
        if (path == null || !Files.exists(path)) {
            LOG.info(() -> "No emission config at " + path + ", using defaults");
            return defaultLocal();
        }
        ConfigFile file;
        try {
            file = JSON.readValue(path.toFile(), ConfigFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read emission config from " + path, e);
        }
        if (file == null) {
            return defaultLocal();
        }
        try {
            return file.toConfig();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid emission config in " + path + ": " + e.getMessage(), e);
        }
    }

    public void save(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), ConfigFile.from(this));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist emission config to " + path, e);
        }
    }

    private static class ConfigFile {
        public long totalSupply = DEFAULT_TOTAL_SUPPLY;
        public long maxSupply = 0L;
        public long supplyCap = Emission.DEFAULT_SUPPLY_CAP;
        public String emissionAddress;
        public long baseAprBps = EpochTracker.DEFAULT_BASE_APR_BPS;
        public long baseValidators = EpochTracker.DEFAULT_BASE_VALIDATORS;
        public long epochLength = EpochTracker.DEFAULT_EPOCH_LENGTH;
        public long secondsPerBlock = EpochTracker.DEFAULT_SECONDS_PER_BLOCK;
        public StakingFile staking = new StakingFile();

        EmissionConfig toConfig() {
            Address address = (emissionAddress == null || emissionAddress.isBlank())
                    ? DEFAULT_EMISSION_ADDRESS
                    : AddressFormat.parse(emissionAddress);
            StakingFile s = staking == null ? new StakingFile() : staking;
            return new EmissionConfig(
                    totalSupply,
                    maxSupply,
                    supplyCap,
                    address,
                    new EpochTracker(baseAprBps, baseValidators, epochLength, secondsPerBlock),
                    new StakingConfig(s.minValidatorStake, s.maxValidatorStake, s.minDelegatorStake,
                            s.minDelegationFeeRate, s.maxDelegationFeeRate, s.minValidatorStakeDuration)
            );
        }

        static ConfigFile from(EmissionConfig c) {
            ConfigFile f = new ConfigFile();
            f.totalSupply = c.totalSupply;
            f.maxSupply = c.maxSupply;
            f.supplyCap = c.supplyCap;
            f.emissionAddress = AddressFormat.format(c.emissionAddress);
            f.baseAprBps = c.epochTracker.baseAprBps();
            f.baseValidators = c.epochTracker.baseValidators();
            f.epochLength = c.epochTracker.epochLength();
            f.secondsPerBlock = c.epochTracker.secondsPerBlock();
            f.staking.minValidatorStake = c.staking.minValidatorStake();
            f.staking.maxValidatorStake = c.staking.maxValidatorStake();
            f.staking.minDelegatorStake = c.staking.minDelegatorStake();
            f.staking.minDelegationFeeRate = c.staking.minDelegationFeeRate();
            f.staking.maxDelegationFeeRate = c.staking.maxDelegationFeeRate();
            f.staking.minValidatorStakeDuration = c.staking.minValidatorStakeDuration();
            return f;
        }
    }

    private static class StakingFile {
        public long minValidatorStake = StakingConfig.DEFAULT_MIN_VALIDATOR_STAKE;
        public long maxValidatorStake = StakingConfig.DEFAULT_MAX_VALIDATOR_STAKE;
        public long minDelegatorStake = StakingConfig.DEFAULT_MIN_DELEGATOR_STAKE;
        public int minDelegationFeeRate = StakingConfig.DEFAULT_MIN_DELEGATION_FEE_RATE;
        public int maxDelegationFeeRate = StakingConfig.DEFAULT_MAX_DELEGATION_FEE_RATE;
        public long minValidatorStakeDuration = StakingConfig.DEFAULT_MIN_VALIDATOR_STAKE_DURATION;
    }
}

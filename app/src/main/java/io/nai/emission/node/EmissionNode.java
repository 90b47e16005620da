package io.nai.emission.node;

import io.nai.emission.actions.StakingActions;
import io.nai.emission.consensus.InMemoryValidatorSet;
import io.nai.emission.consensus.ManualBlockSource;
import io.nai.emission.ledger.Emission;
import io.nai.emission.ledger.FeeDistribution;
import io.nai.emission.metrics.EmissionMetrics;
import io.nai.emission.state.InMemoryStakeStore;
import io.nai.emission.state.StakeStore;
import io.nai.emission.storage.RocksDBStakeStore;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires the block source, validator set, stake store, ledger and staking
 * actions. Call {@link #acceptBlock} once per accepted block.
 */
public final class EmissionNode {
    private static final Logger LOG = Logger.getLogger(EmissionNode.class.getName());

    private final EmissionConfig config;
    private final ManualBlockSource blocks;
    private final InMemoryValidatorSet validatorSet;
    private final StakeStore stakes;
    private final Emission emission;
    private final StakingActions actions;
    private final EmissionMetrics metrics;

    public EmissionNode(EmissionConfig config, StakeStore stakes, Instant genesisTime, EmissionMetrics metrics) {
        this.config = config;
        this.stakes = stakes;
        this.metrics = metrics;
        this.blocks = ManualBlockSource.atGenesis(genesisTime);
        this.validatorSet = new InMemoryValidatorSet();
        this.emission = Emission.builder()
                .totalSupply(config.totalSupply)
                .maxSupply(config.maxSupply)
                .supplyCap(config.supplyCap)
                .emissionAddress(config.emissionAddress)
                .epochTracker(config.epochTracker)
                .blocks(blocks)
                .stakes(stakes)
                .validatorSet(validatorSet)
                .build();
        this.actions = new StakingActions(emission, stakes, config.staking);
        int restored = emission.restoreFromStakeStore();
        if (restored > 0) {
            LOG.info(() -> "Ledger rebuilt from " + restored + " stored validator stakes");
        }
        metrics.bind(emission);
    }

    /** Convenience factory for an in-memory local node. */
    public static EmissionNode inMemory(EmissionConfig config, Instant genesisTime) {
        return new EmissionNode(config, new InMemoryStakeStore(), genesisTime, new EmissionMetrics());
    }

    /**
     * RocksDB-backed stake records. Positions are rebuilt from the store on
     * open; accrued rewards and supply are not persisted and start from the
     * configured values.
     */
    public static EmissionNode rocks(EmissionConfig config, String dataDir, Instant genesisTime) {
        return new EmissionNode(config, RocksDBStakeStore.open(dataDir), genesisTime, new EmissionMetrics());
    }

    /** Advance to the given block, distribute its fees, then mint on epoch boundaries. */
    public BlockOutcome acceptBlock(long height, Instant timestamp, long fees) {
        return metrics.recordBlock(() -> {
            blocks.accept(height, timestamp);
            FeeDistribution distribution = emission.distributeFees(fees);
            metrics.recordFees(distribution);
            long minted = emission.mintNewNAI();
            if (config.epochTracker.isEpochBoundary(height)) {
                metrics.recordMint(minted);
            }
            return new BlockOutcome(height, distribution, minted);
        });
    }

    /** Close underlying resources if any (e.g., RocksDB). */
    public void close() {
        if (stakes instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Failed to close stake store", e);
            }
        }
    }

    public EmissionConfig config() { return config; }
    public Emission emission() { return emission; }
    public StakingActions actions() { return actions; }
    public StakeStore stakes() { return stakes; }
    public InMemoryValidatorSet validatorSet() { return validatorSet; }
    public ManualBlockSource blocks() { return blocks; }
    public EmissionMetrics metrics() { return metrics; }
}

package io.nai.emission.ledger;

import io.nai.emission.consensus.AcceptedBlockSource;
import io.nai.emission.consensus.ValidatorSetSource;
import io.nai.emission.protocol.AcceptedBlock;
import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.NodeId;
import io.nai.emission.state.StakeStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Supply, stake and reward ledger of the chain.
 *
 * <p>One instance per node, created at startup and passed to every
 * collaborator. Mutations hold the write lock for their whole duration;
 * queries hold the read lock and return immutable snapshots. The ledger
 * only accounts: callers move funds using the amounts it returns.
 */
public final class Emission {
    private static final Logger LOG = Logger.getLogger(Emission.class.getName());

    /** 1 NAI in base units (9 decimals). */
    public static final long ONE_NAI = 1_000_000_000L;
    /** Hard cap used when no explicit max supply is configured. */
    public static final long DEFAULT_SUPPLY_CAP = 5_000_000_000L * ONE_NAI;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final LedgerState state;
    private final AcceptedBlockSource blocks;
    private final ValidatorSetSource validatorSet;
    private final StakeStore stakes;

    private final ValidatorRegistry registry;
    private final DelegationLedger delegations;
    private final EpochRewardEngine epochRewards;
    private final FeeDistributionEngine fees;

    private Emission(Builder b) {
        this.blocks = Objects.requireNonNull(b.blocks, "blocks");
        this.validatorSet = Objects.requireNonNull(b.validatorSet, "validatorSet");
        this.stakes = Objects.requireNonNull(b.stakes, "stakes");
        Address emissionAddress = Objects.requireNonNull(b.emissionAddress, "emissionAddress");

        long maxSupply = b.maxSupply == 0 ? b.supplyCap : b.maxSupply;
        if (b.totalSupply < 0 || maxSupply <= 0) {
            throw new IllegalArgumentException("totalSupply must be >= 0 and maxSupply > 0");
        }
        if (b.totalSupply > maxSupply) {
            throw new IllegalArgumentException("totalSupply " + b.totalSupply + " exceeds maxSupply " + maxSupply);
        }
        this.state = new LedgerState(b.totalSupply, maxSupply, new EmissionAccount(emissionAddress, 0L), b.epochTracker);

        StakeDistributor distributor = new StakeDistributor(state);
        this.registry = new ValidatorRegistry(state);
        this.delegations = new DelegationLedger(state, stakes);
        this.epochRewards = new EpochRewardEngine(state, distributor);
        this.fees = new FeeDistributionEngine(state, distributor);

        LOG.info(() -> "Emission ledger initialised: totalSupply=" + state.totalSupply + " maxSupply=" + maxSupply
                + " epochLength=" + state.epochTracker.epochLength());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------- mutations

    public void registerValidatorStake(NodeId nodeId, byte[] publicKey, Instant stakeStart, Instant stakeEnd,
                                       long stakedAmount, int delegationFeeRate) {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(publicKey, "publicKey");
        Objects.requireNonNull(stakeStart, "stakeStart");
        Objects.requireNonNull(stakeEnd, "stakeEnd");
        requireNonNegative(stakedAmount, "stakedAmount");
        if (delegationFeeRate < 0 || delegationFeeRate > 100) {
            throw new IllegalArgumentException("delegationFeeRate must be within 0..100");
        }
        write(() -> {
            registry.register(nodeId, publicKey, stakeStart, stakeEnd, stakedAmount, delegationFeeRate,
                    blocks.lastAccepted().timestamp());
            return null;
        });
    }

    /** @return the unclaimed reward owed to the validator owner */
    public long withdrawValidatorStake(NodeId nodeId) {
        Objects.requireNonNull(nodeId, "nodeId");
        return write(() -> registry.withdraw(nodeId));
    }

    public void delegateUserStake(NodeId nodeId, Address delegator, long amount) {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(delegator, "delegator");
        requireNonNegative(amount, "amount");
        write(() -> {
            delegations.delegate(nodeId, delegator, amount, blocks.lastAccepted().height());
            return null;
        });
    }

    /** @return the delegator's pending reward, settled at the last accepted height */
    public long undelegateUserStake(NodeId nodeId, Address delegator, long amount) {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(delegator, "delegator");
        requireNonNegative(amount, "amount");
        return write(() -> delegations.undelegate(nodeId, delegator, amount, blocks.lastAccepted().height()));
    }

    /**
     * {@link Address#EMPTY} claims the validator's own reward; any other
     * address claims as a delegator and keeps its position.
     */
    public long claimStakingRewards(NodeId nodeId, Address actor) {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(actor, "actor");
        return write(() -> delegations.claim(nodeId, actor, blocks.lastAccepted().height()));
    }

    /** Mints epoch rewards when the last accepted height is an epoch boundary. */
    public long mintNewNAI() {
        return write(() -> epochRewards.mint(blocks.lastAccepted()));
    }

    public FeeDistribution distributeFees(long fee) {
        return write(() -> fees.distribute(fee, blocks.lastAccepted()));
    }

    /** Adds to total supply, clamped at the max supply. @return the new total supply */
    public long addToTotalSupply(long amount) {
        requireNonNegative(amount, "amount");
        return write(() -> {
            long added = Math.min(amount, state.headroom());
            state.totalSupply = Math.addExact(state.totalSupply, added);
            LOG.fine(() -> "Added " + added + " to total supply, now " + state.totalSupply);
            return state.totalSupply;
        });
    }

    /** Drains the emission account. Only its own address may do so. */
    public long claimEmissionBalance(Address actor) {
        Objects.requireNonNull(actor, "actor");
        return write(() -> {
            if (!state.emissionAccount.address().equals(actor)) {
                throw new StakingException(StakingException.Kind.UNAUTHORIZED, "not the emission address");
            }
            long balance = state.emissionAccount.drain();
            LOG.info(() -> "Emission account drained: " + balance);
            return balance;
        });
    }

    /**
     * Rebuilds validator and delegator entries from the stake store, for a node
     * reopening a durable store. Must run before any other mutation.
     *
     * @return number of validator entries restored
     */
    public int restoreFromStakeStore() {
        return write(() -> registry.restore(stakes.validatorStakes(), stakes.delegations(),
                blocks.lastAccepted().height()));
    }

    // ------------------------------------------------------------------ queries

    /** All staked validators for {@link NodeId#EMPTY}, otherwise zero or one entry. */
    public List<ValidatorSnapshot> getStakedValidators(NodeId nodeId) {
        Objects.requireNonNull(nodeId, "nodeId");
        return read(() -> {
            if (nodeId.isEmpty()) {
                List<ValidatorSnapshot> out = new ArrayList<>(state.validators.size());
                for (Validator v : state.validators.values()) {
                    out.add(v.snapshot());
                }
                return List.copyOf(out);
            }
            Validator v = state.validators.get(nodeId);
            return v == null ? List.of() : List.of(v.snapshot());
        });
    }

    /** Delegators of one validator, or across all validators for {@link NodeId#EMPTY}. */
    public int getNumDelegators(NodeId nodeId) {
        Objects.requireNonNull(nodeId, "nodeId");
        return read(() -> {
            if (nodeId.isEmpty()) {
                int count = 0;
                for (Validator v : state.validators.values()) {
                    count += v.delegatorsLastClaim.size();
                }
                return count;
            }
            Validator v = state.validators.get(nodeId);
            return v == null ? 0 : v.delegatorsLastClaim.size();
        });
    }

    /** Current APR in basis points. */
    public long getAprForValidators() {
        return read(() -> RewardMath.aprBps(state.epochTracker, state.validators.size()));
    }

    public long getRewardsPerEpoch() {
        return read(epochRewards::rewardsPerEpoch);
    }

    /**
     * Consensus membership joined with local staking data, sorted by node id.
     * Members without a stake entry come back with zero amounts.
     */
    public List<ValidatorSnapshot> getAllValidators() {
        // consensus may block; ask it before taking the lock
        Map<NodeId, byte[]> members = new TreeMap<>(validatorSet.currentValidators());
        return read(() -> {
            List<ValidatorSnapshot> out = new ArrayList<>(members.size());
            for (Map.Entry<NodeId, byte[]> e : members.entrySet()) {
                Validator staked = state.validators.get(e.getKey());
                out.add(staked == null
                        ? ValidatorSnapshot.unstaked(e.getKey(), e.getValue())
                        : staked.snapshot().withPublicKey(e.getValue()));
            }
            return List.copyOf(out);
        });
    }

    public long calculateUserDelegationRewards(NodeId nodeId, Address delegator, long currentHeight) {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(delegator, "delegator");
        requireNonNegative(currentHeight, "currentHeight");
        return read(() -> delegations.calculate(nodeId, delegator, currentHeight));
    }

    public EmissionSnapshot snapshot() {
        return read(() -> new EmissionSnapshot(
                state.totalSupply,
                state.maxSupply,
                state.totalStaked,
                state.emissionAccount.copy(),
                state.epochTracker,
                state.validators.size()));
    }

    public long getLastAcceptedBlockHeight() {
        return blocks.lastAccepted().height();
    }

    public Instant getLastAcceptedBlockTimestamp() {
        return blocks.lastAccepted().timestamp();
    }

    public AcceptedBlock lastAccepted() {
        return blocks.lastAccepted();
    }

    // ------------------------------------------------------------------ locking

    private <T> T write(Supplier<T> op) {
        lock.writeLock().lock();
        try {
            return op.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Supplier<T> op) {
        lock.readLock().lock();
        try {
            return op.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static void requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
    }

    public static final class Builder {
        private long totalSupply;
        private long maxSupply;
        private long supplyCap = DEFAULT_SUPPLY_CAP;
        private Address emissionAddress;
        private EpochTracker epochTracker = EpochTracker.defaults();
        private AcceptedBlockSource blocks;
        private StakeStore stakes;
        private ValidatorSetSource validatorSet;

        private Builder() {}

        public Builder totalSupply(long totalSupply) { this.totalSupply = totalSupply; return this; }
        /** 0 falls back to the supply cap. */
        public Builder maxSupply(long maxSupply) { this.maxSupply = maxSupply; return this; }
        public Builder supplyCap(long supplyCap) { this.supplyCap = supplyCap; return this; }
        public Builder emissionAddress(Address emissionAddress) { this.emissionAddress = emissionAddress; return this; }
        public Builder epochTracker(EpochTracker epochTracker) { this.epochTracker = Objects.requireNonNull(epochTracker); return this; }
        public Builder blocks(AcceptedBlockSource blocks) { this.blocks = blocks; return this; }
        public Builder stakes(StakeStore stakes) { this.stakes = stakes; return this; }
        public Builder validatorSet(ValidatorSetSource validatorSet) { this.validatorSet = validatorSet; return this; }

        public Emission build() {
            return new Emission(this);
        }
    }
}

package io.nai.emission.ledger;

import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.NodeId;
import io.nai.emission.state.DelegatorStakeRecord;
import io.nai.emission.state.StakeStore;

import java.util.logging.Logger;

/**
 * Delegator checkpoints and lazy per-epoch reward replay.
 */
final class DelegationLedger {
    private static final Logger LOG = Logger.getLogger(DelegationLedger.class.getName());

    private final LedgerState state;
    private final StakeStore stakes;

    DelegationLedger(LedgerState state, StakeStore stakes) {
        this.state = state;
        this.stakes = stakes;
    }

    void delegate(NodeId nodeId, Address delegator, long amount, long currentHeight) {
        Validator v = state.require(nodeId);
        if (v.delegatorsLastClaim.containsKey(delegator)) {
            throw new StakingException(StakingException.Kind.DELEGATOR_ALREADY_STAKED, nodeId.hex());
        }
        v.delegatedAmount = Math.addExact(v.delegatedAmount, amount);
        // inactive validators are counted by the activation sweep instead
        if (v.active) {
            state.addStaked(amount);
        }
        v.delegatorsLastClaim.put(delegator, currentHeight);
        LOG.fine(() -> "Delegated " + amount + " to " + nodeId.hex() + " at height " + currentHeight);
    }

    long undelegate(NodeId nodeId, Address delegator, long amount, long currentHeight) {
        Validator v = state.require(nodeId);
        if (!v.delegatorsLastClaim.containsKey(delegator)) {
            throw new StakingException(StakingException.Kind.DELEGATOR_NOT_FOUND, nodeId.hex());
        }
        long reward = calculate(v, delegator, currentHeight);
        if (amount > v.delegatedAmount) {
            throw new IllegalStateException("Undelegating " + amount + " exceeds delegated amount "
                    + v.delegatedAmount + " of " + nodeId.hex());
        }
        debitDelegatedReward(v, reward);

        v.delegatedAmount -= amount;
        if (v.active) {
            state.removeStaked(amount);
        }
        v.delegatorsLastClaim.remove(delegator);
        // pending or expired validators still owe their owner; only a withdrawn entry goes
        if (v.withdrawn && !v.hasDelegators()) {
            state.validators.remove(nodeId);
            LOG.info(() -> "Removed validator " + nodeId.hex() + " (withdrawn, last delegator left)");
        }
        return reward;
    }

    /**
     * An empty actor is the validator claiming its own reward; anyone else is a
     * delegator claim that keeps the position open.
     */
    long claim(NodeId nodeId, Address actor, long currentHeight) {
        Validator v = state.require(nodeId);
        if (actor.isEmpty()) {
            long reward = v.unclaimedStakedReward;
            v.unclaimedStakedReward = 0L;
            if (!v.hasDelegators()) {
                reward = Math.addExact(reward, v.unclaimedDelegatedReward);
                v.unclaimedDelegatedReward = 0L;
                // the pool behind these records is paid out; later delegators must not replay them
                v.epochRewards.clear();
            }
            return reward;
        }
        long reward = calculate(nodeId, actor, currentHeight);
        debitDelegatedReward(v, reward);
        v.delegatorsLastClaim.put(actor, currentHeight);
        return reward;
    }

    long calculate(NodeId nodeId, Address delegator, long currentHeight) {
        return calculate(state.require(nodeId), delegator, currentHeight);
    }

    /**
     * Sums {@code floor(epochReward * principal / delegatedAmount)} over the
     * epochs in {@code [lastClaim / epochLength, currentHeight / epochLength)}.
     */
    private long calculate(Validator v, Address delegator, long currentHeight) {
        Long lastClaimHeight = v.delegatorsLastClaim.get(delegator);
        if (lastClaimHeight == null) {
            throw new StakingException(StakingException.Kind.DELEGATOR_NOT_FOUND, v.nodeId.hex());
        }
        DelegatorStakeRecord stake = stakes.getDelegatorStake(delegator, v.nodeId)
                .orElseThrow(() -> new StakingException(StakingException.Kind.STAKE_NOT_FOUND, v.nodeId.hex()));

        EpochTracker tracker = state.epochTracker;
        long startEpoch = tracker.epochOf(lastClaimHeight);
        long endEpoch = tracker.epochOf(currentHeight);
        long total = 0L;
        for (long epoch = startEpoch; epoch < endEpoch; epoch++) {
            Long epochReward = v.epochRewards.get(epoch);
            if (epochReward != null) {
                total = Math.addExact(total, RewardMath.mulDiv(epochReward, stake.stakedAmount(), v.delegatedAmount));
            }
        }
        return total;
    }

    private static void debitDelegatedReward(Validator v, long reward) {
        if (reward > v.unclaimedDelegatedReward) {
            throw new IllegalStateException("Delegator reward " + reward + " exceeds unclaimed delegated reward "
                    + v.unclaimedDelegatedReward + " of " + v.nodeId.hex());
        }
        v.unclaimedDelegatedReward -= reward;
    }
}

package io.nai.emission.ledger;

import io.nai.emission.protocol.NodeId;
import io.nai.emission.state.DelegatorStakeRecord;
import io.nai.emission.state.ValidatorStakeRecord;

import java.time.Instant;
import java.util.List;
import java.util.logging.Logger;

/**
 * Validator registration and withdrawal.
 */
final class ValidatorRegistry {
    private static final Logger LOG = Logger.getLogger(ValidatorRegistry.class.getName());

    private final LedgerState state;

    ValidatorRegistry(LedgerState state) {
        this.state = state;
    }

    /**
     * Creates the entry, or re-arms an inactive one in place. An entry is
     * inactive once withdrawn or once {@code blockTime} has passed its stake
     * end; an entry still waiting for activation counts as registered.
     */
    void register(NodeId nodeId, byte[] publicKey, Instant stakeStart, Instant stakeEnd,
                  long stakedAmount, int delegationFeeRate, Instant blockTime) {
        Validator existing = state.validators.get(nodeId);
        if (existing != null && !isInactive(existing, blockTime)) {
            throw new StakingException(StakingException.Kind.VALIDATOR_ALREADY_REGISTERED, nodeId.hex());
        }
        if (existing != null) {
            // keep checkpoints and epoch history
            existing.publicKey = publicKey.clone();
            existing.stakedAmount = Math.addExact(existing.stakedAmount, stakedAmount);
            existing.delegationFeeRate = delegationFeeRate;
            existing.stakeStartTime = stakeStart;
            existing.stakeEndTime = stakeEnd;
            existing.withdrawn = false;
            LOG.info(() -> "Re-registered validator " + nodeId.hex() + " stake=" + existing.stakedAmount);
            return;
        }
        state.validators.put(nodeId, new Validator(nodeId, publicKey, stakedAmount, delegationFeeRate, stakeStart, stakeEnd));
        LOG.info(() -> "Registered validator " + nodeId.hex() + " stake=" + stakedAmount
                + " feeRate=" + delegationFeeRate + "% window=[" + stakeStart + ", " + stakeEnd + "]");
    }

    private static boolean isInactive(Validator v, Instant blockTime) {
        if (v.active) {
            return false;
        }
        return v.withdrawn || blockTime.isAfter(v.stakeEndTime);
    }

    /**
     * @return the reward owed to the validator owner; the ledger never moves funds itself
     */
    long withdraw(NodeId nodeId) {
        Validator v = state.require(nodeId);

        long reward = v.unclaimedStakedReward;
        v.unclaimedStakedReward = 0L;
        if (v.active) {
            state.removeStaked(v.totalStake());
        }
        v.active = false;
        v.withdrawn = true;
        // own stake goes back to the owner with this call
        v.stakedAmount = 0L;

        if (!v.hasDelegators()) {
            reward = Math.addExact(reward, v.unclaimedDelegatedReward);
            v.unclaimedDelegatedReward = 0L;
            state.validators.remove(nodeId);
            LOG.info(() -> "Removed validator " + nodeId.hex() + " (withdrawn, no delegators)");
        } else {
            LOG.info(() -> "Withdrew validator " + nodeId.hex() + ", " + v.delegatorsLastClaim.size() + " delegators remain");
        }
        return reward;
    }

    /**
     * Seeds an empty ledger from stored registrations and delegations.
     * Entries come back inactive with no accruals; the next sweep activates
     * those inside their window. Delegations whose validator record is gone
     * belong to a withdrawn validator.
     *
     * @return number of validator entries restored
     */
    int restore(List<ValidatorStakeRecord> registrations, List<DelegatorStakeRecord> delegations, long checkpoint) {
        if (!state.validators.isEmpty()) {
            throw new IllegalStateException("Ledger already holds " + state.validators.size() + " validators");
        }
        for (ValidatorStakeRecord r : registrations) {
            state.validators.put(r.nodeId(), new Validator(r.nodeId(), new byte[0], r.stakedAmount(),
                    r.delegationFeeRate(), Instant.ofEpochSecond(r.stakeStartTime()), Instant.ofEpochSecond(r.stakeEndTime())));
        }
        for (DelegatorStakeRecord d : delegations) {
            Validator v = state.validators.get(d.nodeId());
            if (v == null) {
                v = new Validator(d.nodeId(), new byte[0], 0L, 0, Instant.EPOCH, Instant.EPOCH);
                v.withdrawn = true;
                state.validators.put(d.nodeId(), v);
            }
            v.delegatedAmount = Math.addExact(v.delegatedAmount, d.stakedAmount());
            // epoch history is not stored, so there is nothing to replay before this height
            v.delegatorsLastClaim.put(d.delegator(), checkpoint);
        }
        LOG.info(() -> "Restored " + state.validators.size() + " validators and " + delegations.size() + " delegations");
        return state.validators.size();
    }
}

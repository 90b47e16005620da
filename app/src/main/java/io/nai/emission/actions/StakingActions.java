package io.nai.emission.actions;

import io.nai.emission.ledger.Emission;
import io.nai.emission.ledger.StakingException;
import io.nai.emission.protocol.AcceptedBlock;
import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.NodeId;
import io.nai.emission.state.DelegatorStakeRecord;
import io.nai.emission.state.StakeStore;
import io.nai.emission.state.ValidatorStakeRecord;

import java.time.Instant;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Staking action handlers: validate input, keep the stake store in step with
 * the ledger and report what the caller has to pay out.
 *
 * <p>The ledger cannot be rolled back, so every store write made before a
 * ledger call is undone here when that call throws. Business rejections come
 * back as failed {@link ActionResult}s; anything else is rethrown.
 */
public final class StakingActions {
    private static final Logger LOG = Logger.getLogger(StakingActions.class.getName());

    private final Emission emission;
    private final StakeStore stakes;
    private final StakingConfig config;

    public StakingActions(Emission emission, StakeStore stakes, StakingConfig config) {
        this.emission = emission;
        this.stakes = stakes;
        this.config = config;
    }

    public ActionResult registerValidatorStake(Address actor, NodeId nodeId, byte[] publicKey,
                                               long stakeStartTime, long stakeEndTime, long stakedAmount,
                                               int delegationFeeRate, Address rewardAddress) {
        long units = ComputeUnits.REGISTER_VALIDATOR_STAKE;
        if (stakedAmount < config.minValidatorStake() || stakedAmount > config.maxValidatorStake()) {
            return ActionResult.fail(units, Outputs.STAKED_AMOUNT_INVALID);
        }
        if (delegationFeeRate < config.minDelegationFeeRate() || delegationFeeRate > config.maxDelegationFeeRate()) {
            return ActionResult.fail(units, Outputs.INVALID_DELEGATION_FEE_RATE);
        }
        AcceptedBlock last = emission.lastAccepted();
        if (stakeStartTime <= last.timestamp().getEpochSecond()) {
            return ActionResult.fail(units, Outputs.INVALID_STAKE_START_TIME);
        }
        if (stakeEndTime <= stakeStartTime) {
            return ActionResult.fail(units, Outputs.INVALID_STAKE_END_TIME);
        }
        if (stakeEndTime - stakeStartTime < config.minValidatorStakeDuration()) {
            return ActionResult.fail(units, Outputs.INVALID_STAKE_DURATION);
        }
        Optional<ValidatorStakeRecord> previous = stakes.getValidatorStake(nodeId);
        long carried = 0L;
        if (previous.isPresent()) {
            ValidatorStakeRecord old = previous.get();
            // only the owner may renew, and only once the old window has closed
            if (!old.owner().equals(actor) || old.stakeEndTime() >= last.timestamp().getEpochSecond()) {
                return ActionResult.fail(units, Outputs.VALIDATOR_ALREADY_REGISTERED);
            }
            carried = old.stakedAmount();
        }

        stakes.putValidatorStake(new ValidatorStakeRecord(nodeId, actor, rewardAddress, stakeStartTime, stakeEndTime,
                Math.addExact(carried, stakedAmount), delegationFeeRate));
        try {
            emission.registerValidatorStake(nodeId, publicKey,
                    Instant.ofEpochSecond(stakeStartTime), Instant.ofEpochSecond(stakeEndTime),
                    stakedAmount, delegationFeeRate);
        } catch (RuntimeException e) {
            if (previous.isPresent()) {
                stakes.putValidatorStake(previous.get());
            } else {
                stakes.removeValidatorStake(nodeId);
            }
            return rejected(units, "register " + nodeId.hex(), e);
        }
        return ActionResult.ok(units, 0L);
    }

    public ActionResult withdrawValidatorStake(Address actor, NodeId nodeId) {
        long units = ComputeUnits.WITHDRAW_VALIDATOR_STAKE;
        Optional<ValidatorStakeRecord> found = stakes.getValidatorStake(nodeId);
        if (found.isEmpty()) {
            return ActionResult.fail(units, Outputs.STAKE_MISSING);
        }
        ValidatorStakeRecord record = found.get();
        if (!record.owner().equals(actor)) {
            return ActionResult.fail(units, Outputs.UNAUTHORIZED);
        }

        stakes.removeValidatorStake(nodeId);
        long reward;
        try {
            reward = emission.withdrawValidatorStake(nodeId);
        } catch (RuntimeException e) {
            stakes.putValidatorStake(record);
            return rejected(units, "withdraw " + nodeId.hex(), e);
        }
        return ActionResult.ok(units, Math.addExact(record.stakedAmount(), reward));
    }

    public ActionResult delegateUserStake(Address actor, NodeId nodeId, long stakedAmount, Address rewardAddress) {
        long units = ComputeUnits.DELEGATE_USER_STAKE;
        if (stakedAmount < config.minDelegatorStake()) {
            return ActionResult.fail(units, Outputs.DELEGATOR_STAKE_INVALID);
        }
        if (stakes.getDelegatorStake(actor, nodeId).isPresent()) {
            return ActionResult.fail(units, Outputs.DELEGATOR_ALREADY_STAKED);
        }

        stakes.putDelegatorStake(new DelegatorStakeRecord(
                actor, nodeId, emission.getLastAcceptedBlockHeight(), stakedAmount, rewardAddress));
        try {
            emission.delegateUserStake(nodeId, actor, stakedAmount);
        } catch (RuntimeException e) {
            stakes.removeDelegatorStake(actor, nodeId);
            return rejected(units, "delegate to " + nodeId.hex(), e);
        }
        return ActionResult.ok(units, 0L);
    }

    public ActionResult undelegateUserStake(Address actor, NodeId nodeId) {
        long units = ComputeUnits.UNDELEGATE_USER_STAKE;
        Optional<DelegatorStakeRecord> found = stakes.getDelegatorStake(actor, nodeId);
        if (found.isEmpty()) {
            return ActionResult.fail(units, Outputs.STAKE_MISSING);
        }
        DelegatorStakeRecord record = found.get();

        // the ledger reads the principal from the store, so the record goes after the call
        long reward;
        try {
            reward = emission.undelegateUserStake(nodeId, actor, record.stakedAmount());
        } catch (StakingException e) {
            return rejected(units, "undelegate from " + nodeId.hex(), e);
        }
        stakes.removeDelegatorStake(actor, nodeId);
        return ActionResult.ok(units, Math.addExact(record.stakedAmount(), reward));
    }

    /**
     * The validator owner claims its own reward; a delegator claims its share
     * and keeps the delegation.
     */
    public ActionResult claimStakingRewards(Address actor, NodeId nodeId) {
        long units = ComputeUnits.CLAIM_STAKING_REWARD;
        Address claimant;
        if (stakes.getDelegatorStake(actor, nodeId).isPresent()) {
            claimant = actor;
        } else if (stakes.getValidatorStake(nodeId).map(r -> r.owner().equals(actor)).orElse(false)) {
            claimant = Address.EMPTY;
        } else {
            return ActionResult.fail(units, Outputs.STAKE_MISSING);
        }
        try {
            return ActionResult.ok(units, emission.claimStakingRewards(nodeId, claimant));
        } catch (StakingException e) {
            return rejected(units, "claim on " + nodeId.hex(), e);
        }
    }

    private static ActionResult rejected(long units, String what, RuntimeException e) {
        if (!(e instanceof StakingException)) {
            LOG.log(Level.SEVERE, "Ledger failure during " + what, e);
            throw e;
        }
        LOG.fine(() -> "Rejected " + what + ": " + e.getMessage());
        return ActionResult.fail(units, e.getMessage());
    }
}

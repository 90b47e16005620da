package io.nai.emission.state;

import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.NodeId;

import java.util.List;
import java.util.Optional;

/**
 * Stake records owned by the storage layer: validator registrations by node id
 * and delegations by (delegator, node id).
 */
public interface StakeStore {

    Optional<ValidatorStakeRecord> getValidatorStake(NodeId nodeId);

    /** Insert or replace the registration for {@code record.nodeId()}. */
    void putValidatorStake(ValidatorStakeRecord record);

    /** @return true if a record was removed */
    boolean removeValidatorStake(NodeId nodeId);

    Optional<DelegatorStakeRecord> getDelegatorStake(Address delegator, NodeId nodeId);

    void putDelegatorStake(DelegatorStakeRecord record);

    boolean removeDelegatorStake(Address delegator, NodeId nodeId);

    /** Every validator registration, ordered by node id. */
    List<ValidatorStakeRecord> validatorStakes();

    /** Every delegation, grouped by node id. */
    List<DelegatorStakeRecord> delegations();

    /** All delegations to a validator, ordered by delegator address. */
    List<DelegatorStakeRecord> delegationsTo(NodeId nodeId);

    /** Sum of delegated principal recorded for a validator. */
    default long delegatedPrincipal(NodeId nodeId) {
        long total = 0L;
        for (DelegatorStakeRecord record : delegationsTo(nodeId)) {
            total = Math.addExact(total, record.stakedAmount());
        }
        return total;
    }
}

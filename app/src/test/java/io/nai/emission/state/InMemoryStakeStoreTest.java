package io.nai.emission.state;

import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.NodeId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStakeStoreTest {

    private final NodeId v1 = NodeId.derive("validator-1");
    private final NodeId v2 = NodeId.derive("validator-2");
    private final Address alice = Address.derive("alice");
    private final Address bob = Address.derive("bob");

    @Test
    void storesAndRemovesValidatorRecords() {
        InMemoryStakeStore store = new InMemoryStakeStore();
        ValidatorStakeRecord record = new ValidatorStakeRecord(v1, alice, bob, 100, 200, 5_000, 10);

        store.putValidatorStake(record);
        assertEquals(record, store.getValidatorStake(v1).orElseThrow());
        assertTrue(store.getValidatorStake(v2).isEmpty());

        assertTrue(store.removeValidatorStake(v1));
        assertFalse(store.removeValidatorStake(v1));
        assertTrue(store.getValidatorStake(v1).isEmpty());
    }

    @Test
    void delegationsAreKeyedByDelegatorAndValidator() {
        InMemoryStakeStore store = new InMemoryStakeStore();
        store.putDelegatorStake(new DelegatorStakeRecord(alice, v1, 3, 100, alice));
        store.putDelegatorStake(new DelegatorStakeRecord(bob, v1, 4, 250, bob));
        store.putDelegatorStake(new DelegatorStakeRecord(alice, v2, 5, 40, alice));

        assertEquals(100, store.getDelegatorStake(alice, v1).orElseThrow().stakedAmount());
        assertEquals(40, store.getDelegatorStake(alice, v2).orElseThrow().stakedAmount());
        assertTrue(store.getDelegatorStake(bob, v2).isEmpty());

        List<DelegatorStakeRecord> toV1 = store.delegationsTo(v1);
        assertEquals(2, toV1.size());
        assertTrue(toV1.get(0).delegator().compareTo(toV1.get(1).delegator()) < 0);
        assertEquals(350, store.delegatedPrincipal(v1));

        assertTrue(store.removeDelegatorStake(bob, v1));
        assertFalse(store.removeDelegatorStake(bob, v1));
        assertEquals(100, store.delegatedPrincipal(v1));
    }

    @Test
    void codecPreservesEveryField() {
        ValidatorStakeRecord validator = new ValidatorStakeRecord(v1, alice, bob, 1_700_000_000L, 1_800_000_000L,
                1_500_000L * 1_000_000_000L, 42);
        DelegatorStakeRecord delegation = new DelegatorStakeRecord(bob, v2, 1_234, 25_000_000_000L, alice);

        byte[] encoded = StakeRecordCodec.encode(validator);
        assertEquals(StakeRecordCodec.VALIDATOR_SIZE, encoded.length);
        assertEquals(validator, StakeRecordCodec.decodeValidator(encoded));
        assertEquals(delegation, StakeRecordCodec.decodeDelegation(StakeRecordCodec.encode(delegation)));
        assertThrows(IllegalArgumentException.class, () -> StakeRecordCodec.decodeDelegation(new byte[3]));
    }

    @Test
    void listsEveryRecordForRestart() {
        InMemoryStakeStore store = new InMemoryStakeStore();
        store.putValidatorStake(new ValidatorStakeRecord(v2, bob, bob, 1, 2, 20, 10));
        store.putValidatorStake(new ValidatorStakeRecord(v1, alice, alice, 1, 2, 10, 10));
        store.putDelegatorStake(new DelegatorStakeRecord(alice, v1, 1, 100, alice));
        store.putDelegatorStake(new DelegatorStakeRecord(bob, v2, 1, 200, bob));

        List<ValidatorStakeRecord> validators = store.validatorStakes();
        assertEquals(2, validators.size());
        assertTrue(validators.get(0).nodeId().compareTo(validators.get(1).nodeId()) < 0);
        assertEquals(300, store.delegations().stream().mapToLong(DelegatorStakeRecord::stakedAmount).sum());
    }
}

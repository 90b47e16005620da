package io.nai.emission.storage;

import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.NodeId;
import io.nai.emission.state.DelegatorStakeRecord;
import io.nai.emission.state.ValidatorStakeRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RocksDBStakeStoreTest {

    @TempDir
    Path tempDir;

    private final NodeId v1 = NodeId.derive("validator-1");
    private final NodeId v2 = NodeId.derive("validator-2");
    private final Address alice = Address.derive("alice");
    private final Address bob = Address.derive("bob");

    @Test
    void recordsSurviveReopen() {
        String dir = tempDir.resolve("stakes").toString();
        ValidatorStakeRecord validator = new ValidatorStakeRecord(v1, alice, alice, 10, 20, 7_000, 5);

        RocksDBStakeStore store = RocksDBStakeStore.open(dir);
        try {
            store.putValidatorStake(validator);
            store.putDelegatorStake(new DelegatorStakeRecord(bob, v1, 2, 300, bob));
        } finally {
            store.close();
        }

        RocksDBStakeStore reopened = RocksDBStakeStore.open(dir);
        try {
            assertEquals(validator, reopened.getValidatorStake(v1).orElseThrow());
            assertEquals(300, reopened.getDelegatorStake(bob, v1).orElseThrow().stakedAmount());
        } finally {
            reopened.close();
        }
    }

    @Test
    void delegationsToScansOnlyOneValidator() {
        RocksDBStakeStore store = RocksDBStakeStore.open(tempDir.resolve("scan").toString());
        try {
            store.putDelegatorStake(new DelegatorStakeRecord(alice, v1, 1, 100, alice));
            store.putDelegatorStake(new DelegatorStakeRecord(bob, v1, 1, 200, bob));
            store.putDelegatorStake(new DelegatorStakeRecord(alice, v2, 1, 999, alice));

            List<DelegatorStakeRecord> toV1 = store.delegationsTo(v1);
            assertEquals(2, toV1.size());
            assertEquals(300, store.delegatedPrincipal(v1));
            assertEquals(999, store.delegatedPrincipal(v2));

            assertTrue(store.removeDelegatorStake(alice, v1));
            assertFalse(store.removeDelegatorStake(alice, v1));
            assertEquals(200, store.delegatedPrincipal(v1));
            assertFalse(store.removeValidatorStake(v1));
        } finally {
            store.close();
        }
    }

    @Test
    void listsAllRecordsAfterReopen() {
        String dir = tempDir.resolve("list").toString();
        RocksDBStakeStore store = RocksDBStakeStore.open(dir);
        try {
            store.putValidatorStake(new ValidatorStakeRecord(v1, alice, alice, 10, 20, 7_000, 5));
            store.putValidatorStake(new ValidatorStakeRecord(v2, bob, bob, 10, 20, 9_000, 5));
            store.putDelegatorStake(new DelegatorStakeRecord(alice, v1, 1, 100, alice));
            store.putDelegatorStake(new DelegatorStakeRecord(bob, v2, 1, 200, bob));
        } finally {
            store.close();
        }

        RocksDBStakeStore reopened = RocksDBStakeStore.open(dir);
        try {
            List<ValidatorStakeRecord> validators = reopened.validatorStakes();
            assertEquals(2, validators.size());
            assertTrue(validators.get(0).nodeId().compareTo(validators.get(1).nodeId()) < 0);
            List<DelegatorStakeRecord> delegations = reopened.delegations();
            assertEquals(2, delegations.size());
            assertEquals(300, delegations.stream().mapToLong(DelegatorStakeRecord::stakedAmount).sum());
        } finally {
            reopened.close();
        }
    }
}

package io.nai.emission.ledger;

import io.nai.emission.consensus.InMemoryValidatorSet;
import io.nai.emission.consensus.ManualBlockSource;
import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.NodeId;
import io.nai.emission.state.DelegatorStakeRecord;
import io.nai.emission.state.InMemoryStakeStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EmissionConcurrencyTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void concurrentDelegationsBlocksAndReadsStayConsistent() throws Exception {
        ManualBlockSource blocks = ManualBlockSource.atGenesis(T0);
        InMemoryStakeStore stakes = new InMemoryStakeStore();
        long maxSupply = 1_000_000_000_000L;
        Emission emission = Emission.builder()
                .totalSupply(maxSupply - 1_000_000L)
                .maxSupply(maxSupply)
                .emissionAddress(Address.derive("emission"))
                .blocks(blocks)
                .stakes(stakes)
                .validatorSet(new InMemoryValidatorSet())
                .build();
        NodeId nodeId = NodeId.derive("validator");
        emission.registerValidatorStake(nodeId, new byte[48], T0.minusSeconds(1), T0.plus(Duration.ofDays(1)),
                4_204_800_000L, 20);

        int delegators = 8;
        int perDelegator = 25;
        ExecutorService pool = Executors.newFixedThreadPool(delegators + 2);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int d = 0; d < delegators; d++) {
            int id = d;
            futures.add(pool.submit(() -> {
                go.await();
                for (int i = 0; i < perDelegator; i++) {
                    Address delegator = Address.derive("delegator-" + id + "-" + i);
                    stakes.putDelegatorStake(new DelegatorStakeRecord(delegator, nodeId, 0, 1_000, delegator));
                    emission.delegateUserStake(nodeId, delegator, 1_000);
                }
                return null;
            }));
        }
        futures.add(pool.submit(() -> {
            go.await();
            for (long h = 1; h <= 200; h++) {
                blocks.accept(h, T0.plusSeconds(h * 3));
                emission.distributeFees(100);
                emission.mintNewNAI();
            }
            return null;
        }));
        futures.add(pool.submit(() -> {
            go.await();
            for (int i = 0; i < 500; i++) {
                EmissionSnapshot snap = emission.snapshot();
                assertTrue(snap.totalSupply() <= snap.maxSupply());
                List<ValidatorSnapshot> validators = emission.getStakedValidators(nodeId);
                assertEquals(1, validators.size());
            }
            return null;
        }));

        go.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        ValidatorSnapshot v = emission.getStakedValidators(nodeId).get(0);
        assertEquals(delegators * perDelegator, emission.getNumDelegators(nodeId));
        assertEquals(delegators * perDelegator * 1_000L, v.delegatedAmount());
        assertEquals(stakes.delegatedPrincipal(nodeId), v.delegatedAmount());
        assertTrue(v.active());
        assertEquals(v.stakedAmount() + v.delegatedAmount(), emission.snapshot().totalStaked());
        assertTrue(emission.snapshot().totalSupply() <= maxSupply);
    }
}

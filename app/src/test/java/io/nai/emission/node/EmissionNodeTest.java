package io.nai.emission.node;

import io.nai.emission.actions.ActionResult;
import io.nai.emission.ledger.EmissionSnapshot;
import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.NodeId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class EmissionNodeTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final NodeId VALIDATOR = NodeId.derive("validator");
    private static final Address OWNER = Address.derive("owner");

    @TempDir
    Path tempDir;

    private EmissionNode node;

    @AfterEach
    void tearDown() {
        if (node != null) {
            node.close();
        }
    }

    private void registerValidator() {
        EmissionConfig config = node.config();
        long start = T0.getEpochSecond() + 1;
        assertTrue(node.actions().registerValidatorStake(
                OWNER, VALIDATOR, new byte[48],
                start, start + Duration.ofDays(365).getSeconds(),
                config.staking.minValidatorStake(), 10, OWNER).success());
    }

    @Test
    void acceptBlockDistributesFeesThenMintsOnBoundary() {
        node = EmissionNode.inMemory(EmissionConfig.defaultLocal(), T0);
        registerValidator();

        BlockOutcome nine = node.acceptBlock(9, T0.plusSeconds(27), 100);
        assertEquals(0, nine.minted());
        assertEquals(50, nine.fees().emissionShare());
        assertEquals(0, nine.fees().distributed());

        BlockOutcome ten = node.acceptBlock(10, T0.plusSeconds(30), 100);
        assertTrue(ten.minted() > 0);

        BlockOutcome eleven = node.acceptBlock(11, T0.plusSeconds(33), 100);
        assertEquals(50, eleven.fees().distributed());

        EmissionSnapshot snap = node.emission().snapshot();
        assertEquals(EmissionConfig.DEFAULT_TOTAL_SUPPLY + ten.minted(), snap.totalSupply());
        assertEquals(150, snap.emissionAccount().unclaimedBalance());
        assertEquals(11, node.emission().getLastAcceptedBlockHeight());
    }

    @Test
    void metricsTrackMintingAndFees() {
        node = EmissionNode.inMemory(EmissionConfig.defaultLocal(), T0);
        registerValidator();

        long minted = 0;
        for (long h = 1; h <= 20; h++) {
            minted += node.acceptBlock(h, T0.plusSeconds(h * 3), 10).minted();
        }

        assertEquals((double) minted, node.metrics().registry().counter("emission.minted").count());
        assertEquals(2.0, node.metrics().registry().counter("emission.epochs").count());
        assertEquals(100.0, node.metrics().registry().counter("emission.fees.emission_account").count());
        String scrape = node.metrics().scrapeMetrics();
        assertTrue(scrape.contains("emission.total_supply"));
        assertTrue(scrape.contains("emission.total_staked"));
    }

    @Test
    void rejectsBlocksGoingBackwards() {
        node = EmissionNode.inMemory(EmissionConfig.defaultLocal(), T0);
        node.acceptBlock(5, T0.plusSeconds(15), 0);
        assertThrows(IllegalArgumentException.class, () -> node.acceptBlock(4, T0.plusSeconds(18), 0));
    }

    @Test
    void rocksNodeKeepsStakeRecordsOnDisk() {
        String dir = tempDir.resolve("stakes").toString();
        node = EmissionNode.rocks(EmissionConfig.defaultLocal(), dir, T0);
        registerValidator();
        node.close();

        node = EmissionNode.rocks(EmissionConfig.defaultLocal(), dir, T0);
        assertTrue(node.stakes().getValidatorStake(VALIDATOR).isPresent());
    }

    @Test
    void reopenedRocksNodeRebuildsLedgerPositions() {
        String dir = tempDir.resolve("reopen").toString();
        Address alice = Address.derive("alice");
        long validatorStake = EmissionConfig.defaultLocal().staking.minValidatorStake();
        long delegated = EmissionConfig.defaultLocal().staking.minDelegatorStake();

        node = EmissionNode.rocks(EmissionConfig.defaultLocal(), dir, T0);
        registerValidator();
        assertTrue(node.actions().delegateUserStake(alice, VALIDATOR, delegated, alice).success());
        node.close();

        node = EmissionNode.rocks(EmissionConfig.defaultLocal(), dir, T0);
        assertEquals(1, node.emission().getNumDelegators(VALIDATOR));
        assertEquals(delegated, node.emission().getStakedValidators(VALIDATOR).get(0).delegatedAmount());

        node.acceptBlock(10, T0.plusSeconds(30), 0);
        assertEquals(validatorStake + delegated, node.emission().snapshot().totalStaked());

        ActionResult undelegated = node.actions().undelegateUserStake(alice, VALIDATOR);
        assertTrue(undelegated.success(), undelegated.output());
        assertEquals(delegated, undelegated.payout());
        assertTrue(node.actions().claimStakingRewards(OWNER, VALIDATOR).success());

        ActionResult withdrawn = node.actions().withdrawValidatorStake(OWNER, VALIDATOR);
        assertTrue(withdrawn.success(), withdrawn.output());
        assertEquals(validatorStake, withdrawn.payout());
        assertTrue(node.emission().getStakedValidators(VALIDATOR).isEmpty());
    }
}

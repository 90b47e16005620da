package io.nai.emission.node;

import io.nai.emission.actions.StakingConfig;
import io.nai.emission.ledger.Emission;
import io.nai.emission.ledger.EpochTracker;
import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.AddressFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EmissionConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        EmissionConfig config = EmissionConfig.load(tempDir.resolve("absent.json"));

        assertEquals(EmissionConfig.DEFAULT_TOTAL_SUPPLY, config.totalSupply);
        assertEquals(0, config.maxSupply);
        assertEquals(Emission.DEFAULT_SUPPLY_CAP, config.supplyCap);
        assertEquals(EmissionConfig.DEFAULT_EMISSION_ADDRESS, config.emissionAddress);
        assertEquals(EpochTracker.defaults(), config.epochTracker);
        assertEquals(StakingConfig.defaults(), config.staking);
    }

    @Test
    void partialFileOverridesOnlyGivenKeys() throws Exception {
        Address emissionAddress = Address.derive("treasury");
        Path file = tempDir.resolve("emission.json");
        Files.writeString(file, """
                {
                  "totalSupply": 1000,
                  "maxSupply": 5000,
                  "emissionAddress": "%s",
                  "epochLength": 1200,
                  "staking": { "minDelegatorStake": 7 },
                  "unknownKey": true
                }
                """.formatted(AddressFormat.format(emissionAddress)), StandardCharsets.UTF_8);

        EmissionConfig config = EmissionConfig.load(file);

        assertEquals(1000, config.totalSupply);
        assertEquals(5000, config.maxSupply);
        assertEquals(emissionAddress, config.emissionAddress);
        assertEquals(1200, config.epochTracker.epochLength());
        assertEquals(EpochTracker.DEFAULT_BASE_APR_BPS, config.epochTracker.baseAprBps());
        assertEquals(7, config.staking.minDelegatorStake());
        assertEquals(StakingConfig.DEFAULT_MIN_VALIDATOR_STAKE, config.staking.minValidatorStake());
    }

    @Test
    void malformedFileFailsLoudly() throws Exception {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{ \"totalSupply\": ", StandardCharsets.UTF_8);
        assertThrows(IllegalStateException.class, () -> EmissionConfig.load(broken));

        Path invalid = tempDir.resolve("invalid.json");
        Files.writeString(invalid, "{ \"epochLength\": 0 }", StandardCharsets.UTF_8);
        assertThrows(IllegalStateException.class, () -> EmissionConfig.load(invalid));
    }

    @Test
    void savedConfigLoadsBack() {
        Path file = tempDir.resolve("nested/emission.json");
        EmissionConfig original = EmissionConfig.defaultLocal()
                .withEpochTracker(new EpochTracker(1_000, 50, 20, 2));

        original.save(file);
        EmissionConfig loaded = EmissionConfig.load(file);

        assertEquals(original.epochTracker, loaded.epochTracker);
        assertEquals(original.staking, loaded.staking);
        assertEquals(original.emissionAddress, loaded.emissionAddress);
        assertEquals(original.totalSupply, loaded.totalSupply);
    }
}

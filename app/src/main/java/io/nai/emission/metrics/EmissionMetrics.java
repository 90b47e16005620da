package io.nai.emission.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.nai.emission.ledger.Emission;
import io.nai.emission.ledger.FeeDistribution;

import java.util.function.Supplier;

/** Minting, fee and supply meters of one node. */
public final class EmissionMetrics {
    private final MeterRegistry registry;
    private final Counter minted;
    private final Counter feesDistributed;
    private final Counter feesToEmissionAccount;
    private final Counter epochs;
    private final Timer blockTime;

    public EmissionMetrics() {
        this(new SimpleMeterRegistry());
    }

    public EmissionMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.minted = registry.counter("emission.minted");
        this.feesDistributed = registry.counter("emission.fees.distributed");
        this.feesToEmissionAccount = registry.counter("emission.fees.emission_account");
        this.epochs = registry.counter("emission.epochs");
        this.blockTime = registry.timer("emission.block.processing.time");
    }

    public void bind(Emission emission) {
        Gauge.builder("emission.total_supply", emission, e -> e.snapshot().totalSupply())
                .strongReference(true)
                .register(registry);
        Gauge.builder("emission.total_staked", emission, e -> e.snapshot().totalStaked())
                .strongReference(true)
                .register(registry);
    }

    public <T> T recordBlock(Supplier<T> blockProcessing) {
        return blockTime.record(blockProcessing);
    }

    public void recordFees(FeeDistribution fees) {
        feesDistributed.increment(fees.distributed());
        feesToEmissionAccount.increment(fees.emissionShare());
    }

    public void recordMint(long amount) {
        epochs.increment();
        minted.increment(amount);
    }

    public String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public MeterRegistry registry() {
        return registry;
    }
}

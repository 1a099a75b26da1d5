package io.rndr.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.rndr.core.ledger.LedgerError;

import java.math.BigInteger;

public final class LedgerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final DistributionSummary escrowFunded = DistributionSummary.builder("escrow.funded.amount")
            .baseUnit("tokens")
            .description("Amounts credited to escrow ids")
            .register(registry);
    private static final DistributionSummary escrowDisbursed = DistributionSummary.builder("escrow.disbursed.amount")
            .baseUnit("tokens")
            .description("Amounts paid out of escrow ids")
            .register(registry);
    private static final Counter partialDisbursals = Counter.builder("escrow.disbursals.partial")
            .description("Disbursals that failed after paying some recipients")
            .register(registry);

    private LedgerMetrics() {}

    public static void recordCall(String entryPoint) {
        registry.counter("ledger.calls", "entry", entryPoint, "outcome", "ok").increment();
    }

    public static void recordRejection(String entryPoint, LedgerError error) {
        registry.counter("ledger.calls", "entry", entryPoint, "outcome", "rejected").increment();
        registry.counter("ledger.rejections", "error", error.code()).increment();
    }

    public static void recordFailure(String entryPoint) {
        registry.counter("ledger.calls", "entry", entryPoint, "outcome", "error").increment();
    }

    public static void recordEscrowFunded(BigInteger amount) {
        escrowFunded.record(amount.doubleValue());
    }

    public static void recordEscrowDisbursed(BigInteger amount) {
        escrowDisbursed.record(amount.doubleValue());
    }

    public static void incrementPartialDisbursals() {
        partialDisbursals.increment();
    }

    public static double rejections(LedgerError error) {
        Counter counter = registry.find("ledger.rejections").tag("error", error.code()).counter();
        return counter == null ? 0.0 : counter.count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                for (Tag tag : m.getId().getTags()) {
                    sb.append(',').append(tag.getKey()).append('=').append(tag.getValue());
                }
                sb.append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}

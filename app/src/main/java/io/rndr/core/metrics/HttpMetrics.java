package io.rndr.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Ledger API request metrics. Routes are tagged by their registered context path,
 * never the raw request URI, so query strings and unknown paths cannot grow the
 * tag space.
 */
public final class HttpMetrics {
    private static final MeterRegistry REGISTRY = LedgerMetrics.registry();

    private HttpMetrics() {}

    public static Timer.Sample start() {
        return Timer.start(REGISTRY);
    }

    public static void stop(Timer.Sample sample, String route, String method, int status) {
        sample.stop(Timer
                .builder("api.requests")
                .description("Ledger API request duration")
                .tag("route", route)
                .tag("method", method)
                .tag("outcome", outcome(status))
                .register(REGISTRY));
    }

    /** Counts an error body sent on {@code route}, tagged with the error code clients see. */
    public static void recordError(String route, String code) {
        REGISTRY.counter("api.errors", "route", route, "code", code).increment();
    }

    public static double errors(String route, String code) {
        Counter counter = REGISTRY.find("api.errors").tag("route", route).tag("code", code).counter();
        return counter == null ? 0.0 : counter.count();
    }

    static String outcome(int status) {
        if (status < 100 || status > 599) {
            return "unknown";
        }
        return (status / 100) + "xx";
    }
}

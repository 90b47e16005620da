package io.nai.emission.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/** {@code http.server.requests} timers for the RPC server. */
public final class HttpMetrics {
    private final MeterRegistry registry;

    public HttpMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public Timer.Sample start() {
        return Timer.start(registry);
    }

    public void stop(Timer.Sample sample, String method, String path, int status) {
        Timer timer = Timer
                .builder("http.server.requests")
                .description("HTTP server request duration")
                .tag("method", method)
                .tag("path", path)
                .tag("status", Integer.toString(status))
                .register(registry);
        sample.stop(timer);
    }
}

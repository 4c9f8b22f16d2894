package com.optionlab.observability;

import com.optionlab.domain.enums.PricingMethod;
import com.optionlab.domain.model.PricingResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the pricing engine, one set per {@link PricingMethod}:
 * <ul>
 *   <li><b>pricing.duration</b> (timer): wall time of successful pricing calls</li>
 *   <li><b>pricing.failures</b> (counter): calls aborted by an exception</li>
 *   <li><b>pricing.convergence.warnings</b> (counter): Monte Carlo results carrying a warning</li>
 * </ul>
 */
@Service
public class PricingMetrics {

    private final Map<PricingMethod, Timer> durationTimers = new EnumMap<>(PricingMethod.class);
    private final Map<PricingMethod, Counter> failureCounters = new EnumMap<>(PricingMethod.class);
    private final Counter convergenceWarningCounter;

    public PricingMetrics(MeterRegistry meterRegistry) {
        for (PricingMethod method : PricingMethod.values()) {
            durationTimers.put(
                    method,
                    Timer.builder("pricing.duration")
                            .description("Wall time of a pricing call")
                            .tag("method", method.name())
                            .publishPercentiles(0.5, 0.95)
                            .register(meterRegistry));
            failureCounters.put(
                    method,
                    Counter.builder("pricing.failures")
                            .description("Pricing calls aborted by invalid input or numerical failure")
                            .tag("method", method.name())
                            .register(meterRegistry));
        }
        this.convergenceWarningCounter = Counter.builder("pricing.convergence.warnings")
                .description("Monte Carlo runs whose standard error exceeded the requested tolerance")
                .register(meterRegistry);
    }

    public void recordSuccess(PricingResult result) {
        durationTimers.get(result.getMethod()).record(result.getElapsedMillis(), TimeUnit.MILLISECONDS);
        if (result.hasWarnings()) {
            convergenceWarningCounter.increment(result.getWarnings().size());
        }
    }

    public void recordFailure(PricingMethod method) {
        failureCounters.get(method).increment();
    }
}

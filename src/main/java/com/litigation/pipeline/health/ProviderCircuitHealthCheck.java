package com.litigation.pipeline.health;

import com.litigation.pipeline.research.ProviderGuardRegistry;
import com.litigation.pipeline.resilience.CircuitBreaker;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports the circuit state of the research providers: DOWN when every provider's
 * circuit is open, DEGRADED when some are.
 */
public class ProviderCircuitHealthCheck implements HealthCheck {

    private final ProviderGuardRegistry guards;
    private final List<String> providerNames;

    public ProviderCircuitHealthCheck(ProviderGuardRegistry guards, List<String> providerNames) {
        this.guards = guards;
        this.providerNames = List.copyOf(providerNames);
    }

    @Override
    public String getName() {
        return "researchProviders";
    }

    @Override
    public HealthStatus check() {
        if (providerNames.isEmpty()) {
            return HealthStatus.down("No research providers configured");
        }
        List<String> open = new ArrayList<>();
        HealthStatus status = HealthStatus.up();
        List<String> states = new ArrayList<>();
        for (String name : providerNames) {
            CircuitBreaker.State state = guards.guardFor(name).circuitBreaker().getState();
            states.add(name + "=" + state);
            if (state == CircuitBreaker.State.OPEN) {
                open.add(name);
            }
        }
        if (open.size() == providerNames.size()) {
            status = HealthStatus.down("All provider circuits open");
        } else if (!open.isEmpty()) {
            status = HealthStatus.degraded("Provider circuits open: " + String.join(", ", open));
        }
        return status
                .withDetail("providers", states)
                .withDetail("openCircuits", open.size());
    }
}

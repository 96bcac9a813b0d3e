package com.example.memeswap.face;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the reference face state.  A registry that has not been used yet
 * is UP: it loads lazily on the first transform.
 */
@Component
public class FaceModelHealthIndicator implements HealthIndicator {

    private final FaceModelRegistry registry;

    public FaceModelHealthIndicator(FaceModelRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        FaceModelRegistry.State state = registry.state();
        if (state == FaceModelRegistry.State.FAILED) {
            return Health.down()
                    .withDetail("referenceFace", state.name())
                    .withDetail("error", String.valueOf(registry.lastFailureMessage()))
                    .build();
        }
        return Health.up()
                .withDetail("referenceFace", state.name())
                .withDetail("swapper", registry.swapper().getClass().getSimpleName())
                .build();
    }
}

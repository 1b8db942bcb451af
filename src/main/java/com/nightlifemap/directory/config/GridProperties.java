package com.nightlifemap.directory.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Component
@ConfigurationProperties(prefix = "grid")
public class GridProperties {

    private final Swap swap = new Swap();
    private final Lease lease = new Lease();

    public Swap getSwap() {
        return swap;
    }

    public Lease getLease() {
        return lease;
    }

    public static class Swap {

        /**
         * Try the TransactWriteItems exchange before the sequential fallback.
         */
        private boolean atomicEnabled = true;

        public boolean isAtomicEnabled() {
            return atomicEnabled;
        }

        public void setAtomicEnabled(boolean atomicEnabled) {
            this.atomicEnabled = atomicEnabled;
        }
    }

    public static class Lease {

        private boolean enabled = true;

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration duration = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getDuration() {
            return duration;
        }

        public void setDuration(Duration duration) {
            this.duration = duration;
        }
    }
}

package com.dcruver.gitpet.app;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Remembers when the user last ran a command, which is what puts the pet to sleep.
 */
@Component
@RequiredArgsConstructor
public class ShellInteractionTracker {

    private final Clock clock;

    private Instant lastInteraction;

    /**
     * Record an interaction and return the idle seconds since the previous one (0 for the first)
     */
    public synchronized long touch() {
        Instant now = clock.instant();
        long idle = idleSeconds(now);
        lastInteraction = now;
        return idle;
    }

    public synchronized long idleSeconds() {
        return idleSeconds(clock.instant());
    }

    private long idleSeconds(Instant now) {
        if (lastInteraction == null) {
            return 0;
        }
        return Math.max(0, Duration.between(lastInteraction, now).getSeconds());
    }
}

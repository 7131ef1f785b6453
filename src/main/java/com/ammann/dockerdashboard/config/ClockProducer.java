/* (C)2026 */
package com.ammann.dockerdashboard.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * CDI producer for the time source used by the dashboard caches.
 *
 * <p>Every time-based decision in the core (for example the running-set reuse window)
 * reads from the produced {@link Clock}, so tests can substitute a fixed or manually
 * advanced clock instead of sleeping.
 */
@ApplicationScoped
public class ClockProducer {

    /**
     * Produces the application-wide UTC clock.
     *
     * @return the system clock in UTC
     */
    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}

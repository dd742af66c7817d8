package com.phillippitts.livenesswatch.config;

import com.phillippitts.livenesswatch.config.properties.WatchdogProperties;
import com.phillippitts.livenesswatch.service.notification.AlertDispatcher;
import com.phillippitts.livenesswatch.service.watchdog.Watchdog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the watchdog instance and the clock it reads time from.
 *
 * <p>The watchdog is an ordinary bean rather than a component so additional, independently
 * owned instances can be constructed the same way.
 */
@Configuration
public class WatchdogConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public Watchdog watchdog(WatchdogProperties props, Clock clock, AlertDispatcher alertDispatcher) {
        return new Watchdog(
                props.getName(),
                props.getDefaultTimeoutMs(),
                clock,
                alertDispatcher);
    }
}

package com.phillippitts.livenesswatch.service.notification;

/**
 * Delivers an alert message over whichever channel accepts it.
 */
@FunctionalInterface
public interface AlertSender {

    /**
     * @param message alert text
     * @return true if some channel delivered the message; never throws for delivery failures
     */
    boolean send(String message);
}

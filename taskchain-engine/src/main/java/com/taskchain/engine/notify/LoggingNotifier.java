package com.taskchain.engine.notify;

import com.taskchain.core.port.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notifier that writes notifications to the log.
 * Admin notifications go to a dedicated logger at WARN so they can be routed
 * to an operator appender.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);
    private static final Logger adminLog = LoggerFactory.getLogger("taskchain.admin");

    @Override
    public void notifyUser(String userId, String subject, String body) {
        log.info("Notify {}: {}\n{}", userId, subject, body);
    }

    @Override
    public void notifyAdmin(String subject, String body) {
        adminLog.warn("{}\n{}", subject, body);
    }
}

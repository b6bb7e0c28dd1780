package com.influxlog.logging;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Attaches an {@link InfluxLogAppender} to the root logger for the lifetime of the
 * application context.
 */
@Slf4j
public class InfluxLogging implements SmartLifecycle {

    static final String APPENDER_NAME = "INFLUX";

    private final InfluxLogAppender appender;

    private volatile boolean running;

    public InfluxLogging(InfluxLogAppender appender) {
        this.appender = appender;
    }

    public synchronized void startLogging() {
        if (running) {
            return;
        }
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.start();
        rootLogger(context).addAppender(appender);
        running = true;
        log.info("InfluxDB log appender attached to root logger");
    }

    /**
     * Detaches and stops the appender. Does nothing when logging was never started.
     */
    public synchronized void stopLogging() {
        if (!running) {
            return;
        }
        running = false;
        rootLogger((LoggerContext) LoggerFactory.getILoggerFactory()).detachAppender(appender);
        appender.stop();
        log.info("InfluxDB log appender detached from root logger");
    }

    @Override
    public void start() {
        startLogging();
    }

    @Override
    public void stop() {
        stopLogging();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private static Logger rootLogger(LoggerContext context) {
        return context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }
}

package com.fluxo.debug;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Forwards hub messages to SLF4J, one logger per tag under "fluxo.". */
public final class Slf4jDebugSink implements DebugSink {

    private final Map<String, Logger> loggers = new ConcurrentHashMap<>();

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        Logger logger = loggers.computeIfAbsent(tag == null ? "engine" : tag,
                t -> LoggerFactory.getLogger("fluxo." + t));
        switch (level) {
            case TRACE:
                logger.trace(message, error);
                break;
            case DEBUG:
                logger.debug(message, error);
                break;
            case INFO:
                logger.info(message, error);
                break;
            case WARN:
                logger.warn(message, error);
                break;
            default:
                logger.error(message, error);
                break;
        }
    }
}

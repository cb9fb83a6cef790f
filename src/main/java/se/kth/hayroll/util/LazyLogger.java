package se.kth.hayroll.util;

import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J logger wrapper whose messages are built only when the level is enabled. Pass rewriting
 * builds long messages (node texts, tag payloads), so nothing is formatted unless it is printed.
 */
public class LazyLogger {
    private final Logger logger;

    public LazyLogger(Class<?> cls) {
        logger = LoggerFactory.getLogger(cls);
    }

    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }

    public void trace(Supplier<String> message) {
        if (logger.isTraceEnabled()) {
            logger.trace(message.get());
        }
    }

    public void debug(Supplier<String> message) {
        if (logger.isDebugEnabled()) {
            logger.debug(message.get());
        }
    }

    /** Log a debug message together with the stack trace of its cause. */
    public void debug(Supplier<String> message, Throwable cause) {
        if (logger.isDebugEnabled()) {
            logger.debug(message.get(), cause);
        }
    }

    public void info(Supplier<String> message) {
        if (logger.isInfoEnabled()) {
            logger.info(message.get());
        }
    }

    public void warn(Supplier<String> message) {
        if (logger.isWarnEnabled()) {
            logger.warn(message.get());
        }
    }


    public void error(Supplier<String> message) {
        if (logger.isErrorEnabled()) {
            logger.error(message.get());
        }
    }
}

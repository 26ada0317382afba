package io.cronqueue4j;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives every failure raised while claiming, processing or rescheduling a job.
 * The polling loop keeps running regardless of what the handler does.
 */
@FunctionalInterface
public interface ErrorHandler {

    ErrorHandler LOGGING = new LoggingErrorHandler();

    void handle(Throwable error) throws Exception;

    final class LoggingErrorHandler implements ErrorHandler {
        private static final Logger log = LoggerFactory.getLogger(LoggingErrorHandler.class);

        private LoggingErrorHandler() {
        }

        @Override
        public void handle(Throwable error) {
            log.error("cronqueue job processing failed msg={}", error.getMessage(), error);
        }
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger("io.omni.debug");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        OmniDebug.setEnabled(false);
        logger.detachAndStopAllAppenders();
    }

    @Test
    void doesNotLogWhenDisabled() {
        DebugLogger.log("should not appear");
        DebugLogger.logRpc("should not appear either");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void logsSanitizedMessagesWhenEnabled() {
        OmniDebug.setEnabled(true);
        DebugLogger.log("envelope {\"signature\":\"abcdef0123\"}");

        assertEquals(1, appender.list.size());
        String message = appender.list.get(0).getFormattedMessage();
        assertTrue(message.contains("***[REDACTED]***"));
        assertFalse(message.contains("abcdef0123"));
    }

    @Test
    void rpcToggleIsIndependentOfConnectionToggle() {
        OmniDebug.setConnectionLogging(true);

        DebugLogger.logRpc("rpc line");
        DebugLogger.logConnection("connection line %d", 2);

        assertEquals(1, appender.list.size());
        assertEquals("connection line 2", appender.list.get(0).getFormattedMessage());
    }
}

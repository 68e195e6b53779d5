package org.kaleido.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is declared with {@link ExpectLog},
 * and fails it if an expected event does not occur.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create("org.kaleido.junit.extensions.logging.LogWatchExtension");

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingTurboFilter filter = new CapturingTurboFilter(findExpectLogs(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingTurboFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingTurboFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        List<String> problems = new ArrayList<>();
        for (CapturedEvent event : filter.events) {
            if (event.level.isGreaterOrEqual(Level.WARN) && !filter.isExpected(event)) {
                problems.add("Unexpected log: " + event);
            }
        }
        for (ExpectLog expected : filter.expects) {
            long count = filter.events.stream().filter(e -> matches(e, expected)).count();
            if (count < expected.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d.",
                        expected.occurrences(), expected.level(), expected.loggerPattern(), expected.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static List<ExpectLog> findExpectLogs(ExtensionContext context) {
        List<ExpectLog> expects = new ArrayList<>();
        context.getTestClass().ifPresent(c -> expects.addAll(List.of(c.getAnnotationsByType(ExpectLog.class))));
        context.getTestMethod().ifPresent(m -> expects.addAll(List.of(m.getAnnotationsByType(ExpectLog.class))));
        return expects;
    }

    private static boolean matches(CapturedEvent event, ExpectLog expected) {
        return event.level.isGreaterOrEqual(toLogback(expected.level()))
                && Pattern.matches(expected.loggerPattern(), event.loggerName)
                && Pattern.matches(expected.messagePattern(), event.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class CapturingTurboFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private final List<ExpectLog> expects;

        CapturingTurboFilter(List<ExpectLog> expects) {
            this.expects = expects;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            if (format == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent event = new CapturedEvent(logger.getName(), level,
                    MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            // Expected events are kept out of the test output.
            return isExpected(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        boolean isExpected(CapturedEvent event) {
            return expects.stream().anyMatch(expected -> matches(event, expected));
        }
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }
}

package org.quarry.formula.junit.extensions.logging;

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
 * Fails a test that logs a WARN or ERROR event it did not declare with {@link ExpectLog}, and a test
 * that misses one it did declare.
 * <p>
 * A fresh filter is installed around every test method, so events logged by asynchronous work of
 * one test cannot leak into the verdict of another.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeEach(ExtensionContext context) {
        WatchingTurboFilter filter = new WatchingTurboFilter(findExpectations(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        WatchingTurboFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, WatchingTurboFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        List<String> problems = new ArrayList<>();
        for (CapturedEvent event : filter.events) {
            if (filter.expectationFor(event) == null) {
                problems.add("Unexpected log: " + event);
            }
        }
        for (ExpectLog expected : filter.expectations) {
            long count = filter.events.stream().filter(event -> matches(event, expected)).count();
            if (count < expected.occurrences()) {
                problems.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        expected.occurrences(), expected.level(), expected.loggerPattern(), expected.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static List<ExpectLog> findExpectations(ExtensionContext context) {
        List<ExpectLog> expectations = new ArrayList<>();
        context.getTestClass().ifPresent(type -> expectations.addAll(List.of(type.getAnnotationsByType(ExpectLog.class))));
        context.getTestMethod().ifPresent(method -> expectations.addAll(List.of(method.getAnnotationsByType(ExpectLog.class))));
        return expectations;
    }

    private static boolean matches(CapturedEvent event, ExpectLog expected) {
        return event.level.isGreaterOrEqual(toLogback(expected.level()))
                && Pattern.matches(expected.loggerPattern(), event.loggerName)
                && Pattern.matches(expected.messagePattern(), event.message);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class WatchingTurboFilter extends TurboFilter {
        private final List<ExpectLog> expectations;
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();

        WatchingTurboFilter(List<ExpectLog> expectations) {
            this.expectations = expectations;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            // a null format is an isEnabled() probe, not an event
            if (format == null || level == null || !level.isGreaterOrEqual(Level.WARN)) {
                return FilterReply.NEUTRAL;
            }
            String message = MessageFormatter.arrayFormat(format, params).getMessage();
            CapturedEvent event = new CapturedEvent(logger.getName(), level, message);
            events.add(event);
            return expectationFor(event) != null ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        ExpectLog expectationFor(CapturedEvent event) {
            for (ExpectLog expected : expectations) {
                if (matches(event, expected)) {
                    return expected;
                }
            }
            return null;
        }
    }

    private static final class CapturedEvent {
        final String loggerName;
        final Level level;
        final String message;

        CapturedEvent(String loggerName, Level level, String message) {
            this.loggerName = loggerName;
            this.level = level;
            this.message = message != null ? message : "";
        }

        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }
}

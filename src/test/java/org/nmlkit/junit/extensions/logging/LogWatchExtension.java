package org.nmlkit.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Fails a test that logs at WARN or above unless the event is declared with {@link ExpectLog}
 * or {@link AllowLog}, and fails it when an expected event is missing.
 * <p>
 * Events from INFO upwards are captured by a Logback turbo filter installed for the test class,
 * so INFO events can be expected as well. Declared events are captured but not printed.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter();
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter != null) {
            filter.reset(rules(context));
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter == null) {
            return;
        }
        Rules rules = rules(context);
        List<String> problems = new ArrayList<>();
        for (Event event : filter.events()) {
            if (event.level().isGreaterOrEqual(Level.WARN) && !rules.isDeclared(event)) {
                problems.add("Unexpected log: " + event);
            }
        }
        for (ExpectLog expected : rules.expects) {
            long count = filter.events().stream().filter(e -> Rules.matches(e, expected.level(),
                    expected.loggerPattern(), expected.messagePattern())).count();
            if (count < expected.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expected.occurrences(), expected.level(), expected.loggerPattern(),
                        expected.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static CapturingFilter filter(ExtensionContext context) {
        return context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules rules(ExtensionContext context) {
        List<AnnotatedElement> elements = new ArrayList<>();
        context.getTestClass().ifPresent(elements::add);
        context.getTestMethod().ifPresent(elements::add);
        List<ExpectLog> expects = new ArrayList<>();
        List<AllowLog> allows = new ArrayList<>();
        for (AnnotatedElement element : elements) {
            expects.addAll(List.of(element.getAnnotationsByType(ExpectLog.class)));
            allows.addAll(List.of(element.getAnnotationsByType(AllowLog.class)));
        }
        return new Rules(expects, allows);
    }

    private static Level toLogback(LogLevel level) {
        switch (level) {
            case INFO: return Level.INFO;
            case WARN: return Level.WARN;
            default: return Level.ERROR;
        }
    }

    private record Event(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + loggerName + " - " + message;
        }
    }

    private record Rules(List<ExpectLog> expects, List<AllowLog> allows) {

        static final Rules NONE = new Rules(List.of(), List.of());

        boolean isDeclared(Event event) {
            return Stream.concat(
                    expects.stream().map(e -> matches(event, e.level(), e.loggerPattern(), e.messagePattern())),
                    allows.stream().map(a -> matches(event, a.level(), a.loggerPattern(), a.messagePattern())))
                    .anyMatch(Boolean::booleanValue);
        }

        static boolean matches(Event event, LogLevel level, String loggerPattern, String messagePattern) {
            return event.level().isGreaterOrEqual(toLogback(level))
                    && Pattern.matches(loggerPattern, event.loggerName())
                    && Pattern.compile(messagePattern).matcher(event.message()).find();
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules = Rules.NONE;

        void reset(Rules newRules) {
            events.clear();
            rules = newRules;
        }

        List<Event> events() {
            return events;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            if (format == null || !level.isGreaterOrEqual(Level.INFO) || !level.isGreaterOrEqual(logger.getEffectiveLevel())) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.isDeclared(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}

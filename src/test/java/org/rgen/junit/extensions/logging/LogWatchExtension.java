package org.rgen.junit.extensions.logging;

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
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is covered by {@link AllowLog} or
 * {@link ExpectLog}, and fails when an {@link ExpectLog} is not met. Events are captured by a
 * Logback turbo filter installed for the lifetime of the test class; allowed and expected events
 * are suppressed from the console.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.resolve(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            filter.clear();
            filter.rules = Rules.resolve(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Captured> events = filter.snapshot();
        filter.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (Captured event : events) {
                if (!rules.isAllowed(event) && !rules.isExpected(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expect : rules.expects) {
            long found = events.stream().filter(event -> matches(event, expect.level(), expect.loggerPattern(),
                expect.messagePattern())).count();
            if (found < expect.occurrences()) {
                problems.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                    expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), found));
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

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static boolean matches(Captured event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level.isGreaterOrEqual(toLogback(level))
            && Pattern.matches(loggerPattern, event.logger)
            && Pattern.matches(messagePattern, event.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class Captured {
        final String logger;
        final Level level;
        final String message;

        Captured(String logger, Level level, String message) {
            this.logger = logger;
            this.level = level;
            this.message = message == null ? "" : message;
        }

        @Override
        public String toString() {
            return "[" + level + "] " + logger + " - " + message;
        }
    }

    private static final class Rules {
        final LogLevel minLevel;
        final boolean disabled;
        final List<AllowLog> allows;
        final List<ExpectLog> expects;

        private Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {
            this.minLevel = minLevel;
            this.disabled = disabled;
            this.allows = allows;
            this.expects = expects;
        }

        // Class-level annotations apply to every test; method-level ones add to them.
        static Rules resolve(ExtensionContext context) {
            Optional<AnnotatedElement> element = context.getElement();
            Optional<Class<?>> testClass = context.getTestClass();
            FailOnLog fail = element.map(e -> e.getAnnotation(FailOnLog.class))
                .orElseGet(() -> testClass.map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
            List<AllowLog> allows = new ArrayList<>();
            List<ExpectLog> expects = new ArrayList<>();
            testClass.ifPresent(c -> {
                allows.addAll(List.of(c.getAnnotationsByType(AllowLog.class)));
                expects.addAll(List.of(c.getAnnotationsByType(ExpectLog.class)));
            });
            element.filter(e -> !(e instanceof Class<?>)).ifPresent(e -> {
                allows.addAll(List.of(e.getAnnotationsByType(AllowLog.class)));
                expects.addAll(List.of(e.getAnnotationsByType(ExpectLog.class)));
            });
            return new Rules(fail == null ? LogLevel.WARN : fail.level(), fail != null && fail.disabled(),
                List.copyOf(allows), List.copyOf(expects));
        }

        boolean isAllowed(Captured event) {
            return allows.stream().anyMatch(a -> matches(event, a.level(), a.loggerPattern(), a.messagePattern()));
        }

        boolean isExpected(Captured event) {
            return expects.stream().anyMatch(x -> matches(event, x.level(), x.loggerPattern(), x.messagePattern()));
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Captured> events = new CopyOnWriteArrayList<>();
        volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format,
                                  Object[] params, Throwable t) {
            Rules current = rules;
            if (format == null || !level.isGreaterOrEqual(toLogback(current.minLevel))) {
                return FilterReply.NEUTRAL;
            }
            Captured event = new Captured(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return current.isAllowed(event) || current.isExpected(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<Captured> snapshot() {
            return new ArrayList<>(events);
        }

        void clear() {
            events.clear();
        }
    }
}

package org.mapforge.junit.extensions.logging;

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

/**
 * Fails a test that logs at WARN or above unless the event was announced with {@link AllowLog} or
 * {@link ExpectLog}, and fails a test whose {@link ExpectLog} events did not occur. Announced events
 * are kept out of the console output.
 * <p>
 * Class-level annotations apply to every test method in addition to the method's own.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.of(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            filter.clear();
            filter.rules = Rules.of(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Event> events = filter.events();
        filter.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (Event e : events) {
                if (!rules.announced(e)) {
                    problems.add("Unexpected log: " + e);
                }
            }
        }
        for (Rule expect : rules.expects) {
            long count = events.stream().filter(expect::matches).count();
            if (count < expect.occurrences) {
                problems.add(String.format("Missing log: expected %d x %s, found %d", expect.occurrences, expect, count));
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

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Event(String logger, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + logger + " - " + message;
        }
    }

    private record Rule(Level level, Pattern logger, Pattern message, int occurrences) {
        static Rule allow(AllowLog a) {
            return new Rule(toLogback(a.level()), Pattern.compile(a.loggerPattern()),
                    Pattern.compile(a.messagePattern(), Pattern.DOTALL), 0);
        }

        static Rule expect(ExpectLog e) {
            return new Rule(toLogback(e.level()), Pattern.compile(e.loggerPattern()),
                    Pattern.compile(e.messagePattern(), Pattern.DOTALL), e.occurrences());
        }

        boolean matches(Event e) {
            return e.level.isGreaterOrEqual(level)
                    && logger.matcher(e.logger).matches()
                    && message.matcher(e.message).matches();
        }

        @Override
        public String toString() {
            return "[" + level + "] logger=\"" + logger + "\" message=\"" + message + "\"";
        }
    }

    private static final class Rules {
        final Level minLevel;
        final boolean disabled;
        final List<Rule> allows = new ArrayList<>();
        final List<Rule> expects = new ArrayList<>();

        private Rules(Level minLevel, boolean disabled) {
            this.minLevel = minLevel;
            this.disabled = disabled;
        }

        static Rules of(ExtensionContext context) {
            FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
                    .orElseGet(() -> context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
            Rules rules = new Rules(toLogback(fail != null ? fail.level() : LogLevel.WARN), fail != null && fail.disabled());
            List<AnnotatedElement> sources = new ArrayList<>();
            context.getTestClass().ifPresent(sources::add);
            context.getTestMethod().ifPresent(sources::add);
            for (AnnotatedElement source : sources) {
                for (AllowLog a : source.getAnnotationsByType(AllowLog.class)) {
                    rules.allows.add(Rule.allow(a));
                }
                for (ExpectLog e : source.getAnnotationsByType(ExpectLog.class)) {
                    rules.expects.add(Rule.expect(e));
                }
            }
            return rules;
        }

        Level captureLevel() {
            Level lowest = minLevel;
            for (Rule r : expects) {
                if (!r.level.isGreaterOrEqual(lowest)) {
                    lowest = r.level;
                }
            }
            return lowest;
        }

        boolean announced(Event e) {
            if (!e.level.isGreaterOrEqual(minLevel)) {
                return true;
            }
            return allows.stream().anyMatch(r -> r.matches(e)) || expects.stream().anyMatch(r -> r.matches(e));
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            // Logback also asks with a null format when checking isXxxEnabled().
            if (format == null || !level.isGreaterOrEqual(rules.captureLevel())) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            boolean quiet = rules.allows.stream().anyMatch(r -> r.matches(event))
                    || rules.expects.stream().anyMatch(r -> r.matches(event));
            return quiet ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<Event> events() {
            return new ArrayList<>(events);
        }

        void clear() {
            events.clear();
        }
    }
}

package org.olympiac.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
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

import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is covered by an {@link AllowLog}
 * or {@link ExpectLog}, and fails a test that does not log what its {@link ExpectLog}
 * annotations require. Annotations on the class apply to every test method.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String RECORDER = "recorder";

    @Override
    public void beforeAll(ExtensionContext context) {
        Recorder recorder = new Recorder();
        recorder.start();
        loggerContext().addTurboFilter(recorder);
        context.getStore(NAMESPACE).put(RECORDER, recorder);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        Recorder recorder = recorder(context);
        if (recorder != null) {
            recorder.clear();
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        Recorder recorder = recorder(context);
        if (recorder == null) {
            return;
        }
        List<Event> events = recorder.events();
        recorder.clear();

        FailOnLog failOn = find(context, FailOnLog.class);
        Level threshold = failOn == null ? Level.WARN : failOn.level().toLogback();
        boolean checkUnexpected = failOn == null || !failOn.disabled();
        List<AllowLog> allows = findAll(context, AllowLog.class);
        List<ExpectLog> expects = findAll(context, ExpectLog.class);

        List<String> problems = new ArrayList<>();
        if (checkUnexpected) {
            for (Event event : events) {
                if (event.level().isGreaterOrEqual(threshold) && !covered(event, allows, expects)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expect : expects) {
            long count = events.stream()
                    .filter(e -> e.matches(expect.level(), expect.loggerPattern(), expect.messagePattern()))
                    .count();
            if (count < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        Recorder recorder = context.getStore(NAMESPACE).remove(RECORDER, Recorder.class);
        if (recorder != null) {
            loggerContext().getTurboFilterList().remove(recorder);
            recorder.stop();
        }
    }

    private static boolean covered(Event event, List<AllowLog> allows, List<ExpectLog> expects) {
        for (AllowLog allow : allows) {
            if (event.matches(allow.level(), allow.loggerPattern(), allow.messagePattern())) {
                return true;
            }
        }
        for (ExpectLog expect : expects) {
            if (event.matches(expect.level(), expect.loggerPattern(), expect.messagePattern())) {
                return true;
            }
        }
        return false;
    }

    private static Recorder recorder(ExtensionContext context) {
        return context.getStore(NAMESPACE).get(RECORDER, Recorder.class);
    }

    private static <A extends Annotation> A find(ExtensionContext context, Class<A> type) {
        A onMethod = context.getElement().map(el -> el.getAnnotation(type)).orElse(null);
        return onMethod != null ? onMethod : context.getTestClass().map(c -> c.getAnnotation(type)).orElse(null);
    }

    private static <A extends Annotation> List<A> findAll(ExtensionContext context, Class<A> type) {
        List<A> all = new ArrayList<>();
        context.getTestClass().ifPresent(c -> all.addAll(List.of(c.getAnnotationsByType(type))));
        context.getTestMethod().ifPresent(m -> all.addAll(List.of(m.getAnnotationsByType(type))));
        return all;
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private record Event(String loggerName, Level level, String message) {
        boolean matches(LogLevel minimum, String loggerPattern, String messagePattern) {
            return level.isGreaterOrEqual(minimum.toLogback())
                    && Pattern.matches(loggerPattern, loggerName)
                    && Pattern.matches(messagePattern, message);
        }

        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    /**
     * Records every event at INFO or above. Level checks without a message are ignored.
     */
    private static final class Recorder extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            if (format != null && level.isGreaterOrEqual(Level.INFO)) {
                String message = MessageFormatter.arrayFormat(format, params).getMessage();
                events.add(new Event(logger.getName(), level, message == null ? "" : message));
            }
            return FilterReply.NEUTRAL;
        }

        List<Event> events() {
            return new ArrayList<>(events);
        }

        void clear() {
            events.clear();
        }
    }
}

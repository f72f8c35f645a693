package org.spindlecheck.junit.extensions.logging;

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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when it logs at WARN or above without declaring it.
 * <p>
 * Events matching an {@link AllowLog} are tolerated, events matching an {@link ExpectLog} are
 * required. Both are swallowed so the build output stays clean. {@link FailOnLog} lowers or
 * raises the watched level, or disables the check.
 * </p>
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeAll(ExtensionContext context) {
        LoggerContext lc = (LoggerContext) LoggerFactory.getILoggerFactory();
        WatchFilter filter = new WatchFilter(resolveRules(context));
        filter.start();
        lc.addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).get("filter", WatchFilter.class);
        if (filter != null) {
            filter.rules = resolveRules(context);
            filter.events.clear();
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).get("filter", WatchFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (Captured e : filter.events) {
                if (!isAllowed(e, rules) && !isExpected(e, rules)) {
                    problems.add("Unexpected log: [" + e.level + "] " + e.loggerName + " - " + e.message);
                }
            }
        }
        for (ExpectLog exp : rules.expects) {
            long count = filter.events.stream()
                    .filter(e -> matches(e, toLogback(exp.level()), exp.loggerPattern(), exp.messagePattern()))
                    .count();
            if (count < exp.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        exp.occurrences(), exp.level(), exp.loggerPattern(), exp.messagePattern(), count));
            }
        }
        filter.events.clear();
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).remove("filter", WatchFilter.class);
        if (filter != null) {
            LoggerContext lc = (LoggerContext) LoggerFactory.getILoggerFactory();
            lc.getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static Rules resolveRules(ExtensionContext context) {
        FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
                .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
        List<AllowLog> allows = new ArrayList<>();
        List<ExpectLog> expects = new ArrayList<>();
        context.getTestClass().ifPresent(c -> {
            allows.addAll(List.of(c.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(c.getAnnotationsByType(ExpectLog.class)));
        });
        context.getTestMethod().ifPresent(m -> {
            allows.addAll(List.of(m.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(m.getAnnotationsByType(ExpectLog.class)));
        });
        LogLevel minLevel = fail != null ? fail.level() : LogLevel.WARN;
        boolean disabled = fail != null && fail.disabled();
        return new Rules(toLogback(minLevel), disabled, allows, expects);
    }

    private static boolean isAllowed(Captured e, Rules rules) {
        return rules.allows.stream()
                .anyMatch(a -> matches(e, toLogback(a.level()), a.loggerPattern(), a.messagePattern()));
    }

    private static boolean isExpected(Captured e, Rules rules) {
        return rules.expects.stream()
                .anyMatch(x -> matches(e, toLogback(x.level()), x.loggerPattern(), x.messagePattern()));
    }

    private static boolean matches(Captured e, Level level, String loggerPattern, String messagePattern) {
        return e.level.isGreaterOrEqual(level)
                && Pattern.matches(loggerPattern, e.loggerName)
                && Pattern.matches(messagePattern, e.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Captured(String loggerName, Level level, String message) {
    }

    private record Rules(Level minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {
    }

    private static final class WatchFilter extends TurboFilter {
        private final List<Captured> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        WatchFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            // isXxxEnabled() probes arrive without a format
            if (format == null || level == null || !level.isGreaterOrEqual(rules.minLevel)) {
                return FilterReply.NEUTRAL;
            }
            String message = MessageFormatter.arrayFormat(format, params).getMessage();
            Captured event = new Captured(logger.getName(), level, message);
            events.add(event);
            return isAllowed(event, rules) || isExpected(event, rules) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}

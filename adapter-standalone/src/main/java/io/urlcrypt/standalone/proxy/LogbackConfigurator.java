package io.urlcrypt.standalone.proxy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback setup from the {@code logging} config section.
 *
 * <p>
 * {@code json} uses Logback's {@link JsonEncoder}, which carries MDC (including
 * the per-request {@code requestId}) as structured fields. Any other format
 * selects a text pattern that prints the request id inline.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDOUT";

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} [%X{requestId}] - %msg%n";

    /** Server libraries pinned below the configured level. */
    private static final Map<String, Level> LIBRARY_LEVELS =
            Map.of("org.eclipse.jetty", Level.WARN, "io.javalin", Level.INFO);

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the root appender and applies {@code level} to the root and
     * {@code io.urlcrypt} loggers.
     *
     * @param format "json" or "text"
     * @param level  TRACE, DEBUG, INFO, WARN or ERROR; unknown values fall back
     *               to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level resolved = Level.toLevel(level, Level.INFO);

        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(resolved);
        context.getLogger("io.urlcrypt").setLevel(resolved);
        LIBRARY_LEVELS.forEach((name, libraryLevel) -> context.getLogger(name).setLevel(libraryLevel));

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setEncoder(encoderFor(format, context));
        appender.start();

        rootLogger.detachAndStopAllAppenders();
        rootLogger.addAppender(appender);
    }

    private static Encoder<ILoggingEvent> encoderFor(String format, LoggerContext context) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}

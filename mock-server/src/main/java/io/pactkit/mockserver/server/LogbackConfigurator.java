package io.pactkit.mockserver.server;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import java.util.List;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback setup for a standalone mock-server process, applied
 * once the configuration has been read.
 *
 * <p>
 * {@code json} output uses Logback's {@link JsonEncoder}, one object per
 * line, for CI log collectors. {@code text} is the console pattern also used
 * by the bundled {@code logback.xml}. The configured level applies to the
 * {@code io.pactkit} loggers; Jetty and Javalin stay at WARN so that request
 * matching is not drowned out by connector chatter.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    static final String PACTKIT_LOGGER = "io.pactkit";

    private static final List<String> QUIET_LOGGERS = List.of("org.eclipse.jetty", "io.javalin");

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the console appender and sets levels.
     *
     * @param format {@code json} or {@code text}; anything else falls back to text
     * @param level  level for pact-kit's own loggers; INFO if not a Logback level name
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level pactkitLevel = Level.toLevel(level, Level.INFO);

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("CONSOLE");
        appender.setEncoder(encoder(context, format));
        appender.start();

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.addAppender(appender);
        root.setLevel(pactkitLevel.isGreaterOrEqual(Level.INFO) ? pactkitLevel : Level.INFO);

        context.getLogger(PACTKIT_LOGGER).setLevel(pactkitLevel);
        QUIET_LOGGERS.forEach(name -> context.getLogger(name).setLevel(Level.WARN));

        if (!"json".equalsIgnoreCase(format) && !"text".equalsIgnoreCase(format)) {
            context.getLogger(LogbackConfigurator.class)
                    .warn("Unknown logging format '{}', using text", format);
        }
    }

    static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
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

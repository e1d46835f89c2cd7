package ai.swiftstyle.lint.logging;

import ai.swiftstyle.lint.config.LogFormat;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Switches the encoder of the root logger's stream appenders between plain text and JSON lines.
 * Diagnostics own stdout, so an appender is added on stderr when none is configured.
 */
public final class LoggingConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";
    private static final String FALLBACK_APPENDER = "STDERR";

    private LoggingConfigurator() {
    }

    public static void configure(LogFormat format) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            return;
        }
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        List<OutputStreamAppender<ILoggingEvent>> appenders = streamAppenders(root);
        if (appenders.isEmpty()) {
            appenders.add(addStderrAppender(context, root));
        }
        for (OutputStreamAppender<ILoggingEvent> appender : appenders) {
            restartAppender(appender, createEncoder(context, format));
        }
    }

    static Encoder<ILoggingEvent> createEncoder(LoggerContext context, LogFormat format) {
        return switch (format) {
            case JSON -> jsonEncoder(context);
            case TEXT -> textEncoder(context);
        };
    }

    private static List<OutputStreamAppender<ILoggingEvent>> streamAppenders(Logger root) {
        List<OutputStreamAppender<ILoggingEvent>> appenders = new ArrayList<>();
        for (var iterator = root.iteratorForAppenders(); iterator.hasNext(); ) {
            Appender<ILoggingEvent> appender = iterator.next();
            if (appender instanceof OutputStreamAppender<ILoggingEvent> outputStreamAppender) {
                appenders.add(outputStreamAppender);
            }
        }
        return appenders;
    }

    private static OutputStreamAppender<ILoggingEvent> addStderrAppender(LoggerContext context, Logger root) {
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(FALLBACK_APPENDER);
        appender.setTarget("System.err");
        appender.setEncoder(textEncoder(context));
        appender.start();
        root.addAppender(appender);
        return appender;
    }

    private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
        JsonLineLayout layout = new JsonLineLayout();
        layout.setContext(context);
        layout.start();
        LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
        encoder.setContext(context);
        encoder.setLayout(layout);
        encoder.start();
        return encoder;
    }

    private static Encoder<ILoggingEvent> textEncoder(LoggerContext context) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }

    private static void restartAppender(OutputStreamAppender<ILoggingEvent> appender,
                                        Encoder<ILoggingEvent> encoder) {
        boolean running = appender.isStarted();
        if (running) {
            appender.stop();
        }
        appender.setEncoder(encoder);
        if (running) {
            appender.start();
        }
    }
}

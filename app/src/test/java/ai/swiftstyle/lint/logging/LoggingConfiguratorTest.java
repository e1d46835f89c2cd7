package ai.swiftstyle.lint.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.swiftstyle.lint.config.LogFormat;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.junit.jupiter.api.Test;

class LoggingConfiguratorTest {

    @Test
    void jsonFormatWrapsJsonLineLayout() {
        LoggerContext context = new LoggerContext();

        Encoder<ILoggingEvent> encoder = LoggingConfigurator.createEncoder(context, LogFormat.JSON);

        assertThat(encoder).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(((LayoutWrappingEncoder<ILoggingEvent>) encoder).getLayout()).isInstanceOf(JsonLineLayout.class);
        assertThat(encoder.isStarted()).isTrue();
    }

    @Test
    void textFormatUsesPattern() {
        LoggerContext context = new LoggerContext();

        Encoder<ILoggingEvent> encoder = LoggingConfigurator.createEncoder(context, LogFormat.TEXT);

        assertThat(encoder).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) encoder).getPattern()).isEqualTo(LoggingConfigurator.TEXT_PATTERN);
    }
}

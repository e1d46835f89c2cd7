package ai.swiftstyle.lint.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class JsonLineLayoutTest {

    private LoggerContext context;
    private JsonLineLayout layout;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        layout = new JsonLineLayout();
        layout.setContext(context);
        layout.start();
    }

    @Test
    void formatsEventAsJson() {
        String json = layout.doLayout(event("hello world"));

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"hello world\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).contains("\"thread\":\"main\"");
        assertThat(json).endsWith("}" + System.lineSeparator());
    }

    @Test
    void promotesMdcEntriesToFields() {
        LoggingEvent event = event("linted");
        event.setMDCPropertyMap(Map.of("file", "Sources/View.swift", "level", "shadowed"));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"file\":\"Sources/View.swift\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("shadowed");
    }

    @Test
    void escapesControlCharactersAndQuotes() {
        assertThat(JsonLineLayout.quote("a \"b\"\n\tc\\")).isEqualTo("\"a \\\"b\\\"\\n\\tc\\\\\"");
        assertThat(JsonLineLayout.quote("\u0001")).isEqualTo("\"\\u0001\"");
        assertThat(JsonLineLayout.quote(null)).isEqualTo("null");
    }

    private LoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}

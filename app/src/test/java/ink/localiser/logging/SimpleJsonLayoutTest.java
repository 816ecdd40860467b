package ink.localiser.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    @Test
    void formatsEventAsJson() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("ink.localiser.patch.PatchApplier");
        event.setMessage("Updating IDs in file: \"main.ink\"");
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        event.setMDCPropertyMap(Map.of());

        String json = layout.doLayout(event);

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"Updating IDs in file: \\\"main.ink\\\"\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void writesScriptContextFromMdc() {
        LoggerContext context = new LoggerContext();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.ERROR);
        event.setLoggerName("ink.localiser.script.ScriptParser");
        event.setMessage("Parse error");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        event.setMDCPropertyMap(Map.of("line", "3", "file", "main.ink"));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"message\":\"Parse error\",\"file\":\"main.ink\",\"line\":\"3\"}");
    }

    @Test
    void escapesControlCharacters() {
        assertThat(SimpleJsonLayout.quote("a\nb\u0001")).isEqualTo("\"a\\nb\\u0001\"");
        assertThat(SimpleJsonLayout.quote(null)).isEqualTo("null");
    }
}

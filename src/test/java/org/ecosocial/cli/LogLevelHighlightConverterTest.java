package org.ecosocial.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.ecosocial.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LogLevelHighlightConverterTest {

    private static String render(Level level, String text) {
        ILoggingEvent event = mock(ILoggingEvent.class);
        when(event.getLevel()).thenReturn(level);
        return new LogLevelHighlightConverter().transform(event, text);
    }

    @Test
    void wrapsLevelsInTheirColour() {
        assertThat(render(Level.ERROR, "ERROR")).isEqualTo("\u001B[31mERROR" + LogLevelHighlightConverter.RESET);
        assertThat(render(Level.WARN, "WARN")).startsWith("\u001B[33m").endsWith(LogLevelHighlightConverter.RESET);
        assertThat(render(Level.INFO, "INFO")).startsWith("\u001B[36m");
        assertThat(render(Level.DEBUG, "DEBUG")).startsWith("\u001B[2m");
    }

    @Test
    void leavesTraceUnstyled() {
        assertThat(render(Level.TRACE, "TRACE")).isEqualTo("TRACE");
    }
}

package org.ecosocial.junit.extensions.logging;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LogWatchExtensionTest {

    private static final Logger LOG = LoggerFactory.getLogger(LogWatchExtensionTest.class);

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Discarding unreadable file.*")
    void expectationMatchesMessageSpanningSeveralLines() {
        LOG.warn("Discarding unreadable file {}: {}", "h.json",
                "Use JsonReader.setStrictness(Strictness.LENIENT) to accept malformed JSON at line 1 column 3 path $\n"
                        + "See https://github.com/google/gson/blob/main/Troubleshooting.md#malformed-json");
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "first.*")
    void allowanceMatchesMessageSpanningSeveralLines() {
        LOG.warn("first line\nsecond line");
    }

    @Test
    @FailOnLog(level = LogLevel.ERROR)
    void warningsBelowRaisedThresholdPass() {
        LOG.warn("Below the threshold of this test");
    }

    @Test
    @FailOnLog(disabled = true)
    void disabledCheckLetsErrorsThrough() {
        LOG.error("Not checked in this test");
    }
}

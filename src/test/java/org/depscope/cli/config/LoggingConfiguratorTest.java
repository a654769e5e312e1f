package org.depscope.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void resetLevels() {
        context.getLogger("depscope.test.quoted").setLevel(null);
        context.getLogger("depscope.test.nested").setLevel(null);
        context.getLogger("depscope.test.direct").setLevel(null);
    }

    @Test
    void appliesQuotedAndNestedLoggerNames() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
                logging.levels {
                  "depscope.test.quoted" = ERROR
                  depscope.test.nested = TRACE
                }
                """));

        assertThat(context.getLogger("depscope.test.quoted").getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("depscope.test.nested").getLevel()).isEqualTo(Level.TRACE);
    }

    @Test
    void missingBlockChangesNothing() {
        LoggingConfigurator.configure(ConfigFactory.parseString("other = 1"));

        assertThat(context.getLogger("depscope.test.quoted").getLevel()).isNull();
    }

    @Test
    void unknownLevelFallsBackToDebug() {
        LoggingConfigurator.setLevel("depscope.test.direct", "LOUD");

        assertThat(context.getLogger("depscope.test.direct").getLevel()).isEqualTo(Level.DEBUG);
    }
}

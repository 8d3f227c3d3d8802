package ascii.diagram.corrector.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ascii.diagram.corrector.config.LogFormat;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    @AfterEach
    void restoreDefaults() {
        LoggingConfigurator.configure(LogFormat.TEXT, false);
    }

    @Test
    void verboseEnablesDebugLogging() {
        LoggingConfigurator.configure(LogFormat.TEXT, true);

        assertThat(rootLogger().getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void quietRunOnlyReportsWarnings() {
        LoggingConfigurator.configure(LogFormat.JSON, false);

        assertThat(rootLogger().getLevel()).isEqualTo(Level.WARN);
        assertThat(rootLogger().isDebugEnabled()).isFalse();
    }

    private static Logger rootLogger() {
        return (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }
}

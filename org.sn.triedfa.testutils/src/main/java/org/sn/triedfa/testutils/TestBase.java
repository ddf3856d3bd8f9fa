package org.sn.triedfa.testutils;

import static java.lang.System.Logger.Level.INFO;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.extension.ExtendWith;


/**
 * Base test class that logs when each test starts and finishes, with the elapsed time.
 * Run with -Djava.util.logging.config.file=target/test-classes/logging.properties to see TRACE output of the code under test.
 * The pom.xml passes this parameter to surefire.
 */
@ExtendWith(LogFailureToConsoleTestWatcher.class)
public abstract class TestBase {
    private final System.Logger logger = System.getLogger(getClass().getName());
    private Instant startOfTest;

    @BeforeEach
    void logTestStarted(TestInfo testInfo) {
        startOfTest = Instant.now();
        logger.log(INFO, "test started: " + testInfo.getDisplayName());
    }

    @AfterEach
    void logTestFinished(TestInfo testInfo) {
        logger.log(INFO, () -> "test finished: " + testInfo.getDisplayName()
                + " (" + Duration.between(startOfTest, Instant.now()).toMillis() + "ms)");
    }
}

package org.sn.triedfa.testutils;

import java.util.Arrays;
import java.util.Optional;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.TestWatcher;


/**
 * Print the call stack of a failed test to stderr, cut off below the last org.sn.triedfa frame
 * so that the JUnit and reflection frames do not hide the assertion.
 */
public final class LogFailureToConsoleTestWatcher implements TestWatcher {
    private static final String PACKAGE_PREFIX = "org.sn.triedfa.";

    @Override
    public void testDisabled(ExtensionContext context, Optional<String> reason) {
        System.err.println(context.getDisplayName() + " disabled: " + reason.orElse("no reason given"));
    }

    @Override
    public void testAborted(ExtensionContext context, Throwable cause) {
        System.err.println(context.getDisplayName() + " aborted: " + cause);
    }

    @Override
    public void testFailed(ExtensionContext context, Throwable cause) {
        System.err.println(context.getRequiredTestClass().getSimpleName() + "." + context.getDisplayName() + " failed");
        cause.setStackTrace(truncateCallStack(cause.getStackTrace()));
        cause.printStackTrace();
    }

    private static StackTraceElement[] truncateCallStack(StackTraceElement[] stackTraceElements) {
        int lastElem = stackTraceElements.length - 1;
        for ( ; lastElem >= 0; lastElem--) {
            if (stackTraceElements[lastElem].getClassName().startsWith(PACKAGE_PREFIX)) {
                break;
            }
        }
        if (lastElem < 0) {
            return stackTraceElements;
        }
        return Arrays.copyOf(stackTraceElements, lastElem + 1);
    }
}

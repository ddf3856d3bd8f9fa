package org.sn.triedfa.testutils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import java.util.function.Predicate;


public class TestUtil {
    private TestUtil() {
    }

    /**
     * Split a multi-line document such as a DOT graph into its lines.
     */
    public static List<String> lines(String document) {
        return document.lines().toList();
    }

    /**
     * Return the number of lines matching the predicate.
     */
    public static long countLines(List<String> lines, Predicate<String> predicate) {
        return lines.stream().filter(predicate).count();
    }

    /**
     * Assert that the desired exception is thrown.
     *
     * @throws AssertionError if assertion fails
     */
    public static <T, U extends Throwable> void assertExceptionFromCallable(Callable<T> callable, Class<U> expectedExceptionClass) {
        assertExceptionFromCallable(callable, expectedExceptionClass, ignored -> { });
    }

    /**
     * Assert that the desired exception is thrown with the given message.
     *
     * @throws AssertionError if assertion fails
     */
    public static <T, U extends Throwable> void assertExceptionFromCallable(Callable<T> callable, Class<U> expectedExceptionClass, String expectedMessage) {
        assertExceptionFromCallable(callable, expectedExceptionClass, exception -> assertEquals(expectedMessage, exception.getMessage()));
    }

    /**
     * Assert that the desired exception is thrown.
     *
     * @param callable the function to run.
     * @param expectedExceptionClass the class of exception to expect.
     * @param exceptionChecker the function to check if the exception has the right value
     * @throws AssertionError if assertion fails
     */
    @SuppressWarnings("unchecked")
    public static <T, U extends Throwable> void assertExceptionFromCallable(Callable<T> callable, Class<U> expectedExceptionClass, Consumer<U> exceptionChecker) {
        Throwable thrown = null;
        try {
            callable.call();
        } catch (Throwable e) {
            thrown = e;
        }
        if (thrown == null) {
            fail("Expected exception " + expectedExceptionClass.getSimpleName() + ", but got no exception");
        }
        assertTrue(expectedExceptionClass.isInstance(thrown), "Expected " + expectedExceptionClass.getSimpleName()
                + " or an exception derived from it, but got " + thrown.getClass().getSimpleName());
        exceptionChecker.accept((U) thrown);
    }

    /**
     * Assert that the desired exception is thrown.
     *
     * @throws AssertionError if assertion fails
     */
    public static <U extends Throwable> void assertException(Runnable runnable, Class<U> expectedExceptionClass) {
        assertExceptionFromCallable(() -> {
            runnable.run();
            return null;
        }, expectedExceptionClass);
    }

    /**
     * Assert that the desired exception is thrown with the given message.
     *
     * @throws AssertionError if assertion fails
     */
    public static <U extends Throwable> void assertException(Runnable runnable, Class<U> expectedExceptionClass, String expectedMessage) {
        assertExceptionFromCallable(() -> {
            runnable.run();
            return null;
        }, expectedExceptionClass, expectedMessage);
    }
}

package com.cooper;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    @Test
    void successCarriesValue() {
        Result<String> result = Result.success("value");

        assertTrue(result.isSuccess());
        assertFalse(result.isFailure());
        assertEquals("value", result.getOrThrow());
        assertEquals("value", result.getOrElse("other"));
    }

    @Test
    void failureRethrowsUncheckedAndWrapsChecked() {
        IllegalStateException unchecked = new IllegalStateException("bad");
        IOException checked = new IOException("io");

        assertSame(unchecked, assertThrows(IllegalStateException.class,
                () -> Result.<String>failure(unchecked).getOrThrow()));
        ReplyException wrapped = assertThrows(ReplyException.class,
                () -> Result.<String>failure(checked).getOrThrow());
        assertSame(checked, wrapped.getCause());
    }

    @Test
    void getOrElseOnFailure() {
        Result<String> result = Result.failure(new IOException("io"));

        assertTrue(result.isFailure());
        assertEquals("default", result.getOrElse("default"));
        assertEquals("io", result.getOrElse(Throwable::getMessage));
    }

    @Test
    void mapCapturesExceptions() {
        Result<Integer> length = Result.success("abc").map(String::length);
        Result<Integer> broken = Result.success("abc").map(s -> Integer.parseInt(s));

        assertEquals(3, length.getOrThrow());
        assertInstanceOf(NumberFormatException.class, ((Result.Failure<Integer>) broken).error());
    }

    @Test
    void failurePropagatesThroughMapAndFlatMap() {
        IOException error = new IOException("io");
        Result<Integer> result = Result.<String>failure(error)
                .map(String::length)
                .flatMap(n -> Result.success(n * 2));

        assertSame(error, ((Result.Failure<Integer>) result).error());
    }

    @Test
    void recoverTurnsFailureIntoSuccess() {
        Result<String> recovered = Result.<String>failure(new IOException("io")).recover(e -> "fallback");
        assertEquals("fallback", recovered.getOrThrow());
    }

    @Test
    void attemptWrapsThrownException() {
        Result<String> result = Result.attempt(() -> {
            throw new IOException("io");
        });
        assertTrue(result.isFailure());
    }

    @Test
    void consumersOnlyRunForMatchingSide() {
        AtomicReference<String> value = new AtomicReference<>();
        AtomicReference<Throwable> error = new AtomicReference<>();

        Result.success("v").ifSuccess(value::set);
        Result.success("v").ifFailure(error::set);

        assertEquals("v", value.get());
        assertNull(error.get());
    }
}

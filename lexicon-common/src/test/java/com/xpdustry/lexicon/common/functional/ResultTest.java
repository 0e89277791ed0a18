package com.xpdustry.lexicon.common.functional;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ResultTest {

    @Test
    void test_success() {
        final Result<Integer, String> result = Result.success(3);
        Assertions.assertTrue(result.isSuccess());
        Assertions.assertEquals(3, result.value());
        Assertions.assertThrows(NullPointerException.class, result::error);
        Assertions.assertEquals(Result.success("3"), result.map(String::valueOf));
    }

    @Test
    void test_failure() {
        final Result<Integer, String> result = Result.failure("Worker timeout");
        Assertions.assertFalse(result.isSuccess());
        Assertions.assertEquals("Worker timeout", result.error());
        Assertions.assertThrows(NullPointerException.class, result::value);
        Assertions.assertEquals(result, result.map(String::valueOf));
    }
}

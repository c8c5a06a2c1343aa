package com.portos.core.provider;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WaitTimeParserTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "1 day 1 hour 33 minutes | 91980",
            "2 hours                 | 7200",
            "45 sec                  | 45",
            "5 MIN                   | 300",
            "3 days                  | 259200",
            "1 hour 30 seconds       | 3630",
            "try again in 10min      | 600"
    })
    void parsesUnits(String text, long seconds) {
        assertEquals(Duration.ofSeconds(seconds), WaitTimeParser.parse(text).orElseThrow());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "soon", "0 minutes", "later today"})
    void unparseableIsEmpty(String text) {
        assertTrue(WaitTimeParser.parse(text).isEmpty());
    }

    @Test
    void overflowIsEmpty() {
        assertTrue(WaitTimeParser.parse("99999999999999999999 days").isEmpty());
    }
}

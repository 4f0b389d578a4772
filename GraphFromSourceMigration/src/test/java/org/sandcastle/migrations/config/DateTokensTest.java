package org.sandcastle.migrations.config;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DateTokensTest {

    private final DateTokens dateTokens = new DateTokens(Clock.fixed(Instant.parse("2024-02-27T10:15:30Z"), ZoneOffset.UTC));

    @ParameterizedTest
    @CsvSource({
        "@today, 2024-02-27",
        "@today+2d, 2024-02-29",
        "@today+30d, 2024-03-28",
        "@today-27d, 2024-01-31",
        "' @today ', 2024-02-27",
        "Prospecting, Prospecting",
        "@tomorrow, @tomorrow",
        "@today+3w, @today+3w"
    })
    void tokensAreResolvedAgainstTheClock(String value, String expected) {
        assertEquals(expected, dateTokens.resolve(value));
    }

    @Test
    void nonTextValuesPassThrough() {
        assertEquals(42, dateTokens.resolve(42));
        assertEquals(Boolean.TRUE, dateTokens.resolve(true));
    }
}

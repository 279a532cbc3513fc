package com.chathub.common.infra;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class EnvUtilsTest {

    @ParameterizedTest
    @ValueSource(strings = { "1", "true", "TRUE", " yes ", "on" })
    void isTruthy_acceptsTruthyValues(String value) {
        assertTrue(EnvUtils.isTruthy(value));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "0", "false", "nope", "  " })
    void isTruthy_rejectsOthers(String value) {
        assertFalse(EnvUtils.isTruthy(value));
    }

    @Test
    void logAcceptedEnvOption_readsOnlyTheNamedKey() {
        List<String> lookups = new ArrayList<>();
        Function<String, String> env = key -> {
            lookups.add(key);
            return "TRUST_PROXY_HEADERS".equals(key) ? "yes" : null;
        };

        EnvUtils.logAcceptedEnvOption(env, "TRUST_PROXY_HEADERS", "trust proxy headers");
        EnvUtils.logAcceptedEnvOption(env, "OPENROUTER_API_KEY", "AI credential", true);

        assertEquals(List.of("TRUST_PROXY_HEADERS", "OPENROUTER_API_KEY"), lookups);
    }

    @Test
    void parseNonNegativeInt_fallsBack() {
        assertEquals(42, EnvUtils.parseNonNegativeInt(" 42 ", 7));
        assertEquals(7, EnvUtils.parseNonNegativeInt("x", 7));
        assertEquals(7, EnvUtils.parseNonNegativeInt("-1", 7));
        assertEquals(7, EnvUtils.parseNonNegativeInt(null, 7));
        assertEquals(0, EnvUtils.parseNonNegativeInt("0", 7));
    }

    @Test
    void stringOrDefault_trims() {
        assertEquals("model", EnvUtils.stringOrDefault("  model ", "x"));
        assertEquals("x", EnvUtils.stringOrDefault("   ", "x"));
        assertEquals("x", EnvUtils.stringOrDefault(null, "x"));
    }
}

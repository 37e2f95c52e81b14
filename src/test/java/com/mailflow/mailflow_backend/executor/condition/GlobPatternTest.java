package com.mailflow.mailflow_backend.executor.condition;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.regex.PatternSyntaxException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GlobPatternTest {

    @ParameterizedTest(name = "{0} ~ {1} -> {2}")
    @CsvSource({
            "*@github.com,       notifications@github.com, true",
            "*@github.com,       NOTIFICATIONS@GITHUB.COM, true",
            "*@github.com,       x@github.com.evil.io,     false",
            "*@github.com,       x@githubxcom,             false",
            "'[URGENT] *',       '[urgent] server down',   true",
            "'[URGENT] *',       'U server down',          false",
            "a+b (1),            a+b (1),                  true",
            "a+b (1),            aab 1,                    false",
            "price $5,           PRICE $5,                 true",
            "*,                  anything at all,          true"
    })
    void matchesWholeValueCaseInsensitively(String glob, String value, boolean expected) {
        assertThat(GlobPattern.matches(glob, value)).isEqualTo(expected);
    }

    @Test
    void escapesBackslashesAndBraces() {
        assertThat(GlobPattern.matches("C:\\temp\\{id}", "c:\\TEMP\\{id}")).isTrue();
        assertThat(GlobPattern.matches("a|b", "a")).isFalse();
    }

    @Test
    void questionMarkIsNotEscaped() {
        assertThat(GlobPattern.matches("colou?r", "color")).isTrue();
        assertThatThrownBy(() -> GlobPattern.compile("what???")).isInstanceOf(PatternSyntaxException.class);
    }
}

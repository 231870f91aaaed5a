/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.detect;

import static org.assertj.core.api.Assertions.assertThat;

import io.scrubflow4j.core.api.model.Substitution;
import org.junit.jupiter.api.Test;

class SecretPatternTest {

    @Test
    void maskedReplacesEveryMatchAndCounts() {
        SecretPattern p = SecretPattern.masked("ticket", "TKT-\\d+");

        Substitution s = p.apply("see TKT-1 and TKT-22");

        assertThat(s.text()).isEqualTo("see [REDACTED:ticket] and [REDACTED:ticket]");
        assertThat(s.count()).isEqualTo(2);
        assertThat(s.changed()).isTrue();
    }

    @Test
    void allowedMatchesAreKeptAndNotCounted() {
        SecretPattern p = SecretPattern.masked("ticket", "TKT-\\d+", m -> m.equals("TKT-1"));

        Substitution s = p.apply("TKT-1 TKT-2");

        assertThat(s.text()).isEqualTo("TKT-1 [REDACTED:ticket]");
        assertThat(s.count()).isEqualTo(1);
        assertThat(p.findAll("TKT-1 TKT-2")).containsExactly("TKT-2");
    }

    @Test
    void rewrittenPlaceholderMayKeepPartOfTheMatch() {
        SecretPattern p = SecretPattern.rewritten("kv", "key=\\w+", m -> "key=<gone>");

        assertThat(p.apply("a key=abc b").text()).isEqualTo("a key=<gone> b");
    }

    @Test
    void replacementTextIsTakenLiterally() {
        SecretPattern p = SecretPattern.rewritten("dollar", "x+", m -> "$1\\");

        assertThat(p.apply("axxb").text()).isEqualTo("a$1\\b");
    }

    @Test
    void noMatchReturnsSameText() {
        SecretPattern p = SecretPattern.masked("ticket", "TKT-\\d+");
        String text = "nothing here";

        Substitution s = p.apply(text);

        assertThat(s.text()).isSameAs(text);
        assertThat(s.changed()).isFalse();
    }

    @Test
    void repeatedCallsDoNotShareMatcherState() {
        SecretPattern p = SecretPattern.masked("ticket", "TKT-\\d+");

        for (int i = 0; i < 3; i++) {
            assertThat(p.apply("TKT-9").count()).isEqualTo(1);
            assertThat(p.findAll("TKT-9 TKT-8")).hasSize(2);
        }
    }
}

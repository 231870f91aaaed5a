/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.identity;

import static org.assertj.core.api.Assertions.assertThat;

import io.scrubflow4j.core.api.model.Substitution;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class UsernameHasherTest {

    @Test
    void hashIsStableSha256Prefix() {
        assertThat(UsernameHasher.hash("testuser123")).isEqualTo("user_d79aeec7");
        assertThat(UsernameHasher.hash("alice")).isEqualTo("user_2bd806c9");
        assertThat(UsernameHasher.hash("alice")).matches("user_[0-9a-f]{8}");
    }

    @Test
    void replacesPlainOccurrencesAndCountsThem() {
        Substitution s = UsernameHasher.anonymize("/home/alice/x and alice again", List.of("alice"));

        assertThat(s.text()).isEqualTo("/home/user_2bd806c9/x and user_2bd806c9 again");
        assertThat(s.count()).isEqualTo(2);
    }

    @Test
    void hyphenEncodedProjectDirectoryIsCovered() {
        Substitution s = UsernameHasher.anonymize("~/.claude/projects/-Users-alice-code-app/log", List.of("alice"));

        assertThat(s.text()).contains("-Users-user_2bd806c9-code-app").doesNotContain("alice");
    }

    @Test
    void blankAndNullCandidatesAreSkipped() {
        String text = "nothing to see";

        Substitution s = UsernameHasher.anonymize(text, Arrays.asList("", "  ", null));

        assertThat(s.changed()).isFalse();
        assertThat(s.text()).isSameAs(text);
    }

    @Test
    void placeholdersContainingTheNameAreLeftIntact() {
        Substitution s = UsernameHasher.anonymize("[REDACTED:pypi-token] pushed by pi", List.of("pi"));

        assertThat(s.text()).isEqualTo("[REDACTED:pypi-token] pushed by user_85b42e17");
        assertThat(s.count()).isEqualTo(1);
    }

    @Test
    void laterCandidateDoesNotRewriteEarlierPseudonym() {
        Substitution s = UsernameHasher.anonymize("alice is a user", List.of("alice", "user"));

        assertThat(s.text()).isEqualTo("user_2bd806c9 is a user_04f8996d");
        assertThat(s.count()).isEqualTo(2);
    }
}

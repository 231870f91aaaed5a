/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UsernameDetectorTest {

    private static final Path REPO = Path.of("/work/repo");

    @Mock
    private GitConfigReader git;

    @Test
    void collectsOsGitAndForgeIdentitiesInOrder() {
        when(git.userName(REPO)).thenReturn(Optional.of("Jane Doe"));
        when(git.userEmail(REPO)).thenReturn(Optional.of("jane.doe@acme.io"));
        when(git.originUrl(REPO)).thenReturn(Optional.of("git@github.com:janedoe/app.git"));
        UsernameDetector detector =
                new UsernameDetector(IdentityProvider.fixed("jdoe", "/home/jdoe"), git, ForgeHandles.DEFAULT_HOST);

        List<String> names = detector.detect(REPO, List.of("jd-alias"));

        assertThat(names).containsExactly("jdoe", "/home/jdoe", "Jane Doe", "jane.doe", "janedoe", "jd-alias");
    }

    @Test
    void skipsGitWithoutWorkingDirectory() {
        UsernameDetector detector =
                new UsernameDetector(IdentityProvider.fixed("jdoe", "/home/jdoe"), git, ForgeHandles.DEFAULT_HOST);

        assertThat(detector.detect(null, null)).containsExactly("jdoe", "/home/jdoe");
        verify(git, never()).userName(any());
    }

    @Test
    void missingGitValuesAreIgnored() {
        when(git.userName(REPO)).thenReturn(Optional.empty());
        when(git.userEmail(REPO)).thenReturn(Optional.empty());
        when(git.originUrl(REPO)).thenReturn(Optional.of("https://gitlab.com/jdoe/app.git"));
        UsernameDetector detector =
                new UsernameDetector(IdentityProvider.fixed("jdoe", null), git, ForgeHandles.DEFAULT_HOST);

        assertThat(detector.detect(REPO, List.of())).containsExactly("jdoe");
    }

    @Test
    void dedupeTrimsDropsBlanksAndKeepsFirstSeen() {
        assertThat(UsernameDetector.dedupe(Arrays.asList(" a ", "b", "", null, "a", "  ", "c")))
                .containsExactly("a", "b", "c");
    }

    @Test
    void noneProviderWithoutGitYieldsOnlyExtras() {
        UsernameDetector detector =
                new UsernameDetector(IdentityProvider.none(), GitConfigReader.none(), ForgeHandles.DEFAULT_HOST);

        assertThat(detector.detect(REPO, List.of("x"))).containsExactly("x");
    }
}

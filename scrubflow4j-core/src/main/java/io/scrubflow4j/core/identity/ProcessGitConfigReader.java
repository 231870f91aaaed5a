/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.identity;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link GitConfigReader} backed by the {@code git} executable.
 *
 * <p>Each lookup runs {@code git -C <dir> ...} with a timeout. A missing binary, a directory that is
 * not a repository, a non-zero exit or a timeout all produce {@link Optional#empty()}.
 */
public final class ProcessGitConfigReader implements GitConfigReader {
    private static final Logger log = LoggerFactory.getLogger(ProcessGitConfigReader.class);

    private final String executable;
    private final Duration timeout;

    public ProcessGitConfigReader(Duration timeout) {
        this("git", timeout);
    }

    public ProcessGitConfigReader(String executable, Duration timeout) {
        this.executable = Objects.requireNonNull(executable, "executable");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public Optional<String> userName(Path workingDirectory) {
        return run(workingDirectory, "config", "user.name");
    }

    @Override
    public Optional<String> userEmail(Path workingDirectory) {
        return run(workingDirectory, "config", "user.email");
    }

    @Override
    public Optional<String> originUrl(Path workingDirectory) {
        return run(workingDirectory, "remote", "get-url", "origin");
    }

    private Optional<String> run(Path dir, String... args) {
        if (dir == null) return Optional.empty();
        List<String> cmd = new ArrayList<>();
        cmd.add(executable);
        cmd.add("-C");
        cmd.add(dir.toString());
        cmd.addAll(List.of(args));

        Process p;
        try {
            p = new ProcessBuilder(cmd)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            log.debug("git unavailable for {}: {}", String.join(" ", args), e.getMessage());
            return Optional.empty();
        }

        try (InputStream stdout = p.getInputStream()) {
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                log.debug("git {} timed out after {}", String.join(" ", args), timeout);
                return Optional.empty();
            }
            if (p.exitValue() != 0) {
                log.debug("git {} exited with {}", String.join(" ", args), p.exitValue());
                return Optional.empty();
            }
            String out = new String(stdout.readAllBytes(), StandardCharsets.UTF_8).trim();
            return out.isEmpty() ? Optional.empty() : Optional.of(out);
        } catch (IOException e) {
            log.debug("git {} output unreadable: {}", String.join(" ", args), e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
            return Optional.empty();
        }
    }
}

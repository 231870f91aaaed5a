/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.spring;

import io.scrubflow4j.core.api.model.RedactionOptions;
import io.scrubflow4j.core.detect.EntropyDetector;
import io.scrubflow4j.core.identity.ForgeHandles;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Persisted redaction settings. All defaults live here; the core receives fully populated
 * {@link RedactionOptions}.
 */
@Getter
@ConfigurationProperties(prefix = "scrubflow4j")
public class ScrubflowProperties {

    @Setter
    private boolean enabled = true;

    private Redaction redaction = new Redaction();
    private Entropy entropy = new Entropy();
    private Identity identity = new Identity();

    public void setRedaction(Redaction redaction) {
        this.redaction = (redaction == null) ? new Redaction() : redaction;
    }

    public void setEntropy(Entropy entropy) {
        this.entropy = (entropy == null) ? new Entropy() : entropy;
    }

    public void setIdentity(Identity identity) {
        this.identity = (identity == null) ? new Identity() : identity;
    }

    /** Options for the redactor; {@code usernames} replaces the configured list (it already contains it). */
    public RedactionOptions toOptions(List<String> usernames) {
        return new RedactionOptions(
                redaction.isEnabled(),
                redaction.getCustomPatterns(),
                usernames,
                redaction.getRedactStrings(),
                redaction.isRedactHighEntropy());
    }

    // ---- nested: redaction ----
    public static final class Redaction {
        @Setter
        @Getter
        private boolean enabled = true;

        @Setter
        @Getter
        private boolean redactHighEntropy = false;

        private List<String> customPatterns = new ArrayList<>();
        private List<String> redactUsernames = new ArrayList<>();
        private List<String> redactStrings = new ArrayList<>();

        public List<String> getCustomPatterns() {
            return Collections.unmodifiableList(customPatterns);
        }

        public void setCustomPatterns(List<String> v) {
            this.customPatterns = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }

        public List<String> getRedactUsernames() {
            return Collections.unmodifiableList(redactUsernames);
        }

        public void setRedactUsernames(List<String> v) {
            this.redactUsernames = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }

        public List<String> getRedactStrings() {
            return Collections.unmodifiableList(redactStrings);
        }

        public void setRedactStrings(List<String> v) {
            this.redactStrings = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }
    }

    // ---- nested: entropy ----
    @Getter
    @Setter
    public static final class Entropy {
        private double threshold = EntropyDetector.DEFAULT_THRESHOLD;
        private int minLength = EntropyDetector.DEFAULT_MIN_LENGTH;
    }

    // ---- nested: identity ----
    @Getter
    @Setter
    public static final class Identity {
        /** Read git user.name, user.email and the origin handle at startup. */
        private boolean gitLookup = true;

        private String forgeHost = ForgeHandles.DEFAULT_HOST;
        private Duration gitTimeout = Duration.ofSeconds(5);
        private Path workingDirectory; // null = process working directory
    }
}

/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.spring.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.scrubflow4j.core.api.Redactor;
import io.scrubflow4j.core.api.model.RedactionOptions;
import io.scrubflow4j.core.detect.EntropyDetector;
import io.scrubflow4j.core.identity.*;
import io.scrubflow4j.core.preset.BuiltInPatterns;
import io.scrubflow4j.core.report.NoopReporter;
import io.scrubflow4j.core.report.Reporter;
import io.scrubflow4j.core.scan.PostRedactionScanner;
import io.scrubflow4j.core.session.SessionRedactor;
import io.scrubflow4j.spring.MicrometerReporter;
import io.scrubflow4j.spring.ScrubflowEndpoint;
import io.scrubflow4j.spring.ScrubflowProperties;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the redaction engine from {@code scrubflow4j.*} properties. Every bean backs off when the
 * application defines its own.
 */
@Slf4j
@AutoConfiguration(
        afterName = {
            "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
            "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
        })
@ConditionalOnProperty(prefix = "scrubflow4j", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ScrubflowProperties.class)
public class ScrubflowAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(Reporter.class)
    public Reporter scrubflowReporter(ObjectProvider<MicrometerReporter> mic) {
        Reporter r = mic.getIfAvailable();
        return (r != null) ? r : new NoopReporter();
    }

    @Bean
    @ConditionalOnMissingBean
    public EntropyDetector scrubflowEntropyDetector(ScrubflowProperties props) {
        var e = props.getEntropy();
        return new EntropyDetector(e.getThreshold(), e.getMinLength());
    }

    @Bean
    @ConditionalOnMissingBean
    public IdentityProvider scrubflowIdentityProvider() {
        return new SystemIdentityProvider();
    }

    @Bean
    @ConditionalOnMissingBean
    public GitConfigReader scrubflowGitConfigReader(ScrubflowProperties props) {
        var id = props.getIdentity();
        return id.isGitLookup() ? new ProcessGitConfigReader(id.getGitTimeout()) : GitConfigReader.none();
    }

    @Bean
    @ConditionalOnMissingBean
    public UsernameDetector scrubflowUsernameDetector(
            ScrubflowProperties props, IdentityProvider identity, GitConfigReader git) {
        return new UsernameDetector(identity, git, props.getIdentity().getForgeHost());
    }

    @Bean
    @ConditionalOnMissingBean
    public Redactor scrubflowRedactor(EntropyDetector entropy, IdentityProvider identity, Reporter reporter) {
        return new Redactor(BuiltInPatterns.all(), entropy, identity, reporter);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionRedactor scrubflowSessionRedactor(Redactor redactor) {
        return new SessionRedactor(redactor);
    }

    @Bean
    @ConditionalOnMissingBean
    public PostRedactionScanner scrubflowPostRedactionScanner(EntropyDetector entropy) {
        return new PostRedactionScanner(BuiltInPatterns.all(), entropy);
    }

    /** Built once at startup: configured names plus the git identities of the working directory. */
    @Bean
    @ConditionalOnMissingBean
    public RedactionOptions scrubflowRedactionOptions(ScrubflowProperties props, UsernameDetector detector) {
        var id = props.getIdentity();
        Path cwd = null;
        if (id.isGitLookup()) {
            cwd = (id.getWorkingDirectory() != null)
                    ? id.getWorkingDirectory()
                    : Path.of(System.getProperty("user.dir"));
        }
        List<String> usernames = detector.detect(cwd, props.getRedaction().getRedactUsernames());
        RedactionOptions options = props.toOptions(usernames);
        log.info(
                "scrubflow4j redaction {}: {} custom pattern(s), {} literal string(s), {} identity value(s), high-entropy={}",
                options.enabled() ? "enabled" : "disabled",
                options.customPatterns().size(),
                options.redactStrings().size(),
                usernames.size(),
                options.redactHighEntropy());
        return options;
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerReporterConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean
        public MicrometerReporter scrubflowMicrometerReporter(MeterRegistry registry) {
            return new MicrometerReporter(registry, 200);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(Endpoint.class)
    static class EndpointConfiguration {

        @Bean
        @ConditionalOnAvailableEndpoint
        @ConditionalOnMissingBean
        public ScrubflowEndpoint scrubflowEndpoint(
                Redactor redactor, ScrubflowProperties props, ObjectProvider<MicrometerReporter> reporter) {
            return new ScrubflowEndpoint(redactor, props, reporter);
        }
    }
}

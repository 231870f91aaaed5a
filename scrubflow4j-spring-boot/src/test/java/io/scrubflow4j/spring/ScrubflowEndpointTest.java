/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.spring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.scrubflow4j.core.api.Redactor;
import io.scrubflow4j.core.api.model.Finding;
import io.scrubflow4j.core.identity.IdentityProvider;
import io.scrubflow4j.core.preset.BuiltInPatterns;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

class ScrubflowEndpointTest {

    @Test
    @SuppressWarnings("unchecked")
    void reportsStatusCategoriesAndRecentFindings() {
        MicrometerReporter reporter = new MicrometerReporter(new SimpleMeterRegistry(), 10);
        reporter.report(List.of(new Finding("jwt", 1)));
        ObjectProvider<MicrometerReporter> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(reporter);

        ScrubflowEndpoint endpoint =
                new ScrubflowEndpoint(new Redactor(IdentityProvider.none()), new ScrubflowProperties(), provider);
        Map<String, Object> info = endpoint.info();

        assertThat(info).containsEntry("status", "ENABLED").containsEntry("highEntropy", false);
        assertThat((List<String>) info.get("categories")).containsExactlyElementsOf(BuiltInPatterns.names());
        assertThat((List<Finding>) info.get("recentFindings")).containsExactly(new Finding("jwt", 1));
    }
}

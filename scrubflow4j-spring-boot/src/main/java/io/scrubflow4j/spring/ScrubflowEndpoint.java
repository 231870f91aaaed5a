/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.spring;

import io.scrubflow4j.core.api.Redactor;
import io.scrubflow4j.core.api.model.Finding;
import io.scrubflow4j.core.detect.SecretPattern;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

@Endpoint(id = "scrubflow")
public class ScrubflowEndpoint {

    private final Redactor redactor;
    private final ScrubflowProperties props;
    private final ObjectProvider<MicrometerReporter> reporter;

    public ScrubflowEndpoint(
            Redactor redactor, ScrubflowProperties props, ObjectProvider<MicrometerReporter> reporter) {
        this.redactor = redactor;
        this.props = props;
        this.reporter = reporter;
    }

    @ReadOperation
    public Map<String, Object> info() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", props.getRedaction().isEnabled() ? "ENABLED" : "DISABLED");
        m.put("categories", redactor.patterns().stream().map(SecretPattern::name).toList());
        m.put("highEntropy", props.getRedaction().isRedactHighEntropy());
        MicrometerReporter r = reporter.getIfAvailable();
        m.put("recentFindings", (r != null) ? r.recentFindings() : List.<Finding>of());
        return m;
    }
}

/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package demo;

import io.scrubflow4j.core.api.Redactor;
import io.scrubflow4j.core.api.model.RedactionOptions;
import io.scrubflow4j.core.api.model.RedactionResult;
import io.scrubflow4j.core.scan.PostRedactionScanner;
import io.scrubflow4j.core.scan.ScanHit;
import io.scrubflow4j.core.session.Session;
import io.scrubflow4j.core.session.SessionRedaction;
import io.scrubflow4j.core.session.SessionRedactor;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@Slf4j
public class DemoController {

    private final Redactor redactor;
    private final SessionRedactor sessionRedactor;
    private final PostRedactionScanner scanner;
    private final RedactionOptions options;

    @PostMapping(path = "/redact", consumes = MediaType.TEXT_PLAIN_VALUE)
    public RedactionResult redact(@RequestBody String text) {
        RedactionResult result = redactor.redact(text, options);
        log.info("Redacted {} item(s): {}", result.redactedCount(), result.types());
        return result;
    }

    @PostMapping(path = "/session", consumes = MediaType.APPLICATION_JSON_VALUE)
    public SessionRedaction session(@RequestBody Session session) {
        SessionRedaction out = sessionRedactor.redactSession(session, options);
        List<ScanHit> leftovers = scanner.scanSession(out.session());
        if (!leftovers.isEmpty()) {
            // categories only, never the excerpts
            log.warn(
                    "Session {} still has {} suspicious value(s) after redaction: {}",
                    session.id(),
                    leftovers.size(),
                    leftovers.stream().map(ScanHit::category).distinct().toList());
        }
        return out;
    }

    @PostMapping(path = "/scan", consumes = MediaType.TEXT_PLAIN_VALUE)
    public List<String> scan(@RequestBody String text) {
        return scanner.scanForRemaining(text);
    }
}

/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.session;

import io.scrubflow4j.core.api.Redactor;
import io.scrubflow4j.core.api.model.RedactionOptions;
import io.scrubflow4j.core.api.model.RedactionResult;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Applies the {@link Redactor} to every free-text field of a {@link Session}: message content,
 * thinking text, and each tool invocation's input summary and result.
 *
 * <p>The input is never modified; a new session value is returned. When redaction is disabled the
 * very same instance comes back.
 */
public final class SessionRedactor {
    private final Redactor redactor;

    public SessionRedactor(Redactor redactor) {
        this.redactor = Objects.requireNonNull(redactor, "redactor");
    }

    public SessionRedaction redactSession(Session session, RedactionOptions options) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(options, "options");
        if (!options.enabled()) return new SessionRedaction(session, 0, List.of());

        Totals totals = new Totals(options);
        List<Message> messages = new ArrayList<>(session.messages().size());
        for (Message msg : session.messages()) {
            String content = totals.redact(msg.content());
            String thinking = totals.redact(msg.thinking());

            List<ToolUse> tools = new ArrayList<>(msg.toolUses().size());
            for (ToolUse tu : msg.toolUses()) {
                tools.add(tu.withText(totals.redact(tu.inputSummary()), totals.redact(tu.result())));
            }
            messages.add(msg.withText(content, thinking, tools));
        }

        return new SessionRedaction(session.withMessages(messages), totals.count, List.copyOf(totals.types));
    }

    private final class Totals {
        private final RedactionOptions options;
        private final Set<String> types = new LinkedHashSet<>();
        private int count;

        Totals(RedactionOptions options) {
            this.options = options;
        }

        // null (absent thinking/result) stays null
        String redact(String text) {
            if (text == null || text.isEmpty()) return text;
            RedactionResult r = redactor.redact(text, options);
            count += r.redactedCount();
            types.addAll(r.types());
            return r.text();
        }
    }
}

package com.stepwright.orchestrator.heal;

import com.stepwright.orchestrator.checkpoint.ContentHash;
import com.stepwright.orchestrator.telemetry.SecretScrubber;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Normalized fingerprint of a failed attempt, used to spot repeats.
 *
 * Built from "step:&lt;id&gt; | skill:&lt;id&gt; | exit:&lt;code&gt; | hint:&lt;hint&gt; | &lt;message&gt;"
 * (absent parts are left out), whitespace-collapsed, scrubbed, lower-cased.
 * The fingerprint is the SHA-256 of that text.
 */
public record FailureSignature(String normalized, String fingerprint) {

    static final int MAX_MESSAGE_CHARS = 1000;

    public static FailureSignature of(String stepId, String skillId, Integer exitCode,
                                      String hint, String message, SecretScrubber scrubber) {
        List<String> parts = new ArrayList<>();
        if (stepId != null)   parts.add("step:" + stepId);
        if (skillId != null)  parts.add("skill:" + skillId);
        if (exitCode != null) parts.add("exit:" + exitCode);
        if (hint != null && !hint.isBlank()) parts.add("hint:" + hint.strip());
        if (message != null && !message.isBlank()) {
            String m = message.strip();
            parts.add(m.length() > MAX_MESSAGE_CHARS ? m.substring(0, MAX_MESSAGE_CHARS) : m);
        }
        String collapsed = String.join(" | ", parts).replaceAll("\\s+", " ").strip();
        // Scrub before lower-casing: known secret values are case-sensitive.
        String normalized = scrubber.scrub(collapsed).toLowerCase(Locale.ROOT);
        return new FailureSignature(normalized, ContentHash.sha256Hex(normalized));
    }
}

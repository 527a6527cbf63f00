package com.example.sqlpilot.model;

import java.util.Locale;

import lombok.Builder;
import lombok.Value;

/**
 * Why the previous attempt was rejected, handed to the next proposal request.
 */
@Value
@Builder
public class AttemptFeedback {
    int attempt;
    RejectionKind kind;
    String message;
    String rejectedStatement;

    public String describe() {
        return "Attempt " + attempt + " rejected (" + kind.name().toLowerCase(Locale.ROOT).replace('_', ' ') + "): " + message;
    }
}

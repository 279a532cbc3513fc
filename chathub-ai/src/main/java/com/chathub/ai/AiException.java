package com.chathub.ai;

import lombok.Getter;

/**
 * Failure of an AI query. The message is safe to show to chat users.
 */
@Getter
public class AiException extends RuntimeException {

    /** Every way an AI query can fail. */
    public enum Kind {
        /** Feature flag off or no credential configured. */
        DISABLED,
        /** Per-user AI window is full. */
        RATE_LIMITED,
        /** Empty or oversized prompt. */
        INVALID_PROMPT,
        /** Completion did not arrive within the configured timeout. */
        TIMEOUT,
        /** Connection-level failure talking to the completion endpoint. */
        TRANSPORT,
        /** Endpoint answered with a non-2xx status. */
        BAD_STATUS,
        /** Endpoint answered 2xx with a body of the wrong shape. */
        BAD_RESPONSE
    }

    private final Kind kind;

    public AiException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AiException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    static AiException disabled() {
        return new AiException(Kind.DISABLED, "AI is niet geactiveerd op deze server.");
    }

    static AiException emptyPrompt() {
        return new AiException(Kind.INVALID_PROMPT, "Geef een vraag op. Gebruik: /ai <vraag>");
    }

    static AiException promptTooLong(int max) {
        return new AiException(Kind.INVALID_PROMPT, "Vraag is te lang (max " + max + " tekens).");
    }

    static AiException rateLimited(int limit, long waitSeconds) {
        return new AiException(Kind.RATE_LIMITED,
                "Rate limit bereikt (max " + limit + "/min). Probeer over " + waitSeconds + " seconden.");
    }

    static AiException timeout(int timeoutSecs, Throwable cause) {
        return new AiException(Kind.TIMEOUT, "AI request timed out after " + timeoutSecs + " seconds.", cause);
    }

    static AiException transport(Throwable cause) {
        return new AiException(Kind.TRANSPORT, "AI service tijdelijk niet beschikbaar.", cause);
    }

    static AiException badStatus(int status) {
        return new AiException(Kind.BAD_STATUS, "AI service error: " + status);
    }

    static AiException badResponse(Throwable cause) {
        return new AiException(Kind.BAD_RESPONSE, "Kon AI antwoord niet verwerken.", cause);
    }
}

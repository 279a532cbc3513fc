package com.chathub.gateway.protocol;

/**
 * Request-level failure answered with a unicast {@code error} to the sender.
 * None of these close the connection or reach other clients.
 */
public abstract class ChatException extends RuntimeException {

    protected ChatException(String message) {
        super(message);
    }

    /** Unparseable envelope or unknown/incomplete {@code type}. */
    public static class ProtocolError extends ChatException {
        public ProtocolError(String message) {
            super(message);
        }
    }

    /** Length, charset or emptiness violation. */
    public static class ValidationError extends ChatException {
        public ValidationError(String message) {
            super(message);
        }
    }

    /** Sliding window full; the message names the wait-time hint. */
    public static class RateLimitError extends ChatException {
        public RateLimitError(long waitSeconds) {
            super("Rate limit exceeded. Please wait " + waitSeconds + " seconds.");
        }
    }
}

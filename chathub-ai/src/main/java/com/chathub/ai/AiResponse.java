package com.chathub.ai;

/**
 * A successful completion.
 *
 * @param content    text of the first completion choice
 * @param responseMs wall-clock time of the HTTP exchange
 * @param tokens     total tokens reported by the endpoint, if any
 * @param cost       cost reported by the endpoint, if any
 */
public record AiResponse(String content, long responseMs, Integer tokens, Double cost) {
}

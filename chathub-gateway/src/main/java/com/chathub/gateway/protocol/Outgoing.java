package com.chathub.gateway.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Server → client envelopes, discriminated by {@code type}.
 * Timestamps ({@code at}) are epoch milliseconds.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Outgoing.ChatMessage.class, name = "chat"),
        @JsonSubTypes.Type(value = Outgoing.SystemNotice.class, name = "system"),
        @JsonSubTypes.Type(value = Outgoing.AckName.class, name = "ackName"),
        @JsonSubTypes.Type(value = Outgoing.StatusReport.class, name = "status"),
        @JsonSubTypes.Type(value = Outgoing.UserList.class, name = "listUsers"),
        @JsonSubTypes.Type(value = Outgoing.ErrorReply.class, name = "error"),
        @JsonSubTypes.Type(value = Outgoing.Pong.class, name = "pong"),
        @JsonSubTypes.Type(value = Outgoing.AiAnswer.class, name = "ai")
})
public sealed interface Outgoing permits Outgoing.ChatMessage, Outgoing.SystemNotice, Outgoing.AckName,
        Outgoing.StatusReport, Outgoing.UserList, Outgoing.ErrorReply, Outgoing.Pong, Outgoing.AiAnswer {

    record ChatMessage(String from, String text, long at) implements Outgoing {
    }

    /** Presence notices and other server-authored lines. */
    record SystemNotice(String text, long at) implements Outgoing {
    }

    record AckName(String name, long at) implements Outgoing {
    }

    record StatusReport(
            String version,
            String javaVersion,
            String os,
            int cpuCores,
            long uptimeSeconds,
            int userCount,
            long peakUsers,
            long connectionsTotal,
            long messagesSent,
            double messagesPerSecond,
            double memoryMb,
            boolean aiEnabled,
            @JsonInclude(JsonInclude.Include.NON_NULL) String aiModel) implements Outgoing {
    }

    record UserList(List<UserInfo> users) implements Outgoing {
    }

    record ErrorReply(String message) implements Outgoing {
    }

    /** Token is echoed verbatim, including when absent (null). */
    record Pong(String token, long at) implements Outgoing {
    }

    record AiAnswer(
            String from,
            String prompt,
            String response,
            long responseMs,
            @JsonInclude(JsonInclude.Include.NON_NULL) Integer tokens,
            @JsonInclude(JsonInclude.Include.NON_NULL) Double cost,
            long at) implements Outgoing {
    }

    record UserInfo(String id, String name, String ip) {
    }

    static Outgoing error(String message) {
        return new ErrorReply(message);
    }

    static Outgoing system(String text, long at) {
        return new SystemNotice(text, at);
    }
}

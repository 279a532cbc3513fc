package com.chathub.gateway.protocol;

/**
 * Client → server envelopes, discriminated on the wire by {@code type}.
 *
 * @see MessageCodec#decode(String)
 */
public sealed interface Incoming
        permits Incoming.Chat, Incoming.SetName, Incoming.Status, Incoming.ListUsers, Incoming.Ping, Incoming.Ai {

    /** {type:"chat", text} */
    record Chat(String text) implements Incoming {
    }

    /** {type:"setName", name} */
    record SetName(String name) implements Incoming {
    }

    /** {type:"status"} */
    record Status() implements Incoming {
    }

    /** {type:"listUsers"} */
    record ListUsers() implements Incoming {
    }

    /** {type:"ping", token?} */
    record Ping(String token) implements Incoming {
    }

    /** {type:"ai", prompt} */
    record Ai(String prompt) implements Incoming {
    }
}

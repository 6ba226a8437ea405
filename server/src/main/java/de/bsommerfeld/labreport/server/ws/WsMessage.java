package de.bsommerfeld.labreport.server.ws;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Envelope of every frame the server sends on the realtime channel.
 * {@code room} is omitted for replies that are not tied to a report.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WsMessage(String event, String room, Object data) {

    static WsMessage info(String msg) {
        return new WsMessage("message", null, Map.of("msg", msg));
    }

    static WsMessage error(String msg) {
        return new WsMessage("error", null, Map.of("msg", msg));
    }
}

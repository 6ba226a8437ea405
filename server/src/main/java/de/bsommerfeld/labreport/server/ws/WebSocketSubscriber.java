package de.bsommerfeld.labreport.server.ws;

import de.bsommerfeld.labreport.core.event.ChangeEvent;
import de.bsommerfeld.labreport.core.event.ChangeSubscriber;
import de.bsommerfeld.labreport.server.http.JsonCodec;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

/**
 * Bridges a WebSocket channel into the change notifier. The write is
 * asynchronous, so delivery never blocks the publishing thread.
 */
public class WebSocketSubscriber implements ChangeSubscriber {

    private final Channel channel;
    private final JsonCodec json;

    public WebSocketSubscriber(Channel channel, JsonCodec json) {
        this.channel = channel;
        this.json = json;
    }

    @Override
    public String id() {
        return "ws-" + channel.id().asShortText();
    }

    @Override
    public void deliver(ChangeEvent event) {
        if (!channel.isActive())
            return;
        WsMessage message = new WsMessage(event.eventName(), event.topic(), event.payload());
        channel.writeAndFlush(new TextWebSocketFrame(json.writeString(message)));
    }
}

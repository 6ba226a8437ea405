package de.bsommerfeld.labreport.server.ws;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.labreport.core.error.ValidationException;
import de.bsommerfeld.labreport.core.event.ChangeNotifier;
import de.bsommerfeld.labreport.server.http.JsonCodec;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Room protocol on {@code /ws}. One instance per connection.
 *
 * <pre>
 * client → {"event":"join","room":"&lt;reportId&gt;"}
 * server ← {"event":"message","data":{"msg":"Joined room: &lt;reportId&gt;"}}
 * client → {"event":"leave","room":"&lt;reportId&gt;"}
 * server ← {"event":"message","data":{"msg":"Left room: &lt;reportId&gt;"}}
 * server ← {"event":"question_added","room":"&lt;reportId&gt;","data":{...}}
 * </pre>
 *
 * Rooms are not checked against the store. Joining an unknown room simply
 * never yields events. Closing the connection leaves every room.
 */
public class WebSocketFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final Logger LOG = LoggerFactory.getLogger(WebSocketFrameHandler.class);

    private final ChangeNotifier notifier;
    private final JsonCodec json;
    private WebSocketSubscriber subscriber;

    public WebSocketFrameHandler(ChangeNotifier notifier, JsonCodec json) {
        this.notifier = notifier;
        this.json = json;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        subscriber = new WebSocketSubscriber(ctx.channel(), json);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            LOG.debug("Realtime client {} connected", subscriber.id());
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        WsMessage reply;
        try {
            reply = handle(json.readTree(frame.text()));
        } catch (ValidationException e) {
            reply = WsMessage.error(e.getMessage());
        }
        ctx.writeAndFlush(new TextWebSocketFrame(json.writeString(reply)));
    }

    private WsMessage handle(JsonNode message) {
        String event = message.path("event").asText("");
        String room = message.path("room").asText("");
        if (!event.equals("join") && !event.equals("leave"))
            return WsMessage.error("Unknown event: " + event);
        if (room.isBlank())
            return WsMessage.error("Missing room");

        if (event.equals("join")) {
            notifier.subscribe(room, subscriber);
            LOG.debug("{} joined room {}", subscriber.id(), room);
            return WsMessage.info("Joined room: " + room);
        }
        notifier.unsubscribe(room, subscriber);
        LOG.debug("{} left room {}", subscriber.id(), room);
        return WsMessage.info("Left room: " + room);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        notifier.unsubscribeAll(subscriber);
        LOG.debug("Realtime client {} disconnected", subscriber.id());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOG.warn("Closing realtime channel {} after error", subscriber.id(), cause);
        ctx.close();
    }
}

package de.bsommerfeld.labreport.server.http;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.labreport.core.config.ServerConfig;
import de.bsommerfeld.labreport.core.event.ChangeNotifier;
import de.bsommerfeld.labreport.server.ws.WebSocketFrameHandler;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.cors.CorsConfig;
import io.netty.handler.codec.http.cors.CorsConfigBuilder;
import io.netty.handler.codec.http.cors.CorsHandler;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;

/**
 * Pipeline for REST and realtime traffic on one port.
 *
 * <pre>
 * HttpServerCodec → HttpObjectAggregator → CorsHandler
 *   → WebSocketServerProtocolHandler("/ws") → WebSocketFrameHandler
 *   → [handler group] ApiRequestHandler
 * </pre>
 *
 * Requests to {@code /ws} are upgraded and stay in the WebSocket handlers.
 * Everything else falls through to the REST handler.
 */
@Singleton
public class HttpServerInitializer extends ChannelInitializer<Channel> {

    public static final String WEBSOCKET_PATH = "/ws";

    private final ServerConfig config;
    private final ChangeNotifier notifier;
    private final JsonCodec json;
    private final ApiRequestHandler apiHandler;
    private final CorsConfig corsConfig;
    private final EventExecutorGroup handlerGroup;

    @Inject
    public HttpServerInitializer(ServerConfig config, ChangeNotifier notifier, JsonCodec json,
            ApiRequestHandler apiHandler) {
        this.config = config;
        this.notifier = notifier;
        this.json = json;
        this.apiHandler = apiHandler;
        this.corsConfig = corsConfig(config.getCorsOrigin());
        this.handlerGroup = new DefaultEventExecutorGroup(config.getHandlerThreads());
    }

    static CorsConfig corsConfig(String origin) {
        CorsConfigBuilder builder = origin == null || origin.isBlank() || origin.equals("*")
                ? CorsConfigBuilder.forAnyOrigin()
                : CorsConfigBuilder.forOrigin(origin);
        return builder
                .allowedRequestMethods(HttpMethod.GET, HttpMethod.POST, HttpMethod.PUT, HttpMethod.DELETE,
                        HttpMethod.OPTIONS)
                .allowedRequestHeaders("Content-Type", "Authorization")
                .build();
    }

    @Override
    protected void initChannel(Channel ch) {
        ch.pipeline()
                .addLast(new HttpServerCodec())
                .addLast(new HttpObjectAggregator(config.getMaxContentLength()))
                .addLast(new CorsHandler(corsConfig))
                .addLast(new WebSocketServerProtocolHandler(WEBSOCKET_PATH, null, true))
                .addLast(new WebSocketFrameHandler(notifier, json))
                .addLast(handlerGroup, apiHandler);
    }

    public EventExecutorGroup handlerGroup() {
        return handlerGroup;
    }
}

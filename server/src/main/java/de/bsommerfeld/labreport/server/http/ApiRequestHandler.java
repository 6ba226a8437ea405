package de.bsommerfeld.labreport.server.http;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.labreport.core.error.AuthenticationException;
import de.bsommerfeld.labreport.core.error.ConstraintViolationException;
import de.bsommerfeld.labreport.core.error.NotFoundException;
import de.bsommerfeld.labreport.core.error.StoreFailureException;
import de.bsommerfeld.labreport.core.error.ValidationException;
import de.bsommerfeld.labreport.service.auth.AuthService;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Terminal handler of the HTTP pipeline. Resolves the route, authenticates
 * secured routes, invokes the handler and writes the JSON response.
 *
 * <p>
 * Runs on a dedicated executor group, never on the I/O event loop: every
 * route ends in a blocking store call.
 *
 * <h3>Error mapping</h3>
 * <ul>
 * <li>{@link NotFoundException}, unknown route → 404</li>
 * <li>{@link ValidationException}, {@link ConstraintViolationException} →
 * 400</li>
 * <li>{@link AuthenticationException} → 401</li>
 * <li>{@link MethodNotAllowedException} → 405</li>
 * <li>{@link StoreFailureException} and anything else → 500</li>
 * </ul>
 * The body is always {@code {"error": "<message>"}}.
 */
@Singleton
@ChannelHandler.Sharable
public class ApiRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger LOG = LoggerFactory.getLogger(ApiRequestHandler.class);

    private final ApiRouter router;
    private final AuthService auth;
    private final JsonCodec json;

    @Inject
    public ApiRequestHandler(ApiRouter router, AuthService auth, JsonCodec json) {
        this.router = router;
        this.auth = auth;
        this.json = json;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        ApiResponse response = dispatch(request);
        write(ctx, request, response);
    }

    ApiResponse dispatch(FullHttpRequest request) {
        String path = new QueryStringDecoder(request.uri()).path();
        try {
            ApiRouter.RouteMatch match = router.resolve(request.method(), path);
            String actor = match.route().secured()
                    ? auth.authenticate(request.headers().get(HttpHeaderNames.AUTHORIZATION))
                    : null;
            byte[] body = ByteBufUtil.getBytes(request.content());
            ApiResponse response = match.route().handler()
                    .handle(new ApiRequest(request.method(), path, match.params(), actor, body));
            LOG.debug("{} {} -> {}", request.method(), path, response.status().code());
            return response;
        } catch (NotFoundException e) {
            return failure(request, path, HttpResponseStatus.NOT_FOUND, e);
        } catch (ValidationException | ConstraintViolationException e) {
            return failure(request, path, HttpResponseStatus.BAD_REQUEST, e);
        } catch (AuthenticationException e) {
            return failure(request, path, HttpResponseStatus.UNAUTHORIZED, e);
        } catch (MethodNotAllowedException e) {
            return failure(request, path, HttpResponseStatus.METHOD_NOT_ALLOWED, e);
        } catch (StoreFailureException e) {
            LOG.error("{} {} failed in the store", request.method(), path, e);
            return ApiResponse.error(HttpResponseStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("{} {} failed unexpectedly", request.method(), path, e);
            return ApiResponse.error(HttpResponseStatus.INTERNAL_SERVER_ERROR, "Internal server error");
        }
    }

    private ApiResponse failure(FullHttpRequest request, String path, HttpResponseStatus status,
            RuntimeException e) {
        LOG.debug("{} {} -> {} ({})", request.method(), path, status.code(), e.getMessage());
        return ApiResponse.error(status, e.getMessage());
    }

    private void write(ChannelHandlerContext ctx, FullHttpRequest request, ApiResponse response) {
        byte[] bytes = json.writeBytes(response.body());
        FullHttpResponse http = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, response.status(),
                Unpooled.wrappedBuffer(bytes));
        http.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON + "; charset=UTF-8")
                .setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);

        boolean keepAlive = HttpUtil.isKeepAlive(request);
        if (keepAlive) {
            http.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(http);
        } else {
            ctx.writeAndFlush(http).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOG.warn("Closing HTTP channel {} after pipeline error", ctx.channel().id().asShortText(), cause);
        ctx.close();
    }
}

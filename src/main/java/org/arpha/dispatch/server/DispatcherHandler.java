package org.arpha.dispatch.server;

import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
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
import lombok.extern.slf4j.Slf4j;
import org.arpha.dispatch.handler.Handler;
import org.arpha.dispatch.http.Body;
import org.arpha.dispatch.http.Request;
import org.arpha.dispatch.http.RequestParts;
import org.arpha.dispatch.http.Response;
import org.arpha.dispatch.response.Responses;

import java.nio.charset.StandardCharsets;

/**
 * Bridges aggregated Netty requests to a {@link Handler}, usually a
 * {@link org.arpha.dispatch.routing.Router}. Every request is answered: a
 * failure escaping dispatch becomes a 500.
 */
@Slf4j
@ChannelHandler.Sharable
public class DispatcherHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final Handler handler;

    public DispatcherHandler(Handler handler) {
        this.handler = handler;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        Response response;
        try {
            response = handler.call(toRequest(request));
        } catch (Throwable e) {
            log.error("Dispatch failed for {} {}", request.method(), request.uri(), e);
            response = Response.of(HttpResponseStatus.INTERNAL_SERVER_ERROR, Responses.TEXT_PLAIN_UTF_8,
                    "Internal error".getBytes(StandardCharsets.UTF_8));
        }
        write(ctx, toNettyResponse(response), keepAlive);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Channel {} failed, closing", ctx.channel().id(), cause);
        ctx.close();
    }

    static Request toRequest(FullHttpRequest request) {
        RequestParts parts = new RequestParts(request.method(), request.uri(), request.headers().copy());
        return new Request(parts, Body.of(ByteBufUtil.getBytes(request.content())));
    }

    static FullHttpResponse toNettyResponse(Response response) {
        byte[] body = response.body();
        FullHttpResponse httpResponse = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                response.status(),
                Unpooled.wrappedBuffer(body)
        );
        httpResponse.headers().set(response.headers());
        httpResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, body.length);
        return httpResponse;
    }

    private static void write(ChannelHandlerContext ctx, FullHttpResponse response, boolean keepAlive) {
        if (keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(response);
        } else {
            ChannelFuture future = ctx.writeAndFlush(response);
            future.addListener(ChannelFutureListener.CLOSE);
        }
    }
}

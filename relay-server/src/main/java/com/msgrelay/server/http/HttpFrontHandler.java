package com.msgrelay.server.http;

import com.msgrelay.core.message.Message;
import com.msgrelay.core.message.MessageConstants;
import com.msgrelay.server.socket.MessageRelay;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.CharsetUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.FOUND;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.METHOD_NOT_ALLOWED;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpResponseStatus.OK;

/**
 * Serves the pages of the web root and relays form submissions to the socket listener.
 * <p>
 * A complete submission is always answered with a redirect home, whether or not the relay
 * succeeded; the browser never learns about backend delivery failures.
 */
@Slf4j
@ChannelHandler.Sharable
public class HttpFrontHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    public static final String MESSAGE_PATH = "/message";
    public static final String STATIC_PREFIX = "/static/";

    static final String INDEX_PAGE = "index.html";
    static final String MESSAGE_PAGE = "message.html";
    static final String ERROR_PAGE = "error.html";

    private static final String HTML_CONTENT_TYPE = "text/html; charset=UTF-8";
    private static final String TEXT_CONTENT_TYPE = "text/plain; charset=UTF-8";

    private final WebContent webContent;
    private final MessageRelay relay;

    public HttpFrontHandler(WebContent webContent, MessageRelay relay) {
        this.webContent = webContent;
        this.relay = relay;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        if (!request.decoderResult().isSuccess()) {
            sendErrorPage(ctx, false, BAD_REQUEST);
            return;
        }

        String path = new QueryStringDecoder(request.uri()).path();
        log.debug("{} {}", request.method(), path);

        if (HttpMethod.GET.equals(request.method())) {
            handleGet(ctx, keepAlive, path);
        } else if (HttpMethod.POST.equals(request.method())) {
            if (MESSAGE_PATH.equals(path)) {
                handleMessage(ctx, keepAlive, request);
            } else {
                sendErrorPage(ctx, keepAlive, NOT_FOUND);
            }
        } else {
            sendErrorPage(ctx, keepAlive, METHOD_NOT_ALLOWED);
        }
    }

    private void handleGet(ChannelHandlerContext ctx, boolean keepAlive, String path) {
        if ("/".equals(path) || "/index.html".equals(path)) {
            sendPage(ctx, keepAlive, INDEX_PAGE);
        } else if ("/message.html".equals(path)) {
            sendPage(ctx, keepAlive, MESSAGE_PAGE);
        } else if ("/error.html".equals(path)) {
            sendPage(ctx, keepAlive, ERROR_PAGE);
        } else if (path.startsWith(STATIC_PREFIX)) {
            sendStatic(ctx, keepAlive, path.substring(STATIC_PREFIX.length()));
        } else {
            sendErrorPage(ctx, keepAlive, NOT_FOUND);
        }
    }

    private void handleMessage(ChannelHandlerContext ctx, boolean keepAlive, FullHttpRequest request) {
        Map<String, List<String>> form = parseForm(request.content().toString(CharsetUtil.UTF_8));
        Message message = Message.builder()
                .username(firstValue(form, MessageConstants.FIELD_USERNAME))
                .message(firstValue(form, MessageConstants.FIELD_MESSAGE))
                .build();

        if (!message.isComplete()) {
            log.error("Missing required field '{}' or '{}'",
                    MessageConstants.FIELD_USERNAME, MessageConstants.FIELD_MESSAGE);
            sendErrorPage(ctx, keepAlive, NOT_FOUND);
            return;
        }

        relay.send(message).whenComplete((ignored, cause) -> {
            if (cause != null) {
                log.error("Error sending message to socket server: {}", cause.getMessage());
            }
            redirectHome(ctx, keepAlive);
        });
    }

    private static Map<String, List<String>> parseForm(String body) {
        try {
            return new QueryStringDecoder(body, CharsetUtil.UTF_8, false).parameters();
        } catch (IllegalArgumentException e) {
            log.warn("Malformed form encoding, undecodable values are kept as sent: {}", e.getMessage());
        }
        Map<String, List<String>> form = new LinkedHashMap<>();
        for (String pair : body.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = decodeLeniently(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decodeLeniently(pair.substring(eq + 1));
            form.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        }
        return form;
    }

    private static String decodeLeniently(String component) {
        try {
            return QueryStringDecoder.decodeComponent(component, CharsetUtil.UTF_8);
        } catch (IllegalArgumentException e) {
            return component.replace('+', ' ');
        }
    }

    private static String firstValue(Map<String, List<String>> form, String name) {
        List<String> values = form.get(name);
        return values == null || values.isEmpty() ? "" : values.get(0);
    }

    private void sendPage(ChannelHandlerContext ctx, boolean keepAlive, String page) {
        Optional<byte[]> content = webContent.readPage(page);
        if (content.isPresent()) {
            writeResponse(ctx, keepAlive, response(OK, HTML_CONTENT_TYPE, content.get()));
        } else {
            sendErrorPage(ctx, keepAlive, NOT_FOUND);
        }
    }

    private void sendStatic(ChannelHandlerContext ctx, boolean keepAlive, String relativePath) {
        Optional<byte[]> content = webContent.readStatic(relativePath);
        if (content.isPresent()) {
            writeResponse(ctx, keepAlive, response(OK, WebContent.contentTypeOf(relativePath), content.get()));
        } else {
            sendErrorPage(ctx, keepAlive, NOT_FOUND);
        }
    }

    private void sendErrorPage(ChannelHandlerContext ctx, boolean keepAlive, HttpResponseStatus status) {
        Optional<byte[]> content = webContent.readPage(ERROR_PAGE);
        if (content.isPresent()) {
            writeResponse(ctx, keepAlive, response(status, HTML_CONTENT_TYPE, content.get()));
        } else {
            writeResponse(ctx, keepAlive, response(status, TEXT_CONTENT_TYPE,
                    status.toString().getBytes(CharsetUtil.UTF_8)));
        }
    }

    private void redirectHome(ChannelHandlerContext ctx, boolean keepAlive) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, FOUND, Unpooled.EMPTY_BUFFER);
        response.headers().set(HttpHeaderNames.LOCATION, "/");
        writeResponse(ctx, keepAlive, response);
    }

    private static FullHttpResponse response(HttpResponseStatus status, String contentType, byte[] content) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
                Unpooled.wrappedBuffer(content));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
        return response;
    }

    private static void writeResponse(ChannelHandlerContext ctx, boolean keepAlive, FullHttpResponse response) {
        HttpUtil.setContentLength(response, response.content().readableBytes());
        HttpUtil.setKeepAlive(response, keepAlive);
        if (keepAlive) {
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("HttpFrontHandler failed to process request", cause);
        if (ctx.channel().isActive()) {
            writeResponse(ctx, false, response(INTERNAL_SERVER_ERROR, TEXT_CONTENT_TYPE,
                    INTERNAL_SERVER_ERROR.toString().getBytes(CharsetUtil.UTF_8)));
        } else {
            ctx.close();
        }
    }
}

package com.vpcrouter.proxy;

import com.vpcrouter.error.GatewayErrorCode;
import com.vpcrouter.error.GatewayException;
import com.vpcrouter.middleware.MiddlewareChain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Serves one request end to end: middleware, dispatch, then relays the chosen response.
 * Gateway-produced failures leave as {@link GatewayException} for the web layer to render.
 */
@Slf4j
@Component
public class GatewayRequestHandler {

    private static final int CHUNK_SIZE = 8192;

    private final MiddlewareChain middlewareChain;
    private final GatewayDispatcher dispatcher;

    public GatewayRequestHandler(MiddlewareChain middlewareChain, GatewayDispatcher dispatcher) {
        this.middlewareChain = middlewareChain;
        this.dispatcher = dispatcher;
    }

    public void handle(ProxyRequest request, RequestContext context, ResponseSink sink) throws IOException {
        context.setRequestBytes(Math.max(request.getBody().length(), 0));
        middlewareChain.execute(request, context, () -> {
            sink.addHeader(TraceContext.TRACEPARENT_HEADER, context.traceOrCreate().toHeader());
            try (BackendExchange exchange = dispatcher.dispatch(request, context)) {
                relay(exchange, context, sink);
            }
        });
    }

    private void relay(BackendExchange exchange, RequestContext context, ResponseSink sink) {
        context.setResponseStatus(exchange.getStatus());
        sink.setStatus(exchange.getStatus());
        exchange.getHeaders().forEach((name, values) -> {
            if (!TraceContext.TRACEPARENT_HEADER.equalsIgnoreCase(name)) {
                values.forEach(value -> sink.addHeader(name, value));
            }
        });
        if (exchange.getContentLength() >= 0) {
            sink.setContentLength(exchange.getContentLength());
        }
        InputStream body = exchange.getBody();
        if (body == null) {
            exchange.markCompleted();
            return;
        }
        OutputStream out = openClientStream(sink, context);
        byte[] chunk = new byte[CHUNK_SIZE];
        long relayed = 0;
        while (true) {
            int read;
            try {
                read = body.read(chunk);
            } catch (IOException e) {
                context.setResponseBytes(relayed);
                throw backendStreamFailure(exchange, context, e);
            }
            if (read == -1) {
                break;
            }
            try {
                out.write(chunk, 0, read);
                out.flush();
            } catch (IOException e) {
                context.setResponseBytes(relayed);
                throw clientGone(context, e);
            }
            relayed += read;
        }
        context.setResponseBytes(relayed);
        exchange.markCompleted();
    }

    private static OutputStream openClientStream(ResponseSink sink, RequestContext context) {
        try {
            return sink.body();
        } catch (IOException e) {
            throw clientGone(context, e);
        }
    }

    private static GatewayException backendStreamFailure(BackendExchange exchange, RequestContext context, IOException e) {
        if (exchange.isTimedOut()) {
            log.warn("Response from {} timed out after {} bytes", context.getLastEndpointId(), context.getResponseBytes());
            return new GatewayException(GatewayErrorCode.GATEWAY_TIMEOUT,
                    "Endpoint " + context.getLastEndpointId() + " timed out while streaming the response", e);
        }
        if (context.isCancelled()) {
            return new GatewayException(GatewayErrorCode.REQUEST_CANCELLED, "Client cancelled request", e);
        }
        log.warn("Response from {} broke off after {} bytes: {}", context.getLastEndpointId(), context.getResponseBytes(), e.toString());
        return new GatewayException(GatewayErrorCode.CONNECTION_FAILURE,
                "Endpoint " + context.getLastEndpointId() + " dropped the connection while streaming the response", e);
    }

    private static GatewayException clientGone(RequestContext context, IOException e) {
        context.cancel();
        log.info("Client went away on {} {} after {} bytes", context.getMethod(), context.getPath(), context.getResponseBytes());
        return new GatewayException(GatewayErrorCode.REQUEST_CANCELLED, "Client closed the connection", e);
    }
}

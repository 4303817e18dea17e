package com.vpcrouter.proxy;

import com.vpcrouter.registry.ConnectionLease;
import com.vpcrouter.registry.Endpoint;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.ConnectTimeoutException;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.protocol.HttpClientContext;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.io.entity.InputStreamEntity;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sends one attempt to one endpoint.
 *
 * <p>The attempt holds a connection slot on the endpoint from before the request is sent
 * until the returned exchange is closed, on every path. The timeout is a hard deadline: a
 * timer aborts the exchange even while the response body is streaming.
 */
@Slf4j
@Component
public class RequestForwarder {

    public static final String FORWARDED_FOR = "X-Forwarded-For";

    private final CloseableHttpClient httpClient;
    private final ScheduledExecutorService deadlineScheduler;

    public RequestForwarder(CloseableHttpClient httpClient,
                            @Qualifier("deadlineScheduler") ScheduledExecutorService deadlineScheduler) {
        this.httpClient = httpClient;
        this.deadlineScheduler = deadlineScheduler;
    }

    /**
     * Forward {@code request} to {@code endpoint}.
     *
     * @param timeout        hard deadline for the whole exchange
     * @param connectTimeout limit for establishing the connection
     * @return the classified exchange; the caller must close it
     */
    public BackendExchange forward(Endpoint endpoint, ProxyRequest request, RequestContext context,
                                   Duration timeout, Duration connectTimeout) {
        long startNanos = System.nanoTime();
        // zero means no limit to the client library
        long timeoutMillis = Math.max(timeout.toMillis(), 1);
        long connectMillis = Math.max(Math.min(connectTimeout.toMillis(), timeoutMillis), 1);
        HttpUriRequestBase outbound = new HttpUriRequestBase(request.getMethod(), targetUri(endpoint, request));
        outbound.setConfig(RequestConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectMillis))
                .setConnectionRequestTimeout(Timeout.ofMilliseconds(timeoutMillis))
                .setResponseTimeout(Timeout.ofMilliseconds(timeoutMillis))
                .build());
        copyHeaders(request, context, outbound);

        ConnectionLease lease = endpoint.acquireConnection();
        AtomicBoolean timedOut = new AtomicBoolean();
        ScheduledFuture<?> timer = deadlineScheduler.schedule(() -> {
            timedOut.set(true);
            outbound.cancel();
        }, timeoutMillis, TimeUnit.MILLISECONDS);
        context.onCancel(outbound::cancel);

        ClassicHttpResponse response = null;
        try {
            attachBody(request, outbound);
            response = httpClient.executeOpen(new HttpHost("http", endpoint.getHost(), endpoint.getPort()), outbound, HttpClientContext.create());
            HttpEntity entity = response.getEntity();
            InputStream body = entity == null ? null : entity.getContent();
            AttemptOutcome outcome = AttemptOutcome.response(response.getCode(), endpoint.getId(), elapsed(startNanos));
            log.debug("Attempt to {} returned {} in {}ms", endpoint, outcome.getStatus(), outcome.getLatency().toMillis());
            ClassicHttpResponse held = response;
            long contentLength = entity == null ? 0 : entity.getContentLength();
            return new BackendExchange(outcome, responseHeaders(response), body, contentLength, aborted -> {
                timer.cancel(false);
                context.clearOnCancel();
                if (aborted) {
                    outbound.cancel();
                }
                closeResponse(held);
                lease.release();
            }, timedOut);
        } catch (IOException e) {
            timer.cancel(false);
            context.clearOnCancel();
            closeResponse(response);
            lease.release();
            AttemptOutcome outcome = classifyFailure(endpoint.getId(), e, timedOut.get(), context.isCancelled(), elapsed(startNanos));
            log.warn("Attempt to {} failed: {} ({})", endpoint, outcome.getKind(), e.toString());
            return BackendExchange.failed(outcome);
        } catch (RuntimeException e) {
            timer.cancel(false);
            context.clearOnCancel();
            outbound.cancel();
            closeResponse(response);
            lease.release();
            throw e;
        }
    }

    static AttemptOutcome classifyFailure(String endpointId, IOException e, boolean timedOut, boolean cancelled, Duration latency) {
        if (cancelled) {
            return AttemptOutcome.cancelled(endpointId, latency);
        }
        if (timedOut) {
            return AttemptOutcome.timeout(endpointId, latency, e);
        }
        // unreachable endpoint, not a slow one
        if (e instanceof ConnectTimeoutException) {
            return AttemptOutcome.connectionFailure(endpointId, latency, e);
        }
        if (e instanceof SocketTimeoutException) {
            return AttemptOutcome.timeout(endpointId, latency, e);
        }
        return AttemptOutcome.connectionFailure(endpointId, latency, e);
    }

    static URI targetUri(Endpoint endpoint, ProxyRequest request) {
        String host = endpoint.getHost().contains(":") ? "[" + endpoint.getHost() + "]" : endpoint.getHost();
        return URI.create("http://" + host + ":" + endpoint.getPort() + request.pathAndQuery());
    }

    private void copyHeaders(ProxyRequest request, RequestContext context, HttpUriRequestBase outbound) {
        HttpHeaders headers = HopByHopHeaders.strip(request.getHeaders());
        headers.remove(TraceContext.TRACEPARENT_HEADER);
        String forwardedFor = headers.getFirst(FORWARDED_FOR);
        headers.remove(FORWARDED_FOR);
        headers.forEach((name, values) -> values.forEach(value -> outbound.addHeader(name, value)));

        outbound.setHeader(TraceContext.TRACEPARENT_HEADER, context.traceOrCreate().toHeader());
        if (request.getClientAddress() != null) {
            outbound.setHeader(FORWARDED_FOR, forwardedFor == null
                    ? request.getClientAddress()
                    : forwardedFor + ", " + request.getClientAddress());
        } else if (forwardedFor != null) {
            outbound.setHeader(FORWARDED_FOR, forwardedFor);
        }
    }

    private void attachBody(ProxyRequest request, HttpUriRequestBase outbound) throws IOException {
        BodySource body = request.getBody();
        if (!body.isEmpty()) {
            // Content-Type travels as a plain header
            outbound.setEntity(new InputStreamEntity(body.open(), body.length(), null));
        }
    }

    private static HttpHeaders responseHeaders(ClassicHttpResponse response) {
        HttpHeaders headers = new HttpHeaders();
        for (Header header : response.getHeaders()) {
            headers.add(header.getName(), header.getValue());
        }
        return HopByHopHeaders.strip(headers);
    }

    private static void closeResponse(ClassicHttpResponse response) {
        if (response == null) {
            return;
        }
        try {
            response.close();
        } catch (IOException e) {
            log.debug("Error closing backend response: {}", e.toString());
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}

package com.vpcrouter.web;

import com.vpcrouter.proxy.BodySource;
import com.vpcrouter.proxy.GatewayRequestHandler;
import com.vpcrouter.proxy.ProxyRequest;
import com.vpcrouter.proxy.RequestContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.time.Clock;
import java.util.Collections;

/**
 * Serving listener: every path not claimed by a more specific mapping is proxied.
 */
@RestController
public class GatewayController {

    private final GatewayRequestHandler requestHandler;
    private final Clock clock;

    public GatewayController(GatewayRequestHandler requestHandler, Clock clock) {
        this.requestHandler = requestHandler;
        this.clock = clock;
    }

    @GetMapping(value = "/healthz", produces = MediaType.TEXT_PLAIN_VALUE)
    public String healthz() {
        return "OK";
    }

    @RequestMapping("/**")
    public void proxy(HttpServletRequest request, HttpServletResponse response) throws IOException {
        ProxyRequest proxyRequest = toProxyRequest(request);
        RequestContext context = new RequestContext(proxyRequest.getMethod(), proxyRequest.getPath(),
                proxyRequest.getClientAddress(), clock.instant());
        requestHandler.handle(proxyRequest, context, new ServletResponseSink(response));
    }

    static ProxyRequest toProxyRequest(HttpServletRequest request) throws IOException {
        HttpHeaders headers = new HttpHeaders();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.addAll(name, Collections.list(request.getHeaders(name)));
        }
        long length = request.getContentLengthLong();
        boolean chunked = headers.containsKey(HttpHeaders.TRANSFER_ENCODING);
        BodySource body = length > 0 || (length < 0 && chunked)
                ? BodySource.streaming(request.getInputStream(), length)
                : BodySource.empty();
        return ProxyRequest.builder()
                .method(request.getMethod())
                .path(request.getRequestURI())
                .rawQuery(request.getQueryString())
                .headers(headers)
                .body(body)
                .clientAddress(request.getRemoteAddr())
                .build();
    }
}

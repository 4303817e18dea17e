package com.vpcrouter.error;

import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;

/**
 * Renders gateway failures as RFC 7807 problem documents.
 */
@Slf4j
@RestControllerAdvice
public class GatewayExceptionHandler {

    public static final String GATEWAY_ERROR_HEADER = "X-Gateway-Error";
    private static final String TYPE_BASE = "urn:vpc-router:error:";

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ProblemDetail> handleGatewayException(GatewayException e, HttpServletResponse response) {
        GatewayErrorCode errorCode = e.getErrorCode();
        if (response.isCommitted()) {
            // Response already streaming; nothing more can be sent
            log.debug("Dropping {} for committed response: {}", errorCode, e.getMessage());
            return null;
        }
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(errorCode.getStatus(), e.getMessage());
        problem.setType(URI.create(TYPE_BASE + errorCode.getType()));
        problem.setTitle(errorCode.getMessage());
        return ResponseEntity.status(errorCode.getStatus())
                .header(GATEWAY_ERROR_HEADER, errorCode.getType())
                .body(problem);
    }
}

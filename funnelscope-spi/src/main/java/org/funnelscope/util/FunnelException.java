package org.funnelscope.util;

import io.netty.handler.codec.http.HttpResponseStatus;

public class FunnelException
        extends RuntimeException {
    private final HttpResponseStatus statusCode;

    public FunnelException(String message, HttpResponseStatus statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public FunnelException(String message, HttpResponseStatus statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public FunnelException(HttpResponseStatus statusCode) {
        this(statusCode.reasonPhrase(), statusCode);
    }

    public HttpResponseStatus getStatusCode() {
        return statusCode;
    }
}

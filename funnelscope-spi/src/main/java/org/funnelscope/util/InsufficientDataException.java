package org.funnelscope.util;

import static io.netty.handler.codec.http.HttpResponseStatus.UNPROCESSABLE_ENTITY;

public class InsufficientDataException
        extends FunnelException {
    public InsufficientDataException(String message) {
        super(message, UNPROCESSABLE_ENTITY);
    }
}

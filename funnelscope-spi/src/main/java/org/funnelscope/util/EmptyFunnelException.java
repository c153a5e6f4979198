package org.funnelscope.util;

import static io.netty.handler.codec.http.HttpResponseStatus.UNPROCESSABLE_ENTITY;

public class EmptyFunnelException
        extends FunnelException {
    public EmptyFunnelException(String firstStep) {
        super(String.format("No users reached the first step '%s', conversion rates are undefined", firstStep),
                UNPROCESSABLE_ENTITY);
    }
}

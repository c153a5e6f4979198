package org.funnelscope.util;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;

/**
 * The funnel definition or an analysis request is malformed.
 */
public class ValidationException
        extends FunnelException {
    public ValidationException(String message) {
        super(message, BAD_REQUEST);
    }
}

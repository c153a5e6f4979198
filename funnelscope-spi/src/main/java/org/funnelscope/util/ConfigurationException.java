package org.funnelscope.util;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;

public class ConfigurationException
        extends FunnelException {
    public ConfigurationException(String message) {
        super(message, BAD_REQUEST);
    }
}

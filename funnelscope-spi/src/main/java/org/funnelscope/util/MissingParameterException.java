package org.funnelscope.util;

import java.util.Set;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;

public class MissingParameterException
        extends FunnelException {
    private final Set<String> parameters;

    public MissingParameterException(Set<String> parameters) {
        super("Query parameters are not bound: " + String.join(", ", parameters), BAD_REQUEST);
        this.parameters = parameters;
    }

    public Set<String> getParameters() {
        return parameters;
    }
}

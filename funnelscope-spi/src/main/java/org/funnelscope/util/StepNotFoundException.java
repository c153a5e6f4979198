package org.funnelscope.util;

import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;

public class StepNotFoundException
        extends FunnelException {
    private final String step;

    public StepNotFoundException(String step, String resultName) {
        super(String.format("Step '%s' does not exist in the %s result", step, resultName), NOT_FOUND);
        this.step = step;
    }

    public String getStep() {
        return step;
    }
}

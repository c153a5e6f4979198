/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.funnelscope.analysis;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.funnelscope.analysis.FunnelResult.StepCount;
import org.funnelscope.util.InsufficientDataException;
import org.funnelscope.util.StepNotFoundException;
import org.funnelscope.util.ValidationException;

import static org.funnelscope.util.ValidationUtil.checkNotNull;

/**
 * Pooled two-proportion z-test between the control and test arm of an experiment.
 */
public class SignificanceEngine {
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

    /**
     * Compares conversion from the first to the last step of the control result.
     */
    public SignificanceReport evaluate(FunnelResult control, FunnelResult test, double confidenceLevel) {
        checkNotNull(control, "control");
        if (control.size() == 0) {
            throw new InsufficientDataException("Control result has no steps");
        }
        return evaluate(control, test,
                control.get(0).getStepLabel(),
                control.get(control.size() - 1).getStepLabel(),
                confidenceLevel);
    }

    public SignificanceReport evaluate(FunnelResult control, FunnelResult test,
                                       String firstStepLabel, String lastStepLabel,
                                       double confidenceLevel) {
        checkNotNull(control, "control");
        checkNotNull(test, "test");
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new ValidationException("Confidence level must be between 0 and 1 exclusive: " + confidenceLevel);
        }

        long n1 = lookup(control, firstStepLabel, "control");
        long x1 = lookup(control, lastStepLabel, "control");
        long n2 = lookup(test, firstStepLabel, "test");
        long x2 = lookup(test, lastStepLabel, "test");

        if (n1 <= 0) {
            throw new InsufficientDataException(String.format("Control arm has no users at step '%s'", firstStepLabel));
        }
        if (n2 <= 0) {
            throw new InsufficientDataException(String.format("Test arm has no users at step '%s'", firstStepLabel));
        }

        double p1 = (double) x1 / n1;
        double p2 = (double) x2 / n2;
        if (p1 == 0) {
            throw new InsufficientDataException("Control conversion is zero, relative lift is undefined");
        }

        double pooled = (double) (x1 + x2) / (n1 + n2);
        double standardError = Math.sqrt(pooled * (1 - pooled) * (1.0 / n1 + 1.0 / n2));

        double zScore;
        double pValue;
        if (standardError > 0 && !Double.isNaN(standardError)) {
            zScore = (p2 - p1) / standardError;
            pValue = 2 * (1 - STANDARD_NORMAL.cumulativeProbability(Math.abs(zScore)));
        } else {
            zScore = 0;
            pValue = 1;
        }

        return new SignificanceReport(p1 * 100, p2 * 100, (p2 - p1) / p1, zScore, pValue,
                confidenceLevel, pValue < 1 - confidenceLevel);
    }

    private static long lookup(FunnelResult result, String label, String name) {
        checkNotNull(label, "step label");
        return result.getStep(label)
                .map(StepCount::getUserCount)
                .orElseThrow(() -> new StepNotFoundException(label, name));
    }
}

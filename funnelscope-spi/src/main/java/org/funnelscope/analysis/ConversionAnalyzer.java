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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.funnelscope.analysis.ConversionReport.Boundary;
import org.funnelscope.analysis.FunnelResult.StepCount;
import org.funnelscope.util.EmptyFunnelException;
import org.funnelscope.util.ValidationException;

import java.util.Map;

import static org.funnelscope.util.ValidationUtil.checkNotNull;

public class ConversionAnalyzer {
    /**
     * One report per segment, in the order of {@code segments}. Segments nobody entered are left out.
     */
    public Map<String, ConversionReport> analyzeSegments(Map<String, FunnelResult> segments) {
        checkNotNull(segments, "segments");
        ImmutableMap.Builder<String, ConversionReport> reports = ImmutableMap.builder();
        segments.forEach((segment, result) -> {
            if (checkNotNull(result, "result").size() > 0 && result.get(0).getUserCount() > 0) {
                reports.put(segment, analyze(result));
            }
        });
        return reports.build();
    }

    public ConversionReport analyze(FunnelResult result) {
        checkNotNull(result, "result");
        if (result.size() < 2) {
            throw new ValidationException(String.format("Conversion needs at least 2 steps, %d given", result.size()));
        }
        for (int i = 1; i < result.size(); i++) {
            if (result.get(i).getStepIndex() <= result.get(i - 1).getStepIndex()) {
                throw new ValidationException("Funnel result rows are not ordered by step index: " + result);
            }
        }

        StepCount first = result.get(0);
        if (first.getUserCount() <= 0) {
            throw new EmptyFunnelException(first.getStepLabel());
        }

        // a step nobody reached converts at 0% instead of failing
        ImmutableList.Builder<Boundary> boundaries = ImmutableList.builder();
        int primary = 0;
        double primaryLoss = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < result.size() - 1; i++) {
            StepCount from = result.get(i);
            StepCount to = result.get(i + 1);
            long before = from.getUserCount();
            long after = to.getUserCount();

            double conversion = before > 0 ? (double) after / before : 0;
            double dropoff = before > 0 ? (double) (before - after) / before : 0;
            double dropoffOfTotal = (double) (before - after) / first.getUserCount();

            boundaries.add(new Boundary(i, from.getStepLabel(), to.getStepLabel(), before, after,
                    conversion, dropoff, dropoffOfTotal));

            if (dropoff > primaryLoss) {
                primaryLoss = dropoff;
                primary = i;
            }
        }

        double overall = (double) result.get(result.size() - 1).getUserCount() / first.getUserCount();
        return new ConversionReport(boundaries.build(), overall, primary);
    }
}

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import org.funnelscope.util.ValidationException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static org.funnelscope.util.ValidationUtil.checkNotNull;

/**
 * Users reaching each step of a funnel, in step order. Produced by a {@link FunnelPlanExecutor}.
 */
public final class FunnelResult {
    private final List<StepCount> steps;

    @JsonCreator
    public FunnelResult(@JsonProperty("steps") List<StepCount> steps) {
        this.steps = ImmutableList.copyOf(checkNotNull(steps, "steps"));
    }

    public static FunnelResult of(List<String> labels, long... userCounts) {
        if (labels.size() != userCounts.length) {
            throw new ValidationException("Each step label needs exactly one user count");
        }
        ImmutableList.Builder<StepCount> builder = ImmutableList.builder();
        for (int i = 0; i < userCounts.length; i++) {
            builder.add(new StepCount(i, labels.get(i), userCounts[i]));
        }
        return new FunnelResult(builder.build());
    }

    @JsonProperty
    public List<StepCount> getSteps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    public StepCount get(int position) {
        return steps.get(position);
    }

    public Optional<StepCount> getStep(String label) {
        return steps.stream().filter(step -> step.getStepLabel().equals(label)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FunnelResult && steps.equals(((FunnelResult) o).steps));
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return "FunnelResult" + steps;
    }

    public static final class StepCount {
        private final int stepIndex;
        private final String stepLabel;
        private final long userCount;

        @JsonCreator
        public StepCount(@JsonProperty("stepIndex") int stepIndex,
                         @JsonProperty("stepLabel") String stepLabel,
                         @JsonProperty("userCount") long userCount) {
            this.stepIndex = stepIndex;
            this.stepLabel = checkNotNull(stepLabel, "stepLabel");
            this.userCount = userCount;
        }

        @JsonProperty
        public int getStepIndex() {
            return stepIndex;
        }

        @JsonProperty
        public String getStepLabel() {
            return stepLabel;
        }

        @JsonProperty
        public long getUserCount() {
            return userCount;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof StepCount)) {
                return false;
            }
            StepCount that = (StepCount) o;
            return stepIndex == that.stepIndex && userCount == that.userCount && stepLabel.equals(that.stepLabel);
        }

        @Override
        public int hashCode() {
            return Objects.hash(stepIndex, stepLabel, userCount);
        }

        @Override
        public String toString() {
            return stepIndex + ":" + stepLabel + "=" + userCount;
        }
    }
}

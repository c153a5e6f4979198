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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Step over step conversion and dropoff of a single funnel result. Rates are fractions in [0, 1] for
 * well-formed results.
 */
public final class ConversionReport {
    private final List<Boundary> boundaries;
    private final double overallConversion;
    private final int primaryAttritionIndex;

    public ConversionReport(List<Boundary> boundaries, double overallConversion, int primaryAttritionIndex) {
        this.boundaries = ImmutableList.copyOf(boundaries);
        this.overallConversion = overallConversion;
        this.primaryAttritionIndex = primaryAttritionIndex;
    }

    @JsonProperty
    public List<Boundary> getBoundaries() {
        return boundaries;
    }

    @JsonProperty
    public double getOverallConversion() {
        return overallConversion;
    }

    /**
     * The boundary losing the largest share of the users that reached its starting step.
     */
    @JsonProperty
    public Boundary getPrimaryAttrition() {
        return boundaries.get(primaryAttritionIndex);
    }

    public List<Double> getConversionRates() {
        return boundaries.stream().map(Boundary::getConversionRate).collect(ImmutableList.toImmutableList());
    }

    public static double percent(double rate) {
        return Math.round(rate * 10000) / 100.0;
    }

    /**
     * Transition between two adjacent steps.
     */
    public static final class Boundary {
        private final int fromIndex;
        private final String fromLabel;
        private final String toLabel;
        private final long usersBefore;
        private final long usersAfter;
        private final double conversionRate;
        private final double dropoffRate;
        private final double dropoffRateOfTotal;

        public Boundary(int fromIndex, String fromLabel, String toLabel, long usersBefore, long usersAfter,
                        double conversionRate, double dropoffRate, double dropoffRateOfTotal) {
            this.fromIndex = fromIndex;
            this.fromLabel = fromLabel;
            this.toLabel = toLabel;
            this.usersBefore = usersBefore;
            this.usersAfter = usersAfter;
            this.conversionRate = conversionRate;
            this.dropoffRate = dropoffRate;
            this.dropoffRateOfTotal = dropoffRateOfTotal;
        }

        @JsonProperty
        public int getFromIndex() {
            return fromIndex;
        }

        @JsonProperty
        public String getFromLabel() {
            return fromLabel;
        }

        @JsonProperty
        public String getToLabel() {
            return toLabel;
        }

        @JsonProperty
        public long getUsersBefore() {
            return usersBefore;
        }

        @JsonProperty
        public long getUsersAfter() {
            return usersAfter;
        }

        @JsonProperty
        public double getConversionRate() {
            return conversionRate;
        }

        @JsonProperty
        public long getDropoffCount() {
            return usersBefore - usersAfter;
        }

        /**
         * Dropped users as a share of the users that reached {@link #getFromLabel()}.
         */
        @JsonProperty
        public double getDropoffRate() {
            return dropoffRate;
        }

        /**
         * Dropped users as a share of the users that entered the funnel.
         */
        @JsonProperty
        public double getDropoffRateOfTotal() {
            return dropoffRateOfTotal;
        }

        @Override
        public String toString() {
            return fromLabel + " -> " + toLabel + ": " + percent(conversionRate) + "%";
        }
    }
}

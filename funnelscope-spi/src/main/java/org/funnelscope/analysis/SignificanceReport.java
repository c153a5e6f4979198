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

/**
 * Two-proportion comparison of a control and a test arm. Conversions and the absolute difference are percentages,
 * the relative lift is a fraction of the control conversion.
 */
public final class SignificanceReport {
    private final double controlConversion;
    private final double testConversion;
    private final double absoluteDifference;
    private final double relativeLift;
    private final double zScore;
    private final double pValue;
    private final double confidenceLevel;
    private final boolean significant;

    public SignificanceReport(double controlConversion, double testConversion, double relativeLift,
                              double zScore, double pValue, double confidenceLevel, boolean significant) {
        this.controlConversion = controlConversion;
        this.testConversion = testConversion;
        this.absoluteDifference = testConversion - controlConversion;
        this.relativeLift = relativeLift;
        this.zScore = zScore;
        this.pValue = pValue;
        this.confidenceLevel = confidenceLevel;
        this.significant = significant;
    }

    @JsonProperty
    public double getControlConversion() {
        return controlConversion;
    }

    @JsonProperty
    public double getTestConversion() {
        return testConversion;
    }

    @JsonProperty
    public double getAbsoluteDifference() {
        return absoluteDifference;
    }

    @JsonProperty
    public double getRelativeLift() {
        return relativeLift;
    }

    @JsonProperty
    public double getZScore() {
        return zScore;
    }

    @JsonProperty
    public double getPValue() {
        return pValue;
    }

    @JsonProperty
    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    @JsonProperty("significant")
    public boolean isSignificant() {
        return significant;
    }

    @JsonProperty
    public Recommendation getRecommendation() {
        if (!significant || relativeLift == 0) {
            return Recommendation.CONTINUE;
        }
        return relativeLift > 0 ? Recommendation.ADOPT : Recommendation.REJECT;
    }

    @Override
    public String toString() {
        return "SignificanceReport{" +
                "control=" + controlConversion +
                "%, test=" + testConversion +
                "%, lift=" + relativeLift +
                ", z=" + zScore +
                ", p=" + pValue +
                ", significant=" + significant +
                '}';
    }

    public enum Recommendation {
        /**
         * Significant improvement, roll out the change.
         */
        ADOPT,
        /**
         * Significant degradation, discard the change.
         */
        REJECT,
        /**
         * No significant difference yet, keep the experiment running or try another variant.
         */
        CONTINUE
    }
}

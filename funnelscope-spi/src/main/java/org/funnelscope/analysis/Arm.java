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

import com.fasterxml.jackson.annotation.JsonValue;

import static java.util.Locale.ENGLISH;

public enum Arm {
    CONTROL, TEST, UNASSIGNED,
    /**
     * Every user assigned to either arm. Never the result of an assignment.
     */
    ALL;

    /**
     * {@code <test>-A...} is the control arm, {@code <test>-B...} the test arm. Codes of other experiments and any
     * other suffix are unassigned.
     */
    public static Arm fromGroupCode(String testCode, String groupCode) {
        if (groupCode == null || !groupCode.startsWith(testCode + "-")) {
            return UNASSIGNED;
        }
        if (groupCode.contains("-A")) {
            return CONTROL;
        }
        if (groupCode.contains("-B")) {
            return TEST;
        }
        return UNASSIGNED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(ENGLISH);
    }
}

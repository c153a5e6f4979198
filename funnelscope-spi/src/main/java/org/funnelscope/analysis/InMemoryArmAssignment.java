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

import com.google.common.collect.ImmutableMap;

import java.util.Map;

import static org.funnelscope.util.ValidationUtil.checkNotNull;

/**
 * Group codes per user, as they would be read from an assignment table.
 */
public class InMemoryArmAssignment
        implements ArmAssignment {
    private final Map<String, String> groupCodes;

    public InMemoryArmAssignment(Map<String, String> groupCodes) {
        this.groupCodes = ImmutableMap.copyOf(checkNotNull(groupCodes, "groupCodes"));
    }

    @Override
    public Arm resolve(ABTestConfig config, String userId) {
        return config.armOf(groupCodes.get(userId));
    }
}

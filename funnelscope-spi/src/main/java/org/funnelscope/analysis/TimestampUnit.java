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

import io.airlift.units.Duration;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

public enum TimestampUnit {
    SECONDS(TimeUnit.SECONDS),
    MICROSECONDS(TimeUnit.MICROSECONDS);

    private final TimeUnit timeUnit;

    TimestampUnit(TimeUnit timeUnit) {
        this.timeUnit = timeUnit;
    }

    public TimeUnit getTimeUnit() {
        return timeUnit;
    }

    /**
     * Whole units of this resolution contained in the duration, rounded down.
     */
    public long convert(Duration duration) {
        return (long) Math.floor(duration.getValue(timeUnit));
    }

    public long fromInstant(Instant instant) {
        if (this == SECONDS) {
            return instant.getEpochSecond();
        }
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L),
                TimeUnit.NANOSECONDS.toMicros(instant.getNano()));
    }
}

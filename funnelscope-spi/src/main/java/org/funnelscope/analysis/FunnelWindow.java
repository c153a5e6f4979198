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
import com.fasterxml.jackson.annotation.JsonValue;
import io.airlift.units.Duration;
import org.funnelscope.util.ValidationException;

import java.util.concurrent.TimeUnit;

import static org.funnelscope.util.ValidationUtil.checkNotEmpty;

/**
 * Maximum time a user has, counted from the first qualifying event of the funnel, to complete every later step.
 */
public final class FunnelWindow {
    public static final FunnelWindow DEFAULT = new FunnelWindow(Duration.valueOf("24h"));

    private final Duration duration;

    public FunnelWindow(Duration duration) {
        this.duration = duration;
    }

    public static FunnelWindow of(long value, TimeUnit unit) {
        if (value < 0) {
            throw new ValidationException("Window must not be negative: " + value);
        }
        return new FunnelWindow(new Duration(value, unit));
    }

    /**
     * Parses windows such as {@code 45s}, {@code 30m}, {@code 8h} or {@code 7d}.
     */
    @JsonCreator
    public static FunnelWindow valueOf(String window) {
        checkNotEmpty(window, "window");
        try {
            return new FunnelWindow(Duration.valueOf(window.trim()));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(String.format("Invalid window '%s'. Use a number followed by 's', 'm', 'h' or 'd'.", window));
        }
    }

    public Duration getDuration() {
        return duration;
    }

    public boolean isPositive() {
        return duration.getValue(TimeUnit.NANOSECONDS) > 0;
    }

    public long toUnits(TimestampUnit unit) {
        return unit.convert(duration);
    }

    @JsonValue
    @Override
    public String toString() {
        return duration.convertToMostSuccinctTimeUnit().toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunnelWindow)) {
            return false;
        }
        return duration.equals(((FunnelWindow) o).duration);
    }

    @Override
    public int hashCode() {
        return duration.hashCode();
    }
}

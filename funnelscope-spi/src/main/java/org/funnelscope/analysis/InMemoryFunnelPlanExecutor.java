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
import io.airlift.log.Logger;
import org.funnelscope.analysis.SchemaProfile.ParameterAccessor;
import org.funnelscope.util.ValidationException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static org.funnelscope.util.ValidationUtil.checkNotNull;

/**
 * Evaluates funnel plans against events held in memory. Slow, but it computes exactly what the rendered queries of
 * the database backends are expected to compute, so it is used to check them.
 */
public class InMemoryFunnelPlanExecutor
        implements FunnelPlanExecutor {
    private final static Logger LOGGER = Logger.get(InMemoryFunnelPlanExecutor.class);

    private final List<EventRecord> events;
    private final ArmAssignment armAssignment;

    public InMemoryFunnelPlanExecutor(Collection<EventRecord> events, ArmAssignment armAssignment) {
        this.events = ImmutableList.copyOf(checkNotNull(events, "events"));
        this.armAssignment = checkNotNull(armAssignment, "armAssignment");
    }

    public InMemoryFunnelPlanExecutor(Collection<EventRecord> events) {
        this(events, new InMemoryArmAssignment(ImmutableMap.of()));
    }

    @Override
    public CompletableFuture<FunnelResult> execute(FunnelQueryPlan plan) {
        try {
            return CompletableFuture.completedFuture(toResult(plan, count(plan, filter(plan, user -> true))));
        } catch (RuntimeException e) {
            LOGGER.error(e, "Unable to compute funnel %s", plan);
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<CostEstimate> estimate(FunnelQueryPlan plan) {
        return CompletableFuture.completedFuture(new CostEstimate(0));
    }

    @Override
    public CompletableFuture<Map<Arm, FunnelResult>> executeByArm(FunnelQueryPlan plan, ABTestConfig config) {
        try {
            return CompletableFuture.completedFuture(ImmutableMap.of(
                    Arm.CONTROL, armResult(plan, config, arm -> arm == Arm.CONTROL),
                    Arm.TEST, armResult(plan, config, arm -> arm == Arm.TEST),
                    Arm.ALL, armResult(plan, config, arm -> arm != Arm.UNASSIGNED)));
        } catch (RuntimeException e) {
            LOGGER.error(e, "Unable to compute funnel %s for test %s", plan, config.getTestCode());
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public CompletableFuture<Map<String, FunnelResult>> executeBySegment(FunnelQueryPlan plan) {
        String segmentColumn = plan.getSegmentColumn()
                .orElseThrow(() -> new ValidationException("Funnel has no segment column"));
        try {
            Map<String, List<EventRecord>> eventsBySegment = new TreeMap<>();
            for (EventRecord event : filter(plan, user -> true)) {
                Object segment = event.getColumn(segmentColumn);
                if (segment != null) {
                    eventsBySegment.computeIfAbsent(ParameterMatch.asString(segment), key -> new ArrayList<>()).add(event);
                }
            }

            ImmutableMap.Builder<String, FunnelResult> results = ImmutableMap.builder();
            eventsBySegment.forEach((segment, segmentEvents) -> {
                long[] counts = count(plan, segmentEvents);
                if (counts[0] > 0) {
                    results.put(segment, toResult(plan, counts));
                }
            });
            return CompletableFuture.completedFuture(results.build());
        } catch (RuntimeException e) {
            LOGGER.error(e, "Unable to compute funnel %s by %s", plan, segmentColumn);
            return CompletableFuture.failedFuture(e);
        }
    }

    private FunnelResult armResult(FunnelQueryPlan plan, ABTestConfig config, Predicate<Arm> arms) {
        return toResult(plan, count(plan, filter(plan, user -> arms.test(armAssignment.resolve(config, user)))));
    }

    private List<EventRecord> filter(FunnelQueryPlan plan, Predicate<String> userFilter) {
        return events.stream()
                .filter(event -> userFilter.test(event.getUserId()))
                .filter(event -> plan.getDateRange().contains(dateOf(plan.getProfile(), event)))
                .collect(Collectors.toList());
    }

    private static long[] count(FunnelQueryPlan plan, List<EventRecord> events) {
        List<StepPredicate> steps = plan.getSteps();
        long[] counts = new long[steps.size()];

        Map<String, List<EventRecord>> eventsByUser = events.stream()
                .sorted(Comparator.comparing(EventRecord::getTime))
                .collect(Collectors.groupingBy(EventRecord::getUserId));

        for (List<EventRecord> userEvents : eventsByUser.values()) {
            Instant anchor = null;
            Instant windowEnd = null;
            Instant previous = null;

            for (StepPredicate step : steps) {
                Instant reached = null;
                for (EventRecord event : userEvents) {
                    if (!matches(plan.getProfile(), step, event)) {
                        continue;
                    }
                    Instant time = event.getTime();
                    if (step.isAnchor() || (time.isAfter(previous) && !time.isAfter(windowEnd))) {
                        reached = time;
                        break;
                    }
                }

                if (reached == null) {
                    break;
                }
                if (step.isAnchor()) {
                    anchor = reached;
                    windowEnd = anchor.plus(plan.getWindow(), plan.getProfile().getTimestampUnit().getTimeUnit().toChronoUnit());
                }
                previous = reached;
                counts[step.getIndex()]++;
            }
        }
        return counts;
    }

    private static FunnelResult toResult(FunnelQueryPlan plan, long[] counts) {
        ImmutableList.Builder<FunnelResult.StepCount> rows = ImmutableList.builder();
        for (StepPredicate step : plan.getSteps()) {
            rows.add(new FunnelResult.StepCount(step.getIndex(), step.getLabel(), counts[step.getIndex()]));
        }
        return new FunnelResult(rows.build());
    }

    private static LocalDate dateOf(SchemaProfile profile, EventRecord event) {
        switch (profile.getDateFilter()) {
            case TIMESTAMP_CAST:
                return event.getTime().atOffset(ZoneOffset.UTC).toLocalDate();
            case DATE_COLUMN:
                return event.getEventDate();
            default:
                throw new IllegalStateException("Unknown date filter: " + profile.getDateFilter());
        }
    }

    private static boolean matches(SchemaProfile profile, StepPredicate step, EventRecord event) {
        if (!step.getEventName().equals(event.getEventName())) {
            return false;
        }
        boolean nested = profile.getParameterAccessor() == ParameterAccessor.NESTED_KEY_VALUE;
        for (Map.Entry<String, ParameterMatch> entry : step.getParameters().entrySet()) {
            Object value = nested ? event.getParameters().get(entry.getKey()) : event.getColumn(entry.getKey());
            if (!entry.getValue().matches(value)) {
                return false;
            }
        }
        for (Map.Entry<String, ParameterMatch> entry : step.getFilters().entrySet()) {
            if (!entry.getValue().matches(event.getColumn(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }
}

package com.medicalcor.crm.routing.model;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Condition set of a routing rule, or a partial query against rules. A null or empty dimension is unconstrained.
 *
 * <p>{@code timeRange} is a property of rules only; queries never carry one and it is checked against the clock
 * through {@link #activeAt(ZonedDateTime)}.
 */
public record RoutingConditions(
        List<String> procedureTypes,
        List<UrgencyLevel> urgencyLevels,
        List<Channel> channels,
        TimeRange timeRange,
        Boolean vip,
        Boolean existingPatient,
        LeadScore leadScore
) {
    public RoutingConditions {
        procedureTypes = procedureTypes == null ? List.of() : List.copyOf(procedureTypes);
        urgencyLevels = urgencyLevels == null ? List.of() : List.copyOf(urgencyLevels);
        channels = channels == null ? List.of() : List.copyOf(channels);
    }

    public static RoutingConditions any() {
        return of(null, null, null);
    }

    public static RoutingConditions of(List<String> procedureTypes, List<UrgencyLevel> urgencyLevels, List<Channel> channels) {
        return new RoutingConditions(procedureTypes, urgencyLevels, channels, null, null, null, null);
    }

    public static RoutingConditions of(RoutingContext context) {
        return new RoutingConditions(
                context.procedureType() == null ? List.of() : List.of(context.procedureType()),
                context.urgencyLevel() == null ? List.of() : List.of(context.urgencyLevel()),
                context.channel() == null ? List.of() : List.of(context.channel()),
                null,
                context.vip(),
                context.existingRelationship(),
                context.leadScore()
        );
    }

    /**
     * True when, for every dimension present in {@code query}, this condition set either leaves it unconstrained
     * or shares at least one value with it.
     */
    public boolean admits(RoutingConditions query) {
        if (query == null) return true;
        return procedureTypesAdmit(query.procedureTypes())
                && intersects(urgencyLevels, query.urgencyLevels())
                && intersects(channels, query.channels())
                && sameWhenBothSet(vip, query.vip())
                && sameWhenBothSet(existingPatient, query.existingPatient())
                && sameWhenBothSet(leadScore, query.leadScore());
    }

    public boolean activeAt(ZonedDateTime time) {
        return timeRange == null || time == null || timeRange.contains(time);
    }

    private boolean procedureTypesAdmit(List<String> wanted) {
        if (procedureTypes.isEmpty() || wanted.isEmpty()) return true;
        for (var w : wanted) {
            for (var p : procedureTypes) {
                if (p != null && p.equalsIgnoreCase(w)) return true;
            }
        }
        return false;
    }

    private static <T> boolean intersects(Collection<T> constraint, Collection<T> wanted) {
        if (constraint.isEmpty() || wanted.isEmpty()) return true;
        for (var w : wanted) {
            if (constraint.contains(w)) return true;
        }
        return false;
    }

    private static <T> boolean sameWhenBothSet(T constraint, T wanted) {
        return constraint == null || wanted == null || constraint.equals(wanted);
    }

    /**
     * Hours are local to the routing time zone, {@code startHour} inclusive and {@code endHour} exclusive. A start
     * after the end wraps past midnight. An empty {@code daysOfWeek} means every day.
     */
    public record TimeRange(Integer startHour, Integer endHour, List<DayOfWeek> daysOfWeek) {
        public TimeRange {
            if (startHour == null) startHour = 0;
            if (endHour == null) endHour = 24;
            if (startHour < 0 || startHour > 23 || endHour < 1 || endHour > 24 || startHour.equals(endHour)) {
                throw new IllegalArgumentException("invalid_time_range");
            }
            daysOfWeek = daysOfWeek == null ? List.of() : List.copyOf(daysOfWeek);
        }

        public boolean contains(ZonedDateTime time) {
            if (!daysOfWeek.isEmpty() && !daysOfWeek.contains(time.getDayOfWeek())) return false;
            var hour = time.getHour();
            return startHour < endHour
                    ? hour >= startHour && hour < endHour
                    : hour >= startHour || hour < endHour;
        }
    }
}

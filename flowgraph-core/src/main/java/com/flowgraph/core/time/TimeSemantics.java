package com.flowgraph.core.time;

import com.flowgraph.core.model.TransitionRecord;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Queries over an instance's transition history under the two-clock discipline.
 *
 * <ul>
 *   <li>effectiveAt: business time. "What was true at T" filters on it.</li>
 *   <li>recordedAt: system time. "What did the system know at T" filters on it.</li>
 * </ul>
 *
 * All methods take the history in append (sequence) order, as the audit ledger
 * returns it, and never mutate it. When several records qualify, the one appended
 * last wins: a backdated correction supersedes the record it corrects.
 */
public final class TimeSemantics {

    /**
     * Finest resolution a stamp keeps. Matches PostgreSQL {@code timestamptz}, so a
     * record reads back exactly as it was committed.
     */
    public static final ChronoUnit PRECISION = ChronoUnit.MICROS;

    private TimeSemantics() {
    }

    /**
     * {@code instant} truncated to {@link #PRECISION}; null stays null.
     */
    public static Instant atStoredPrecision(Instant instant) {
        return instant == null ? null : instant.truncatedTo(PRECISION);
    }

    /**
     * Latest-appended record whose business time is at or before {@code effectiveAt}.
     */
    public static Optional<TransitionRecord> latestEffective(List<TransitionRecord> history, Instant effectiveAt) {
        TransitionRecord match = null;
        for (TransitionRecord record : history) {
            if (!record.effectiveAt().isAfter(effectiveAt)) {
                match = record;
            }
        }
        return Optional.ofNullable(match);
    }

    /**
     * Latest-appended record the system had recorded at or before {@code recordedAt}.
     */
    public static Optional<TransitionRecord> latestRecorded(List<TransitionRecord> history, Instant recordedAt) {
        TransitionRecord match = null;
        for (TransitionRecord record : history) {
            if (!record.recordedAt().isAfter(recordedAt)) {
                match = record;
            }
        }
        return Optional.ofNullable(match);
    }

    /**
     * What the system believed, as of {@code knownAt}, about business time {@code effectiveAt}.
     */
    public static Optional<TransitionRecord> latestEffective(
            List<TransitionRecord> history, Instant effectiveAt, Instant knownAt) {
        return latestEffective(knownAt(history, knownAt), effectiveAt);
    }

    /**
     * The part of the history recorded at or before {@code knownAt}.
     */
    public static List<TransitionRecord> knownAt(List<TransitionRecord> history, Instant knownAt) {
        return history.stream()
            .filter(r -> !r.recordedAt().isAfter(knownAt))
            .collect(Collectors.toList());
    }

    /**
     * The history ordered by business time, ties kept in append order.
     */
    public static List<TransitionRecord> inEffectiveOrder(List<TransitionRecord> history) {
        List<TransitionRecord> ordered = new ArrayList<>(history);
        ordered.sort(Comparator.comparing(TransitionRecord::effectiveAt)
            .thenComparingLong(TransitionRecord::sequenceNumber));
        return ordered;
    }

    /**
     * Business time spent in each state between {@code startedAt} and {@code until}.
     * The state at any instant is the one {@link #latestEffective} reports, so the
     * totals agree with point-in-time queries. States are keyed in the order they
     * were first occupied.
     */
    public static Map<String, Duration> dwellTimes(
            String initialState,
            Instant startedAt,
            List<TransitionRecord> history,
            Instant until) {
        Map<String, Duration> dwell = new LinkedHashMap<>();
        List<Instant> changePoints = history.stream()
            .map(TransitionRecord::effectiveAt)
            .filter(t -> t.isAfter(startedAt) && t.isBefore(until))
            .distinct()
            .sorted()
            .collect(Collectors.toList());

        Instant cursor = startedAt;
        String state = stateAt(history, startedAt, initialState);
        for (Instant point : changePoints) {
            addDwell(dwell, state, cursor, point);
            cursor = point;
            state = stateAt(history, point, initialState);
        }
        addDwell(dwell, state, cursor, until);
        return dwell;
    }

    /**
     * Check that recordedAt never decreases in append order.
     */
    public static boolean isRecordedMonotonic(List<TransitionRecord> history) {
        for (int i = 1; i < history.size(); i++) {
            if (history.get(i).recordedAt().isBefore(history.get(i - 1).recordedAt())) {
                return false;
            }
        }
        return true;
    }

    private static void addDwell(Map<String, Duration> dwell, String state, Instant from, Instant to) {
        Duration spent = to.isAfter(from) ? Duration.between(from, to) : Duration.ZERO;
        dwell.merge(state, spent, Duration::plus);
    }

    private static String stateAt(List<TransitionRecord> history, Instant at, String initialState) {
        return latestEffective(history, at)
            .map(TransitionRecord::toState)
            .orElse(initialState);
    }
}

package com.bko.readiness.recommendation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * How a session is laid out. Only the fields that apply to the session's category are set:
 * interval sessions carry work/rest/interval counts, tempo sessions a main set, easy sessions an
 * intensity cap, cross-training a list of activities.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkoutStructure(
        int totalDurationMinutes,
        List<Integer> zones,
        Integer warmupMinutes,
        Integer cooldownMinutes,
        Integer workMinutes,
        Integer restMinutes,
        Integer intervals,
        Integer mainSetMinutes,
        String paceGuidance,
        String intensityCap,
        List<String> activities,
        String summary
) {
    public WorkoutStructure {
        zones = zones == null ? List.of() : List.copyOf(zones);
        activities = activities == null ? null : List.copyOf(activities);
    }

    public static WorkoutStructure intervals(int workMinutes, int restMinutes, int intervals, int warmupMinutes, int cooldownMinutes) {
        int total = (workMinutes + restMinutes) * intervals + warmupMinutes + cooldownMinutes;
        return new WorkoutStructure(total, List.of(4, 5), warmupMinutes, cooldownMinutes, workMinutes, restMinutes,
                intervals, null, null, null, null,
                intervals + "x " + workMinutes + "min @ Z4-5 / " + restMinutes + "min rest");
    }

    public static WorkoutStructure tempo(int mainSetMinutes, int warmupMinutes, int cooldownMinutes) {
        return new WorkoutStructure(mainSetMinutes + warmupMinutes + cooldownMinutes, List.of(3, 4), warmupMinutes, cooldownMinutes,
                null, null, null, mainSetMinutes, "Comfortably hard, can speak short sentences", null, null,
                mainSetMinutes + "min @ Z3-4 (tempo/threshold pace)");
    }

    public static WorkoutStructure easy(int minutes) {
        return new WorkoutStructure(minutes, List.of(1), null, null, null, null, null, minutes, null,
                "Zone 1 only, very easy conversational pace", null, minutes + "min @ Z1 (recovery pace)");
    }

    public static WorkoutStructure completeRest() {
        return new WorkoutStructure(0, List.of(), null, null, null, null, null, null, null, null, null,
                "Complete rest, no training");
    }

    public static WorkoutStructure steady(int minutes) {
        return new WorkoutStructure(minutes, List.of(2), null, null, null, null, null, minutes,
                "Conversational pace, can hold a full conversation", null, null,
                minutes + "min @ Z2 (aerobic/endurance pace)");
    }

    public static WorkoutStructure crossTraining(int minutes, List<String> activities) {
        return new WorkoutStructure(minutes, List.of(1, 2), null, null, null, null, null, null, null, null, activities,
                "Low-impact cross-training: " + String.join(", ", activities));
    }

    public boolean isIntervalSession() {
        return intervals != null;
    }

    /**
     * Shrinks the session to fit a time budget. Interval sessions drop repetitions in proportion,
     * never below three.
     */
    public WorkoutStructure fittedTo(int budgetMinutes) {
        if (totalDurationMinutes <= budgetMinutes) {
            return this;
        }
        if (!isIntervalSession()) {
            return new WorkoutStructure(budgetMinutes, zones, warmupMinutes, cooldownMinutes, workMinutes, restMinutes,
                    intervals, mainSetMinutes, paceGuidance, intensityCap, activities, summary);
        }
        int scaled = Math.max(3, (int) Math.floor(intervals * (double) budgetMinutes / totalDurationMinutes));
        return new WorkoutStructure(budgetMinutes, zones, warmupMinutes, cooldownMinutes, workMinutes, restMinutes,
                scaled, mainSetMinutes, paceGuidance, intensityCap, activities,
                scaled + "x " + workMinutes + "min @ Z4-5 / " + restMinutes + "min rest");
    }
}

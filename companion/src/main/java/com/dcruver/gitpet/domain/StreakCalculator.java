package com.dcruver.gitpet.domain;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Counts consecutive calendar days with at least one commit, ending today.
 *
 * A streak whose latest day is yesterday still counts: someone who committed every
 * day up to yesterday and has not committed yet today keeps their streak until the
 * day is over. Only the most recent date gets that allowance; once it is taken the
 * run is counted backwards from yesterday.
 */
public final class StreakCalculator {

    private StreakCalculator() {
    }

    /**
     * @param commitDates calendar dates of recent commits, any order, duplicates allowed
     * @param today       the caller's current local date
     * @return streak length in days, 0 when there are no commits
     */
    public static int calculate(Collection<LocalDate> commitDates, LocalDate today) {
        List<LocalDate> dates = commitDates.stream()
            .filter(Objects::nonNull)
            .filter(date -> !date.isAfter(today))
            .distinct()
            .sorted(Comparator.reverseOrder())
            .toList();

        if (dates.isEmpty()) {
            return 0;
        }

        LocalDate anchor = today;
        if (dates.get(0).equals(today.minusDays(1))) {
            anchor = today.minusDays(1);
        }

        int streak = 0;
        for (int i = 0; i < dates.size(); i++) {
            if (!dates.get(i).equals(anchor.minusDays(i))) {
                break;
            }
            streak++;
        }
        return streak;
    }
}

package com.offy.competition.service;

import com.offy.competition.model.ScreenTimeLog;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Minutes per day from a user's log rows. A day with a "Total" row uses it as the day's
 * total; otherwise the app rows of that day are summed.
 */
final class DayTotals {

    private DayTotals() {
    }

    static Map<LocalDate, Integer> of(List<ScreenTimeLog> logs) {
        Map<LocalDate, Integer> appSums = new HashMap<>();
        Map<LocalDate, Integer> totals = new HashMap<>();
        for (ScreenTimeLog log : logs) {
            if (AppCatalog.TOTAL.equals(log.getAppName())) {
                totals.merge(log.getLogDate(), log.getMinutes(), Integer::sum);
            } else {
                appSums.merge(log.getLogDate(), log.getMinutes(), Integer::sum);
            }
        }

        Map<LocalDate, Integer> result = new TreeMap<>(appSums);
        result.putAll(totals);
        return result;
    }
}

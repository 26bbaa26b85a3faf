package hk.edu.hulab.portal.backend.analytics;

import java.util.Map;

/**
 * @param byHour         statements per hour of day (0-23)
 * @param byWeekday      statements per ISO weekday name, Monday first
 * @param mostActiveHour null when there were no statements
 */
public record ActivityPatterns(Map<Integer, Long> byHour, Map<String, Long> byWeekday, Integer mostActiveHour) {
}

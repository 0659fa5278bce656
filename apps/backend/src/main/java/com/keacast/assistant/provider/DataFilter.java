package com.keacast.assistant.provider;

import java.time.LocalDate;

/**
 * Query scope of a data provider.
 *
 * @param ownerId      user the data belongs to
 * @param scopeId      account, where the family is account scoped
 * @param forecastType only read by the upcoming-transactions provider
 */
public record DataFilter(
        String ownerId,
        String scopeId,
        LocalDate startDate,
        LocalDate endDate,
        String forecastType
) {
    public static DataFilter owner(String ownerId) {
        return new DataFilter(ownerId, null, null, null, null);
    }

    public static DataFilter account(String ownerId, String scopeId) {
        return new DataFilter(ownerId, scopeId, null, null, null);
    }

    public DataFilter withRange(LocalDate start, LocalDate end) {
        return new DataFilter(ownerId, scopeId, start, end, forecastType);
    }

    public DataFilter withForecastType(String type) {
        return new DataFilter(ownerId, scopeId, startDate, endDate, type);
    }

    public boolean hasRange() {
        return startDate != null && endDate != null;
    }
}

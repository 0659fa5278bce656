package com.keacast.assistant.provider;

import com.keacast.assistant.config.AiProperties;
import com.keacast.assistant.mapper.TransactionMapper;
import com.keacast.assistant.mapper.model.TransactionRecord;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Component
public class UpcomingTransactionProvider extends AbstractPaginatedProvider<TransactionRecord> {

    public static final String DEFAULT_FORECAST_TYPE = "F";
    private static final int DEFAULT_WINDOW_DAYS = 30;

    private final TransactionMapper mapper;
    private final Clock clock;

    public UpcomingTransactionProvider(AiProperties props, ResourceExhaustionDetector detector,
                                       TransactionMapper mapper, Clock clock) {
        super(props, detector);
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public String family() {
        return "upcoming transactions";
    }

    @Override
    public int defaultLimit() {
        return props.getProviders().getDefaultUpcomingLimit();
    }

    @Override
    protected DataFilter prepare(DataFilter filter) {
        require(filter.scopeId(), "accountId");
        LocalDate today = LocalDate.now(clock);
        LocalDate start = filter.startDate() != null ? filter.startDate() : today;
        LocalDate end = filter.endDate() != null ? filter.endDate() : start.plusDays(DEFAULT_WINDOW_DAYS);
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }
        String type = filter.forecastType() == null || filter.forecastType().isBlank()
                ? DEFAULT_FORECAST_TYPE : filter.forecastType();
        return filter.withRange(start, end).withForecastType(type);
    }

    @Override
    protected List<TransactionRecord> fetch(DataFilter filter, int limit, int offset) {
        return mapper.findUpcoming(filter.scopeId(), filter.forecastType(),
                filter.startDate(), filter.endDate(), limit, offset);
    }

    @Override
    protected long doCount(DataFilter filter) {
        return mapper.countUpcoming(filter.scopeId(), filter.forecastType(), filter.startDate(), filter.endDate());
    }
}

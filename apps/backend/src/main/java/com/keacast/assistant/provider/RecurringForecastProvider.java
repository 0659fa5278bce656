package com.keacast.assistant.provider;

import com.keacast.assistant.config.AiProperties;
import com.keacast.assistant.mapper.TransactionMapper;
import com.keacast.assistant.mapper.model.TransactionRecord;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class RecurringForecastProvider extends AbstractPaginatedProvider<TransactionRecord> {

    private final TransactionMapper mapper;

    public RecurringForecastProvider(AiProperties props, ResourceExhaustionDetector detector, TransactionMapper mapper) {
        super(props, detector);
        this.mapper = mapper;
    }

    @Override
    public String family() {
        return "forecasts";
    }

    @Override
    public int defaultLimit() {
        return props.getProviders().getDefaultForecastsLimit();
    }

    @Override
    protected DataFilter prepare(DataFilter filter) {
        require(filter.scopeId(), "accountId");
        return filter;
    }

    @Override
    protected List<TransactionRecord> fetch(DataFilter filter, int limit, int offset) {
        return mapper.findRecurringForecasts(filter.scopeId(), limit, offset);
    }

    @Override
    protected long doCount(DataFilter filter) {
        return mapper.countRecurringForecasts(filter.scopeId());
    }
}

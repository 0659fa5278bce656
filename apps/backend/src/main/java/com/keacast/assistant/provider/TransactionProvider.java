package com.keacast.assistant.provider;

import com.keacast.assistant.config.AiProperties;
import com.keacast.assistant.mapper.TransactionMapper;
import com.keacast.assistant.mapper.model.TransactionRecord;
import com.keacast.assistant.mapper.model.TransactionSummary;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Transactions of one account in a date window. Without an explicit window the query covers
 * one year back to two years forward from yesterday.
 */
@Component
public class TransactionProvider extends AbstractPaginatedProvider<TransactionRecord> {

    private final TransactionMapper mapper;
    private final Clock clock;

    public TransactionProvider(AiProperties props, ResourceExhaustionDetector detector,
                               TransactionMapper mapper, Clock clock) {
        super(props, detector);
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public String family() {
        return "transactions";
    }

    @Override
    public int defaultLimit() {
        return props.getProviders().getDefaultTransactionsLimit();
    }

    @Override
    protected DataFilter prepare(DataFilter filter) {
        require(filter.ownerId(), "userId");
        require(filter.scopeId(), "accountId");
        LocalDate anchor = LocalDate.now(clock).minusDays(1);
        LocalDate start = filter.startDate() != null ? filter.startDate() : anchor.minusYears(1);
        LocalDate end = filter.endDate() != null ? filter.endDate() : anchor.plusYears(2);
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }
        return filter.withRange(start, end);
    }

    @Override
    protected List<TransactionRecord> fetch(DataFilter filter, int limit, int offset) {
        return mapper.findByAccount(filter.ownerId(), filter.scopeId(),
                filter.startDate(), filter.endDate(), limit, offset);
    }

    @Override
    protected long doCount(DataFilter filter) {
        return mapper.countByAccount(filter.scopeId(), filter.startDate(), filter.endDate());
    }

    /** 聚合统计，不加载明细 */
    public TransactionSummary summarize(DataFilter filter) {
        DataFilter f = prepare(filter);
        TransactionSummary summary = mapper.summarize(f.scopeId(), f.startDate(), f.endDate());
        return summary == null ? new TransactionSummary() : summary;
    }
}

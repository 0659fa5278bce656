package com.keacast.assistant.provider;

import com.keacast.assistant.config.AiProperties;
import com.keacast.assistant.mapper.AccountMapper;
import com.keacast.assistant.mapper.model.AccountRecord;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class AccountProvider extends AbstractPaginatedProvider<AccountRecord> {

    private final AccountMapper mapper;

    public AccountProvider(AiProperties props, ResourceExhaustionDetector detector, AccountMapper mapper) {
        super(props, detector);
        this.mapper = mapper;
    }

    @Override
    public String family() {
        return "accounts";
    }

    @Override
    public int defaultLimit() {
        return props.getProviders().getDefaultAccountsLimit();
    }

    @Override
    protected DataFilter prepare(DataFilter filter) {
        require(filter.ownerId(), "userId");
        return filter;
    }

    @Override
    protected List<AccountRecord> fetch(DataFilter filter, int limit, int offset) {
        return mapper.findByUser(filter.ownerId(), limit, offset);
    }

    @Override
    protected long doCount(DataFilter filter) {
        return mapper.countByUser(filter.ownerId());
    }
}

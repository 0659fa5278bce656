package com.keacast.assistant.provider;

import com.keacast.assistant.config.AiProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.List;

/**
 * list = page query + count query; a resource-exhausted page query degrades to count only.
 */
@Slf4j
public abstract class AbstractPaginatedProvider<T> implements PaginatedDataProvider<T> {

    protected final AiProperties props;
    private final ResourceExhaustionDetector detector;

    protected AbstractPaginatedProvider(AiProperties props, ResourceExhaustionDetector detector) {
        this.props = props;
        this.detector = detector;
    }

    protected abstract List<T> fetch(DataFilter filter, int limit, int offset);

    protected abstract long doCount(DataFilter filter);

    /** 补默认日期窗口等；非法参数抛 IllegalArgumentException */
    protected DataFilter prepare(DataFilter filter) {
        return filter;
    }

    @Override
    public final PageOutcome<T> list(DataFilter filter, PageRequest page) {
        DataFilter f = prepare(filter);
        PageRequest req = (page == null ? PageRequest.first() : page)
                .normalize(defaultLimit(), props.getProviders().getMaxLimit());
        try {
            List<T> items = fetch(f, req.limit(), req.offset());
            long total = doCount(f);
            log.debug("[DATA] family={} owner={} scope={} page={} limit={} items={} total={}",
                    family(), f.ownerId(), f.scopeId(), req.page(), req.limit(), items.size(), total);
            return PageOutcome.ok(PageResult.of(items, req, total));
        } catch (DataAccessException e) {
            if (!detector.isResourceExhausted(e)) {
                throw e;
            }
            long total = doCount(f);
            log.warn("[DATA-FALLBACK] family={} owner={} scope={} resource exhausted, count={} err={}",
                    family(), f.ownerId(), f.scopeId(), total, e.getMostSpecificCause().getMessage());
            return PageOutcome.resourceExhausted(total, String.format(
                    "Database memory limit reached. Found %d %s total. Please use smaller date ranges or contact support.",
                    total, family()));
        }
    }

    @Override
    public final long count(DataFilter filter) {
        return doCount(prepare(filter));
    }

    protected static String require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }
}

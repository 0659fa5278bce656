package com.keacast.assistant.provider;

/**
 * Blocking, paginated read access to one data family. Callers on a reactive thread wrap the calls
 * with {@code Mono.fromCallable(..).subscribeOn(Schedulers.boundedElastic())}.
 */
public interface PaginatedDataProvider<T> {

    /** accounts / transactions / forecasts / upcoming */
    String family();

    int defaultLimit();

    /**
     * 资源耗尽（排序内存不足之类）时返回 {@link PageOutcome#resourceExhausted}，不抛异常；
     * 其它数据访问错误照常抛出。
     */
    PageOutcome<T> list(DataFilter filter, PageRequest page);

    long count(DataFilter filter);
}

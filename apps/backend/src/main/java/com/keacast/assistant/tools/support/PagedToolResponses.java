package com.keacast.assistant.tools.support;

import com.keacast.assistant.provider.PageOutcome;
import com.keacast.assistant.provider.PageResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool payloads for paginated provider results.
 */
public final class PagedToolResponses {
    private PagedToolResponses() {}

    public static final Map<String, Object> PAGE_PROPERTIES = Map.of(
            "page", Map.of("type", "integer", "description", "1-based page number, default 1"),
            "limit", Map.of("type", "integer", "description", "Page size; omit to use the default")
    );

    /**
     * @param itemsKey 例如 "accounts" / "transactions"
     * @param noun     用在提示语里的名词
     */
    public static <T> Map<String, Object> render(PageOutcome<T> outcome, String itemsKey, String noun) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (!outcome.isOk()) {
            data.put(itemsKey, List.of());
            data.put("total_count", outcome.total());
            data.put("error", "Memory limit exceeded");
            data.put("message", outcome.message());
            return data;
        }
        PageResult<T> page = outcome.page();
        data.put(itemsKey, page.items());

        Map<String, Object> pagination = new LinkedHashMap<>();
        pagination.put("page", page.page());
        pagination.put("limit", page.limit());
        pagination.put("total", page.total());
        pagination.put("pages", page.pages());
        pagination.put("hasNext", page.hasNext());
        pagination.put("hasPrev", page.hasPrev());
        data.put("pagination", pagination);

        if (page.page() == 1 && page.total() > page.limit()) {
            data.put("message", String.format("Retrieved %d of %d %s. Use pagination for more %s.",
                    page.items().size(), page.total(), noun, noun));
        } else {
            data.put("message", String.format("Retrieved %d %s (page %d of %d).",
                    page.items().size(), noun, page.page(), Math.max(1, page.pages())));
        }
        return data;
    }
}

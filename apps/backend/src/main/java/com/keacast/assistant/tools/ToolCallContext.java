package com.keacast.assistant.tools;

import java.util.Set;

/**
 * Caller scope handed to every tool. The bearer token is passed through opaquely.
 */
public record ToolCallContext(
        String userId,
        String accountId,
        String authToken,
        String sessionId
) {
    /** 由调用方作用域注入的参数名（含下划线写法），模型不能自己给 */
    public static final Set<String> SCOPE_ARGUMENTS = Set.of("userId", "accountId", "user_id", "account_id");
}

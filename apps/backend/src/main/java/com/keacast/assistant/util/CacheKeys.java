package com.keacast.assistant.util;

import java.util.StringJoiner;

/**
 * Context cache key layout. Every caller-supplied segment is percent-escaped so that ':' and glob
 * characters in an id can neither collide with another (user, account, purpose) triple nor widen
 * an invalidation pattern.
 *
 * <pre>
 *   {prefix}:{user}:context:{account}
 *   {prefix}:{user}:userdata
 *   {prefix}:{user}:balances:{account}
 *   {prefix}:{user}:lastupdated:{account}
 *   {prefix}:{user}:transactions:{account}:{range}
 *   {prefix}:{user}:quick:{slot}
 *   {prefix}:health-check:{token}
 * </pre>
 */
public final class CacheKeys {

    public static final String CONTEXT = "context";
    public static final String USER_DATA = "userdata";
    public static final String BALANCES = "balances";
    public static final String LAST_UPDATED = "lastupdated";
    public static final String TRANSACTIONS = "transactions";
    public static final String QUICK_ACCESS = "quick";
    public static final String HEALTH_CHECK = "health-check";

    static final String NULL_SEGMENT = "%00";

    private final String prefix;

    public CacheKeys(String prefix) {
        this.prefix = prefix == null || prefix.isBlank() ? "ctx" : prefix;
    }

    public String context(String userId, String accountId) {
        return join(userId, CONTEXT, accountId);
    }

    public String userData(String userId) {
        return join(userId, USER_DATA);
    }

    public String balances(String userId, String accountId) {
        return join(userId, BALANCES, accountId);
    }

    public String lastUpdated(String userId, String accountId) {
        return join(userId, LAST_UPDATED, accountId);
    }

    public String transactions(String userId, String accountId, String range) {
        return join(userId, TRANSACTIONS, accountId, range);
    }

    /** 短 TTL 的快速查询结果，slot 例如 "accounts" */
    public String quickAccess(String userId, String slot) {
        return join(userId, QUICK_ACCESS, slot);
    }

    /** 健康检查用的临时 key */
    public String healthCheck(String token) {
        return prefix + ":" + HEALTH_CHECK + ":" + escape(token);
    }

    /** 该用户的全部 key */
    public String userPattern(String userId) {
        return prefix + ":" + escape(userId) + ":*";
    }

    public String accountTransactionsPattern(String userId, String accountId) {
        return join(userId, TRANSACTIONS, accountId) + ":*";
    }

    private String join(String userId, String purpose, String... rest) {
        StringJoiner j = new StringJoiner(":");
        j.add(prefix).add(escape(userId)).add(purpose);
        for (String r : rest) {
            j.add(escape(r));
        }
        return j.toString();
    }

    public static String escape(String segment) {
        if (segment == null) {
            // 转义结果里不会出现 %00，不会和任何真实 id 撞上
            return NULL_SEGMENT;
        }
        StringBuilder sb = new StringBuilder(segment.length());
        for (char c : segment.toCharArray()) {
            switch (c) {
                case '%', ':', '*', '?', '[', ']', '\\' -> sb.append('%')
                        .append(String.format("%02X", (int) c));
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}

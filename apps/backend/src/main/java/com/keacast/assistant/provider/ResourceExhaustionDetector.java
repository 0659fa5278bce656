package com.keacast.assistant.provider;

import com.keacast.assistant.config.AiProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Recognizes "query ran out of resources" by vendor error code or SQLState anywhere on the cause
 * chain. Message text is not inspected.
 */
@Component
@RequiredArgsConstructor
public class ResourceExhaustionDetector {

    private final AiProperties props;

    public boolean isResourceExhausted(Throwable error) {
        AiProperties.Providers cfg = props.getProviders();
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        Throwable t = error;
        while (t != null && seen.put(t, Boolean.TRUE) == null) {
            if (t instanceof SQLException sql) {
                SQLException cur = sql;
                while (cur != null) {
                    if (cfg.getResourceExhaustedErrorCodes().contains(cur.getErrorCode())) {
                        return true;
                    }
                    if (cur.getSQLState() != null && cfg.getResourceExhaustedSqlStates().contains(cur.getSQLState())) {
                        return true;
                    }
                    cur = cur.getNextException();
                }
            }
            t = t.getCause();
        }
        return false;
    }
}

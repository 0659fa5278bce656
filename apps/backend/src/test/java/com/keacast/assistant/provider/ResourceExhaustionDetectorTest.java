package com.keacast.assistant.provider;

import com.keacast.assistant.config.AiProperties;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class ResourceExhaustionDetectorTest {

    private final ResourceExhaustionDetector detector = new ResourceExhaustionDetector(new AiProperties());

    @Test
    void matches_vendor_code_deep_in_cause_chain() {
        SQLException root = new SQLException("Out of memory", "HY000", 1041);
        Exception wrapped = new DataAccessResourceFailureException("query failed", new RuntimeException(root));

        assertTrue(detector.isResourceExhausted(wrapped));
    }

    @Test
    void matches_sql_state_on_chained_next_exception() {
        SQLException first = new SQLException("batch failed", "HY000", 0);
        first.setNextException(new SQLException("out of memory", "53200", 0));

        assertTrue(detector.isResourceExhausted(first));
    }

    @Test
    void ignores_message_text_and_other_codes() {
        assertFalse(detector.isResourceExhausted(new SQLException("Out of sort memory", "42000", 1064)));
        assertFalse(detector.isResourceExhausted(new IllegalStateException("Out of sort memory")));
        assertFalse(detector.isResourceExhausted(null));
    }
}

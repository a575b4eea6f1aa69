package com.monitoring.plugin.result;

import com.monitoring.plugin.core.model.Result;
import com.monitoring.plugin.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResultAggregator Tests")
class ResultAggregatorTest {

    private ResultAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new ResultAggregator();
    }

    @Nested
    @DisplayName("code()")
    class Code {

        @Test
        @DisplayName("No results is UNKNOWN")
        void empty() {
            assertEquals(Severity.UNKNOWN, aggregator.code());
            assertTrue(aggregator.isEmpty());
        }

        @Test
        @DisplayName("Single result gives its own severity")
        void single() {
            for (Severity severity : Severity.values()) {
                ResultAggregator one = new ResultAggregator();
                one.addResult(severity, severity.label());
                assertEquals(severity, one.code());
            }
        }

        @Test
        @DisplayName("CRITICAL wins over everything")
        void criticalWins() {
            aggregator.addResult(Severity.OK, "a");
            aggregator.addResult(Severity.UNKNOWN, "u");
            aggregator.addResult(Severity.WARNING, "w");
            aggregator.addResult(Severity.CRITICAL, "c");
            assertEquals(Severity.CRITICAL, aggregator.code());
        }

        @Test
        @DisplayName("WARNING is not masked by UNKNOWN")
        void warningOverUnknown() {
            aggregator.addResult(Severity.UNKNOWN, "u");
            aggregator.addResult(Severity.WARNING, "w");
            assertEquals(Severity.WARNING, aggregator.code());
        }

        @Test
        @DisplayName("UNKNOWN masks OK")
        void unknownOverOk() {
            aggregator.addResult(Severity.OK, "a");
            aggregator.addResult(Severity.UNKNOWN, "u");
            aggregator.addResult(Severity.OK, "b");
            assertEquals(Severity.UNKNOWN, aggregator.code());
        }

        @Test
        @DisplayName("Many warnings after a critical stay CRITICAL")
        void criticalThenWarnings() {
            aggregator.addResult(Severity.CRITICAL, "OK");
            aggregator.addResult(Severity.WARNING, "WARNING");
            aggregator.addResult(Severity.WARNING, "WARNING");
            aggregator.addResult(Severity.WARNING, "UNKNOWN");
            assertEquals(Severity.CRITICAL, aggregator.code());
        }
    }

    @Nested
    @DisplayName("message()")
    class Message {

        @Test
        @DisplayName("Message of the first result with the aggregate severity")
        void firstMatch() {
            aggregator.addResult(Severity.OK, "a");
            aggregator.addResult(Severity.CRITICAL, "b");
            aggregator.addResult(Severity.WARNING, "c");
            aggregator.addResult(Severity.CRITICAL, "d");
            assertEquals(Severity.CRITICAL, aggregator.code());
            assertEquals("b", aggregator.message());
        }

        @Test
        @DisplayName("Empty aggregator has an empty message")
        void empty() {
            assertEquals("", aggregator.message());
            assertEquals("", aggregator.message(ResultAggregator.DEFAULT_LEVELS, ResultAggregator.DEFAULT_JOINER));
        }

        @Test
        @DisplayName("Default levels join OK, WARNING and CRITICAL messages")
        void joinAll() {
            aggregator.addResult(Severity.OK, "OK");
            aggregator.addResult(Severity.UNKNOWN, "hidden");
            aggregator.addResult(Severity.WARNING, "WARNING");
            aggregator.addResult(Severity.OK, null);
            aggregator.addResult(Severity.CRITICAL, "CRITICAL");
            assertEquals("OK, WARNING, CRITICAL",
                    aggregator.message(ResultAggregator.DEFAULT_LEVELS, ResultAggregator.DEFAULT_JOINER));
        }

        @Test
        @DisplayName("message(levels, joiner) filters by level")
        void joinLevels() {
            aggregator.addResult(Severity.OK, "OK");
            aggregator.addResult(Severity.WARNING, "disk");
            aggregator.addResult(Severity.CRITICAL, "CRITICAL");
            aggregator.addResult(Severity.WARNING, "load");
            assertEquals("disk / load", aggregator.message(EnumSet.of(Severity.WARNING), " / "));
        }
    }

    @Test
    @DisplayName("results() preserves insertion order and is read-only")
    void resultsView() {
        aggregator.addResult(Severity.WARNING, "x");
        aggregator.add(Result.ok("y"));

        List<Result> results = aggregator.results();
        assertEquals(2, aggregator.size());
        assertEquals("x", results.get(0).message());
        assertEquals("y", results.get(1).message());
        assertThrows(UnsupportedOperationException.class, () -> results.add(Result.ok("z")));
    }

    @Test
    @DisplayName("Rejected add leaves the results unchanged")
    void atomicAdd() {
        aggregator.addResult(Severity.OK, "a");
        assertThrows(NullPointerException.class, () -> aggregator.addResult(null, "b"));
        assertThrows(NullPointerException.class, () -> aggregator.add(null));
        assertEquals(1, aggregator.size());
    }
}

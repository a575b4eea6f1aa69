package com.monitoring.plugin.perfdata;

import com.monitoring.plugin.threshold.ThresholdRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Performance Data Tests")
class PerformanceDataFormatterTest {

    private PerformanceDataFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new PerformanceDataFormatter();
    }

    @Nested
    @DisplayName("render()")
    class Render {

        @Test
        @DisplayName("Renders tokens in insertion order with empty positions kept")
        void readmeExample() {
            formatter.addPerfdata("percent_used", 20, "%", (String) null, null, 0, 100);
            formatter.addPerfdata("age_of_the_captain", 87);

            assertEquals("'percent_used'=20%;;;0;100 'age_of_the_captain'=87;;;;", formatter.render());
        }

        @Test
        @DisplayName("Nothing added renders empty")
        void empty() {
            assertEquals("", formatter.render());
            assertTrue(formatter.isEmpty());
        }

        @Test
        @DisplayName("Rendering twice gives the same output")
        void idempotent() {
            formatter.addPerfdata("load1", 0.75, null, "5", "10", 0, null);
            String first = formatter.render();
            assertEquals(first, formatter.render());
            assertEquals("'load1'=0.75;5;10;0;", first);
        }

        @Test
        @DisplayName("Textual thresholds are rendered verbatim")
        void textualThresholds() {
            formatter.addPerfdata("value", 42, null, "@10:20", "~:90", null, null);
            assertEquals("'value'=42;@10:20;~:90;;", formatter.render());
        }

        @Test
        @DisplayName("Parsed ranges are rendered in canonical form")
        void rangeThresholds() {
            formatter.add(PerfDatum.builder("used", 93.5)
                    .unit("%")
                    .warning(ThresholdRange.parse(":90"))
                    .critical(ThresholdRange.parse("95"))
                    .minimum(0)
                    .maximum(100.0)
                    .build());
            assertEquals("'used'=93.5%;~:90;0:95;0;100", formatter.render());
        }

        @Test
        @DisplayName("Parsed ranges are accepted directly by addPerfdata")
        void rangeOverload() {
            formatter.addPerfdata("temp", 21.5, "C",
                    ThresholdRange.parse("@10:20"), ThresholdRange.parse("5:"), null, 40);
            assertEquals("'temp'=21.5C;@10:20;5:;;40", formatter.render());
        }

        @Test
        @DisplayName("Float values render without widening noise")
        void floatValue() {
            formatter.addPerfdata("load", 0.1f);
            assertEquals("'load'=0.1;;;;", formatter.render());
        }

        @Test
        @DisplayName("Spaces are kept and single quotes doubled inside the label")
        void labelQuoting() {
            formatter.addPerfdata("disk /var", 1, "B");
            formatter.addPerfdata("captain's age", 87);
            assertEquals("'disk /var'=1B;;;; 'captain''s age'=87;;;;", formatter.render());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Empty or null label is rejected")
        void emptyLabel() {
            assertThrows(InvalidPerfdataLabelException.class, () -> formatter.addPerfdata("", 1));
            assertThrows(InvalidPerfdataLabelException.class, () -> formatter.addPerfdata(null, 1));
            assertTrue(formatter.isEmpty());
        }

        @Test
        @DisplayName("Label with '=' or line break is rejected")
        void delimiterLabel() {
            InvalidPerfdataLabelException e = assertThrows(InvalidPerfdataLabelException.class,
                    () -> formatter.addPerfdata("a=b", 1));
            assertEquals("a=b", e.getLabel());
            assertNull(e.getCause());
            assertThrows(InvalidPerfdataLabelException.class, () -> formatter.addPerfdata("a\nb", 1));
        }

        @Test
        @DisplayName("Fields that would break the token are rejected")
        void badFields() {
            assertThrows(IllegalArgumentException.class, () -> formatter.addPerfdata("x", 1, "m s"));
            assertThrows(IllegalArgumentException.class,
                    () -> formatter.addPerfdata("x", 1, null, "1;2", null, null, null));
            assertThrows(NullPointerException.class, () -> formatter.addPerfdata("x", null));
            assertThrows(IllegalArgumentException.class, () -> formatter.addPerfdata("x", Double.NaN));
            assertEquals(0, formatter.size());
        }

        @Test
        @DisplayName("Label exception can carry a cause")
        void labelExceptionCause() {
            IllegalStateException cause = new IllegalStateException("source");
            InvalidPerfdataLabelException e = new InvalidPerfdataLabelException("x", "bad label", cause);
            assertSame(cause, e.getCause());
            assertEquals("x", e.getLabel());
            assertEquals("bad label", e.getMessage());
        }

        @Test
        @DisplayName("Failed add leaves previously added data untouched")
        void atomicAdd() {
            formatter.addPerfdata("ok", 1);
            assertThrows(InvalidPerfdataLabelException.class, () -> formatter.addPerfdata("", 2));
            assertEquals(1, formatter.data().size());
            assertEquals("'ok'=1;;;;", formatter.render());
        }
    }
}

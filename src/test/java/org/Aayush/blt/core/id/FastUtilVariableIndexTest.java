package org.Aayush.blt.core.id;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilVariableIndexTest {

    private List<String> standardNames;

    @BeforeEach
    void setUp() {
        standardNames = List.of("h", "v", "g");
    }

    @Test
    @DisplayName("Baseline Correctness: Declaration order defines the dense index")
    void testSimpleMapping() {
        VariableIndex index = VariableIndex.of(standardNames);

        // Forward
        assertEquals(0, index.indexOf("h"));
        assertEquals(1, index.indexOf("v"));

        // Reverse
        assertEquals("h", index.nameOf(0));
        assertEquals("g", index.nameOf(2));

        // Membership
        assertTrue(index.contains("v"));
        assertFalse(index.contains("w"));

        assertEquals(3, index.size());
    }

    @Test
    @DisplayName("Dotted and subscripted names are plain keys")
    void testStructuredNames() {
        VariableIndex index = new FastUtilVariableIndex(List.of("body.pos[1]", "body.pos[2]", "motor.i"));

        assertEquals(1, index.indexOf("body.pos[2]"));
        assertEquals("motor.i", index.nameOf(2));
        assertFalse(index.contains("body.pos"));
    }

    @Test
    @DisplayName("Exception Path: Unknown variable name")
    void testUnknownName() {
        VariableIndex index = new FastUtilVariableIndex(standardNames);

        assertThrows(VariableIndex.UnknownVariableException.class, () -> {
            index.indexOf("w");
        }, "Should throw UnknownVariableException for undeclared names");
    }

    @Test
    @DisplayName("Exception Path: Invalid dense index")
    void testInvalidIndex() {
        VariableIndex index = new FastUtilVariableIndex(standardNames);

        assertThrows(IndexOutOfBoundsException.class, () -> index.nameOf(3));
        assertThrows(IndexOutOfBoundsException.class, () -> index.nameOf(-1));
    }

    @Test
    @DisplayName("Null lookups are reported as absent")
    void testNullLookup() {
        VariableIndex index = new FastUtilVariableIndex(standardNames);

        assertFalse(index.contains(null));
        assertThrows(VariableIndex.UnknownVariableException.class, () -> index.indexOf(null));
    }

    @Test
    @DisplayName("Constructor Validation: Reject null list and null names")
    void testRejectNulls() {
        assertThrows(IllegalArgumentException.class, () -> new FastUtilVariableIndex(null));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilVariableIndex(Arrays.asList("a", null)));
    }

    @Test
    @DisplayName("Constructor Validation: Detect duplicate names")
    void testDuplicateDetection() {
        Exception exception = assertThrows(IllegalArgumentException.class, () -> {
            new FastUtilVariableIndex(List.of("a", "b", "a"));
        });

        assertTrue(exception.getMessage().contains("Duplicate variable name"));
    }

    @Test
    @DisplayName("Stress Test: Large flattened array")
    void testLargeVolume() {
        int count = 200_000;
        List<String> names = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            names.add("x[" + (i + 1) + "]");
        }

        VariableIndex index = new FastUtilVariableIndex(names);

        assertEquals(count, index.size());
        assertEquals(998, index.indexOf("x[999]"));
        assertEquals("x[200000]", index.nameOf(count - 1));
    }

    @Test
    @DisplayName("Concurrency: Thread-safe read operations")
    void testConcurrentReads() throws InterruptedException {
        VariableIndex index = new FastUtilVariableIndex(standardNames);
        int threads = 8;
        int iterations = 1000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        AtomicInteger errors = new AtomicInteger(0);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < iterations; i++) {
                        int id = index.indexOf("v");
                        if (!"v".equals(index.nameOf(id))) {
                            errors.incrementAndGet();
                        }
                        index.contains("g");
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                }
            });
        }

        executor.shutdown();
        boolean finished = executor.awaitTermination(5, TimeUnit.SECONDS);

        assertTrue(finished, "Executor did not finish in time");
        assertEquals(0, errors.get(), "Concurrent reads caused errors");
    }
}

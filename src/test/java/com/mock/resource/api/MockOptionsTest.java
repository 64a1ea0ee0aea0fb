package com.mock.resource.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MockOptions Tests")
class MockOptionsTest {

    @Test
    @DisplayName("Defaults should enable default routes and JSON")
    void defaults() {
        MockOptions options = MockOptions.defaults();

        assertEquals(1000, options.getMaxUniquenessAttempts());
        assertTrue(options.isDefaultRoutesEnabled());
        assertEquals("json", options.getDefaultFormat());
        assertFalse(options.isDiagnosticsEnabled());
    }

    @Test
    @DisplayName("Builder should validate its inputs")
    void validation() {
        assertThrows(IllegalArgumentException.class,
                () -> MockOptions.builder().maxUniquenessAttempts(0));
        assertThrows(IllegalArgumentException.class,
                () -> MockOptions.builder().defaultFormat("yaml"));
    }

    @Test
    @DisplayName("A small uniqueness budget should surface through the context")
    void uniquenessBudget() {
        MockContext mock = MockContext.builder()
                .options(MockOptions.builder().maxUniquenessAttempts(2).build())
                .build();
        mock.define("color", c -> c.uniquify("name", () -> "red"));

        mock.create("color");
        mock.create("color");

        assertEquals("red 2", mock.find("colors", 2).get("name"));
    }
}

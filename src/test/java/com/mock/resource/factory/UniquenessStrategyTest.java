package com.mock.resource.factory;

import com.mock.resource.core.model.Record;
import com.mock.resource.definition.AttributeDefinition;
import com.mock.resource.definition.DefaultProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class UniquenessStrategyTest {

    private static Record stored(String type, int id, Object value) {
        return new Record(type, id, Map.of("code", value));
    }

    @Test
    @DisplayName("Free candidates should be returned unchanged")
    void testFreeCandidate() {
        UniquenessStrategy strategy = new UniquenessStrategy(5);
        AttributeDefinition code = new AttributeDefinition("code", DefaultProvider.literal("A"), true);

        Object value = strategy.ensureUnique(code, "A", new Record("item"), List.of(stored("item", 1, "B")));

        assertEquals("A", value);
    }

    @Test
    @DisplayName("Non-string, non-integral values should be regenerated")
    void testRegeneration() {
        AtomicInteger day = new AtomicInteger(1);
        UniquenessStrategy strategy = new UniquenessStrategy(5);
        AttributeDefinition code = new AttributeDefinition("code",
                DefaultProvider.generator(() -> LocalDate.of(2024, 1, day.getAndIncrement())), true);

        Object value = strategy.ensureUnique(code, LocalDate.of(2024, 1, 1), new Record("item"),
                List.of(stored("item", 1, LocalDate.of(2024, 1, 1)), stored("item", 2, LocalDate.of(2024, 1, 2))));

        assertEquals(LocalDate.of(2024, 1, 3), value);
    }

    @Test
    @DisplayName("A taken literal that cannot be varied should exhaust")
    void testLiteralExhausted() {
        UniquenessStrategy strategy = new UniquenessStrategy(3);
        LocalDate date = LocalDate.of(2024, 1, 1);
        AttributeDefinition code = new AttributeDefinition("code", DefaultProvider.literal(date), true);

        UniquenessExhaustedException e = assertThrows(UniquenessExhaustedException.class,
                () -> strategy.ensureUnique(code, date, new Record("item"), List.of(stored("item", 1, date))));

        assertEquals("item", e.getTypeName());
        assertEquals("code", e.getAttributeName());
        assertEquals(3, e.getAttempts());
        assertTrue(e.getMessage().contains("item.code"));
    }

    @Test
    @DisplayName("Suffixing should stop after the attempt budget")
    void testSuffixExhausted() {
        UniquenessStrategy strategy = new UniquenessStrategy(2);
        AttributeDefinition code = new AttributeDefinition("code", DefaultProvider.literal("X"), true);
        List<Record> existing = List.of(stored("item", 1, "X"), stored("item", 2, "X 2"), stored("item", 3, "X 3"));

        assertThrows(UniquenessExhaustedException.class,
                () -> strategy.ensureUnique(code, "X", new Record("item"), existing));
    }

    @Test
    @DisplayName("Should reject a non-positive attempt budget")
    void testInvalidBudget() {
        assertThrows(IllegalArgumentException.class, () -> new UniquenessStrategy(0));
    }

    @Test
    @DisplayName("isTaken should report values held by stored records only")
    void testIsTaken() {
        UniquenessStrategy strategy = new UniquenessStrategy(5);
        AttributeDefinition code = AttributeDefinition.plain("code");
        List<Record> existing = List.of(stored("item", 1, "A"));

        assertTrue(strategy.isTaken(code, "A", existing));
        assertFalse(strategy.isTaken(code, "B", existing));
        assertFalse(strategy.isTaken(code, null, existing));
    }
}

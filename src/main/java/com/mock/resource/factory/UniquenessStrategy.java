package com.mock.resource.factory;

import com.mock.resource.core.model.Record;
import com.mock.resource.definition.AttributeDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Produces a value for a uniquified attribute that no stored record of the same type holds.
 *
 * <p>Candidate derivation, in order:</p>
 * <ul>
 *   <li>no default declared: {@code "<type> <attribute> <n>"}, counting up</li>
 *   <li>string candidate: the candidate itself, then {@code "<candidate> 2"}, {@code "<candidate> 3"}, ...</li>
 *   <li>integral candidate: the candidate, then successive increments</li>
 *   <li>any other candidate from a generator: the generator is evaluated again</li>
 * </ul>
 * <p>Every derivation is bounded by {@code maxAttempts}.</p>
 */
public class UniquenessStrategy {
    private static final Logger log = LoggerFactory.getLogger(UniquenessStrategy.class);

    private final int maxAttempts;

    public UniquenessStrategy(int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        this.maxAttempts = maxAttempts;
    }

    /**
     * Returns a value distinct from the attribute's value on every existing record.
     *
     * @param candidate the value produced by the attribute's default provider, may be null
     * @param partial   the record under construction, handed to regenerating providers
     * @param existing  the stored records of the same type
     * @throws UniquenessExhaustedException if no free value is found within the attempt budget
     */
    public Object ensureUnique(AttributeDefinition attribute, Object candidate, Record partial,
                               Collection<Record> existing) {
        Objects.requireNonNull(attribute, "attribute is required");
        String type = partial.getType();
        Set<Object> taken = new HashSet<>();
        for (Record record : existing) {
            Object value = record.get(attribute.name());
            if (value != null) {
                taken.add(value);
            }
        }

        if (!attribute.provider().hasDefault()) {
            return sequence(type + " " + attribute.name(), taken.size() + 1, taken, attribute, type);
        }
        if (candidate != null && !taken.contains(candidate)) {
            return candidate;
        }
        if (candidate instanceof String text) {
            return sequence(text, 2, taken, attribute, type);
        }
        if (candidate instanceof Integer number) {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                Integer next = number + attempt;
                if (!taken.contains(next)) {
                    return next;
                }
            }
            throw exhausted(type, attribute);
        }
        if (candidate instanceof Long number) {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                Long next = number + attempt;
                if (!taken.contains(next)) {
                    return next;
                }
            }
            throw exhausted(type, attribute);
        }
        if (attribute.provider().isRegenerable()) {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                Object next = attribute.provider().resolve(partial);
                if (next != null && !taken.contains(next)) {
                    log.debug("Regenerated unique value for {}.{} after {} attempts",
                            type, attribute.name(), attempt);
                    return next;
                }
            }
        }
        throw exhausted(type, attribute);
    }

    /**
     * Whether a stored record of the same type already holds {@code value}.
     */
    public boolean isTaken(AttributeDefinition attribute, Object value, Collection<Record> existing) {
        if (value == null) {
            return false;
        }
        for (Record record : existing) {
            if (value.equals(record.get(attribute.name()))) {
                return true;
            }
        }
        return false;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private String sequence(String base, int start, Set<Object> taken, AttributeDefinition attribute,
                            String type) {
        for (int n = start; n < start + maxAttempts; n++) {
            String value = base + " " + n;
            if (!taken.contains(value)) {
                return value;
            }
        }
        throw exhausted(type, attribute);
    }

    private UniquenessExhaustedException exhausted(String type, AttributeDefinition attribute) {
        log.warn("Uniqueness exhausted for {}.{} after {} attempts", type, attribute.name(), maxAttempts);
        return new UniquenessExhaustedException(type, attribute.name(), maxAttempts);
    }
}

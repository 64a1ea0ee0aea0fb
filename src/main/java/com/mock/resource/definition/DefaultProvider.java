package com.mock.resource.definition;

import com.mock.resource.core.model.Record;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Default-generation rule of an attribute, evaluated per creation.
 *
 * <p>Variants:</p>
 * <ul>
 *   <li>{@link None} -- no default, the attribute stays unset unless overridden</li>
 *   <li>{@link Literal} -- a fixed value</li>
 *   <li>{@link Generator} -- a zero-argument generator, evaluated on every creation</li>
 *   <li>{@link DependentGenerator} -- a generator that receives the partially built record
 *       and may read attributes resolved before it</li>
 * </ul>
 *
 * <p>Equality of generator variants is reference equality of the wrapped function.</p>
 */
public interface DefaultProvider {

    /**
     * Whether this provider produces a value at all.
     */
    boolean hasDefault();

    /**
     * Whether evaluating this provider again may yield a different value.
     */
    boolean isRegenerable();

    /**
     * Evaluates the provider against the partially built record.
     */
    Object resolve(Record partial);

    static DefaultProvider none() {
        return None.INSTANCE;
    }

    static DefaultProvider literal(Object value) {
        return new Literal(value);
    }

    static DefaultProvider generator(Supplier<?> supplier) {
        return new Generator(supplier);
    }

    static DefaultProvider dependent(Function<Record, ?> function) {
        return new DependentGenerator(function);
    }

    record None() implements DefaultProvider {
        static final None INSTANCE = new None();

        @Override
        public boolean hasDefault() {
            return false;
        }

        @Override
        public boolean isRegenerable() {
            return false;
        }

        @Override
        public Object resolve(Record partial) {
            return null;
        }
    }

    record Literal(Object value) implements DefaultProvider {

        @Override
        public boolean hasDefault() {
            return true;
        }

        @Override
        public boolean isRegenerable() {
            return false;
        }

        @Override
        public Object resolve(Record partial) {
            return value;
        }
    }

    record Generator(Supplier<?> supplier) implements DefaultProvider {

        public Generator {
            Objects.requireNonNull(supplier, "supplier is required");
        }

        @Override
        public boolean hasDefault() {
            return true;
        }

        @Override
        public boolean isRegenerable() {
            return true;
        }

        @Override
        public Object resolve(Record partial) {
            return supplier.get();
        }
    }

    record DependentGenerator(Function<Record, ?> function) implements DefaultProvider {

        public DependentGenerator {
            Objects.requireNonNull(function, "function is required");
        }

        @Override
        public boolean hasDefault() {
            return true;
        }

        @Override
        public boolean isRegenerable() {
            return true;
        }

        @Override
        public Object resolve(Record partial) {
            return function.apply(partial);
        }
    }
}

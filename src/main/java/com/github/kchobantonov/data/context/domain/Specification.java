package com.github.kchobantonov.data.context.domain;

import java.util.function.Predicate;

import org.springframework.lang.Nullable;
import org.springframework.util.Assert;

/**
 * A reusable criterion describing which records of type {@code T} match.
 *
 * <p>
 * Specifications are composed with {@link #and(Specification)},
 * {@link #or(Specification)} and {@link #not(Specification)} and handed to a
 * query source as a plain {@link Predicate} through {@link #export()}.
 * </p>
 *
 * @param <T> the record type
 */
@FunctionalInterface
public interface Specification<T> {

	/**
	 * Evaluates this specification against the given candidate.
	 *
	 * @param candidate the record to test, never {@literal null}.
	 * @return true if the candidate matches
	 */
	boolean isSatisfiedBy(T candidate);

	/**
	 * Exports this specification as a filter predicate usable by a query source.
	 *
	 * @return the predicate, never {@literal null}.
	 */
	default Predicate<T> export() {
		return this::isSatisfiedBy;
	}

	/**
	 * Returns a specification matching every record.
	 */
	static <T> Specification<T> all() {
		return candidate -> true;
	}

	/**
	 * Null-tolerant entry point, a {@literal null} specification matches every
	 * record.
	 *
	 * @param spec can be {@literal null}.
	 * @return never {@literal null}.
	 */
	static <T> Specification<T> where(@Nullable Specification<T> spec) {
		return spec == null ? all() : spec;
	}

	/**
	 * Negates the given specification.
	 *
	 * @param spec can be {@literal null}, in which case no record matches.
	 * @return never {@literal null}.
	 */
	static <T> Specification<T> not(@Nullable Specification<T> spec) {
		Specification<T> actual = where(spec);
		return candidate -> !actual.isSatisfiedBy(candidate);
	}

	/**
	 * Lifts a plain predicate into a specification.
	 *
	 * @param predicate must not be {@literal null}.
	 */
	static <T> Specification<T> of(Predicate<? super T> predicate) {
		Assert.notNull(predicate, "Predicate must not be null!");
		return predicate::test;
	}

	/**
	 * ANDs the given specification to the current one, a {@literal null} argument
	 * leaves this specification unchanged.
	 */
	default Specification<T> and(@Nullable Specification<T> other) {
		if (other == null) {
			return this;
		}
		return candidate -> isSatisfiedBy(candidate) && other.isSatisfiedBy(candidate);
	}

	/**
	 * ORs the given specification to the current one, a {@literal null} argument
	 * leaves this specification unchanged.
	 */
	default Specification<T> or(@Nullable Specification<T> other) {
		if (other == null) {
			return this;
		}
		return candidate -> isSatisfiedBy(candidate) || other.isSatisfiedBy(candidate);
	}
}

package com.github.kchobantonov.data.context.query;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

import com.github.kchobantonov.data.context.domain.SortKey;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Streams;

/**
 * A lazily evaluated, composable sequence of records. Every operation returns
 * a new source and leaves the receiver untouched, nothing is read from the
 * backing store until the source is iterated.
 *
 * @param <T> the record type
 */
public interface QuerySource<T> extends Iterable<T> {

	/**
	 * Keeps only the records matching the given predicate.
	 */
	QuerySource<T> filter(Predicate<? super T> predicate);

	/**
	 * Orders the records by the given key. Any ordering established before is
	 * discarded.
	 */
	OrderedQuerySource<T> orderBy(SortKey<T> key);

	/**
	 * Bypasses the given number of records, skipping past the end yields an empty
	 * source.
	 */
	QuerySource<T> skip(long count);

	/**
	 * Returns at most the given number of records.
	 */
	QuerySource<T> take(int count);

	/**
	 * Evaluates the source.
	 *
	 * @return an immutable snapshot of the current records
	 */
	default List<T> toList() {
		return ImmutableList.copyOf(this);
	}

	default Stream<T> stream() {
		return Streams.stream(this);
	}
}

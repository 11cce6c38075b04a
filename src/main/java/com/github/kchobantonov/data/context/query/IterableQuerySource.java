package com.github.kchobantonov.data.context.query;

import java.util.Comparator;
import java.util.Iterator;
import java.util.function.Predicate;

import org.springframework.util.Assert;

import com.github.kchobantonov.data.context.domain.SortKey;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

/**
 * {@link QuerySource} over any {@link Iterable}. Stages are chained as a Guava
 * {@link FluentIterable} pipeline and re-evaluated on every iteration.
 *
 * @param <T> the record type
 */
public class IterableQuerySource<T> implements QuerySource<T> {

	protected final FluentIterable<T> elements;

	protected IterableQuerySource(Iterable<T> elements) {
		Assert.notNull(elements, "Elements must not be null!");
		this.elements = FluentIterable.from(elements);
	}

	public static <T> IterableQuerySource<T> of(Iterable<T> elements) {
		return new IterableQuerySource<T>(elements);
	}

	@Override
	public QuerySource<T> filter(Predicate<? super T> predicate) {
		Assert.notNull(predicate, "Predicate must not be null!");
		return new IterableQuerySource<T>(elements.filter(predicate::test));
	}

	@Override
	public OrderedQuerySource<T> orderBy(SortKey<T> key) {
		Assert.notNull(key, "Sort key must not be null!");
		return new Ordered<T>(elements, key.toComparator());
	}

	@Override
	public QuerySource<T> skip(long count) {
		Assert.isTrue(count >= 0, "Skip count must not be negative!");
		return new IterableQuerySource<T>(elements.skip(Ints.saturatedCast(count)));
	}

	@Override
	public QuerySource<T> take(int count) {
		Assert.isTrue(count >= 0, "Take count must not be negative!");
		return new IterableQuerySource<T>(elements.limit(count));
	}

	@Override
	public Iterator<T> iterator() {
		return elements.iterator();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName();
	}

	/**
	 * Sorted view over an unordered pipeline. The sort is stable, so records
	 * equal under every key keep their source order.
	 */
	static class Ordered<T> extends IterableQuerySource<T> implements OrderedQuerySource<T> {
		private final FluentIterable<T> unordered;
		private final Comparator<T> comparator;

		Ordered(FluentIterable<T> unordered, Comparator<T> comparator) {
			super(() -> ImmutableList.sortedCopyOf(comparator, unordered).iterator());
			this.unordered = unordered;
			this.comparator = comparator;
		}

		@Override
		public OrderedQuerySource<T> thenBy(SortKey<T> key) {
			Assert.notNull(key, "Sort key must not be null!");
			return new Ordered<T>(unordered, comparator.thenComparing(key.toComparator()));
		}

		@Override
		public OrderedQuerySource<T> orderBy(SortKey<T> key) {
			Assert.notNull(key, "Sort key must not be null!");
			return new Ordered<T>(unordered, key.toComparator());
		}
	}
}

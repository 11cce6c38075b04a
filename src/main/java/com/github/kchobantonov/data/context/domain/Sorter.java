package com.github.kchobantonov.data.context.domain;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.data.domain.Sort;
import org.springframework.data.domain.Sort.Direction;
import org.springframework.util.Assert;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

/**
 * An ordered, non-empty chain of {@link SortKey}s. The first key establishes
 * the primary order, every following key only breaks ties left by the keys
 * before it.
 *
 * <p>
 * Instances are immutable, {@link #then(SortKey)} returns a new sorter.
 * </p>
 *
 * @param <T> the record type
 */
public final class Sorter<T> implements Iterable<SortKey<T>> {

	private final ImmutableList<SortKey<T>> keys;

	private Sorter(ImmutableList<SortKey<T>> keys) {
		Assert.notEmpty(keys, "Sorter requires at least one sort key!");
		Assert.noNullElements(keys, "Sort keys must not be null!");

		this.keys = keys;
	}

	public static <T> Sorter<T> by(SortKey<T> key) {
		Assert.notNull(key, "Sort key must not be null!");
		return new Sorter<T>(ImmutableList.of(key));
	}

	public static <T> Sorter<T> by(Function<? super T, ? extends Comparable<?>> keyExtractor, Direction direction) {
		return by(SortKey.of(keyExtractor, direction));
	}

	public static <T> Sorter<T> by(List<SortKey<T>> keys) {
		Assert.notNull(keys, "Sort keys must not be null!");
		return new Sorter<T>(ImmutableList.copyOf(keys));
	}

	/**
	 * Creates a sorter from a sorted Spring Data {@link Sort}, each order becoming
	 * a property key.
	 *
	 * @param sort must not be {@literal null} or unsorted.
	 * @return the sorter
	 */
	public static <T> Sorter<T> fromSort(Sort sort) {
		Assert.notNull(sort, "Sort must not be null!");
		Assert.isTrue(sort.isSorted(), "Sort must define at least one order!");

		return new Sorter<T>(sort.stream().map(SortKey::<T>from).collect(ImmutableList.toImmutableList()));
	}

	public Sorter<T> then(SortKey<T> key) {
		Assert.notNull(key, "Sort key must not be null!");
		return new Sorter<T>(ImmutableList.<SortKey<T>>builder().addAll(keys).add(key).build());
	}

	public Sorter<T> then(Function<? super T, ? extends Comparable<?>> keyExtractor, Direction direction) {
		return then(SortKey.of(keyExtractor, direction));
	}

	public SortKey<T> getPrimary() {
		return keys.get(0);
	}

	public int size() {
		return keys.size();
	}

	/**
	 * Returns the equivalent Spring Data {@link Sort} when every key was built from
	 * a property path.
	 */
	public Optional<Sort> toSort() {
		if (!Iterables.all(keys, SortKey::hasProperty)) {
			return Optional.empty();
		}
		return Optional.of(Sort.by(keys.stream().map(SortKey::toOrder).collect(Collectors.toList())));
	}

	/**
	 * Returns the lexicographic comparator over all keys.
	 */
	public Comparator<T> toComparator() {
		Comparator<T> comparator = keys.get(0).toComparator();
		for (SortKey<T> key : keys.subList(1, keys.size())) {
			comparator = comparator.thenComparing(key.toComparator());
		}
		return comparator;
	}

	@Override
	public Iterator<SortKey<T>> iterator() {
		return keys.iterator();
	}

	@Override
	public String toString() {
		return keys.toString();
	}
}

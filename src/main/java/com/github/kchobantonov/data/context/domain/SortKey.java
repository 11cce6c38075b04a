package com.github.kchobantonov.data.context.domain;

import java.util.Comparator;
import java.util.function.Function;

import org.springframework.beans.PropertyAccessorFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.domain.Sort.Direction;
import org.springframework.data.domain.Sort.NullHandling;
import org.springframework.data.domain.Sort.Order;
import org.springframework.lang.Nullable;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import lombok.Value;

/**
 * One ordering dimension: a key extracted from each record plus the direction
 * in which the extracted values are ordered.
 *
 * <p>
 * A key built from a property path ({@link #property(String, Direction)})
 * remembers the path so that stores able to sort natively can receive it as a
 * {@link Sort.Order}.
 * </p>
 *
 * @param <T> the record type
 */
@Value
public class SortKey<T> {

	Function<? super T, ? extends Comparable<?>> keyExtractor;
	Direction direction;
	NullHandling nullHandling;
	@Nullable
	String property;
	boolean ignoreCase;

	private SortKey(Function<? super T, ? extends Comparable<?>> keyExtractor, Direction direction,
			NullHandling nullHandling, @Nullable String property, boolean ignoreCase) {

		Assert.notNull(keyExtractor, "Key extractor must not be null!");
		Assert.notNull(direction, "Direction must not be null!");
		Assert.notNull(nullHandling, "NullHandling must not be null!");

		this.keyExtractor = keyExtractor;
		this.direction = direction;
		this.nullHandling = nullHandling;
		this.property = property;
		this.ignoreCase = ignoreCase;
	}

	public static <T> SortKey<T> of(Function<? super T, ? extends Comparable<?>> keyExtractor, Direction direction) {
		return new SortKey<T>(keyExtractor, direction, NullHandling.NATIVE, null, false);
	}

	public static <T> SortKey<T> asc(Function<? super T, ? extends Comparable<?>> keyExtractor) {
		return of(keyExtractor, Direction.ASC);
	}

	public static <T> SortKey<T> desc(Function<? super T, ? extends Comparable<?>> keyExtractor) {
		return of(keyExtractor, Direction.DESC);
	}

	/**
	 * Creates a key reading the given bean property path (nested paths such as
	 * {@code address.city} are supported) from each record.
	 *
	 * @param path      must not be {@literal null} or empty.
	 * @param direction must not be {@literal null}.
	 * @return the key
	 */
	public static <T> SortKey<T> property(String path, Direction direction) {
		return property(path, direction, NullHandling.NATIVE);
	}

	public static <T> SortKey<T> property(String path, Direction direction, NullHandling nullHandling) {
		Assert.isTrue(StringUtils.hasText(path), "Property path must not be empty!");

		return new SortKey<T>(it -> readProperty(it, path), direction, nullHandling, path, false);
	}

	/**
	 * Creates a key from a Spring Data {@link Order}, keeping its property path,
	 * direction, null handling and case sensitivity.
	 */
	public static <T> SortKey<T> from(Order order) {
		Assert.notNull(order, "Order must not be null!");

		SortKey<T> key = property(order.getProperty(), order.getDirection(), order.getNullHandling());
		return order.isIgnoreCase() ? key.ignoringCase() : key;
	}

	/**
	 * Returns a copy of this key comparing {@link String} values without regard to
	 * case.
	 */
	public SortKey<T> ignoringCase() {
		return new SortKey<T>(keyExtractor, direction, nullHandling, property, true);
	}

	public boolean isAscending() {
		return direction.isAscending();
	}

	public boolean hasProperty() {
		return property != null;
	}

	/**
	 * Returns the Spring Data {@link Order} equivalent of this key.
	 *
	 * @throws IllegalStateException if the key was not built from a property path
	 */
	public Order toOrder() {
		if (property == null) {
			throw new IllegalStateException("Sort key " + this + " has no property path!");
		}
		Order order = new Order(direction, property, nullHandling);
		return ignoreCase ? order.ignoreCase() : order;
	}

	/**
	 * Returns the comparator ordering records by this key alone. With
	 * {@link NullHandling#NATIVE} a {@literal null} key is the smallest value.
	 *
	 * @return never {@literal null}.
	 */
	@SuppressWarnings({ "unchecked", "rawtypes" })
	public Comparator<T> toComparator() {
		Comparator<Comparable> natural = ignoreCase ? SortKey::compareIgnoringCase : Comparator.naturalOrder();
		Comparator<Comparable> directed = isAscending() ? natural : natural.reversed();

		Comparator<Comparable> values;
		switch (nullHandling) {
		case NULLS_FIRST:
			values = Comparator.nullsFirst(directed);
			break;
		case NULLS_LAST:
			values = Comparator.nullsLast(directed);
			break;
		default:
			values = isAscending() ? Comparator.nullsFirst(directed) : Comparator.nullsLast(directed);
			break;
		}

		Function<T, Comparable> extractor = (Function<T, Comparable>) (Function) keyExtractor;
		return Comparator.comparing(extractor, values);
	}

	@SuppressWarnings({ "unchecked", "rawtypes" })
	private static int compareIgnoringCase(Comparable left, Comparable right) {
		if (left instanceof String && right instanceof String) {
			return String.CASE_INSENSITIVE_ORDER.compare((String) left, (String) right);
		}
		return left.compareTo(right);
	}

	@Nullable
	private static Comparable<?> readProperty(Object record, String path) {
		Object value = PropertyAccessorFactory.forBeanPropertyAccess(record).getPropertyValue(path);
		if (value != null && !(value instanceof Comparable)) {
			throw new IllegalArgumentException("Property " + path + " of " + record.getClass().getName()
					+ " is not comparable: " + value.getClass().getName());
		}
		return (Comparable<?>) value;
	}

	@Override
	public String toString() {
		return (property == null ? "<key>" : property) + ": " + direction + (ignoreCase ? ", ignoring case" : "");
	}
}

package com.github.kchobantonov.data.context.query;

import com.github.kchobantonov.data.context.domain.SortKey;

/**
 * A {@link QuerySource} with an established order that can be refined by
 * further keys.
 *
 * @param <T> the record type
 */
public interface OrderedQuerySource<T> extends QuerySource<T> {

	/**
	 * Refines the current order: the given key only decides between records that
	 * are equal under every key applied so far.
	 */
	OrderedQuerySource<T> thenBy(SortKey<T> key);
}

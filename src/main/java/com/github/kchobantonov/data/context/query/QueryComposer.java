package com.github.kchobantonov.data.context.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.lang.Nullable;
import org.springframework.util.Assert;

import com.github.kchobantonov.data.context.domain.SortKey;
import com.github.kchobantonov.data.context.domain.Sorter;
import com.github.kchobantonov.data.context.domain.Specification;

/**
 * Builds a paged, ordered and filtered query on top of a {@link QuerySource}.
 *
 * <p>
 * The composed query filters first, then orders by every key of the
 * {@link Sorter} in turn, then skips {@code pageIndex * pageSize} records and
 * takes {@code pageSize}. Nothing is evaluated here, the returned source is
 * executed by whoever iterates it.
 * </p>
 *
 * <p>
 * Stateless and safe to share between threads.
 * </p>
 */
public class QueryComposer {
	private static final Logger logger = LoggerFactory.getLogger(QueryComposer.class);

	/**
	 * Composes the query for one page.
	 *
	 * @param source        the unfiltered, unordered records, must not be
	 *                      {@literal null}.
	 * @param pageSize      the maximum number of records to return, must be
	 *                      greater than zero.
	 * @param pageIndex     zero based page index, must not be negative.
	 * @param sorter        the ordering, must not be {@literal null}.
	 * @param specification the filter, {@literal null} matches every record.
	 * @return the composed, not yet evaluated query
	 * @throws IllegalArgumentException on invalid page arguments
	 */
	public <T> QuerySource<T> compose(QuerySource<T> source, int pageSize, int pageIndex, Sorter<T> sorter,
			@Nullable Specification<T> specification) {

		return compose(source, PageRequest.of(pageIndex, pageSize), sorter, specification);
	}

	/**
	 * Composes the query for the page described by the given {@link Pageable}. Any
	 * {@link org.springframework.data.domain.Sort} carried by the pageable is
	 * ignored in favour of the sorter.
	 */
	public <T> QuerySource<T> compose(QuerySource<T> source, Pageable pageable, Sorter<T> sorter,
			@Nullable Specification<T> specification) {

		Assert.notNull(source, "QuerySource must not be null!");
		Assert.notNull(pageable, "Pageable must not be null!");
		Assert.isTrue(pageable.isPaged(), "Pageable must be paged!");
		Assert.notNull(sorter, "Sorter must not be null!");

		QuerySource<T> query = source;
		if (specification != null) {
			query = query.filter(specification.export());
		}

		OrderedQuerySource<T> ordered = null;
		for (SortKey<T> key : sorter) {
			ordered = ordered == null ? query.orderBy(key) : ordered.thenBy(key);
		}

		if (logger.isTraceEnabled()) {
			logger.trace("Composed query: filtered={}, sorter={}, offset={}, size={}", specification != null,
					sorter, pageable.getOffset(), pageable.getPageSize());
		}

		return ordered.skip(pageable.getOffset()).take(pageable.getPageSize());
	}
}

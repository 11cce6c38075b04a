package com.github.kchobantonov.data.context.repository.support;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.PagingAndSortingRepository;
import org.springframework.lang.Nullable;
import org.springframework.util.Assert;

import com.github.kchobantonov.data.context.domain.SortKey;
import com.github.kchobantonov.data.context.domain.Sorter;
import com.github.kchobantonov.data.context.query.IterableQuerySource;
import com.github.kchobantonov.data.context.query.OrderedQuerySource;
import com.github.kchobantonov.data.context.query.QuerySource;
import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;

/**
 * {@link QuerySource} over a Spring Data repository.
 *
 * <p>
 * Stages applied in the order filter, order, skip, take are collected and
 * executed together. Ordering by property keys is handed to
 * {@link PagingAndSortingRepository#findAll(Sort)}; without a filter and with
 * an offset that is a whole number of pages, paging is handed to
 * {@link PagingAndSortingRepository#findAll(org.springframework.data.domain.Pageable)}
 * as well. All remaining work happens in memory. Stages applied in any other
 * order are composed in memory on top of the current result.
 * </p>
 *
 * <p>
 * Keys with {@link Sort.NullHandling#NATIVE} are handed to the store as they
 * are, so {@literal null} values end up where the store places them. In memory
 * a {@literal null} key is the smallest value. Use an explicit
 * {@link Sort.NullHandling} when the placement of nulls matters.
 * </p>
 *
 * @param <T> the record type
 */
public class RepositoryQuerySource<T> implements QuerySource<T> {
	private static final Logger logger = LoggerFactory.getLogger(RepositoryQuerySource.class);

	protected final CrudRepository<T, ?> repository;
	protected final ImmutableList<Predicate<? super T>> filters;
	protected final ImmutableList<SortKey<T>> keys;
	protected final long offset;
	@Nullable
	protected final Integer limit;

	protected RepositoryQuerySource(CrudRepository<T, ?> repository, ImmutableList<Predicate<? super T>> filters,
			ImmutableList<SortKey<T>> keys, long offset, @Nullable Integer limit) {

		Assert.notNull(repository, "Repository must not be null!");

		this.repository = repository;
		this.filters = filters;
		this.keys = keys;
		this.offset = offset;
		this.limit = limit;
	}

	public static <T> RepositoryQuerySource<T> of(CrudRepository<T, ?> repository) {
		return new RepositoryQuerySource<T>(repository, ImmutableList.of(), ImmutableList.of(), 0, null);
	}

	protected boolean isPaged() {
		return offset > 0 || limit != null;
	}

	@Override
	public QuerySource<T> filter(Predicate<? super T> predicate) {
		Assert.notNull(predicate, "Predicate must not be null!");

		if (isPaged()) {
			return inMemory().filter(predicate);
		}
		return new RepositoryQuerySource<T>(repository,
				ImmutableList.<Predicate<? super T>>builder().addAll(filters).add(predicate).build(), keys, offset,
				limit);
	}

	@Override
	public OrderedQuerySource<T> orderBy(SortKey<T> key) {
		Assert.notNull(key, "Sort key must not be null!");

		if (isPaged()) {
			return inMemory().orderBy(key);
		}
		return new Ordered<T>(repository, filters, ImmutableList.of(key));
	}

	@Override
	public QuerySource<T> skip(long count) {
		Assert.isTrue(count >= 0, "Skip count must not be negative!");

		if (limit != null) {
			return inMemory().skip(count);
		}
		return new RepositoryQuerySource<T>(repository, filters, keys, LongMath.saturatedAdd(offset, count), null);
	}

	@Override
	public QuerySource<T> take(int count) {
		Assert.isTrue(count >= 0, "Take count must not be negative!");

		return new RepositoryQuerySource<T>(repository, filters, keys, offset,
				limit == null ? count : Math.min(limit, count));
	}

	@Override
	public Iterator<T> iterator() {
		return execute().iterator();
	}

	protected QuerySource<T> inMemory() {
		return IterableQuerySource.of(this);
	}

	/**
	 * Runs the collected stages against the repository.
	 */
	protected Iterable<T> execute() {
		Optional<Sort> sort = keys.isEmpty() ? Optional.of(Sort.unsorted()) : Sorter.by(keys).toSort();

		if (sort.isPresent() && repository instanceof PagingAndSortingRepository) {
			PagingAndSortingRepository<T, ?> pagingRepository = (PagingAndSortingRepository<T, ?>) repository;

			if (canPushDownPage()) {
				int page = (int) (offset / limit);
				logger.debug("Reading page {} of size {} sorted by {} from {}", page, limit, sort.get(), repository);
				return pagingRepository.findAll(PageRequest.of(page, limit, sort.get())).getContent();
			}

			logger.debug("Reading all records sorted by {} from {}", sort.get(), repository);
			return applyInMemory(IterableQuerySource.of(() -> pagingRepository.findAll(sort.get()).iterator()),
					ImmutableList.of());
		}

		logger.debug("Reading all records from {}, sorting by {} in memory", repository, keys);
		return applyInMemory(IterableQuerySource.of(() -> repository.findAll().iterator()), keys);
	}

	private boolean canPushDownPage() {
		return filters.isEmpty() && limit != null && limit > 0 && offset % limit == 0
				&& offset / limit <= Integer.MAX_VALUE;
	}

	private QuerySource<T> applyInMemory(QuerySource<T> source, List<SortKey<T>> sortKeys) {
		QuerySource<T> query = source;
		for (Predicate<? super T> predicate : filters) {
			query = query.filter(predicate);
		}

		OrderedQuerySource<T> ordered = null;
		for (SortKey<T> key : sortKeys) {
			ordered = ordered == null ? query.orderBy(key) : ordered.thenBy(key);
		}
		if (ordered != null) {
			query = ordered;
		}

		if (offset > 0) {
			query = query.skip(offset);
		}
		if (limit != null) {
			query = query.take(limit);
		}
		return query;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[repository=" + repository + ", filters=" + filters.size() + ", keys="
				+ keys + ", offset=" + offset + ", limit=" + limit + "]";
	}

	static class Ordered<T> extends RepositoryQuerySource<T> implements OrderedQuerySource<T> {

		Ordered(CrudRepository<T, ?> repository, ImmutableList<Predicate<? super T>> filters,
				ImmutableList<SortKey<T>> keys) {
			super(repository, filters, keys, 0, null);
		}

		@Override
		public OrderedQuerySource<T> thenBy(SortKey<T> key) {
			Assert.notNull(key, "Sort key must not be null!");

			return new Ordered<T>(repository, filters, ImmutableList.<SortKey<T>>builder().addAll(keys).add(key).build());
		}
	}
}

package com.github.kchobantonov.data.context.repository;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.springframework.lang.Nullable;

import com.github.kchobantonov.data.context.domain.Sorter;
import com.github.kchobantonov.data.context.domain.Specification;
import com.github.kchobantonov.data.context.query.QuerySource;

/**
 * Repository-style access to the records of a persistence store for a single
 * unit of work: queries plus tracking of added, updated and deleted records
 * until {@link #saveChanges()} writes them.
 *
 * <p>
 * Implementations keep per-context state and are not meant to be shared
 * between threads.
 * </p>
 */
public interface DataContext {

	/**
	 * Returns every record currently tracked by this context, whatever its state.
	 *
	 * @return an immutable snapshot
	 */
	List<Object> getTrackedObjects();

	/**
	 * Returns the lazy, unfiltered and unordered query source over all records of
	 * the given type.
	 *
	 * @param modelType must not be {@literal null}.
	 */
	<T> QuerySource<T> getDataModel(Class<T> modelType);

	/**
	 * Marks the record as new, it is inserted by the next save.
	 */
	<T> void addRecord(T instance);

	/**
	 * Marks the record as deleted, it is removed by the next save. Deleting a
	 * record that was only added in this context forgets it instead.
	 */
	<T> void deleteRecord(T instance);

	/**
	 * Marks the record as modified, it is written by the next save.
	 */
	<T> void updateRecord(T instance);

	/**
	 * Reads one page of records.
	 *
	 * @param modelType     must not be {@literal null}.
	 * @param pageSize      greater than zero.
	 * @param pageIndex     zero based, not negative.
	 * @param sorter        must not be {@literal null}.
	 * @param specification {@literal null} matches every record.
	 * @return the page content, tracked as unchanged
	 */
	<T> List<T> getRecords(Class<T> modelType, int pageSize, int pageIndex, Sorter<T> sorter,
			@Nullable Specification<T> specification);

	/**
	 * Asynchronous variant of
	 * {@link #getRecords(Class, int, int, Sorter, Specification)}. Cancelling the
	 * returned future before it runs skips the read.
	 */
	<T> CompletableFuture<List<T>> getRecordsAsync(Class<T> modelType, int pageSize, int pageIndex,
			Sorter<T> sorter, @Nullable Specification<T> specification);

	/**
	 * Writes every pending change to the backing repositories.
	 *
	 * @return the number of records written
	 */
	int saveChanges();

	CompletableFuture<Integer> saveChangesAsync();
}

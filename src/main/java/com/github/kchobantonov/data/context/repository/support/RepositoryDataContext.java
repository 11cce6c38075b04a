package com.github.kchobantonov.data.context.repository.support;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.repository.CrudRepository;
import org.springframework.lang.Nullable;
import org.springframework.util.Assert;

import com.github.kchobantonov.data.context.annotation.DataModel;
import com.github.kchobantonov.data.context.domain.Sorter;
import com.github.kchobantonov.data.context.domain.Specification;
import com.github.kchobantonov.data.context.query.QueryComposer;
import com.github.kchobantonov.data.context.query.QuerySource;
import com.github.kchobantonov.data.context.repository.DataContext;
import com.github.kchobantonov.data.context.repository.query.DataModelMetadata;
import com.github.kchobantonov.data.context.repository.query.DefaultDataModelMetadata;

/**
 * {@link DataContext} over the Spring Data repositories registered for each
 * record type. Queries are composed by a {@link QueryComposer} on top of a
 * {@link RepositoryQuerySource}; pending changes are kept in a
 * {@link ChangeTracker} and written through {@link CrudRepository#save(Object)}
 * and {@link CrudRepository#delete(Object)}.
 *
 * <p>
 * No transaction is opened by {@link #saveChanges()}. A failing write
 * propagates, records written before it keep their new state.
 * </p>
 */
public class RepositoryDataContext implements DataContext {
	private static final Logger logger = LoggerFactory.getLogger(RepositoryDataContext.class);

	protected final Repositories repositories;
	protected final QueryComposer queryComposer;
	protected final Executor executor;
	protected final ChangeTracker changeTracker = new ChangeTracker();

	private final Map<Class<?>, CrudRepository<Object, Object>> repositoryCache = new HashMap<>();

	public RepositoryDataContext(Repositories repositories, QueryComposer queryComposer, Executor executor) {

		Assert.notNull(repositories, "Repositories must not be null!");
		Assert.notNull(queryComposer, "QueryComposer must not be null!");
		Assert.notNull(executor, "Executor must not be null!");

		this.repositories = repositories;
		this.queryComposer = queryComposer;
		this.executor = executor;
	}

	public ChangeTracker getChangeTracker() {
		return changeTracker;
	}

	@Override
	public List<Object> getTrackedObjects() {
		return changeTracker.getTrackedObjects();
	}

	@Override
	@SuppressWarnings("unchecked")
	public <T> QuerySource<T> getDataModel(Class<T> modelType) {
		Assert.notNull(modelType, "Model type must not be null!");

		return RepositoryQuerySource.of((CrudRepository<T, ?>) getRepository(modelType));
	}

	@Override
	public <T> void addRecord(T instance) {
		Assert.notNull(instance, "Record must not be null!");
		changeTracker.setState(instance, EntityState.ADDED);
	}

	@Override
	public <T> void deleteRecord(T instance) {
		Assert.notNull(instance, "Record must not be null!");
		changeTracker.setState(instance, EntityState.DELETED);
	}

	@Override
	public <T> void updateRecord(T instance) {
		Assert.notNull(instance, "Record must not be null!");
		changeTracker.setState(instance, EntityState.MODIFIED);
	}

	@Override
	public <T> List<T> getRecords(Class<T> modelType, int pageSize, int pageIndex, Sorter<T> sorter,
			@Nullable Specification<T> specification) {

		QuerySource<T> query = queryComposer.compose(getDataModel(modelType), pageSize, pageIndex, sorter,
				specification);

		List<T> records = query.toList();
		records.forEach(changeTracker::attach);

		return records;
	}

	@Override
	public <T> CompletableFuture<List<T>> getRecordsAsync(Class<T> modelType, int pageSize, int pageIndex,
			Sorter<T> sorter, @Nullable Specification<T> specification) {

		QuerySource<T> query = queryComposer.compose(getDataModel(modelType), pageSize, pageIndex, sorter,
				specification);

		return CompletableFuture.supplyAsync(() -> {
			List<T> records = query.toList();
			records.forEach(changeTracker::attach);
			return records;
		}, executor);
	}

	@Override
	public int saveChanges() {
		synchronized (changeTracker) {
			List<EntityEntry> pending = changeTracker.getPendingEntries();
			if (pending.isEmpty()) {
				return 0;
			}

			if (logger.isDebugEnabled()) {
				logger.debug("Saving {} pending changes: {}", pending.size(), pending.stream()
						.collect(Collectors.groupingBy(EntityEntry::getState, Collectors.counting())));
			}

			int written = 0;
			for (EntityEntry entry : pending) {
				CrudRepository<Object, Object> repository = getRepository(entry.getModelType());

				switch (entry.getState()) {
				case ADDED:
				case MODIFIED:
					Object persisted = repository.save(entry.getEntity());
					changeTracker.acceptChanges(entry.getEntity(), persisted == null ? entry.getEntity() : persisted);
					break;
				case DELETED:
					repository.delete(entry.getEntity());
					changeTracker.setState(entry.getEntity(), EntityState.DETACHED);
					break;
				default:
					throw new IllegalStateException("Unexpected pending state " + entry.getState() + " for " + entry);
				}
				written++;
			}

			return written;
		}
	}

	@Override
	public CompletableFuture<Integer> saveChangesAsync() {
		return CompletableFuture.supplyAsync(this::saveChanges, executor);
	}

	/**
	 * Resolves the repository managing the given type. When several repositories
	 * manage it, the {@link DataModel#repositoryClass()} of the type selects one.
	 *
	 * @throws IllegalStateException if no single repository can be resolved
	 */
	@SuppressWarnings("unchecked")
	protected CrudRepository<Object, Object> getRepository(Class<?> modelType) {
		synchronized (repositoryCache) {
			CrudRepository<Object, Object> repository = repositoryCache.get(modelType);
			if (repository == null) {
				repository = (CrudRepository<Object, Object>) resolveRepository(
						new DefaultDataModelMetadata<>(modelType));
				repositoryCache.put(modelType, repository);
			}
			return repository;
		}
	}

	private Object resolveRepository(DataModelMetadata<?> metadata) {
		Map<String, Object> candidates = repositories.getRepositoriesFor(metadata.getJavaType())
				.orElseThrow(() -> new IllegalStateException("Unable to find repository for " + metadata.getJavaType()
						+ ". Register a " + CrudRepository.class.getName() + " bean for it"));

		Map<String, Object> matches = candidates.entrySet().stream()
				.filter(it -> metadata.getRepositoryJavaType().isInstance(it.getValue()))
				.collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));

		if (matches.size() > 1) {
			Assert.isTrue(metadata.hasExplicitRepository(),
					"Multiple repositories found for " + metadata.getJavaType()
							+ ". Please specify a concrete repository interface using annotation " + DataModel.class
							+ " attribute repositoryClass. Repositories found: " + matches.keySet());

			throw new IllegalStateException("Unable to find unique repository for " + metadata.getJavaType()
					+ " and repository class " + metadata.getRepositoryJavaType()
					+ ". Narrow the repository class in annotation " + DataModel.class + ". Repositories found: "
					+ matches.keySet());
		}

		if (matches.isEmpty()) {
			throw new IllegalStateException("Unable to find repository for " + metadata.getJavaType()
					+ " and repository class " + metadata.getRepositoryJavaType() + ". Validate annotation "
					+ DataModel.class + " attribute repositoryClass. Repositories found: " + candidates.keySet());
		}

		Map.Entry<String, Object> match = matches.entrySet().iterator().next();
		logger.info("Resolved repository {} for data model {}", match.getKey(), metadata.getJavaType().getName());

		return match.getValue();
	}
}

package com.github.kchobantonov.data.context.support;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.data.repository.CrudRepository;

import com.google.common.collect.ImmutableList;

/**
 * Map backed {@link CrudRepository} recording the calls it receives.
 */
public abstract class InMemoryCrudRepository<T> implements CrudRepository<T, Long> {
	protected final Map<Long, T> store = new LinkedHashMap<>();
	protected final List<String> calls = new ArrayList<>();
	private final AtomicLong sequence = new AtomicLong(1000);

	protected abstract Long getId(T entity);

	protected abstract void setId(T entity, Long id);

	public List<String> getCalls() {
		return calls;
	}

	public void put(Iterable<? extends T> entities) {
		entities.forEach(it -> store.put(getId(it), it));
	}

	@Override
	public <S extends T> S save(S entity) {
		calls.add("save");
		if (getId(entity) == null) {
			setId(entity, sequence.incrementAndGet());
		}
		store.put(getId(entity), entity);
		return entity;
	}

	@Override
	public <S extends T> Iterable<S> saveAll(Iterable<S> entities) {
		List<S> result = new ArrayList<>();
		entities.forEach(it -> result.add(save(it)));
		return result;
	}

	@Override
	public Optional<T> findById(Long id) {
		return Optional.ofNullable(store.get(id));
	}

	@Override
	public boolean existsById(Long id) {
		return store.containsKey(id);
	}

	@Override
	public Iterable<T> findAll() {
		calls.add("findAll");
		return ImmutableList.copyOf(store.values());
	}

	@Override
	public Iterable<T> findAllById(Iterable<Long> ids) {
		List<T> result = new ArrayList<>();
		ids.forEach(id -> findById(id).ifPresent(result::add));
		return result;
	}

	@Override
	public long count() {
		return store.size();
	}

	@Override
	public void deleteById(Long id) {
		store.remove(id);
	}

	@Override
	public void delete(T entity) {
		calls.add("delete");
		store.remove(getId(entity));
	}

	@Override
	public void deleteAllById(Iterable<? extends Long> ids) {
		ids.forEach(this::deleteById);
	}

	@Override
	public void deleteAll(Iterable<? extends T> entities) {
		entities.forEach(this::delete);
	}

	@Override
	public void deleteAll() {
		store.clear();
	}
}

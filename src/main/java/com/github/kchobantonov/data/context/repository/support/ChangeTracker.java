package com.github.kchobantonov.data.context.repository.support;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

import com.google.common.base.Equivalence;
import com.google.common.collect.ImmutableList;

/**
 * Tracks record instances by identity together with their
 * {@link EntityState}. Entries are kept in the order in which they were first
 * tracked.
 */
public class ChangeTracker {
	private static final Logger logger = LoggerFactory.getLogger(ChangeTracker.class);

	private final Map<Equivalence.Wrapper<Object>, EntityEntry> entries = new LinkedHashMap<>();

	public synchronized EntityState getState(Object entity) {
		Assert.notNull(entity, "Entity must not be null!");

		EntityEntry entry = entries.get(key(entity));
		return entry == null ? EntityState.DETACHED : entry.getState();
	}

	/**
	 * Moves the given instance into the requested state, starting to track it if
	 * needed. Deleting an instance that is only {@link EntityState#ADDED} detaches
	 * it, as does requesting {@link EntityState#DETACHED}.
	 */
	public synchronized void setState(Object entity, EntityState state) {
		Assert.notNull(entity, "Entity must not be null!");
		Assert.notNull(state, "EntityState must not be null!");

		Equivalence.Wrapper<Object> key = key(entity);
		EntityEntry entry = entries.get(key);

		if (state == EntityState.DETACHED
				|| (state == EntityState.DELETED && entry != null && entry.getState() == EntityState.ADDED)) {
			if (entries.remove(key) != null) {
				logger.debug("Detached {}", entity);
			}
			return;
		}

		if (entry == null) {
			entries.put(key, new EntityEntry(entity, state));
		} else {
			entry.setState(state);
		}
	}

	/**
	 * Tracks the instance as {@link EntityState#UNCHANGED} unless it is already
	 * tracked, in which case its pending state wins.
	 */
	public synchronized void attach(Object entity) {
		Assert.notNull(entity, "Entity must not be null!");

		entries.computeIfAbsent(key(entity), it -> new EntityEntry(entity, EntityState.UNCHANGED));
	}

	/**
	 * Replaces a tracked instance by the one the store returned for it, the new
	 * instance keeps the tracking position and becomes
	 * {@link EntityState#UNCHANGED}.
	 */
	public synchronized void acceptChanges(Object entity, Object persisted) {
		Assert.notNull(entity, "Entity must not be null!");
		Assert.notNull(persisted, "Persisted entity must not be null!");

		if (entity == persisted) {
			setState(entity, EntityState.UNCHANGED);
			return;
		}

		Map<Equivalence.Wrapper<Object>, EntityEntry> copy = new LinkedHashMap<>(entries);
		entries.clear();
		copy.forEach((key, entry) -> {
			if (key.get() == entity) {
				entries.put(key(persisted), new EntityEntry(persisted, EntityState.UNCHANGED));
			} else if (key.get() != persisted) {
				entries.put(key, entry);
			}
		});
	}

	public synchronized List<EntityEntry> getEntries() {
		return ImmutableList.copyOf(entries.values());
	}

	public synchronized List<EntityEntry> getPendingEntries() {
		return entries.values().stream().filter(it -> it.getState().isPending())
				.collect(ImmutableList.toImmutableList());
	}

	public synchronized List<Object> getTrackedObjects() {
		return entries.values().stream().map(EntityEntry::getEntity).collect(ImmutableList.toImmutableList());
	}

	public synchronized boolean hasChanges() {
		return entries.values().stream().anyMatch(it -> it.getState().isPending());
	}

	private static Equivalence.Wrapper<Object> key(Object entity) {
		return Equivalence.identity().wrap(entity);
	}
}

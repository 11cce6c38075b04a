package com.github.kchobantonov.data.context.repository.support;

import org.springframework.util.Assert;
import org.springframework.util.ClassUtils;

import lombok.Getter;
import lombok.ToString;

/**
 * A record tracked by a {@link ChangeTracker} together with its current state.
 */
@Getter
@ToString
public class EntityEntry {
	private final Object entity;
	private final Class<?> modelType;
	private EntityState state;

	EntityEntry(Object entity, EntityState state) {
		Assert.notNull(entity, "Entity must not be null!");
		Assert.notNull(state, "EntityState must not be null!");

		this.entity = entity;
		this.modelType = ClassUtils.getUserClass(entity);
		this.state = state;
	}

	void setState(EntityState state) {
		Assert.notNull(state, "EntityState must not be null!");
		this.state = state;
	}
}

package com.github.kchobantonov.data.context.repository.query;

import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.core.EntityMetadata;

public interface DataModelMetadata<T> extends EntityMetadata<T> {

	/**
	 * Returns the repository class the data model is bound to, or
	 * {@link CrudRepository} when any single repository will do.
	 *
	 * @return never {@literal null}.
	 */
	@SuppressWarnings("rawtypes")
	Class<? extends CrudRepository> getRepositoryJavaType();

	/**
	 * Whether the data model names an explicit backing repository class.
	 */
	boolean hasExplicitRepository();
}

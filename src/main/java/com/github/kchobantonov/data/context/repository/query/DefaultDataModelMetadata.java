package com.github.kchobantonov.data.context.repository.query;

import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.data.repository.CrudRepository;
import org.springframework.util.Assert;

import com.github.kchobantonov.data.context.annotation.DataModel;

public class DefaultDataModelMetadata<T> implements DataModelMetadata<T> {
	private final Class<T> domainType;

	/**
	 * Creates a new {@link DefaultDataModelMetadata} for the given domain type.
	 *
	 * @param domainType must not be {@literal null}.
	 */
	public DefaultDataModelMetadata(Class<T> domainType) {

		Assert.notNull(domainType, "Domain type must not be null!");
		this.domainType = domainType;
	}

	/*
	 * (non-Javadoc)
	 * 
	 * @see org.springframework.data.repository.core.EntityMetadata#getJavaType()
	 */
	@Override
	public Class<T> getJavaType() {
		return domainType;
	}

	@Override
	@SuppressWarnings("rawtypes")
	public Class<? extends CrudRepository> getRepositoryJavaType() {
		DataModel model = AnnotatedElementUtils.findMergedAnnotation(domainType, DataModel.class);
		return model == null ? CrudRepository.class : model.repositoryClass();
	}

	@Override
	public boolean hasExplicitRepository() {
		return !CrudRepository.class.equals(getRepositoryJavaType());
	}
}

package com.github.kchobantonov.data.context.repository.support;

import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.data.util.Lazy;
import org.springframework.util.Assert;

import com.github.kchobantonov.data.context.query.QueryComposer;
import com.github.kchobantonov.data.context.repository.DataContext;

/**
 * Hands out a fresh {@link DataContext} per unit of work. The factory itself is
 * stateless apart from the lazily collected {@link Repositories} and can be
 * shared.
 */
public class DataContextFactory {
	private final Lazy<Repositories> repositories;
	private final QueryComposer queryComposer;
	private final Executor executor;

	public DataContextFactory(BeanFactory beanFactory, QueryComposer queryComposer) {
		this(beanFactory, queryComposer, ForkJoinPool.commonPool());
	}

	public DataContextFactory(BeanFactory beanFactory, QueryComposer queryComposer, Executor executor) {

		Assert.isInstanceOf(ListableBeanFactory.class, beanFactory, "beanFactory must be of type ListableBeanFactory!");
		Assert.notNull(queryComposer, "QueryComposer must not be null!");
		Assert.notNull(executor, "Executor must not be null!");

		this.repositories = Lazy.of(() -> beanFactory.getBeanProvider(Repositories.class)
				.getIfAvailable(() -> new Repositories((ListableBeanFactory) beanFactory)));
		this.queryComposer = queryComposer;
		this.executor = executor;
	}

	public DataContext create() {
		return new RepositoryDataContext(repositories.get(), queryComposer, executor);
	}
}

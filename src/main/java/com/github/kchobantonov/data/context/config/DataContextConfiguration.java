package com.github.kchobantonov.data.context.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import com.github.kchobantonov.data.context.query.QueryComposer;
import com.github.kchobantonov.data.context.repository.support.DataContextFactory;
import com.github.kchobantonov.data.context.repository.support.Repositories;

/**
 * Registers the beans needed to obtain a
 * {@link com.github.kchobantonov.data.context.repository.DataContext}. Async
 * operations run on the {@value #EXECUTOR_BEAN_NAME} bean when one is defined,
 * otherwise on the common fork join pool.
 */
@Configuration(proxyBeanMethods = false)
public class DataContextConfiguration {

	public static final String EXECUTOR_BEAN_NAME = "dataContextExecutor";

	@Bean
	@Lazy
	public Repositories dataContextRepositories(ListableBeanFactory beanFactory) {
		return new Repositories(beanFactory);
	}

	@Bean
	public QueryComposer queryComposer() {
		return new QueryComposer();
	}

	@Bean
	public DataContextFactory dataContextFactory(ListableBeanFactory beanFactory, QueryComposer queryComposer,
			@Qualifier(EXECUTOR_BEAN_NAME) ObjectProvider<Executor> executor) {
		return new DataContextFactory(beanFactory, queryComposer, executor.getIfAvailable(ForkJoinPool::commonPool));
	}
}

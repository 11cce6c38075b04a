package com.github.kchobantonov.data.context.repository.support;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.BeanFactoryUtils;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.core.ResolvableType;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.core.RepositoryInformation;
import org.springframework.data.repository.core.support.RepositoryFactoryInformation;
import org.springframework.data.util.ProxyUtils;
import org.springframework.util.Assert;
import org.springframework.util.ClassUtils;

/**
 * Similar class like
 * {@see org.springframework.data.repository.support.Repositories} but returns
 * all registered repositories for a specific domain class. Besides the
 * repositories created by Spring Data repository factories, any
 * {@link CrudRepository} bean whose domain type can be resolved from its
 * generic signature is registered as well.
 *
 * @author kchobantonov
 */
public class Repositories implements Iterable<Class<?>>, ApplicationContextAware {
	private static final Logger logger = LoggerFactory.getLogger(Repositories.class);

	private static final String DOMAIN_TYPE_MUST_NOT_BE_NULL = "Domain type must not be null!";

	private Optional<BeanFactory> beanFactory;
	private Map<Class<?>, Set<String>> repositoryBeanNames;

	/**
	 * Creates a new {@link Repositories} instance by looking up the repository
	 * instances and meta information from the given {@link ListableBeanFactory}.
	 *
	 * @param factory must not be {@literal null}.
	 */
	public Repositories(ListableBeanFactory factory) {

		Assert.notNull(factory, "ListableBeanFactory must not be null!");

		this.beanFactory = Optional.of(factory);
		this.repositoryBeanNames = new HashMap<>();

		populateRepositoryInformation(factory);
	}

	@Override
	public void setApplicationContext(ApplicationContext applicationContext) throws BeansException {
		this.beanFactory = Optional.of(applicationContext);
		this.repositoryBeanNames = new HashMap<>();

		populateRepositoryInformation(applicationContext);
	}

	private void populateRepositoryInformation(ListableBeanFactory factory) {

		for (String name : BeanFactoryUtils.beanNamesForTypeIncludingAncestors(factory,
				RepositoryFactoryInformation.class, false, false)) {
			cacheRepositoryFactory(factory, name);
		}

		for (String name : BeanFactoryUtils.beanNamesForTypeIncludingAncestors(factory, CrudRepository.class,
				false, false)) {
			cacheRepositoryBean(factory, name);
		}
	}

	@SuppressWarnings("rawtypes")
	private synchronized void cacheRepositoryFactory(ListableBeanFactory factory, String name) {

		RepositoryFactoryInformation repositoryFactoryInformation = factory.getBean(name,
				RepositoryFactoryInformation.class);
		RepositoryInformation information = repositoryFactoryInformation.getRepositoryInformation();
		Class<?> domainType = ClassUtils.getUserClass(information.getDomainType());

		Set<Class<?>> typesToRegister = new LinkedHashSet<>(information.getAlternativeDomainTypes().size() + 1);
		typesToRegister.add(domainType);
		typesToRegister.addAll(information.getAlternativeDomainTypes());

		for (Class<?> type : typesToRegister) {
			cache(type, BeanFactoryUtils.transformedBeanName(name));
		}
	}

	private synchronized void cacheRepositoryBean(ListableBeanFactory factory, String name) {

		Class<?> repositoryType = factory.getType(name, false);
		if (repositoryType == null) {
			logger.debug("Skipping repository bean {}, its type cannot be determined", name);
			return;
		}

		Class<?> domainType = ResolvableType.forClass(repositoryType).as(CrudRepository.class).resolveGeneric(0);
		if (domainType == null) {
			logger.debug("Skipping repository bean {}, its domain type cannot be resolved from {}", name,
					repositoryType.getName());
			return;
		}

		cache(ClassUtils.getUserClass(domainType), BeanFactoryUtils.transformedBeanName(name));
	}

	/**
	 * Returns whether we have a repository instance registered to manage instances
	 * of the given domain class.
	 *
	 * @param domainClass must not be {@literal null}.
	 * @return
	 */
	public boolean hasRepositoryFor(Class<?> domainClass) {

		Assert.notNull(domainClass, DOMAIN_TYPE_MUST_NOT_BE_NULL);

		return getRepositoryBeanNamesFor(domainClass).isPresent();
	}

	/**
	 * Returns the repositories managing the given domain class keyed by bean name.
	 * Repositories registered for a superclass are returned when the class itself
	 * has none.
	 *
	 * @param domainClass must not be {@literal null}.
	 * @return
	 */
	public Optional<Map<String, Object>> getRepositoriesFor(Class<?> domainClass) {

		Assert.notNull(domainClass, DOMAIN_TYPE_MUST_NOT_BE_NULL);

		Optional<Set<String>> repositoryBeanName = getRepositoryBeanNamesFor(domainClass);

		return beanFactory.flatMap(it -> repositoryBeanName
				.map(beans -> beans.stream().collect(Collectors.toMap(Function.identity(), it::getBean))));
	}

	/**
	 * Returns the repository bean names for the given domain class. The given
	 * <code>code</code> is converted to the actual user class if necessary, @see
	 * ProxyUtils#getUserClass.
	 *
	 * @param domainClass must not be {@literal null}.
	 */
	private Optional<Set<String>> getRepositoryBeanNamesFor(Class<?> domainClass) {

		Class<?> userType = ProxyUtils.getUserClass(domainClass);
		Set<String> names = repositoryBeanNames.get(userType);

		if (names != null) {
			return Optional.of(names);
		}

		if (userType.getSuperclass() != null && !userType.equals(Object.class)) {
			return getRepositoryBeanNamesFor(userType.getSuperclass());
		}

		return Optional.empty();
	}

	/*
	 * (non-Javadoc)
	 *
	 * @see java.lang.Iterable#iterator()
	 */
	public Iterator<Class<?>> iterator() {
		return repositoryBeanNames.keySet().iterator();
	}

	/**
	 * Caches the repository bean name for the given domain type.
	 *
	 * @param type must not be {@literal null}.
	 * @param name must not be {@literal null}.
	 */
	private void cache(Class<?> type, String name) {

		Set<String> names = this.repositoryBeanNames.get(type);
		if (names == null) {
			names = new LinkedHashSet<>();
		}
		if (!names.contains(name)) {
			names.add(name);
			logger.debug("Registered repository {} for domain type {}", name, type.getName());
		}

		this.repositoryBeanNames.put(type, names);
	}

}

package com.github.kchobantonov.data.context.annotation;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Documented;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import org.springframework.data.annotation.Persistent;
import org.springframework.data.repository.CrudRepository;

@Documented
@Inherited
@Target(TYPE)
@Retention(RUNTIME)
@Persistent
public @interface DataModel {

	/**
	 * <p>
	 * The backing repository class. This is useful in case of multiple
	 * repositories for the same domain class. The default is to expect a single
	 * backing repository per domain class.
	 * 
	 * @return the backing repository class.
	 */
	@SuppressWarnings("rawtypes")
	Class<? extends CrudRepository> repositoryClass() default CrudRepository.class;

}

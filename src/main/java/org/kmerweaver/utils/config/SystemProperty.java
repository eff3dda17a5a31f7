package org.kmerweaver.utils.config;

import java.lang.annotation.*;

/**
 * Marks a configuration option that is copied into the Java System Properties by
 * {@link ConfigFactory#injectSystemPropertiesFromConfig}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Documented
public @interface SystemProperty {

}

/**
 * Spring configuration: typed {@code @ConfigurationProperties} under {@code config.properties}
 * and the {@code @Configuration} classes that turn them into engine, scorer and dictionary beans.
 *
 * <p>Properties classes are immutable, constructor-bound and default every unset value, so
 * the application starts with an empty {@code application.properties}.
 *
 * @since 1.0
 */
package com.phillippitts.wordcomplexity.config;

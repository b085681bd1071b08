/**
 * Typed {@code @ConfigurationProperties} classes. Defaults live in the constructors so the
 * application runs without any properties set; {@code application.properties} restates them.
 */
package com.phillippitts.culinara.config.properties;

/**
 * Spring configuration: executors, thread pool metrics, placeholder collaborators and
 * orchestration wiring. Typed properties live in {@code config.properties}.
 */
package com.phillippitts.culinara.config;

/**
 * Configuration loading and wiring: defaults, YAML and CLI merged into {@link ca.gc.cra.calsync.config.SyncConfig},
 * then turned into a runnable use case by {@link ca.gc.cra.calsync.config.CompositionRoot}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.calsync.config;

/**
 * Command-line surface of calsync: argument parsing, configuration assembly, exit codes and run summaries.
 *
 * @since 0.1.0
 */
package ca.gc.cra.calsync.api;

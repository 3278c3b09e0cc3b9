/**
 * Core preview and migration workflow package.
 *
 * <p>
 * {@code PreviewPlanner} scans an export and writes a {@code MigrationPlan};
 * {@code MigrationOrchestrator} executes a plan in nine phases, recording progress in the
 * migration state and reporting through a {@code ProgressReporter}.
 * </p>
 */
package io.github.yok.itgluemigrate.core;

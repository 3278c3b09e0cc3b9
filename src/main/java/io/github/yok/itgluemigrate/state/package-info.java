/**
 * Migration state package.
 *
 * <p>
 * {@code MigrationState} records completed and failed entities per phase plus attachment
 * progress, and {@code IdMapper} maps IT Glue ids to destination ids. Both are persisted as JSON
 * so an interrupted run can resume.
 * </p>
 *
 * <p>
 * All mutators and readers are synchronized; attachment uploads update the state from pool
 * threads.
 * </p>
 */
package io.github.yok.itgluemigrate.state;

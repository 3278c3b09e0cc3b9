/**
 * Export parser package.
 *
 * <p>
 * Reads the core CSV files of an IT Glue export ({@code organizations}, {@code configurations},
 * {@code documents}, {@code locations}, {@code passwords}) into typed records, and custom asset
 * CSV files into field maps whose field definitions are inferred from the data by
 * {@code FieldInferrer}.
 * </p>
 */
package io.github.yok.itgluemigrate.parser;

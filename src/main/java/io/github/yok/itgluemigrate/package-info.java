/**
 * Root package of the IT Glue migration tool.
 *
 * <p>
 * Provides a CLI that migrates an IT Glue CSV export into BifrostDocs through its REST API, in two
 * steps: {@code preview} writes a reviewable migration plan, and {@code run} executes it with
 * resume support.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code parser}: export CSV parsing and custom asset field inference</li>
 * <li>{@code attachment}: attachment and document folder discovery</li>
 * <li>{@code document}: document HTML cleanup and image upload</li>
 * <li>{@code state}: resumable migration state and id mapping</li>
 * <li>{@code client}: destination API client</li>
 * <li>{@code core}: preview planning and phase orchestration</li>
 * </ul>
 */
package io.github.yok.itgluemigrate;

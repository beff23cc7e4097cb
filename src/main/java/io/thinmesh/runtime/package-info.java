/**
 * Process wiring.
 *
 * <p>{@link io.thinmesh.runtime.Backends} builds every backend client once from
 * configuration; {@link io.thinmesh.runtime.ThinMeshRuntime} combines them into
 * the operations the CLI exposes.
 */
package io.thinmesh.runtime;
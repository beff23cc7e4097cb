/**
 * Value types shared by the router, manifest, ledger, planner and workers.
 *
 * <p>{@link io.thinmesh.model.TaskEnvelope} and
 * {@link io.thinmesh.model.ManifestEntry} are wire formats: their JSON field
 * names are snake_case and stable across processes.
 */
package io.thinmesh.model;

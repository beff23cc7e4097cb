/**
 * ThinMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.thinmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.thinmesh.cli.ThinMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.thinmesh.planner.Planner} turns a run spec into dispatched tasks and reacts to completions.</li>
 *   <li>{@code io.thinmesh.worker.WorkerAgent} runs the claim, execute, record, ack cycle.</li>
 * </ul>
 */
package io.thinmesh;
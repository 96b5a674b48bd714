/**
 * Host-facing facade over the stage graph.
 * <ul>
 *   <li>{@link com.stagegraph.workflow.ManifestRegistry} – manifests and scripts in a directory</li>
 *   <li>{@link com.stagegraph.workflow.WorkflowAdapter} – command lookup, transition checks, progress text</li>
 *   <li>{@link com.stagegraph.workflow.SessionManager} – session creation, resume and listing</li>
 *   <li>{@link com.stagegraph.workflow.WorkflowRuntime} – wiring from {@link com.stagegraph.config.StageGraphConfig}</li>
 * </ul>
 */
package com.stagegraph.workflow;

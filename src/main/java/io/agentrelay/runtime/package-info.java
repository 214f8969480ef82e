/**
 * Message routing and workflow execution.
 *
 * <p>{@link io.agentrelay.runtime.Orchestrator} owns both execution paths. Rejections that happen
 * before any step runs (unknown workflow, unbound agent) come back as error responses; invalid
 * timeouts are thrown to the caller.
 */
package io.agentrelay.runtime;

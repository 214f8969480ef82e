/**
 * Workflow definitions and the per-run ledger.
 *
 * <p>Steps of a definition always run in declared order, one at a time, because a step's
 * {@link io.agentrelay.workflow.InputMapping} may read any earlier step's result.
 */
package io.agentrelay.workflow;

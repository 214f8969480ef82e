/**
 * Agent contract and registry.
 *
 * <p>The orchestrator only ever sees {@link io.agentrelay.agent.Agent}; concrete business agents
 * (planning, risk scoring, reporting) are supplied by collaborators. The agents shipped here are
 * infrastructure agents used for wiring checks, demos and external scripts.
 */
package io.agentrelay.agent;

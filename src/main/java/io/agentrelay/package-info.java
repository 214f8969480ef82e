/**
 * AgentRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentrelay.runtime.AgentRelayRuntime} wires broker, agents and workflows from configuration.</li>
 *   <li>{@code io.agentrelay.runtime.Orchestrator} routes messages and runs workflows with or without a deadline.</li>
 *   <li>{@code io.agentrelay.broker.MessageBroker} fans outcome events out to subscribers.</li>
 * </ul>
 */
package io.agentrelay;

/**
 * In-process message broker.
 *
 * <p>Ordering: per topic, messages from one producer reach every subscriber in publish order.
 * Nothing survives a process restart and delivery is not exactly-once.
 */
package io.agentrelay.broker;

/**
 * Runtime wiring package.
 *
 * <p>{@link io.agentrelay.runtime.AgentRelayRuntime} owns one instance of every component,
 * applies settings, seeds identities from {@code agents.json} and audits inbound RPC traffic.
 */
package io.agentrelay.runtime;

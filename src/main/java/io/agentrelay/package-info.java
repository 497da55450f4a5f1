/**
 * AgentRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentrelay.runtime.AgentRelayRuntime} wires the bus, task ledger and transcoder.</li>
 *   <li>{@code io.agentrelay.bus.MessageBus} validates and routes envelopes into mailboxes.</li>
 *   <li>{@code io.agentrelay.protocol.ProtocolTranscoder} is the JSON-RPC 2.0 boundary.</li>
 * </ul>
 */
package io.agentrelay;

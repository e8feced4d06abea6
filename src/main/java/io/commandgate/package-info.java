/**
 * CommandGate source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.commandgate.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.commandgate.runtime.CommandGateRuntime} wires stores, router, gateway and workers.</li>
 *   <li>{@code io.commandgate.runtime.Orchestrator} is the caller-facing submit/decide/status API.</li>
 *   <li>{@code io.commandgate.gateway.WriteGateway} is the only path that mutates execution state.</li>
 * </ul>
 */
package io.commandgate;

/**
 * Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty, a simulator, or a test
 * double) and the bridge's transport adapters.
 *
 * <h2>Why these ports exist</h2>
 * Netty does the socket work in production (event loop model, mature TCP and
 * UDP support, robust lifecycle handling) <strong>without</strong> Netty types
 * leaking into dispatch or execution code. Everything above the endpoints sees
 * only:
 * <ul>
 *   <li>Complete messages as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>A {@link com.questrail.hostbridge.transport.StreamConnection} to write TCP responses</li>
 *   <li>Transport lifecycle notifications (up/down, connection open/close)</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Endpoint implementations MUST:
 * <ul>
 *   <li>Perform transport I/O and framing only</li>
 *   <li>Not parse JSON or classify commands</li>
 *   <li>Not call the host or the execution serializer</li>
 *   <li>Never write to a UDP sender</li>
 * </ul>
 */
package com.questrail.hostbridge.transport;

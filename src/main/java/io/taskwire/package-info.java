/**
 * TaskWire source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.taskwire.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.taskwire.transport.local.InProcessTransport} delivers envelopes inside one JVM.</li>
 *   <li>{@code io.taskwire.transport.socket.UnixSocketServer} and {@code UnixSocketClient} carry them across processes.</li>
 *   <li>{@code io.taskwire.correlation.TaskCorrelator} turns a task request into an awaitable response.</li>
 * </ul>
 */
package io.taskwire;

/**
 * Framed transport over a Unix domain socket.
 *
 * <p>Each record is a 4-byte big-endian length followed by a MessagePack map. A connection
 * becomes usable only after the {@code HELLO}/{@code ACK} handshake; heartbeats are
 * advisory and never close a connection on their own.
 */
package io.taskwire.transport.socket;

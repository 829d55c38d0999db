/**
 * Request/response correlation on top of one-way transports.
 */
package io.taskwire.correlation;

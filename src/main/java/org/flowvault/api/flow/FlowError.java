package org.flowvault.api.flow;

/**
 * Error recorded on a flow by the capture engine (connection reset, timeout, ...).
 *
 * @param msg       Human-readable error message.
 * @param timestamp Epoch seconds when the error occurred.
 */
public record FlowError(String msg, double timestamp) {
}

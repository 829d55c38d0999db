package io.taskwire.transport.socket;

import io.taskwire.transport.TransportException;

public final class FrameTooLargeException extends TransportException {
    private final long frameLength;

    public FrameTooLargeException(long frameLength, int maxFrameSize) {
        super("Frame too large: " + frameLength + " bytes (max " + maxFrameSize + ")");
        this.frameLength = frameLength;
    }

    public long frameLength() {
        return frameLength;
    }
}

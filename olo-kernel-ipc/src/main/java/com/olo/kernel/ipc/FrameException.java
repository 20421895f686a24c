package com.olo.kernel.ipc;

import java.io.IOException;

/** Malformed frame on the wire: bad length or unknown type byte. */
public final class FrameException extends IOException {

    public FrameException(String message) {
        super(message);
    }
}

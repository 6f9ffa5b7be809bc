package net.imadata.imatools.rpm;

import java.io.IOException;

/**
 * Thrown when a file does not follow the RPM package layout. The offset points at the first byte of the
 * offending structure.
 */
public class RpmFormatException extends IOException {
    private final long offset;

    public RpmFormatException(String message, long offset) {
        super(message + " (at byte " + offset + ")");
        this.offset = offset;
    }

    public long getOffset() {
        return offset;
    }
}

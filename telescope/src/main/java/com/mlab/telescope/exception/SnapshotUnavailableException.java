package com.mlab.telescope.exception;

import java.nio.file.Path;

/**
 * The ASN snapshot backing an IP translator could not be opened or read.
 */
public class SnapshotUnavailableException extends TelescopeException {

    public SnapshotUnavailableException(Path snapshotPath, Throwable cause) {
        super("Failed to open ASN snapshot at " + snapshotPath + ": " + cause.getMessage(), cause);
    }
}

package org.rgen.runtime.persistence;

/**
 * Thrown when a snapshot carries a format version this build cannot read.
 */
public class VersionMismatchException extends Exception {

    private final int foundVersion;
    private final int supportedVersion;

    public VersionMismatchException(int foundVersion, int supportedVersion) {
        super("Snapshot format version " + foundVersion + " is not supported (expected " + supportedVersion + ")");
        this.foundVersion = foundVersion;
        this.supportedVersion = supportedVersion;
    }

    public int getFoundVersion() {
        return foundVersion;
    }

    public int getSupportedVersion() {
        return supportedVersion;
    }
}

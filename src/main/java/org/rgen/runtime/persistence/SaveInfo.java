package org.rgen.runtime.persistence;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A save file found in the save directory.
 *
 * @param name         save name without extensions.
 * @param path         file location.
 * @param sizeBytes    file size.
 * @param lastModified modification time.
 */
public record SaveInfo(String name, Path path, long sizeBytes, Instant lastModified) {
}

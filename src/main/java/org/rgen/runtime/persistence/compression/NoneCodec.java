package org.rgen.runtime.persistence.compression;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * Pass-through codec used when compression is disabled.
 */
public class NoneCodec implements ICompressionCodec {

    @Override
    public OutputStream wrapOutputStream(OutputStream out) {
        return out;
    }

    @Override
    public InputStream wrapInputStream(InputStream in) {
        return in;
    }

    @Override
    public String getName() {
        return "none";
    }

    @Override
    public String getFileExtension() {
        return "";
    }

    @Override
    public int getLevel() {
        return 0;
    }

    /**
     * Any data can be uncompressed, so this never claims a match during detection.
     */
    @Override
    public boolean matches(byte[] data) {
        return false;
    }

    @Override
    public void validateEnvironment() {
        // nothing to check
    }

    @Override
    public String toString() {
        return "NoneCodec{}";
    }
}

package org.patterncompare.io;

import java.io.IOException;
import java.io.InputStream;

/**
 * Simple functional interface so callers can provide:
 * - a file stream
 * - a classpath resource stream
 * - an in-memory stream in tests
 */
@FunctionalInterface
public interface InputStreamSupplier {
    InputStream open() throws IOException;
}

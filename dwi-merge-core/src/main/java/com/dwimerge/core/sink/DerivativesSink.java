package com.dwimerge.core.sink;

import java.nio.file.Path;
import java.util.Map;

/**
 * Receives the outputs of a merge run.
 *
 * <p>Implementations decide the storage layout; the run only hands over named artifacts.
 */
public interface DerivativesSink {

    /**
     * Unique identifier for this sink, e.g. {@code filesystem}.
     *
     * @return sink id
     */
    String getId();

    /**
     * Stores every artifact of the bundle.
     *
     * @param bundle run outputs
     * @return output name to written location
     */
    Map<String, Path> write(DerivativesBundle bundle);
}

package org.io;

import org.model.Sample;

import java.util.List;

/**
 * A training data input: where labeled examples come from (file/stream/classpath/etc.).
 *
 * Implementations should:
 * - load the sample once (and optionally cache)
 * - validate it (non-empty, consistent attribute set, labels present)
 * - return immutable values
 */
public interface SampleSource<L> {

    /**
     * Loads (or returns cached) labeled examples.
     */
    Sample<String, L> load();

    /**
     * Attribute ids shared by every example, in the order they first appear.
     * Loads the sample if it was not loaded yet.
     */
    List<String> attributes();
}

package io.tsvstream.core;

import java.io.IOException;

/**
 * Push callbacks from a {@link LineSource}. Callbacks run on the source's thread and must not block.
 */
public interface LineListener {
    void onLine(String line);

    /** Read failure; always followed by {@link #onClosed()}. */
    void onError(IOException e);

    /** No further lines will be delivered. Called exactly once. */
    void onClosed();
}

package org.javai.regular;

/**
 * Result of a {@link TimeWindow} containment check.
 *
 * @param started "now" has reached or passed the window's start boundary
 * @param ended "now" has reached or passed the window's end boundary
 */
public record WindowState(boolean started, boolean ended) {

    /**
     * True while the window's task should be running.
     */
    public boolean isOpen() {
        return started && !ended;
    }
}

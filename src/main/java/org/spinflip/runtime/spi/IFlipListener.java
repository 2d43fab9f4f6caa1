package org.spinflip.runtime.spi;

/**
 * Observer notified for every accepted flip during a sweep.
 * <p>
 * Listeners are called synchronously from the sweep loop, after the flip has been
 * applied. They must not modify the simulation. A listener that throws is logged
 * and skipped; the sweep continues.
 *
 * @param <V> The variable label type.
 */
@FunctionalInterface
public interface IFlipListener<V> {

    /**
     * Called after a variable has been flipped.
     *
     * @param label The flipped variable.
     * @param delta The energy change caused by the flip.
     * @param temperature The temperature of the sweep.
     */
    void onFlipAccepted(V label, double delta, double temperature);
}

package org.spinflip.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rewrites energy models between the Boolean and the spin domain.
 * <p>
 * Substituting {@code b = (1 - s) / 2} (or {@code s = 1 - 2b}) into a term of arity
 * {@code k} expands it into up to {@code 2^k} terms over the subsets of its labels.
 * The results are merged into a new model under the usual invariants. The empty
 * subset contributes a constant that no term can hold; it is returned separately
 * as the offset, so that {@code original(x) == converted.model(x') + converted.offset()}
 * for every assignment {@code x} and its translation {@code x'}.
 */
public final class DomainConversions {

    private static final int MAX_EXPANDABLE_ARITY = 30;

    private DomainConversions() {
    }

    /**
     * A converted model together with the constant energy the conversion split off.
     *
     * @param model  The converted model.
     * @param offset The constant to add to the converted model's energy.
     * @param <V>    The variable label type.
     */
    public record Converted<V>(EnergyModel<V> model, double offset) {}

    /**
     * Converts a Boolean-domain model into the equivalent spin-domain model.
     *
     * @param booleanModel A model over variables in {0, 1}.
     * @param <V> The variable label type.
     * @return The spin-domain model and the constant offset.
     */
    public static <V> Converted<V> booleanToSpin(EnergyModel<V> booleanModel) {
        // c * prod (1 - s_i) / 2 == c / 2^k * sum over subsets S of (-1)^|S| * prod_{i in S} s_i
        return expand(booleanModel, 0.5, -1.0);
    }

    /**
     * Converts a spin-domain model into the equivalent Boolean-domain model.
     *
     * @param spinModel A model over variables in {-1, +1}.
     * @param <V> The variable label type.
     * @return The Boolean-domain model and the constant offset.
     */
    public static <V> Converted<V> spinToBoolean(EnergyModel<V> spinModel) {
        // c * prod (1 - 2 b_i) == c * sum over subsets S of (-2)^|S| * prod_{i in S} b_i
        return expand(spinModel, 1.0, -2.0);
    }

    /**
     * Expands {@code c * prod (scale * (1 + factor * x_i))} for every term.
     */
    private static <V> Converted<V> expand(EnergyModel<V> source, double scale, double factor) {
        EnergyModel<V> target = new EnergyModel<>();
        double offset = 0.0;
        for (Map.Entry<Term<V>, Double> entry : source) {
            List<V> labels = new ArrayList<>(entry.getKey().labels());
            int arity = labels.size();
            if (arity > MAX_EXPANDABLE_ARITY) {
                throw new InvalidTermException(
                        "Term of arity " + arity + " is too large to convert: " + entry.getKey());
            }
            double base = entry.getValue() * Math.pow(scale, arity);
            for (int mask = 0; mask < (1 << arity); mask++) {
                double coefficient = base * Math.pow(factor, Integer.bitCount(mask));
                if (mask == 0) {
                    offset += coefficient;
                    continue;
                }
                List<V> subset = new ArrayList<>(Integer.bitCount(mask));
                for (int i = 0; i < arity; i++) {
                    if ((mask & (1 << i)) != 0) {
                        subset.add(labels.get(i));
                    }
                }
                target.add(subset, coefficient);
            }
        }
        return new Converted<>(target, offset);
    }
}

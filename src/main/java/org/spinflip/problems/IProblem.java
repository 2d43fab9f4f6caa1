package org.spinflip.problems;

import java.util.Map;

/**
 * A combinatorial problem that can be encoded as an energy model and whose
 * solutions can be read back from a simulated state.
 *
 * @param <V> The variable label type of the encoding.
 * @param <S> The problem's solution type.
 */
public interface IProblem<V, S> {

    /**
     * Encodes the problem with its default penalty parameters.
     */
    Encoding<V> encode();

    /**
     * @return The number of model variables the encoding uses.
     */
    int getNumVariables();

    /**
     * Decodes a state of the encoding's domain into a problem solution.
     */
    S convertSolution(Map<V, Integer> state);

    /**
     * @return {@code true} if the solution satisfies every constraint of the problem.
     */
    boolean isSolutionValid(S solution);
}

// =============================================================================
// DeliveryEase - Genetic Operators
// =============================================================================
package com.deliveryease.optimizer.engine;

import com.deliveryease.optimizer.model.Stop;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Selection, recombination and mutation over stop permutations.
 * Operators never modify their inputs.
 */
public class GeneticOperators {

    private final RandomGenerator random;

    public GeneticOperators(RandomGenerator random) {
        this.random = random;
    }

    /**
     * Order crossover that always keeps position 0 of {@code parent1}.
     * A sub-range starting at 1 or later is copied from parent 1, the other
     * positions take parent 2's stops in order, skipping stops already used.
     * With probability {@code 1 - crossoverRate} parent 1 is returned as is.
     */
    public List<Stop> orderCrossover(List<Stop> parent1, List<Stop> parent2, double crossoverRate) {
        if (random.nextDouble() > crossoverRate) {
            return new ArrayList<>(parent1);
        }
        int length = parent1.size();
        if (length <= 1) {
            return new ArrayList<>(parent1);
        }

        int start = 1 + random.nextInt(length - 1);
        int end = start + random.nextInt(length - start);

        Stop[] offspring = new Stop[length];
        Set<String> used = new HashSet<>();

        offspring[0] = parent1.get(0);
        used.add(parent1.get(0).getId());
        for (int i = start; i <= end; i++) {
            offspring[i] = parent1.get(i);
            used.add(parent1.get(i).getId());
        }

        int donor = 0;
        for (int i = 1; i < length; i++) {
            if (offspring[i] != null) {
                continue;
            }
            while (donor < parent2.size() && used.contains(parent2.get(donor).getId())) {
                donor++;
            }
            if (donor < parent2.size()) {
                offspring[i] = parent2.get(donor);
                used.add(parent2.get(donor).getId());
                donor++;
            }
        }

        // parent 2 may lack stops of parent 1; close the gaps from parent 1
        for (int i = 1; i < length; i++) {
            if (offspring[i] != null) {
                continue;
            }
            for (Stop stop : parent1) {
                if (used.add(stop.getId())) {
                    offspring[i] = stop;
                    break;
                }
            }
        }
        return new ArrayList<>(Arrays.asList(offspring));
    }

    /**
     * Swaps each position, with probability {@code mutationRate}, with a
     * uniformly random position. Position 0 is not protected.
     */
    public List<Stop> swapMutation(List<Stop> route, double mutationRate) {
        List<Stop> mutated = new ArrayList<>(route);
        for (int i = 0; i < mutated.size(); i++) {
            if (random.nextDouble() < mutationRate) {
                Collections.swap(mutated, i, random.nextInt(mutated.size()));
            }
        }
        return mutated;
    }

    /**
     * Index of the fittest of {@code tournamentSize} randomly drawn contenders.
     */
    public int tournamentSelect(double[] fitness, int tournamentSize) {
        int best = random.nextInt(fitness.length);
        for (int i = 1; i < tournamentSize; i++) {
            int contender = random.nextInt(fitness.length);
            if (fitness[contender] > fitness[best]) {
                best = contender;
            }
        }
        return best;
    }
}

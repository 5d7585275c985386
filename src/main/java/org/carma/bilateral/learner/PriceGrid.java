package org.carma.bilateral.learner;

import org.carma.bilateral.model.Expert;
import org.carma.bilateral.safety.ContractGuard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the discretized expert sets used by the hedge learners.
 *
 * Both constructions are deterministic for a fixed resolution K and return
 * unmodifiable lists whose order defines expert identity.
 */
public final class PriceGrid {

    private PriceGrid() {
    }

    /**
     * Grid for the budget-accumulating learner.
     *
     * For every diagonal point g = k/K (k in [0, K]) the grid holds (g, g)
     * and, for each scale d = 2^-i with i in [0, floor(ln K)), the pairs
     * (g - d, g) and (g, g + d) whenever they stay inside [0,1]. Every pair
     * has bid &gt;= ask, so a cleared trade never costs budget.
     *
     * @param resolution K, must be at least 1
     */
    public static List<Expert> multiplicativeGrid(int resolution) {
        ContractGuard.requirePositiveResolution(resolution);
        int scales = (int) Math.floor(Math.log(resolution));

        List<Expert> grid = new ArrayList<>();
        for (int k = 0; k <= resolution; k++) {
            double g = (double) k / resolution;
            grid.add(new Expert(g, g));
            for (int i = 0; i < scales; i++) {
                double step = Math.pow(2, -i);
                if (g - step >= 0) {
                    grid.add(new Expert(g - step, g));
                }
                if (g + step <= 1) {
                    grid.add(new Expert(g, g + step));
                }
            }
        }
        return Collections.unmodifiableList(grid);
    }

    /**
     * Grid for the gains-from-trade learner: K pairs ((i+1)/K, i/K),
     * each posting an ask one step of 1/K above its bid.
     *
     * @param resolution K, must be at least 1
     */
    public static List<Expert> additiveGrid(int resolution) {
        ContractGuard.requirePositiveResolution(resolution);

        List<Expert> grid = new ArrayList<>(resolution);
        for (int i = 0; i < resolution; i++) {
            grid.add(new Expert((double) (i + 1) / resolution, (double) i / resolution));
        }
        return Collections.unmodifiableList(grid);
    }
}

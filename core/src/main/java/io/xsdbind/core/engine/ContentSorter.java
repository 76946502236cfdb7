package io.xsdbind.core.engine;

import io.xsdbind.core.particle.ModelGroup;
import io.xsdbind.core.particle.Particle;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Puts children into the order of their content model. Children are grouped by the particle that
 * declares them, in declaration order; a repeated sequence takes one round of its particles at a
 * time so {@code (a, b)*} yields {@code a b a b}. Children without a particle go last, in their
 * original order.
 */
final class ContentSorter {

    private ContentSorter() {}

    static <T> List<T> sort(ModelGroup group, List<T> items, Function<T, Particle> particleOf) {
        if (group == null || items.size() < 2) {
            return items;
        }
        boolean[] taken = new boolean[items.size()];
        List<T> out = new ArrayList<>(items.size());
        sortGroup(group, items, particleOf, taken, out);
        for (int i = 0; i < items.size(); i++) {
            if (!taken[i]) {
                out.add(items.get(i));
            }
        }
        return out;
    }

    private static <T> int sortGroup(
            ModelGroup group, List<T> items, Function<T, Particle> particleOf, boolean[] taken, List<T> out) {
        boolean rounds = group.compositor() == ModelGroup.Compositor.SEQUENCE && !group.occurs().isSingle();
        int total = 0;
        while (true) {
            int pass = 0;
            for (Particle p : group.particles()) {
                if (p instanceof ModelGroup nested) {
                    pass += sortGroup(nested, items, particleOf, taken, out);
                } else {
                    int limit = rounds && p.occurs().max() != null ? p.occurs().max() : Integer.MAX_VALUE;
                    pass += take(p, limit, items, particleOf, taken, out);
                }
            }
            total += pass;
            if (!rounds || pass == 0) {
                return total;
            }
        }
    }

    private static <T> int take(
            Particle particle, int limit, List<T> items, Function<T, Particle> particleOf, boolean[] taken, List<T> out) {
        int count = 0;
        for (int i = 0; i < items.size() && count < limit; i++) {
            if (!taken[i] && particleOf.apply(items.get(i)) == particle) {
                taken[i] = true;
                out.add(items.get(i));
                count++;
            }
        }
        return count;
    }
}

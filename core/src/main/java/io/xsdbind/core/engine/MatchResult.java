package io.xsdbind.core.engine;

import io.xsdbind.core.particle.ElementDecl;
import io.xsdbind.core.particle.Particle;
import java.util.BitSet;
import java.util.List;

/**
 * Outcome of matching a child sequence against a content model.
 *
 * @param pairings   children placed on particles, in child order
 * @param mismatches unmet minimums and unexpected children, in discovery order
 * @param childCount number of children that were matched against the model
 */
public record MatchResult(List<Pairing> pairings, List<Mismatch> mismatches, int childCount) {

    public MatchResult {
        pairings = List.copyOf(pairings);
        mismatches = List.copyOf(mismatches);
    }

    public boolean isValid() {
        return mismatches.isEmpty();
    }

    /** Indices of children that no particle took. */
    public BitSet unplaced() {
        BitSet unplaced = new BitSet(childCount);
        unplaced.set(0, childCount);
        for (Pairing p : pairings) {
            unplaced.clear(p.childIndex());
        }
        return unplaced;
    }

    /**
     * One child placed on one particle.
     *
     * @param childIndex position of the child
     * @param particle   the element particle or wildcard that took the child
     * @param decl       effective declaration of the child, {@code null} for a wildcard match
     *                   without a declaration
     * @param repeatable {@code true} if the particle (or an enclosing group) admits repetition
     */
    public record Pairing(int childIndex, Particle particle, ElementDecl decl, boolean repeatable) {}

    /**
     * A content model violation.
     *
     * @param childIndex position of the child the violation was found at; equal to the child count
     *                   when found after the last child
     * @param reason     description, e.g. {@code tag expected: 'item'}
     * @param expected   names acceptable at that position, possibly empty
     */
    public record Mismatch(int childIndex, String reason, List<String> expected) {
        public Mismatch {
            expected = List.copyOf(expected);
        }
    }
}

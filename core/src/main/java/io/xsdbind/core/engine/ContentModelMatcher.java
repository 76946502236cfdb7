package io.xsdbind.core.engine;

import io.xsdbind.core.particle.ElementDecl;
import io.xsdbind.core.particle.ModelGroup;
import io.xsdbind.core.particle.Occurs;
import io.xsdbind.core.particle.Particle;
import io.xsdbind.core.particle.ProcessContents;
import io.xsdbind.core.particle.Wildcard;
import io.xsdbind.core.schema.Schema;
import io.xsdbind.core.type.XsdNames;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import javax.xml.namespace.QName;

/**
 * Matches an ordered list of child names against a model group.
 *
 * <p>The matcher is greedy and never backtracks: each particle takes as many children as its
 * bounds allow, a choice commits to the first alternative that takes at least one child, and an
 * {@code all} group tries its remaining members in declaration order at each position. It keeps no
 * state between calls, so one instance serves any number of concurrent matches.
 */
public final class ContentModelMatcher {

    private final Schema schema;

    public ContentModelMatcher(Schema schema) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    /**
     * Matches children against a content model.
     *
     * @param group    the content model, {@code null} for empty content
     * @param children child names in document order
     * @return pairings and mismatches
     */
    public MatchResult match(ModelGroup group, List<QName> children) {
        Run run = new Run(children);
        int cursor = 0;
        List<String> expected = List.of();
        if (group != null) {
            Outcome outcome = run.matchParticle(group, 0, false);
            cursor = outcome.cursor;
            if (outcome.status == Status.ABSENT) {
                expected = outcome.expected;
                if (children.isEmpty()) {
                    run.report(0, "tag expected: " + names(expected), expected);
                }
            }
        }
        boolean first = true;
        for (int i = cursor; i < children.size(); i++) {
            if (run.paired.get(i) || run.reported.get(i)) {
                continue;
            }
            String reason = "unexpected tag '" + XsdNames.display(children.get(i)) + "'";
            if (first && !expected.isEmpty()) {
                reason += ", tag expected: " + names(expected);
            }
            run.report(i, reason, first ? expected : List.of());
            first = false;
        }
        run.pairings.sort((a, b) -> Integer.compare(a.childIndex(), b.childIndex()));
        return new MatchResult(run.pairings, run.mismatches, children.size());
    }

    /**
     * Finds the declaration a single child would take on an element particle or wildcard.
     *
     * @return the match, or {@code null} if the particle does not accept the name
     */
    public Candidate accepts(Particle particle, QName name) {
        if (particle instanceof ElementDecl e) {
            ElementDecl decl = schema.resolve(e);
            if (decl.name().equals(name) && !decl.isAbstract()) {
                return new Candidate(decl);
            }
            for (ElementDecl member : schema.substitutes(decl.name())) {
                if (member.name().equals(name) && !member.isAbstract()) {
                    return new Candidate(member.withOccurs(e.occurs()));
                }
            }
            return null;
        }
        if (particle instanceof Wildcard w) {
            if (!w.namespaces().allows(name.getNamespaceURI())) {
                return null;
            }
            ElementDecl global = schema.element(name).orElse(null);
            return switch (w.processContents()) {
                case SKIP -> new Candidate(null);
                case LAX -> new Candidate(global);
                case STRICT -> global == null ? null : new Candidate(global);
            };
        }
        return null;
    }

    /** Names an element particle or wildcard accepts, for diagnostics. */
    List<String> acceptedNames(Particle particle) {
        List<String> out = new ArrayList<>();
        if (particle instanceof ElementDecl e) {
            ElementDecl decl = schema.resolve(e);
            if (!decl.isAbstract()) {
                out.add(XsdNames.display(decl.name()));
            }
            for (ElementDecl member : schema.substitutes(decl.name())) {
                if (!member.isAbstract()) {
                    out.add(XsdNames.display(member.name()));
                }
            }
        } else if (particle instanceof Wildcard w) {
            out.add(w.describe() + (w.processContents() == ProcessContents.STRICT ? " declared" : ""));
        }
        return out;
    }

    private static String names(List<String> expected) {
        if (expected.size() == 1) {
            return "'" + expected.get(0) + "'";
        }
        return expected.stream().map(n -> "'" + n + "'").collect(Collectors.joining(", ", "one of [", "]"));
    }

    /** A child accepted by a particle, with its effective declaration ({@code null} for skip). */
    public record Candidate(ElementDecl decl) {}

    private enum Status {
        /** Minimum reached. */
        SATISFIED,
        /** Nothing consumed and minimum not reached. */
        ABSENT,
        /** Consumed children but violations were found. */
        BROKEN
    }

    private record Outcome(Status status, int cursor, List<String> expected) {

        static Outcome satisfied(int cursor, List<String> expected) {
            return new Outcome(Status.SATISFIED, cursor, expected);
        }

        static Outcome absent(int cursor, List<String> expected) {
            return new Outcome(Status.ABSENT, cursor, expected);
        }

        static Outcome broken(int cursor) {
            return new Outcome(Status.BROKEN, cursor, List.of());
        }
    }

    /** Working state of one {@link #match} call. */
    private final class Run {

        private final List<QName> children;
        private final List<MatchResult.Pairing> pairings = new ArrayList<>();
        private final List<MatchResult.Mismatch> mismatches = new ArrayList<>();
        private final BitSet paired = new BitSet();
        private final BitSet reported = new BitSet();

        Run(List<QName> children) {
            this.children = children;
        }

        void report(int index, String reason, List<String> expected) {
            mismatches.add(new MatchResult.Mismatch(index, reason, expected));
            if (index < children.size()) {
                reported.set(index);
            }
        }

        Outcome matchParticle(Particle particle, int cursor, boolean enclosingRepeatable) {
            if (particle instanceof ModelGroup group) {
                return matchGroup(group, cursor, enclosingRepeatable);
            }
            return matchTerm(particle, cursor, enclosingRepeatable);
        }

        /** An element particle or wildcard, repeated within its bounds. */
        private Outcome matchTerm(Particle term, int cursor, boolean enclosingRepeatable) {
            Occurs occurs = term.occurs();
            boolean repeatable = enclosingRepeatable || !occurs.isSingle();
            int count = 0;
            int pos = cursor;
            while (!occurs.isExhaustedBy(count) && pos < children.size()) {
                Candidate candidate = accepts(term, children.get(pos));
                if (candidate == null) {
                    break;
                }
                pairings.add(new MatchResult.Pairing(pos, term, candidate.decl(), repeatable));
                paired.set(pos);
                pos++;
                count++;
            }
            List<String> names = acceptedNames(term);
            if (occurs.isSatisfiedBy(count)) {
                return Outcome.satisfied(pos, occurs.isExhaustedBy(count) ? List.of() : names);
            }
            if (count == 0) {
                return Outcome.absent(pos, names);
            }
            report(pos, "tag expected: " + names(names), names);
            return Outcome.broken(pos);
        }

        /** A model group, repeated within its bounds. */
        private Outcome matchGroup(ModelGroup group, int cursor, boolean enclosingRepeatable) {
            Occurs occurs = group.occurs();
            boolean repeatable = enclosingRepeatable || !occurs.isSingle();
            int count = 0;
            int pos = cursor;
            List<String> expected = List.of();
            while (!occurs.isExhaustedBy(count)) {
                Outcome pass = switch (group.compositor()) {
                    case SEQUENCE -> matchSequence(group, pos, repeatable);
                    case CHOICE -> matchChoice(group, pos, repeatable);
                    case ALL -> matchAll(group, pos, repeatable);
                };
                if (pass.status == Status.ABSENT) {
                    if (occurs.isSatisfiedBy(count)) {
                        return Outcome.satisfied(pos, pass.expected);
                    }
                    if (count == 0) {
                        return Outcome.absent(pos, pass.expected);
                    }
                    report(pos, "tag expected: " + names(pass.expected), pass.expected);
                    return Outcome.broken(pos);
                }
                if (pass.status == Status.BROKEN) {
                    return Outcome.broken(pass.cursor);
                }
                count++;
                if (pass.cursor == pos) {
                    // an empty pass satisfies every remaining repetition
                    return Outcome.satisfied(pos, pass.expected);
                }
                pos = pass.cursor;
                expected = pass.expected;
            }
            return Outcome.satisfied(pos, occurs.isExhaustedBy(count) ? List.of() : expected);
        }

        private Outcome matchSequence(ModelGroup group, int start, boolean repeatable) {
            int pos = start;
            boolean broken = false;
            Set<String> expected = new LinkedHashSet<>();
            for (Particle p : group.particles()) {
                Outcome o = matchParticle(p, pos, repeatable);
                switch (o.status) {
                    case SATISFIED -> {
                        if (o.cursor > pos) {
                            expected.clear();
                        }
                        expected.addAll(o.expected);
                        pos = o.cursor;
                    }
                    case BROKEN -> {
                        broken = true;
                        expected.clear();
                        pos = o.cursor;
                    }
                    case ABSENT -> {
                        expected.addAll(o.expected);
                        if (pos == start && !broken) {
                            return Outcome.absent(pos, List.copyOf(expected));
                        }
                        List<String> names = List.copyOf(expected);
                        report(pos, "tag expected: " + names(names), names);
                        broken = true;
                        expected.clear();
                    }
                }
            }
            return broken ? Outcome.broken(pos) : Outcome.satisfied(pos, List.copyOf(expected));
        }

        private Outcome matchChoice(ModelGroup group, int start, boolean repeatable) {
            Set<String> expected = new LinkedHashSet<>();
            Outcome emptiable = null;
            for (Particle alternative : group.particles()) {
                Outcome o = matchParticle(alternative, start, repeatable);
                if (o.cursor > start) {
                    return o;
                }
                expected.addAll(o.expected);
                if (o.status == Status.SATISFIED && emptiable == null) {
                    emptiable = o;
                }
            }
            if (emptiable != null || group.particles().isEmpty()) {
                return Outcome.satisfied(start, List.copyOf(expected));
            }
            return Outcome.absent(start, List.copyOf(expected));
        }

        private Outcome matchAll(ModelGroup group, int start, boolean repeatable) {
            List<Particle> remaining = new ArrayList<>(group.particles());
            int pos = start;
            boolean broken = false;
            boolean progress = true;
            while (progress && !remaining.isEmpty()) {
                progress = false;
                for (Particle p : remaining) {
                    Outcome o = matchParticle(p, pos, repeatable);
                    if (o.cursor > pos) {
                        broken |= o.status == Status.BROKEN;
                        pos = o.cursor;
                        remaining.remove(p);
                        progress = true;
                        break;
                    }
                }
            }
            List<String> missing = new ArrayList<>();
            List<String> optional = new ArrayList<>();
            for (Particle p : remaining) {
                (p.isEmptiable() ? optional : missing).addAll(acceptedNames(p));
            }
            if (missing.isEmpty()) {
                if (broken) {
                    return Outcome.broken(pos);
                }
                List<String> expected = new ArrayList<>(optional);
                return Outcome.satisfied(pos, expected);
            }
            if (pos == start && !broken) {
                List<String> expected = new ArrayList<>(missing);
                expected.addAll(optional);
                return Outcome.absent(pos, expected);
            }
            report(pos, "tag expected: " + names(missing), missing);
            return Outcome.broken(pos);
        }
    }
}

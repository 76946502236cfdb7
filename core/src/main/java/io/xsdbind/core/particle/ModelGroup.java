package io.xsdbind.core.particle;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A sequence, choice or all group. Group references are inlined when the schema is built, so a
 * model group is a finite tree; recursion in content models goes through element references.
 */
public final class ModelGroup implements Particle {

    /** Model group kinds. */
    public enum Compositor {
        SEQUENCE,
        CHOICE,
        ALL
    }

    private final Compositor compositor;
    private final List<Particle> particles;
    private final Occurs occurs;

    public ModelGroup(Compositor compositor, List<? extends Particle> particles, Occurs occurs) {
        this.compositor = Objects.requireNonNull(compositor, "compositor must not be null");
        this.particles = List.copyOf(particles);
        this.occurs = Objects.requireNonNull(occurs, "occurs must not be null");
    }

    public static ModelGroup sequence(Particle... particles) {
        return new ModelGroup(Compositor.SEQUENCE, List.of(particles), Occurs.ONCE);
    }

    public static ModelGroup choice(Particle... particles) {
        return new ModelGroup(Compositor.CHOICE, List.of(particles), Occurs.ONCE);
    }

    public static ModelGroup all(Particle... particles) {
        return new ModelGroup(Compositor.ALL, List.of(particles), Occurs.ONCE);
    }

    public Compositor compositor() {
        return compositor;
    }

    public List<Particle> particles() {
        return particles;
    }

    @Override
    public Occurs occurs() {
        return occurs;
    }

    public boolean isEmpty() {
        return particles.isEmpty();
    }

    @Override
    public boolean isEmptiable() {
        if (occurs.isOptional() || particles.isEmpty()) {
            return true;
        }
        if (compositor == Compositor.CHOICE) {
            return particles.stream().anyMatch(Particle::isEmptiable);
        }
        return particles.stream().allMatch(Particle::isEmptiable);
    }

    public ModelGroup withOccurs(Occurs newOccurs) {
        return new ModelGroup(compositor, particles, newOccurs);
    }

    /** Returns a copy with the given particles appended after this group's own. */
    public ModelGroup append(List<? extends Particle> more) {
        List<Particle> all = new ArrayList<>(particles);
        all.addAll(more);
        return new ModelGroup(compositor, all, occurs);
    }

    /** Element particles of this group and of its nested groups, in declaration order. */
    public List<ElementDecl> elementParticles() {
        List<ElementDecl> out = new ArrayList<>();
        collect(this, out);
        return out;
    }

    /** Wildcards of this group and of its nested groups, in declaration order. */
    public List<Wildcard> wildcards() {
        List<Wildcard> out = new ArrayList<>();
        for (Particle p : particles) {
            if (p instanceof Wildcard w) {
                out.add(w);
            } else if (p instanceof ModelGroup g) {
                out.addAll(g.wildcards());
            }
        }
        return out;
    }

    /** Nesting depth of model groups, 1 for a group without nested groups. */
    public int depth() {
        int max = 0;
        for (Particle p : particles) {
            if (p instanceof ModelGroup g) {
                max = Math.max(max, g.depth());
            }
        }
        return max + 1;
    }

    private static void collect(ModelGroup group, List<ElementDecl> out) {
        for (Particle p : group.particles) {
            if (p instanceof ElementDecl e) {
                out.add(e);
            } else if (p instanceof ModelGroup g) {
                collect(g, out);
            }
        }
    }

    public String describe() {
        return compositor.name().toLowerCase(Locale.ROOT) + " group";
    }

    @Override
    public String toString() {
        return compositor + particles.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")")) + occurs;
    }
}

package io.xsdbind.core.engine;

import io.xsdbind.core.particle.ElementDecl;
import io.xsdbind.core.particle.ModelGroup;
import io.xsdbind.core.particle.Particle;
import io.xsdbind.core.particle.ProcessContents;
import io.xsdbind.core.particle.Wildcard;
import io.xsdbind.core.schema.Schema;
import javax.xml.namespace.QName;

/**
 * Finds the particle that declares a child name when encoding. Element particles are tried
 * first (with their substitution groups), then element particles by local part only, then
 * wildcards.
 */
final class ChildResolver {

    private final Schema schema;
    private final ContentModelMatcher matcher;

    ChildResolver(Schema schema, ContentModelMatcher matcher) {
        this.schema = schema;
        this.matcher = matcher;
    }

    /**
     * @return the resolution, or {@code null} if no particle of the group accepts the name
     */
    Resolution resolve(ModelGroup group, QName name) {
        if (group == null) {
            return null;
        }
        Resolution r = byName(group, name, false);
        if (r == null && name.getNamespaceURI().isEmpty()) {
            r = byLocalPart(group, name.getLocalPart(), false);
        }
        if (r == null) {
            r = byWildcard(group, name, false);
        }
        return r;
    }

    private Resolution byName(ModelGroup group, QName name, boolean repeatable) {
        boolean rep = repeatable || !group.occurs().isSingle();
        for (Particle p : group.particles()) {
            if (p instanceof ElementDecl e) {
                ContentModelMatcher.Candidate c = matcher.accepts(e, name);
                if (c != null) {
                    return new Resolution(p, c.decl(), name, rep || !e.occurs().isSingle(), true);
                }
            } else if (p instanceof ModelGroup g) {
                Resolution r = byName(g, name, rep);
                if (r != null) {
                    return r;
                }
            }
        }
        return null;
    }

    private Resolution byLocalPart(ModelGroup group, String localName, boolean repeatable) {
        boolean rep = repeatable || !group.occurs().isSingle();
        for (Particle p : group.particles()) {
            if (p instanceof ElementDecl e) {
                ElementDecl decl = schema.resolve(e);
                if (decl.name().getLocalPart().equals(localName) && !decl.isAbstract()) {
                    return new Resolution(p, decl, decl.name(), rep || !e.occurs().isSingle(), true);
                }
                for (ElementDecl member : schema.substitutes(decl.name())) {
                    if (member.name().getLocalPart().equals(localName) && !member.isAbstract()) {
                        return new Resolution(p, member, member.name(), rep || !e.occurs().isSingle(), true);
                    }
                }
            } else if (p instanceof ModelGroup g) {
                Resolution r = byLocalPart(g, localName, rep);
                if (r != null) {
                    return r;
                }
            }
        }
        return null;
    }

    private Resolution byWildcard(ModelGroup group, QName name, boolean repeatable) {
        boolean rep = repeatable || !group.occurs().isSingle();
        for (Particle p : group.particles()) {
            if (p instanceof Wildcard w) {
                ContentModelMatcher.Candidate c = matcher.accepts(w, name);
                if (c != null) {
                    boolean checks = w.processContents() != ProcessContents.SKIP;
                    return new Resolution(p, c.decl(), name, rep || !w.occurs().isSingle(), checks);
                }
            } else if (p instanceof ModelGroup g) {
                Resolution r = byWildcard(g, name, rep);
                if (r != null) {
                    return r;
                }
            }
        }
        return null;
    }

    /**
     * A resolved child.
     *
     * @param particle   the element particle or wildcard of the group
     * @param decl       effective declaration, {@code null} for an undeclared wildcard match
     * @param name       the child name to write
     * @param repeatable whether the particle or an enclosing group admits more than one occurrence
     * @param checks     {@code false} below a skip wildcard
     */
    record Resolution(Particle particle, ElementDecl decl, QName name, boolean repeatable, boolean checks) {}
}

package io.xsdbind.core.schema;

import io.xsdbind.core.particle.ModelGroup;
import io.xsdbind.core.particle.Occurs;
import io.xsdbind.core.type.XsdNames;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import javax.xml.namespace.QName;

/** A sequence, choice or all group before resolution; also the body of a named group. */
public final class ModelGroupDraft extends Draft<ModelGroup> implements ParticleDraft {

    final ModelGroup.Compositor compositor;
    final List<ParticleDraft> particles = new ArrayList<>();
    final Occurs occurs;

    public ModelGroupDraft(QName name, ModelGroup.Compositor compositor, Occurs occurs) {
        super(name);
        this.compositor = compositor;
        this.occurs = occurs;
    }

    public ModelGroupDraft particle(ParticleDraft particle) {
        particles.add(particle);
        return this;
    }

    @Override
    public Occurs occurs() {
        return occurs;
    }

    @Override
    String describe() {
        return name != null ? "group '" + XsdNames.display(name) + "'" : compositor.name().toLowerCase(Locale.ROOT) + " group";
    }
}

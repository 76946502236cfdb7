package io.xsdbind.core.schema;

import javax.xml.namespace.QName;

/**
 * Mutable build-time state of one named component. A draft is registered by name, resolved into
 * its immutable component and then checked once per {@link BuildGeneration}.
 *
 * @param <T> the component type the draft resolves to
 */
abstract class Draft<T> {

    final QName name;
    T built;
    boolean resolving;
    BuildGeneration checked;
    boolean checking;

    Draft(QName name) {
        this.name = name;
    }

    public QName name() {
        return name;
    }

    public boolean isBuilt() {
        return built != null;
    }

    /** Generation of the last check pass that reached this draft, or {@code null}. */
    public BuildGeneration checked() {
        return checked;
    }

    abstract String describe();
}

package io.xsdbind.core.engine;

import io.xsdbind.core.model.ElementNode;
import io.xsdbind.core.model.Result;
import io.xsdbind.core.model.ValidationError;
import io.xsdbind.core.particle.ElementDecl;
import io.xsdbind.core.spi.ContentItem;
import io.xsdbind.core.spi.ElementData;
import io.xsdbind.core.type.AttributeGroup;
import io.xsdbind.core.type.Builtins;
import io.xsdbind.core.type.ComplexType;
import io.xsdbind.core.type.ListType;
import io.xsdbind.core.type.SimpleType;
import io.xsdbind.core.type.XsdNames;
import io.xsdbind.core.type.XsdType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;
import javax.xml.namespace.QName;

/**
 * Encode frame of one element: the element's own errors (attributes, simple content, child
 * resolution), then the steps of each child in content model order, then the content model check
 * of the produced children and finally the {@link ElementNode}.
 */
final class ElementEncoder implements FrameStack.Frame<ElementNode> {

    private enum Phase {
        START,
        CHILDREN,
        FINISH,
        DONE
    }

    private final BindingContext ctx;
    private final Object value;
    private final ElementDecl decl;
    private final QName tag;
    private final XsdType type;
    private final String path;
    private final int level;
    private final boolean checks;
    private final String component;

    private Phase phase = Phase.START;
    private ElementNode.Builder builder;
    private final TreeMap<Integer, String> charData = new TreeMap<>();

    private List<PendingChild> pending = List.of();
    private String[] childPaths;
    private int childIndex;
    private final List<ElementNode> produced = new ArrayList<>();
    private ElementNode result;

    ElementEncoder(BindingContext ctx, Object value, ElementDecl decl, QName tag, String path, int level, boolean checks) {
        this.ctx = ctx;
        this.value = value;
        this.decl = decl;
        this.tag = tag;
        this.type = decl != null ? ctx.schema().typeOf(decl) : Builtins.anyType();
        this.path = path;
        this.level = level;
        this.checks = checks;
        this.component = decl != null ? decl.describe() : "element '" + XsdNames.display(tag) + "'";
    }

    @Override
    public FrameStack.Frame<ElementNode> advance(Consumer<Result<ElementNode>> out) {
        switch (phase) {
            case START -> {
                builder = ElementNode.builder(tag);
                if (level >= ctx.encodeOptions().maxDepth()) {
                    phase = Phase.DONE;
                    out.accept(Result.error(ValidationError.encode(
                            "maximum depth of " + ctx.encodeOptions().maxDepth() + " exceeded", component, path, value)));
                    result = builder.build();
                    return null;
                }
                List<ValidationError> errors = new ArrayList<>();
                start(errors);
                for (ValidationError e : errors) {
                    out.accept(Result.error(e));
                }
                return null;
            }
            case CHILDREN -> {
                return nextChild();
            }
            case FINISH -> {
                result = finish(out);
                phase = Phase.DONE;
                return null;
            }
            default -> {
                return null;
            }
        }
    }

    @Override
    public boolean isDone() {
        return phase == Phase.DONE;
    }

    @Override
    public ElementNode value() {
        return result;
    }

    @Override
    public void childDone(ElementNode child) {
        produced.add(child);
        childIndex++;
    }

    private void start(List<ValidationError> errors) {
        if (value == null && decl != null && decl.isNillable()) {
            builder.attribute(XsdNames.XSI_NIL, "true");
            phase = Phase.DONE;
            result = builder.build();
            return;
        }
        ElementData data;
        try {
            data = ctx.converter().elementEncode(value, decl, level);
        } catch (IllegalArgumentException e) {
            errors.add(ValidationError.encode(e.getMessage(), component, path, value));
            phase = Phase.FINISH;
            return;
        }
        ComplexType complex = type instanceof ComplexType ct ? ct : null;
        AttributeBinder binder = new AttributeBinder(ctx.schema(), checks, false);
        AttributeGroup attrGroup = complex != null ? complex.attributes() : AttributeGroup.EMPTY;
        binder.encode(attrGroup, data.attributes(), path, component, errors).forEach(builder::attribute);

        SimpleType simple = type instanceof SimpleType st ? st : complex.simpleContent();
        if (simple != null) {
            if (checks && !data.content().isEmpty()) {
                errors.add(ValidationError.encode(
                        "a simple content element can't have child elements", component, path, value));
            }
            encodeSimpleContent(binder, simple, data.text(), errors);
            phase = Phase.FINISH;
            return;
        }
        if (data.text() != null) {
            addCharData(0, String.valueOf(data.text()), complex, errors);
        }
        List<PendingChild> children = new ArrayList<>();
        ChildResolver resolver = new ChildResolver(ctx.schema(), ctx.matcher());
        for (ContentItem item : data.content()) {
            if (item instanceof ContentItem.CharData cd) {
                addCharData(cd.index(), cd.text(), complex, errors);
            } else if (item instanceof ContentItem.Child c) {
                ChildResolver.Resolution res = resolver.resolve(complex.group(), c.name());
                if (res == null && checks && ctx.encodeOptions().unordered()) {
                    errors.add(ValidationError.encode(
                            "unexpected child element '" + XsdNames.display(c.name()) + "'",
                            component,
                            path + "/" + XsdNames.display(c.name()),
                            c.value()));
                }
                expand(c, res, children);
            }
        }
        if (!ctx.encodeOptions().unordered()) {
            children = ContentSorter.sort(
                    complex.group(), children, p -> p.resolution() == null ? null : p.resolution().particle());
        }
        pending = children;
        List<QName> names = new ArrayList<>(children.size());
        for (PendingChild p : children) {
            names.add(p.name());
        }
        childPaths = InstancePaths.children(path, names);
        phase = Phase.CHILDREN;
    }

    private void encodeSimpleContent(AttributeBinder binder, SimpleType simple, Object text, List<ValidationError> errors) {
        if (text == null && decl != null && decl.valueConstraint() != null) {
            return;
        }
        builder.text(binder.encodeValue(simple, text == null ? "" : text, path, component, errors));
    }

    private void addCharData(int index, String text, ComplexType complex, List<ValidationError> errors) {
        if (complex.isMixed()) {
            charData.merge(index, text, String::concat);
        } else if (checks && !text.isBlank()) {
            errors.add(ValidationError.encode(
                    "character data not allowed in element-only content", component, path, text));
        }
    }

    /** A list value becomes one child per item unless it is the value of a single list-typed element. */
    private void expand(ContentItem.Child c, ChildResolver.Resolution res, List<PendingChild> out) {
        QName name = res != null ? res.name() : c.name();
        if (c.value() instanceof List<?> items && !isListValue(res)) {
            for (Object item : items) {
                out.add(new PendingChild(name, item, res));
            }
        } else {
            out.add(new PendingChild(name, c.value(), res));
        }
    }

    private boolean isListValue(ChildResolver.Resolution res) {
        return res != null
                && res.decl() != null
                && !res.repeatable()
                && ctx.schema().typeOf(res.decl()) instanceof ListType;
    }

    private ElementEncoder nextChild() {
        if (childIndex >= pending.size()) {
            phase = Phase.FINISH;
            return null;
        }
        PendingChild child = pending.get(childIndex);
        ChildResolver.Resolution res = child.resolution();
        return new ElementEncoder(
                ctx,
                child.value(),
                res != null ? res.decl() : null,
                child.name(),
                childPaths[childIndex],
                level + 1,
                checks && (res == null || res.checks()));
    }

    private ElementNode finish(Consumer<Result<ElementNode>> out) {
        if (type instanceof ComplexType complex && !complex.hasSimpleContent()) {
            if (checks && !ctx.encodeOptions().unordered()) {
                List<QName> names = new ArrayList<>(produced.size());
                for (ElementNode n : produced) {
                    names.add(n.tag());
                }
                MatchResult match = ctx.matcher().match(complex.group(), names);
                for (MatchResult.Mismatch m : match.mismatches()) {
                    boolean atChild = m.childIndex() < produced.size();
                    out.accept(Result.error(ValidationError.validation(
                            m.reason(),
                            component,
                            atChild ? childPaths[m.childIndex()] : path,
                            atChild ? produced.get(m.childIndex()) : value)));
                }
            }
            placeCharData();
        }
        return builder.build();
    }

    private void placeCharData() {
        if (charData.containsKey(0)) {
            builder.text(charData.get(0));
        }
        for (int i = 0; i < produced.size(); i++) {
            ElementNode child = produced.get(i);
            String tail = i == produced.size() - 1
                    ? joinFrom(i + 1)
                    : charData.get(i + 1);
            builder.child(tail != null ? child.withTail(tail) : child);
        }
        if (produced.isEmpty() && !charData.isEmpty()) {
            String text = joinFrom(0);
            builder.text(text);
        }
    }

    /** Character data at {@code index} and every later index, concatenated. */
    private String joinFrom(int index) {
        Map<Integer, String> tail = charData.tailMap(index);
        return tail.isEmpty() ? null : String.join("", tail.values());
    }

    private record PendingChild(QName name, Object value, ChildResolver.Resolution resolution) {}
}

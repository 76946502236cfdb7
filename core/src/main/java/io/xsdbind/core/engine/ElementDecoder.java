package io.xsdbind.core.engine;

import io.xsdbind.core.model.Result;
import io.xsdbind.core.model.ValidationError;
import io.xsdbind.core.particle.ElementDecl;
import io.xsdbind.core.particle.ModelGroup;
import io.xsdbind.core.particle.ProcessContents;
import io.xsdbind.core.particle.Wildcard;
import io.xsdbind.core.spi.ContentItem;
import io.xsdbind.core.spi.ElementData;
import io.xsdbind.core.spi.MarkupNode;
import io.xsdbind.core.type.AttributeGroup;
import io.xsdbind.core.type.Builtins;
import io.xsdbind.core.type.ComplexType;
import io.xsdbind.core.type.SimpleType;
import io.xsdbind.core.type.XsdNames;
import io.xsdbind.core.type.XsdType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import javax.xml.namespace.QName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decode frame of one element. Errors of the element itself come first (attributes, then
 * simple content or the content model), then the steps of each child in document order, and
 * finally the element's value as built by the converter. Child frames are created only when the
 * stream reaches them.
 */
final class ElementDecoder implements FrameStack.Frame<Object> {

    private static final Logger LOG = LoggerFactory.getLogger(ElementDecoder.class);

    private enum Phase {
        START,
        CHILDREN,
        FINISH,
        DONE
    }

    private final BindingContext ctx;
    private final MarkupNode node;
    private final ElementDecl decl;
    private final XsdType type;
    private final String path;
    private final int level;
    private final boolean checks;
    private final String component;

    private Phase phase = Phase.START;
    private Map<QName, Object> attributes = Map.of();
    private Object textValue;
    private final List<ContentItem> content = new ArrayList<>();

    private List<? extends MarkupNode> children = List.of();
    private String[] childPaths;
    private ChildPlan[] plans;
    private int childIndex;
    private boolean mixed;
    private Object value;

    ElementDecoder(BindingContext ctx, MarkupNode node, ElementDecl decl, String path, int level, boolean checks) {
        this.ctx = ctx;
        this.node = node;
        this.decl = decl;
        this.type = decl != null ? ctx.schema().typeOf(decl) : Builtins.anyType();
        this.path = path;
        this.level = level;
        this.checks = checks;
        this.component = decl != null ? decl.describe() : "element '" + XsdNames.display(node.tag()) + "'";
    }

    @Override
    public FrameStack.Frame<Object> advance(Consumer<Result<Object>> out) {
        switch (phase) {
            case START -> {
                if (level >= ctx.decodeOptions().maxDepth()) {
                    phase = Phase.DONE;
                    out.accept(error("maximum depth of " + ctx.decodeOptions().maxDepth() + " exceeded", path, node));
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
                value = finish(out);
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
    public Object value() {
        return value;
    }

    @Override
    public void childDone(Object childValue) {
        ChildPlan plan = plans[childIndex];
        content.add(new ContentItem.Child(children.get(childIndex).tag(), childValue, plan.decl(), plan.repeatable()));
        afterChild();
    }

    private void start(List<ValidationError> errors) {
        if (checks && decl != null && decl.isAbstract()) {
            errors.add(ValidationError.validation("cannot use an abstract element for validation", component, path, node));
        }
        ComplexType complex = type instanceof ComplexType ct ? ct : null;
        if (checks && complex != null && complex.isAbstract()) {
            errors.add(ValidationError.validation(
                    "cannot use an abstract type for validation", complex.describe(), path, node));
        }
        AttributeBinder binder = new AttributeBinder(ctx.schema(), checks, ctx.decodeOptions().fillDefaults());
        AttributeGroup attrGroup = complex != null ? complex.attributes() : AttributeGroup.EMPTY;
        attributes = binder.decode(attrGroup, node.attributes(), path, component, errors);

        if (isNil(errors)) {
            phase = Phase.FINISH;
            return;
        }
        SimpleType simple = type instanceof SimpleType st ? st : complex.simpleContent();
        if (simple != null) {
            decodeSimpleContent(simple, errors);
            phase = Phase.FINISH;
            return;
        }
        decodeComplexContent(complex, errors);
        phase = Phase.CHILDREN;
    }

    private boolean isNil(List<ValidationError> errors) {
        String nil = node.attributes().get(XsdNames.XSI_NIL);
        if (nil == null || !("true".equals(nil.strip()) || "1".equals(nil.strip()))) {
            return false;
        }
        if (decl == null || !decl.isNillable()) {
            if (checks) {
                errors.add(ValidationError.validation("element is not nillable", component, path, node));
            }
            return false;
        }
        if (checks && (!isBlank(node.text()) || !node.children().isEmpty())) {
            errors.add(ValidationError.validation("an element with xsi:nil='true' must be empty", component, path, node));
        }
        if (checks && decl.fixedValue() != null) {
            errors.add(ValidationError.validation(
                    "an element with a fixed value can't be nil", component, path, node));
        }
        textValue = null;
        return true;
    }

    private void decodeSimpleContent(SimpleType simple, List<ValidationError> errors) {
        if (checks && !node.children().isEmpty()) {
            errors.add(ValidationError.validation(
                    "a simple content element can't have child elements", component, path, node));
        }
        String text = node.text() == null ? "" : node.text();
        if (text.isEmpty() && decl != null && decl.valueConstraint() != null && ctx.decodeOptions().fillDefaults()) {
            text = decl.valueConstraint();
        }
        for (Result<Object> step : simple.decode(text, checks)) {
            if (step instanceof Result.Error<Object> err) {
                errors.add(err.error().at(path));
            } else {
                textValue = ((Result.Value<Object>) step).value();
            }
        }
        if (checks
                && decl != null
                && decl.fixedValue() != null
                && !AttributeBinder.sameAsConstraint(simple, decl.fixedValue(), textValue)) {
            errors.add(ValidationError.validation(
                    "value doesn't match the fixed value '" + decl.fixedValue() + "'", component, path, text));
        }
    }

    private void decodeComplexContent(ComplexType complex, List<ValidationError> errors) {
        children = node.children();
        mixed = complex.isMixed();
        List<QName> names = new ArrayList<>(children.size());
        for (MarkupNode child : children) {
            names.add(child.tag());
        }
        childPaths = InstancePaths.children(path, names);

        if (mixed) {
            if (node.text() != null && !node.text().isEmpty()) {
                content.add(new ContentItem.CharData(0, node.text()));
            }
        } else if (checks && hasCharacterData()) {
            errors.add(ValidationError.validation(
                    "character data between child elements not allowed", component, path, node));
        }

        MatchResult match = ctx.matcher().match(complex.group(), names);
        if (checks) {
            for (MatchResult.Mismatch m : match.mismatches()) {
                boolean atChild = m.childIndex() < children.size();
                errors.add(ValidationError.validation(
                        m.reason(),
                        component,
                        atChild ? childPaths[m.childIndex()] : path,
                        atChild ? children.get(m.childIndex()) : node));
            }
        }
        plans = new ChildPlan[children.size()];
        for (MatchResult.Pairing p : match.pairings()) {
            boolean skipContents = p.particle() instanceof Wildcard w && w.processContents() == ProcessContents.SKIP;
            plans[p.childIndex()] = new ChildPlan(p.decl(), p.repeatable(), !skipContents);
        }
        for (int i = match.unplaced().nextSetBit(0); i >= 0; i = match.unplaced().nextSetBit(i + 1)) {
            ElementDecl known = findByName(complex.group(), names.get(i));
            if (known != null) {
                LOG.debug("Decoding unplaced child {} with {}", childPaths[i], known.describe());
                plans[i] = new ChildPlan(known, !known.occurs().isSingle(), true);
            }
        }
    }

    private ElementDecoder nextChild() {
        while (childIndex < children.size()) {
            ChildPlan plan = plans[childIndex];
            if (plan != null) {
                return new ElementDecoder(
                        ctx, children.get(childIndex), plan.decl(), childPaths[childIndex], level + 1, checks && plan.checks());
            }
            afterChild();
        }
        phase = Phase.FINISH;
        return null;
    }

    private void afterChild() {
        if (mixed) {
            String tail = children.get(childIndex).tail();
            if (tail != null && !tail.isEmpty()) {
                content.add(new ContentItem.CharData(childIndex + 1, tail));
            }
        }
        childIndex++;
    }

    private Object finish(Consumer<Result<Object>> out) {
        ElementData data = new ElementData(node.tag(), textValue, content, attributes);
        try {
            return ctx.converter().elementDecode(data, decl, level);
        } catch (IllegalArgumentException e) {
            out.accept(Result.error(ValidationError.decode(e.getMessage(), component, path, node)));
            return null;
        }
    }

    private ElementDecl findByName(ModelGroup group, QName name) {
        if (group != null) {
            for (ElementDecl particle : group.elementParticles()) {
                ElementDecl resolved = ctx.schema().resolve(particle);
                if (resolved.name().equals(name)) {
                    return resolved;
                }
            }
            if (!group.wildcards().isEmpty()) {
                return ctx.schema().element(name).orElse(null);
            }
        }
        return null;
    }

    private boolean hasCharacterData() {
        if (!isBlank(node.text())) {
            return true;
        }
        for (MarkupNode child : children) {
            if (!isBlank(child.tail())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private Result<Object> error(String reason, String at, Object obj) {
        return Result.error(ValidationError.validation(reason, component, at, obj));
    }

    /** How a child is decoded: its declaration, whether it repeats, and whether its subtree is checked. */
    private record ChildPlan(ElementDecl decl, boolean repeatable, boolean checks) {}
}

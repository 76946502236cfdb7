package io.xsdbind.core.engine;

import io.xsdbind.core.model.BindingResult;
import io.xsdbind.core.model.DecodeOptions;
import io.xsdbind.core.model.ElementNode;
import io.xsdbind.core.model.EncodeOptions;
import io.xsdbind.core.model.Result;
import io.xsdbind.core.model.ValidationError;
import io.xsdbind.core.model.ValidationMode;
import io.xsdbind.core.particle.ElementDecl;
import io.xsdbind.core.schema.Schema;
import io.xsdbind.core.spi.Converter;
import io.xsdbind.core.spi.MarkupNode;
import io.xsdbind.core.type.XsdNames;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import javax.xml.namespace.QName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for instance processing: binds a built {@link Schema} to a {@link Converter} and
 * decodes, encodes and validates markup trees against it.
 *
 * <p>Every method takes the {@link ValidationMode} of the call:
 *
 * <ul>
 *   <li>{@code STRICT}: the first error is raised as an
 *       {@link io.xsdbind.core.error.InstanceException};
 *   <li>{@code LAX}: every error is collected and returned next to a best-effort value;
 *   <li>{@code SKIP}: facet, attribute and content checks are off and no error is returned.
 * </ul>
 *
 * <p>Thread-safe: the binder holds only immutable state, each call allocates its own frames.
 */
public final class XsdBinder {

    private static final Logger LOG = LoggerFactory.getLogger(XsdBinder.class);

    private final Schema schema;
    private final Converter converter;
    private final ContentModelMatcher matcher;
    private final DecodeOptions decodeOptions;
    private final EncodeOptions encodeOptions;

    public XsdBinder(Schema schema, Converter converter) {
        this(schema, converter, DecodeOptions.DEFAULT, EncodeOptions.DEFAULT);
    }

    public XsdBinder(Schema schema, Converter converter, DecodeOptions decodeOptions, EncodeOptions encodeOptions) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
        this.decodeOptions = Objects.requireNonNull(decodeOptions, "decodeOptions must not be null");
        this.encodeOptions = Objects.requireNonNull(encodeOptions, "encodeOptions must not be null");
        this.matcher = new ContentModelMatcher(schema);
    }

    public Schema schema() {
        return schema;
    }

    /**
     * Raw decode stream of a document root: errors in document order, then the value. The root
     * is looked up among the global elements by its tag.
     */
    public Iterator<Result<Object>> decodeSteps(MarkupNode root, ValidationMode mode) {
        Objects.requireNonNull(root, "root must not be null");
        BindingContext ctx = context(mode);
        String path = InstancePaths.root(root.tag());
        ElementDecl decl = schema.element(root.tag()).orElse(null);
        FrameStack<Object> decoder = new FrameStack<>(new ElementDecoder(ctx, root, decl, path, 0, ctx.checks()));
        if (decl != null) {
            return decoder;
        }
        ValidationError unknown = ValidationError.validation(
                "no global element declaration for '" + XsdNames.display(root.tag()) + "'", null, path, root);
        return prepend(unknown, decoder);
    }

    /** Raw encode stream of a value as the global element {@code elementName}. */
    public Iterator<Result<ElementNode>> encodeSteps(Object value, QName elementName, ValidationMode mode) {
        Objects.requireNonNull(elementName, "elementName must not be null");
        BindingContext ctx = context(mode);
        String path = InstancePaths.root(elementName);
        ElementDecl decl = schema.element(elementName).orElse(null);
        QName tag = decl != null ? decl.name() : elementName;
        FrameStack<ElementNode> encoder =
                new FrameStack<>(new ElementEncoder(ctx, value, decl, tag, path, 0, ctx.checks()));
        if (decl != null) {
            return encoder;
        }
        ValidationError unknown = ValidationError.encode(
                "no global element declaration for '" + XsdNames.display(elementName) + "'", null, path, value);
        return prepend(unknown, encoder);
    }

    /**
     * Decodes a document root into a native value.
     *
     * @throws io.xsdbind.core.error.InstanceException in strict mode, at the first error
     */
    public BindingResult<Object> decode(MarkupNode root, ValidationMode mode) {
        BindingResult<Object> result = ModeDriver.drive(decodeSteps(root, mode), mode);
        LOG.debug("Decoded <{}> in {} mode: {} error(s)", XsdNames.display(root.tag()), mode, result.errors().size());
        return result;
    }

    /**
     * Encodes a native value as the global element {@code elementName}.
     *
     * @throws io.xsdbind.core.error.InstanceException in strict mode, at the first error
     */
    public BindingResult<ElementNode> encode(Object value, QName elementName, ValidationMode mode) {
        BindingResult<ElementNode> result = ModeDriver.drive(encodeSteps(value, elementName, mode), mode);
        LOG.debug("Encoded <{}> in {} mode: {} error(s)", XsdNames.display(elementName), mode, result.errors().size());
        return result;
    }

    /** Lazily yields every validation error of a document, in document order. */
    public Iterator<ValidationError> iterErrors(MarkupNode root) {
        Iterator<Result<Object>> steps = decodeSteps(root, ValidationMode.LAX);
        return new Iterator<>() {
            private ValidationError next;

            @Override
            public boolean hasNext() {
                while (next == null && steps.hasNext()) {
                    if (steps.next() instanceof Result.Error<Object> e) {
                        next = e.error();
                    }
                }
                return next != null;
            }

            @Override
            public ValidationError next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                ValidationError e = next;
                next = null;
                return e;
            }
        };
    }

    /**
     * Validates a document.
     *
     * @return the errors found: empty in strict mode (the first error is raised) and in skip mode
     * @throws io.xsdbind.core.error.InstanceException in strict mode, at the first error
     */
    public List<ValidationError> validate(MarkupNode root, ValidationMode mode) {
        return decode(root, mode).errors();
    }

    /** Returns {@code true} if the document has no validation error. Stops at the first error. */
    public boolean isValid(MarkupNode root) {
        return !iterErrors(root).hasNext();
    }

    private BindingContext context(ValidationMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        return new BindingContext(schema, converter, matcher, decodeOptions, encodeOptions, mode.checks());
    }

    private static <T> Iterator<Result<T>> prepend(ValidationError first, Iterator<Result<T>> rest) {
        return new StepIterator<>() {
            private boolean started;

            @Override
            protected Result<T> computeNext() {
                if (!started) {
                    started = true;
                    return Result.error(first);
                }
                return rest.hasNext() ? rest.next() : null;
            }
        };
    }
}

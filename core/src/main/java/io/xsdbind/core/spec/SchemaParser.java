package io.xsdbind.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.xsdbind.core.error.SchemaParseException;
import io.xsdbind.core.facet.FacetDecl;
import io.xsdbind.core.facet.FacetKind;
import io.xsdbind.core.facet.JdkPatternCompiler;
import io.xsdbind.core.model.BuildOptions;
import io.xsdbind.core.model.XsdVersion;
import io.xsdbind.core.particle.ModelGroup;
import io.xsdbind.core.particle.NamespaceConstraint;
import io.xsdbind.core.particle.Occurs;
import io.xsdbind.core.particle.ProcessContents;
import io.xsdbind.core.particle.Wildcard;
import io.xsdbind.core.schema.AttributeDraft;
import io.xsdbind.core.schema.AttributeGroupDraft;
import io.xsdbind.core.schema.ComplexTypeDraft;
import io.xsdbind.core.schema.ElementDraft;
import io.xsdbind.core.schema.GroupRefDraft;
import io.xsdbind.core.schema.ModelGroupDraft;
import io.xsdbind.core.schema.ParticleDraft;
import io.xsdbind.core.schema.Schema;
import io.xsdbind.core.schema.SchemaBuilder;
import io.xsdbind.core.schema.SimpleTypeDraft;
import io.xsdbind.core.schema.WildcardDraft;
import io.xsdbind.core.spi.PatternCompiler;
import io.xsdbind.core.type.AnyAttribute;
import io.xsdbind.core.type.AttributeUse;
import io.xsdbind.core.type.Derivation;
import io.xsdbind.core.type.XsdNames;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import javax.xml.namespace.QName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses YAML schema documents into a {@link Schema}.
 *
 * <p>A document declares one target namespace and its global components under the keys
 * {@code simpleTypes}, {@code complexTypes}, {@code elements}, {@code groups},
 * {@code attributeGroups} and {@code attributes}. Names in references are {@code prefix:local}
 * with prefixes bound under {@code namespaces}; {@code xs} is always bound to the XML Schema
 * namespace and an unprefixed reference names a component of the target namespace.
 *
 * <p>The document is first checked against the bundled JSON Schema
 * ({@code schema-document.schema.json}), which rejects unknown keys and malformed values. In lax
 * build mode the violations are collected like any other build error and parsing continues
 * component by component; in skip mode the check is not run.
 *
 * <p>Thread-safe: all state of one parse lives in a per-call object.
 */
public final class SchemaParser {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaParser.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String META_SCHEMA_RESOURCE = "schema-document.schema.json";

    private static final Set<String> COMPOSITORS = Set.of("sequence", "choice", "all");

    private final BuildOptions options;
    private final PatternCompiler patternCompiler;
    private final JsonSchema metaSchema;

    public SchemaParser() {
        this(BuildOptions.DEFAULT);
    }

    public SchemaParser(BuildOptions options) {
        this(options, JdkPatternCompiler.INSTANCE);
    }

    public SchemaParser(BuildOptions options, PatternCompiler patternCompiler) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.patternCompiler = Objects.requireNonNull(patternCompiler, "patternCompiler must not be null");
        this.metaSchema = loadMetaSchema();
    }

    /**
     * Parses and builds the schema document at the given path.
     *
     * @throws SchemaParseException if the file cannot be read, or in strict mode for the first
     *                              document or build error
     */
    public Schema parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new SchemaParseException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
        return parse(root, source);
    }

    /** Parses a schema document held in a string; {@code source} names it in errors. */
    public Schema parse(String yaml, String source) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new SchemaParseException("Failed to parse YAML: " + e.getMessage(), e, null, source);
        }
        return parse(root, source);
    }

    /** Parses an already read schema document tree. */
    public Schema parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new SchemaParseException("Schema document must be a YAML mapping", null, source);
        }
        return new Run(root, source).build();
    }

    private static JsonSchema loadMetaSchema() {
        try (InputStream in = SchemaParser.class.getResourceAsStream(META_SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + META_SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + META_SCHEMA_RESOURCE, e);
        }
    }

    /** State of one parse: namespace bindings, form defaults and the builder being fed. */
    private final class Run {

        private final JsonNode root;
        private final String source;
        private final String tns;
        private final Map<String, String> namespaces = new LinkedHashMap<>();
        private final boolean elementQualified;
        private final boolean attributeQualified;
        private final SchemaBuilder builder;

        Run(JsonNode root, String source) {
            this.root = root;
            this.source = source;
            this.tns = text(root, "targetNamespace", "");
            this.elementQualified = "qualified".equals(text(root, "elementFormDefault", "unqualified"));
            this.attributeQualified = "qualified".equals(text(root, "attributeFormDefault", "unqualified"));
            BuildOptions effective = options;
            String version = text(root, "version", null);
            if (version != null) {
                try {
                    effective = options.withVersion(XsdVersion.fromLabel(version));
                } catch (IllegalArgumentException e) {
                    throw new SchemaParseException(e.getMessage(), e, "version", source);
                }
            }
            this.builder = new SchemaBuilder(tns, effective).source(source).patternCompiler(patternCompiler);
            namespaces.put("xs", XsdNames.XSD_NAMESPACE);
            namespaces.put("xsd", XsdNames.XSD_NAMESPACE);
            JsonNode ns = root.get("namespaces");
            if (ns != null && ns.isObject()) {
                ns.fields().forEachRemaining(e -> namespaces.put(e.getKey(), e.getValue().asText()));
            }
        }

        Schema build() {
            if (options.mode().checks()) {
                checkDocument();
            }
            each("simpleTypes", (name, node) -> builder.addSimpleType(simpleType(node, global(name))));
            each("complexTypes", (name, node) -> builder.addComplexType(complexType(node, global(name))));
            each("groups", (name, node) -> builder.addGroup(namedGroup(node, global(name))));
            each("attributeGroups", (name, node) -> builder.addAttributeGroup(attributeGroup(node, global(name))));
            each("attributes", (name, node) -> builder.addAttribute(globalAttribute(node, global(name))));
            each("elements", (name, node) -> builder.addElement(globalElement(node, global(name))));
            return builder.build();
        }

        private void checkDocument() {
            Set<ValidationMessage> messages = metaSchema.validate(root);
            if (messages.isEmpty()) {
                return;
            }
            LOG.debug("Schema document {} has {} structural problem(s)", source, messages.size());
            for (ValidationMessage m : messages.stream()
                    .sorted((a, b) -> a.getMessage().compareTo(b.getMessage()))
                    .collect(Collectors.toList())) {
                builder.reportError(new SchemaParseException(
                        "Invalid schema document: " + m.getMessage(), "document", source));
            }
        }

        /** Feeds each entry of a top-level section; an entry that fails is reported and skipped. */
        private void each(String section, ComponentReader reader) {
            JsonNode block = root.get(section);
            if (block == null || !block.isObject()) {
                return;
            }
            Iterator<Map.Entry<String, JsonNode>> it = block.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                try {
                    reader.read(e.getKey(), e.getValue());
                } catch (SchemaParseException ex) {
                    builder.reportError(ex);
                } catch (IllegalArgumentException ex) {
                    builder.reportError(new SchemaParseException(
                            ex.getMessage(), ex, section + "/" + e.getKey(), source));
                }
            }
        }

        // --- simple types ---

        private SimpleTypeDraft simpleType(JsonNode node, QName name) {
            String where = describe("simpleType", name);
            if (node.has("restriction")) {
                JsonNode r = node.get("restriction");
                SimpleTypeDraft d = r.has("simpleType")
                        ? SimpleTypeDraft.restriction(name, simpleType(r.get("simpleType"), null))
                        : SimpleTypeDraft.restriction(name, ref(require(r, "base", where)));
                return d.facets(facets(r.get("facets"), where));
            }
            if (node.has("list")) {
                JsonNode l = node.get("list");
                return l.has("simpleType")
                        ? SimpleTypeDraft.list(name, simpleType(l.get("simpleType"), null))
                        : SimpleTypeDraft.list(name, ref(require(l, "itemType", where)));
            }
            if (node.has("union")) {
                JsonNode u = node.get("union");
                List<QName> members = new ArrayList<>();
                for (JsonNode m : array(u.get("memberTypes"))) {
                    members.add(ref(m.asText()));
                }
                List<SimpleTypeDraft> inline = new ArrayList<>();
                for (JsonNode m : array(u.get("simpleTypes"))) {
                    inline.add(simpleType(m, null));
                }
                if (members.isEmpty() && inline.isEmpty()) {
                    throw new SchemaParseException(where + ": a union needs at least one member type", where, source);
                }
                return SimpleTypeDraft.union(name, members, inline);
            }
            throw new SchemaParseException(
                    where + ": expected one of 'restriction', 'list' or 'union'", where, source);
        }

        private List<FacetDecl> facets(JsonNode node, String where) {
            List<FacetDecl> out = new ArrayList<>();
            if (node == null || node.isNull()) {
                return out;
            }
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                FacetKind kind = FacetKind.fromName(e.getKey())
                        .orElseThrow(() -> new SchemaParseException(
                                where + ": unknown facet '" + e.getKey() + "'", where, source));
                JsonNode v = e.getValue();
                if (v.isArray()) {
                    for (JsonNode item : v) {
                        out.add(FacetDecl.of(kind, item.asText()));
                    }
                } else if (v.isObject()) {
                    out.add(new FacetDecl(kind, require(v, "value", where), v.path("fixed").asBoolean(false)));
                } else {
                    out.add(FacetDecl.of(kind, v.asText()));
                }
            }
            return out;
        }

        // --- complex types ---

        private ComplexTypeDraft complexType(JsonNode node, QName name) {
            String where = describe("complexType", name);
            ComplexTypeDraft d = new ComplexTypeDraft(name)
                    .isAbstract(node.path("abstract").asBoolean(false))
                    .mixed(node.path("mixed").asBoolean(false));
            if (node.has("simpleContent")) {
                JsonNode sc = node.get("simpleContent");
                JsonNode body = derivationBody(sc, where);
                d.simpleContent(derivation(sc), ref(require(body, "base", where)));
                facets(body.get("facets"), where).forEach(d::facet);
                attributesInto(body, d.attributes(), where);
            } else if (node.has("complexContent")) {
                JsonNode cc = node.get("complexContent");
                JsonNode body = derivationBody(cc, where);
                d.complexContent(derivation(cc), ref(require(body, "base", where)));
                if (cc.path("mixed").asBoolean(false)) {
                    d.mixed(true);
                }
                ModelGroupDraft group = content(body, where);
                if (group != null) {
                    d.group(group);
                }
                attributesInto(body, d.attributes(), where);
            } else {
                ModelGroupDraft group = content(node, where);
                if (group != null) {
                    d.group(group);
                }
            }
            attributesInto(node, d.attributes(), where);
            return d;
        }

        private JsonNode derivationBody(JsonNode node, String where) {
            if (node.has("extension")) {
                return node.get("extension");
            }
            if (node.has("restriction")) {
                return node.get("restriction");
            }
            throw new SchemaParseException(where + ": expected 'extension' or 'restriction'", where, source);
        }

        private Derivation derivation(JsonNode node) {
            return node.has("extension") ? Derivation.EXTENSION : Derivation.RESTRICTION;
        }

        /** The content model declared on a node, a group reference wrapped in a sequence. */
        private ModelGroupDraft content(JsonNode node, String where) {
            for (String key : COMPOSITORS) {
                if (node.has(key)) {
                    return modelGroup(null, key, node.get(key), where);
                }
            }
            if (node.has("group")) {
                JsonNode g = node.get("group");
                ModelGroupDraft wrapper = new ModelGroupDraft(null, ModelGroup.Compositor.SEQUENCE, Occurs.ONCE);
                return wrapper.particle(groupRef(g, where));
            }
            return null;
        }

        private ModelGroupDraft modelGroup(QName name, String compositor, JsonNode body, String where) {
            ModelGroupDraft group = new ModelGroupDraft(name, compositor(compositor), occurs(body, where));
            for (JsonNode p : array(body.get("particles"))) {
                group.particle(particle(p, where));
            }
            return group;
        }

        private ParticleDraft particle(JsonNode node, String where) {
            if (node.has("element")) {
                QName name = local(node.get("element").asText(), elementQualified);
                ElementDraft e = ElementDraft.local(name).occurs(occurs(node, where));
                elementBody(e, node, describe("element", name));
                return e;
            }
            if (node.has("ref")) {
                return ElementDraft.reference(ref(node.get("ref").asText())).occurs(occurs(node, where));
            }
            if (node.has("any")) {
                JsonNode any = node.get("any");
                Wildcard w = new Wildcard(
                        NamespaceConstraint.parse(text(any, "namespace", null), tns),
                        ProcessContents.fromName(text(any, "processContents", "strict")),
                        occurs(any, where));
                return new WildcardDraft(w);
            }
            if (node.has("group")) {
                return groupRef(node, where);
            }
            for (String key : COMPOSITORS) {
                if (node.has(key)) {
                    return modelGroup(null, key, node.get(key), where);
                }
            }
            throw new SchemaParseException(
                    where + ": a particle must be one of 'element', 'ref', 'any', 'group', 'sequence', 'choice' or 'all'",
                    where,
                    source);
        }

        private GroupRefDraft groupRef(JsonNode node, String where) {
            JsonNode g = node.get("group");
            if (g.isObject()) {
                return new GroupRefDraft(ref(require(g, "ref", where)), occurs(g, where));
            }
            return new GroupRefDraft(ref(g.asText()), occurs(node, where));
        }

        private ModelGroupDraft namedGroup(JsonNode node, QName name) {
            String where = describe("group", name);
            for (String key : COMPOSITORS) {
                if (node.has(key)) {
                    ModelGroupDraft group = new ModelGroupDraft(name, compositor(key), Occurs.ONCE);
                    for (JsonNode p : array(node.get(key).get("particles"))) {
                        group.particle(particle(p, where));
                    }
                    return group;
                }
            }
            throw new SchemaParseException(where + ": expected one of " + COMPOSITORS, where, source);
        }

        // --- attributes ---

        private void attributesInto(JsonNode node, AttributeGroupDraft target, String where) {
            for (JsonNode a : array(node.get("attributes"))) {
                target.attribute(localAttribute(a, where));
            }
            for (JsonNode g : array(node.get("attributeGroups"))) {
                target.groupRef(ref(g.asText()));
            }
            if (node.has("anyAttribute")) {
                target.anyAttribute(anyAttribute(node.get("anyAttribute")));
            }
        }

        private AttributeDraft localAttribute(JsonNode node, String where) {
            AttributeDraft d;
            if (node.has("ref")) {
                d = AttributeDraft.reference(ref(node.get("ref").asText()));
            } else {
                d = AttributeDraft.named(local(require(node, "name", where), attributeQualified));
                attributeType(d, node);
            }
            String use = text(node, "use", null);
            if (use != null) {
                d.use(AttributeUse.fromName(use));
            }
            return d.defaultValue(text(node, "default", null)).fixedValue(text(node, "fixed", null));
        }

        private AttributeDraft globalAttribute(JsonNode node, QName name) {
            AttributeDraft d = AttributeDraft.named(name);
            attributeType(d, node);
            return d.defaultValue(text(node, "default", null)).fixedValue(text(node, "fixed", null));
        }

        private void attributeType(AttributeDraft d, JsonNode node) {
            if (node.has("simpleType")) {
                d.inlineType(simpleType(node.get("simpleType"), null));
            } else if (node.has("type")) {
                d.typeName(ref(node.get("type").asText()));
            }
        }

        private AttributeGroupDraft attributeGroup(JsonNode node, QName name) {
            AttributeGroupDraft d = new AttributeGroupDraft(name);
            attributesInto(node, d, describe("attributeGroup", name));
            return d;
        }

        private AnyAttribute anyAttribute(JsonNode node) {
            return new AnyAttribute(
                    NamespaceConstraint.parse(text(node, "namespace", null), tns),
                    ProcessContents.fromName(text(node, "processContents", "strict")));
        }

        // --- elements ---

        private ElementDraft globalElement(JsonNode node, QName name) {
            ElementDraft e = ElementDraft.global(name).isAbstract(node.path("abstract").asBoolean(false));
            String head = text(node, "substitutionGroup", null);
            if (head != null) {
                e.substitutionGroup(ref(head));
            }
            elementBody(e, node, describe("element", name));
            return e;
        }

        private void elementBody(ElementDraft e, JsonNode node, String where) {
            if (node.has("complexType")) {
                e.inlineType(complexType(node.get("complexType"), null));
            } else if (node.has("simpleType")) {
                e.inlineType(simpleType(node.get("simpleType"), null));
            } else if (node.has("type")) {
                e.typeName(ref(node.get("type").asText()));
            }
            if (node.has("complexType") && node.has("type")) {
                throw new SchemaParseException(where + ": 'type' and an inline type are mutually exclusive", where, source);
            }
            e.nillable(node.path("nillable").asBoolean(false))
                    .defaultValue(text(node, "default", null))
                    .fixedValue(text(node, "fixed", null));
        }

        // --- names and scalars ---

        private QName global(String localName) {
            return new QName(tns, localName);
        }

        private QName local(String localName, boolean qualified) {
            return qualified ? new QName(tns, localName) : new QName(localName);
        }

        /** Resolves a reference: {@code prefix:local}, or an unprefixed name in the target namespace. */
        private QName ref(String name) {
            int colon = name.indexOf(':');
            if (colon < 0) {
                return new QName(tns, name);
            }
            String prefix = name.substring(0, colon);
            String uri = namespaces.get(prefix);
            if (uri == null) {
                throw new SchemaParseException("Unknown namespace prefix '" + prefix + "' in '" + name + "'", name, source);
            }
            return new QName(uri, name.substring(colon + 1));
        }

        private Occurs occurs(JsonNode node, String where) {
            try {
                return Occurs.parse(text(node, "minOccurs", null), text(node, "maxOccurs", null));
            } catch (IllegalArgumentException e) {
                throw new SchemaParseException(where + ": " + e.getMessage(), e, where, source);
            }
        }

        private ModelGroup.Compositor compositor(String key) {
            return ModelGroup.Compositor.valueOf(key.toUpperCase(Locale.ROOT));
        }

        private String require(JsonNode node, String field, String where) {
            JsonNode v = node.get(field);
            if (v == null || v.isNull() || v.isContainerNode()) {
                throw new SchemaParseException(
                        where + ": missing or invalid required field '" + field + "'", where, source);
            }
            return v.asText();
        }

        private String describe(String kind, QName name) {
            return name == null ? "anonymous " + kind : kind + " '" + name.getLocalPart() + "'";
        }
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? fallback : v.asText();
    }

    private static Iterable<JsonNode> array(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            return List.of(node);
        }
        return node;
    }

    @FunctionalInterface
    private interface ComponentReader {
        void read(String name, JsonNode node);
    }
}

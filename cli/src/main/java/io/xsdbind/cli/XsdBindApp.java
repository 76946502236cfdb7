package io.xsdbind.cli;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import io.xsdbind.cli.config.CliConfig;
import io.xsdbind.cli.config.ConfigLoadException;
import io.xsdbind.cli.config.ConfigLoader;
import io.xsdbind.core.converter.DefaultConverter;
import io.xsdbind.core.dom.DomMarkupReader;
import io.xsdbind.core.dom.MarkupException;
import io.xsdbind.core.dom.MarkupWriter;
import io.xsdbind.core.error.InstanceException;
import io.xsdbind.core.error.SchemaBuildException;
import io.xsdbind.core.engine.XsdBinder;
import io.xsdbind.core.model.BindingResult;
import io.xsdbind.core.model.ElementNode;
import io.xsdbind.core.model.ValidationError;
import io.xsdbind.core.schema.Schema;
import io.xsdbind.core.spec.SchemaParser;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import javax.xml.namespace.QName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one {@code xsd-bind} command line.
 *
 * <pre>
 * xsd-bind [--config file] validate &lt;schema.yaml&gt; &lt;file.xml&gt;...
 * xsd-bind [--config file] xml2json &lt;schema.yaml&gt; &lt;file.xml&gt;
 * xsd-bind [--config file] json2xml &lt;schema.yaml&gt; &lt;file.json&gt; --element &lt;qname&gt;
 * </pre>
 *
 * <p>Separate from {@link XsdBindMain} so commands can be run in tests without exiting the JVM.
 */
public final class XsdBindApp {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(
            System.lineSeparator(),
            "usage: xsd-bind [--config <file>] <command> [args]",
            "  validate <schema.yaml> <file.xml>...",
            "  xml2json <schema.yaml> <file.xml>",
            "  json2xml <schema.yaml> <file.json> --element <qname>");

    private static final Logger LOG = LoggerFactory.getLogger(XsdBindApp.class);

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;
    private final ObjectMapper json = jsonMapper();

    public XsdBindApp(PrintStream out, PrintStream err, Function<String, String> envLookup) {
        this.out = out;
        this.err = err;
        this.envLookup = envLookup;
    }

    /**
     * Runs a command line.
     *
     * @return 0 on success, 1 when an instance is invalid or cannot be read, 2 for usage,
     *     configuration or schema errors
     */
    public int run(String[] args) {
        Invocation invocation;
        CliConfig config;
        try {
            invocation = Invocation.parse(args);
            config = ConfigLoader.resolve(args, envLookup);
        } catch (UsageException | ConfigLoadException e) {
            err.println("xsd-bind: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (invocation.command() == null) {
            out.println(USAGE);
            return EXIT_OK;
        }
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());

        Schema schema;
        try {
            schema = loadSchema(invocation.positional().get(0), config);
        } catch (SchemaBuildException e) {
            err.println("schema error: " + e.getMessage());
            return EXIT_USAGE;
        }
        DefaultConverter converter = new DefaultConverter(config.converterOptions(schema.targetNamespace()));
        XsdBinder binder = new XsdBinder(schema, converter, config.decodeOptions(), config.encodeOptions());

        return switch (invocation.command()) {
            case "validate" -> validate(binder, invocation.positional(), config);
            case "xml2json" -> xmlToJson(binder, Path.of(invocation.positional().get(1)), config);
            case "json2xml" -> jsonToXml(binder, converter, invocation, config);
            default -> throw new IllegalStateException("unreachable command " + invocation.command());
        };
    }

    private Schema loadSchema(String file, CliConfig config) {
        Schema schema = new SchemaParser(config.buildOptions()).parse(Path.of(file));
        for (SchemaBuildException e : schema.buildErrors()) {
            LOG.warn("Schema {}: {}", file, e.getMessage());
        }
        LOG.info("Loaded schema {} ({} global elements)", file, schema.elements().size());
        return schema;
    }

    private int validate(XsdBinder binder, List<String> positional, CliConfig config) {
        DomMarkupReader reader = new DomMarkupReader();
        boolean allValid = true;
        for (String file : positional.subList(1, positional.size())) {
            List<ValidationError> errors;
            try {
                errors = binder.validate(reader.read(Path.of(file)), config.instanceMode());
            } catch (InstanceException e) {
                errors = List.of(e.error());
            } catch (MarkupException e) {
                err.println(file + ": " + e.getMessage());
                allValid = false;
                continue;
            }
            if (errors.isEmpty()) {
                out.println(file + " is valid");
            } else {
                allValid = false;
                for (ValidationError error : errors) {
                    out.println(file + ": " + error);
                }
            }
        }
        return allValid ? EXIT_OK : EXIT_INVALID;
    }

    private int xmlToJson(XsdBinder binder, Path file, CliConfig config) {
        BindingResult<Object> result;
        try {
            result = binder.decode(new DomMarkupReader().read(file), config.instanceMode());
        } catch (InstanceException e) {
            err.println(file + ": " + e.error());
            return EXIT_INVALID;
        } catch (MarkupException e) {
            err.println(file + ": " + e.getMessage());
            return EXIT_INVALID;
        }
        try {
            out.println(json.writeValueAsString(result.value()));
        } catch (IOException e) {
            err.println(file + ": cannot write JSON: " + e.getMessage());
            return EXIT_INVALID;
        }
        return report(file, result.errors());
    }

    private int jsonToXml(XsdBinder binder, DefaultConverter converter, Invocation invocation, CliConfig config) {
        Path file = Path.of(invocation.positional().get(1));
        QName element;
        try {
            element = converter.parse(invocation.element(), true);
        } catch (IllegalArgumentException e) {
            err.println("xsd-bind: " + e.getMessage());
            return EXIT_USAGE;
        }
        Object value;
        try {
            value = json.readValue(Files.readAllBytes(file), Object.class);
        } catch (IOException e) {
            err.println(file + ": cannot read JSON: " + e.getMessage());
            return EXIT_INVALID;
        }
        BindingResult<ElementNode> result;
        try {
            result = binder.encode(value, element, config.instanceMode());
        } catch (InstanceException e) {
            err.println(file + ": " + e.error());
            return EXIT_INVALID;
        }
        if (result.value() != null) {
            out.println(new MarkupWriter(config.indent()).write(result.value()));
        }
        return report(file, result.errors());
    }

    private int report(Path file, List<ValidationError> errors) {
        for (ValidationError error : errors) {
            err.println(file + ": " + error);
        }
        return errors.isEmpty() ? EXIT_OK : EXIT_INVALID;
    }

    /** JSON mapper: exact numbers in and out, temporal values as ISO strings. */
    static ObjectMapper jsonMapper() {
        SimpleModule temporals = new SimpleModule("xsd-temporals");
        for (Class<?> type :
                List.of(LocalDate.class, LocalDateTime.class, LocalTime.class, OffsetDateTime.class, OffsetTime.class)) {
            temporals.addSerializer(type, ToStringSerializer.instance);
        }
        return new ObjectMapper()
                .registerModule(temporals)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS);
    }

    /** Parsed command line. A {@code null} command asks for help. */
    record Invocation(String command, List<String> positional, String element) {

        static Invocation parse(String[] args) {
            List<String> positional = new ArrayList<>();
            String element = null;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-h", "--help" -> {
                        return new Invocation(null, List.of(), null);
                    }
                    case "--config" -> i++;
                    case "--element" -> {
                        if (i + 1 >= args.length) {
                            throw new UsageException("--element requires a qualified name");
                        }
                        element = args[++i];
                    }
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new UsageException("unknown option " + arg);
                        }
                        positional.add(arg);
                    }
                }
            }
            if (positional.isEmpty()) {
                throw new UsageException("missing command");
            }
            String command = positional.remove(0);
            switch (command) {
                case "validate" -> require(positional.size() >= 2, "validate needs a schema and at least one file");
                case "xml2json" -> require(positional.size() == 2, "xml2json needs a schema and one file");
                case "json2xml" -> {
                    require(positional.size() == 2, "json2xml needs a schema and one file");
                    require(element != null, "json2xml needs --element <qname>");
                }
                default -> throw new UsageException("unknown command '" + command + "'");
            }
            if (element != null && !"json2xml".equals(command)) {
                throw new UsageException("--element only applies to json2xml");
            }
            return new Invocation(command, List.copyOf(positional), element);
        }

        private static void require(boolean condition, String message) {
            if (!condition) {
                throw new UsageException(message);
            }
        }
    }

    /** A malformed command line. */
    static final class UsageException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        UsageException(String message) {
            super(message);
        }
    }
}

package io.xsdbind.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.xsdbind.core.converter.DefaultConverter;
import io.xsdbind.core.dom.DomMarkupReader;
import io.xsdbind.core.model.BindingResult;
import io.xsdbind.core.model.ElementNode;
import io.xsdbind.core.model.ValidationMode;
import io.xsdbind.core.particle.ElementDecl;
import io.xsdbind.core.schema.Schema;
import io.xsdbind.core.spec.SchemaParser;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.xml.namespace.QName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * One built schema and binder shared by many threads. The schema is parsed fresh for each test so
 * that the substitution group memo is first populated while the threads race.
 */
class ConcurrentBindingTest {

    private static final int THREADS = 12;
    private static final int ROUNDS = 50;

    private static final ElementNode DOCUMENT = new DomMarkupReader().parse(
            "<drawing><circle>c1</circle><square>s1</square><circle>c2</circle></drawing>");

    private Schema schema;

    @BeforeEach
    void setUp() {
        schema = new SchemaParser().parse("""
                complexTypes:
                  drawingType:
                    sequence:
                      particles:
                        - {ref: shape, maxOccurs: unbounded}
                elements:
                  drawing: {type: drawingType}
                  shape: {type: xs:string, abstract: true}
                  circle: {type: xs:string, substitutionGroup: shape}
                  square: {type: xs:string, substitutionGroup: shape}
                """, "drawing.yaml");
    }

    @Test
    void decodeFromManyThreadsGivesIdenticalResults() throws Exception {
        XsdBinder binder = new XsdBinder(schema, new DefaultConverter());

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(THREADS);
        List<BindingResult<Object>> results = new CopyOnWriteArrayList<>();
        List<Throwable> failures = new CopyOnWriteArrayList<>();

        for (int i = 0; i < THREADS; i++) {
            Thread t = new Thread(() -> {
                try {
                    startLatch.await();
                    for (int r = 0; r < ROUNDS; r++) {
                        results.add(binder.decode(DOCUMENT, ValidationMode.LAX));
                    }
                } catch (Throwable e) {
                    failures.add(e);
                } finally {
                    doneLatch.countDown();
                }
            });
            t.start();
        }
        startLatch.countDown();
        doneLatch.await();

        assertThat(failures).isEmpty();
        assertThat(results).hasSize(THREADS * ROUNDS);

        BindingResult<Object> expected = binder.decode(DOCUMENT, ValidationMode.LAX);
        assertThat(expected.errors()).isEmpty();
        assertThat(results).allSatisfy(r -> {
            assertThat(r.errors()).isEmpty();
            assertThat(r.value()).isEqualTo(expected.value());
        });
        assertThat(schema.substitutes(new QName("shape")))
                .extracting(ElementDecl::name)
                .containsExactlyInAnyOrder(new QName("circle"), new QName("square"));
    }

    @Test
    void validateFromManyThreadsReportsTheSameErrors() throws Exception {
        XsdBinder binder = new XsdBinder(schema, new DefaultConverter());
        ElementNode invalid = new DomMarkupReader().parse("<drawing><shape>x</shape></drawing>");

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(THREADS);
        List<String> reasons = new CopyOnWriteArrayList<>();
        List<Throwable> failures = new CopyOnWriteArrayList<>();

        for (int i = 0; i < THREADS; i++) {
            Thread t = new Thread(() -> {
                try {
                    startLatch.await();
                    binder.validate(invalid, ValidationMode.LAX).forEach(e -> reasons.add(e.reason()));
                } catch (Throwable e) {
                    failures.add(e);
                } finally {
                    doneLatch.countDown();
                }
            });
            t.start();
        }
        startLatch.countDown();
        doneLatch.await();

        assertThat(failures).isEmpty();
        List<String> single = binder.validate(invalid, ValidationMode.LAX).stream()
                .map(e -> e.reason())
                .toList();
        assertThat(single).isNotEmpty();
        assertThat(reasons).hasSize(THREADS * single.size());
        assertThat(reasons).containsOnlyElementsOf(single);
    }
}

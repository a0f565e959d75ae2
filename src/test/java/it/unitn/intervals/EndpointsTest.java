package it.unitn.intervals;

import it.unitn.intervals.utils.Ordering;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

import java.math.BigDecimal;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.DynamicTest.dynamicTest;
import static org.junit.jupiter.api.DynamicTest.stream;
import static org.junit.jupiter.api.Named.named;

class EndpointsTest {

    private static final Endpoint<Integer> UNBOUNDED = Endpoint.unbounded();

    @TestFactory
    Stream<DynamicTest> factories() {
        return Stream.of(
            dynamicTest("open", () -> assertEquals(new Endpoint.Open<>(1), Endpoint.open(1))),
            dynamicTest("closed", () -> assertEquals(new Endpoint.Closed<>(1), Endpoint.closed(1))),
            dynamicTest("unbounded", () -> assertEquals(new Endpoint.Unbounded<Integer>(), Endpoint.unbounded())),
            dynamicTest("open w/ null", () -> assertThrows(NullPointerException.class, () -> Endpoint.open(null))),
            dynamicTest("closed w/ null", () -> assertThrows(NullPointerException.class, () -> Endpoint.closed(null)))
        );
    }

    record Test(Endpoint<Integer> a, Endpoint<Integer> b, Ordering expected) {}

    @TestFactory
    Stream<DynamicTest> asLower() {

        final var examples =
            Stream.of(
                    new Test(UNBOUNDED, Endpoint.open(0), Ordering.LT),
                    new Test(Endpoint.closed(0), UNBOUNDED, Ordering.GT),
                    new Test(UNBOUNDED, UNBOUNDED, Ordering.EQ),
                    new Test(Endpoint.open(0), Endpoint.open(1), Ordering.LT),
                    new Test(Endpoint.closed(1), Endpoint.open(0), Ordering.GT),
                    new Test(Endpoint.closed(0), Endpoint.open(0), Ordering.LT),
                    new Test(Endpoint.open(0), Endpoint.closed(0), Ordering.GT),
                    new Test(Endpoint.open(0), Endpoint.open(0), Ordering.EQ)
                )
                .map(x -> named("%s %s → %s".formatted(x.a(), x.b(), x.expected()), x));

        return stream(examples, t -> assertEquals(t.expected(), Endpoints.asLower(t.a(), t.b())));
    }

    @TestFactory
    Stream<DynamicTest> asUpper() {

        final var examples =
            Stream.of(
                    new Test(UNBOUNDED, Endpoint.open(0), Ordering.GT),
                    new Test(Endpoint.closed(0), UNBOUNDED, Ordering.LT),
                    new Test(UNBOUNDED, UNBOUNDED, Ordering.EQ),
                    new Test(Endpoint.open(0), Endpoint.open(1), Ordering.LT),
                    new Test(Endpoint.closed(1), Endpoint.open(0), Ordering.GT),
                    new Test(Endpoint.closed(0), Endpoint.open(0), Ordering.GT),
                    new Test(Endpoint.open(0), Endpoint.closed(0), Ordering.LT),
                    new Test(Endpoint.closed(0), Endpoint.closed(0), Ordering.EQ)
                )
                .map(x -> named("%s %s → %s".formatted(x.a(), x.b(), x.expected()), x));

        return stream(examples, t -> assertEquals(t.expected(), Endpoints.asUpper(t.a(), t.b())));
    }

    @TestFactory
    Stream<DynamicTest> gap() {

        record Gap(Endpoint<Integer> lower, Endpoint<Integer> upper, boolean expected) {}

        final var examples =
            Stream.of(
                    new Gap(Endpoint.open(1), Endpoint.open(1), true),
                    new Gap(Endpoint.open(1), Endpoint.closed(1), false),
                    new Gap(Endpoint.closed(1), Endpoint.open(1), false),
                    new Gap(Endpoint.closed(1), Endpoint.closed(1), false),
                    new Gap(Endpoint.closed(2), Endpoint.closed(1), true),
                    new Gap(Endpoint.open(1), Endpoint.open(2), false),
                    new Gap(UNBOUNDED, Endpoint.open(2), false),
                    new Gap(Endpoint.open(2), UNBOUNDED, false)
                )
                .map(x -> named("%s %s → %s".formatted(x.lower(), x.upper(), x.expected()), x));

        return stream(examples, t -> assertEquals(t.expected(), Endpoints.gap(t.lower(), t.upper())));
    }

    @TestFactory
    Stream<DynamicTest> flip() {
        return Stream.of(
            dynamicTest("open → closed", () -> assertEquals(Endpoint.closed(1), Endpoints.flip(Endpoint.open(1)))),
            dynamicTest("closed → open", () -> assertEquals(Endpoint.open(1), Endpoints.flip(Endpoint.closed(1)))),
            dynamicTest("unbounded → unbounded", () -> assertEquals(UNBOUNDED, Endpoints.flip(UNBOUNDED)))
        );
    }

    @TestFactory
    Stream<DynamicTest> same() {
        return Stream.of(
            dynamicTest("w/ equal values", () -> assertTrue(Endpoints.same(Endpoint.open(1), Endpoint.open(1)))),
            dynamicTest("w/ values equal under compareTo", () -> assertTrue(Endpoints.same(Endpoint.closed(new BigDecimal("1.0")), Endpoint.closed(new BigDecimal("1.00"))))),
            dynamicTest("w/ different kinds", () -> assertFalse(Endpoints.same(Endpoint.open(1), Endpoint.closed(1)))),
            dynamicTest("w/ different values", () -> assertFalse(Endpoints.same(Endpoint.open(1), Endpoint.open(2)))),
            dynamicTest("w/ different domains", () -> assertFalse(Endpoints.same(Endpoint.open(1), Endpoint.open("1")))),
            dynamicTest("w/ unbounded", () -> assertTrue(Endpoints.same(UNBOUNDED, Endpoint.<String>unbounded()))),
            dynamicTest("unbounded vs bounded", () -> assertFalse(Endpoints.same(UNBOUNDED, Endpoint.open(1))))
        );
    }

}

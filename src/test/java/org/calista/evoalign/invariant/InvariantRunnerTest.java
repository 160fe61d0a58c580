package org.calista.evoalign.invariant;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InvariantRunnerTest {

    private static InvariantChecker checker(String name, InvariantCheck result) {
        return new InvariantChecker() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public InvariantCheck check() {
                return result;
            }
        };
    }

    private static InvariantChecker throwing(String name, Exception e) {
        return new InvariantChecker() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public InvariantCheck check() throws IOException {
                if (e instanceof IOException io) throw io;
                throw (RuntimeException) e;
            }
        };
    }

    @Test
    void runsEveryCheckInOrder() {
        InvariantRunner runner = new InvariantRunner(List.of(
                checker("A", InvariantCheck.pass("A", "ok")),
                checker("B", InvariantCheck.skip("B", "nothing to do")),
                checker("C", new InvariantCheck("C", InvariantResult.WARN, "hm", null))));

        InvariantReport report = runner.run();

        assertEquals(List.of("A", "B", "C"), report.results().stream().map(InvariantCheck::name).toList());
        assertTrue(report.allPassed());
        assertEquals(1, report.count(InvariantResult.SKIP));
        assertEquals("nothing to do", report.find("B").orElseThrow().message());
        assertTrue(report.find("Z").isEmpty());
    }

    @Test
    void throwingCheckBecomesFailAndOthersStillRun() {
        InvariantRunner runner = new InvariantRunner(List.of(
                throwing("IO", new IOException("disk gone")),
                throwing("NPE", new NullPointerException()),
                checker("NULL", null),
                checker("OK", InvariantCheck.pass("OK", "fine"))));

        InvariantReport report = runner.run();

        assertFalse(report.allPassed());
        assertEquals(3, report.count(InvariantResult.FAIL));
        assertEquals("disk gone", report.find("IO").orElseThrow().message());
        assertEquals("NullPointerException", report.find("NPE").orElseThrow().message());
        assertEquals("Check produced no result", report.find("NULL").orElseThrow().message());
        assertEquals(InvariantResult.PASS, report.find("OK").orElseThrow().result());
    }

    @Test
    void failureDetailsAreExposed() {
        InvariantCheck c = InvariantCheck.failures("X", "1 issue", List.of(Map.of("reason", "bad")));

        assertEquals(InvariantResult.FAIL, c.result());
        assertEquals("bad", c.failureList().get(0).get("reason"));
        assertEquals("FAIL", c.toMap().get("result"));
        assertEquals(List.of(), InvariantCheck.pass("Y", null).failureList());
        assertEquals("", InvariantCheck.pass("Y", null).message());
    }
}

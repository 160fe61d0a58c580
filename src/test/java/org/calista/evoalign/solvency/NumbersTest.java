package org.calista.evoalign.solvency;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NumbersTest {

    @Test
    void formatsLikeSixSignificantDigits() {
        assertEquals("0.06", Numbers.g6(0.06));
        assertEquals("0.05", Numbers.g6(0.05));
        assertEquals("0", Numbers.g6(0.0));
        assertEquals("100", Numbers.g6(100));
        assertEquals("0.333333", Numbers.g6(1.0 / 3));
        assertEquals("1.23457e+06", Numbers.g6(1234567));
        assertEquals("1e-05", Numbers.g6(0.00001));
    }

    @Test
    void acceptsNumbersAndNumericStrings() throws Exception {
        assertEquals(0.25, Numbers.numeric(new ObjectMapper().readTree("0.25"), "tau", "f"));
        assertEquals(3.0, Numbers.numeric(new ObjectMapper().readTree("3"), "tau", "f"));
        assertEquals(0.5, Numbers.numeric(TextNode.valueOf(" 0.5 "), "tau", "f"));
    }

    @Test
    void rejectsEverythingElse() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Numbers.numeric(TextNode.valueOf("abc"), "tau", "contracts/a.yaml"));
        assertEquals("Invalid numeric 'tau' in contracts/a.yaml", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> Numbers.numeric(BooleanNode.TRUE, "tau", "f"));
        assertThrows(IllegalArgumentException.class, () -> Numbers.numeric(null, "tau", "f"));
        assertThrows(IllegalArgumentException.class, () -> Numbers.numeric(TextNode.valueOf("NaN"), "tau", "f"));
    }
}

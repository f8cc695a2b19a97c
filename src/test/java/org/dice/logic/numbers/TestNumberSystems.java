package org.dice.logic.numbers;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class TestNumberSystems {

    @Test
    public void convertsDecimal() {
        assertEquals("0", NumberSystems.decimalToBinary(0));
        assertEquals("1010", NumberSystems.decimalToBinary(10));
        assertEquals("FF", NumberSystems.decimalToHex(255));
        assertEquals("0", NumberSystems.decimalToHex(0));
    }

    @Test
    public void parsesBinaryAndHex() {
        assertEquals(10L, NumberSystems.binaryToDecimal("1010"));
        assertEquals(5L, NumberSystems.binaryToDecimal(" 00101 "));
        assertEquals(255L, NumberSystems.hexToDecimal("ff"));
        assertEquals(4096L, NumberSystems.hexToDecimal("1000"));
    }

    @Test
    public void convertsBetweenBinaryAndHex() {
        assertEquals("2A", NumberSystems.binaryToHex("101010"));
        assertEquals("11111111", NumberSystems.hexToBinary("FF"));
    }

    @Test
    public void padsBinary() {
        assertEquals("00000101", NumberSystems.padBinary("101"));
        assertEquals("0101", NumberSystems.padBinary("101", 4));
        assertEquals("101010101", NumberSystems.padBinary("101010101"));
    }

    @Test(expected = NumberFormatException.class)
    public void rejectsNonBinaryDigits() {
        NumberSystems.binaryToDecimal("102");
    }

    @Test(expected = NumberFormatException.class)
    public void rejectsSignedInput() {
        NumberSystems.hexToDecimal("-A");
    }

    @Test(expected = NumberFormatException.class)
    public void rejectsBlankInput() {
        NumberSystems.padBinary("  ");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNegativeDecimal() {
        NumberSystems.decimalToBinary(-3);
    }
}

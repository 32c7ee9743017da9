package com.questrail.plc.protocol.modbus.server;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegisterTableTest {

    @Test
    void startsZeroed() {
        RegisterTable t = new RegisterTable(10);

        assertEquals(10, t.size());
        assertArrayEquals(new int[10], t.read(0, 10));
    }

    @Test
    void writesAreMaskedToSixteenBits() {
        RegisterTable t = new RegisterTable(4);

        t.write(1, 0x1_0005);
        t.write(2, new int[] { -1, 7 });

        assertArrayEquals(new int[] { 0, 5, 0xFFFF, 7 }, t.read(0, 4));
    }

    @Test
    void rangeChecks() {
        RegisterTable t = new RegisterTable(1000);

        assertTrue(t.contains(0, 1000));
        assertTrue(t.contains(999, 1));
        assertFalse(t.contains(999, 2));
        assertFalse(t.contains(-1, 1));
        assertThrows(IndexOutOfBoundsException.class, () -> t.read(999, 2));
        assertThrows(IndexOutOfBoundsException.class, () -> t.write(1000, 1));
    }

    @Test
    void rejectsBadSize() {
        assertThrows(IllegalArgumentException.class, () -> new RegisterTable(0));
        assertThrows(IllegalArgumentException.class, () -> new RegisterTable(0x10001));
    }
}

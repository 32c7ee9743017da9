package com.questrail.plc.protocol.modbus.server;

import java.util.Objects;

/**
 * RegisterTable
 * =============================================================================
 * The PLC's holding register space: a fixed number of unsigned 16-bit words,
 * zero-based.
 *
 * <h2>Concurrency</h2>
 * The table is shared between the scan thread (which publishes status and
 * pulls commands) and the server event loop (which services supervisory
 * clients). Every operation holds a single lock, so a multi-word read or write
 * is observed either entirely or not at all.
 *
 * <p>Stored values are masked to 16 bits.</p>
 */
public final class RegisterTable
{
    private final Object lock = new Object();
    private final int[] words;

    public RegisterTable(int size) {
        if (size <= 0 || size > 0x10000) {
            throw new IllegalArgumentException("size must be in 1..65536: " + size);
        }
        this.words = new int[size];
    }

    public int size() {
        return words.length;
    }

    /**
     * Returns true if {@code [address, address + quantity)} lies inside the table.
     */
    public boolean contains(int address, int quantity) {
        return address >= 0 && quantity >= 0 && address + quantity <= words.length;
    }

    public int read(int address) {
        return read(address, 1)[0];
    }

    /**
     * @throws IndexOutOfBoundsException if the range is outside the table
     */
    public int[] read(int address, int quantity) {
        Objects.checkFromIndexSize(address, quantity, words.length);
        int[] out = new int[quantity];
        synchronized (lock) {
            System.arraycopy(words, address, out, 0, quantity);
        }
        return out;
    }

    public void write(int address, int value) {
        write(address, new int[] { value });
    }

    /**
     * @throws IndexOutOfBoundsException if the range is outside the table
     */
    public void write(int address, int[] values) {
        Objects.requireNonNull(values, "values");
        Objects.checkFromIndexSize(address, values.length, words.length);
        synchronized (lock) {
            for (int i = 0; i < values.length; i++) {
                words[address + i] = values[i] & 0xFFFF;
            }
        }
    }
}

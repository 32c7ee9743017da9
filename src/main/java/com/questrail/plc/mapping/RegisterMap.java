package com.questrail.plc.mapping;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * RegisterMap
 * =============================================================================
 * Read-only view of the signal → address table defined by {@link RegisterSignal}.
 *
 * <h2>Address semantics</h2>
 * Addresses are zero-based protocol addresses as they appear in the PDU
 * (what older documentation calls 40001 is address 0 here). The space is
 * {@link #REGISTER_COUNT} words; the first 400 are split into the four
 * {@link RegisterBlock}s.
 */
public final class RegisterMap
{
    /** Number of holding registers exposed by the PLC's register table. */
    public static final int REGISTER_COUNT = 1000;

    private static final Map<RegisterBlock, List<RegisterSignal>> BY_BLOCK;

    static {
        Map<RegisterBlock, List<RegisterSignal>> tmp = new EnumMap<>(RegisterBlock.class);
        for (RegisterBlock b : RegisterBlock.values()) {
            tmp.put(b, Stream.of(RegisterSignal.values())
                    .filter(s -> b.contains(s.address()))
                    .collect(Collectors.toUnmodifiableList()));
        }
        BY_BLOCK = Collections.unmodifiableMap(tmp);
    }

    private RegisterMap() {}

    /**
     * Returns the block containing an address, if it is inside one.
     */
    public static Optional<RegisterBlock> blockOf(int address) {
        for (RegisterBlock b : RegisterBlock.values()) {
            if (b.contains(address)) {
                return Optional.of(b);
            }
        }
        return Optional.empty();
    }

    /**
     * Signals of one block, in address order.
     */
    public static List<RegisterSignal> signalsIn(RegisterBlock block) {
        Objects.requireNonNull(block, "block");
        return BY_BLOCK.get(block);
    }

    /**
     * Resolves a signal by its label ({@code "FanSpeed"}, {@code "SensorTemp"}).
     */
    public static Optional<RegisterSignal> byLabel(String label) {
        Objects.requireNonNull(label, "label");
        for (RegisterSignal s : RegisterSignal.values()) {
            if (s.label().equals(label)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the signal mapped at an address.
     */
    public static Optional<RegisterSignal> atAddress(int address) {
        for (RegisterSignal s : RegisterSignal.values()) {
            if (s.address() == address) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}

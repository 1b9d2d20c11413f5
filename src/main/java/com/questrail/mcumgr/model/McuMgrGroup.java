package com.questrail.mcumgr.model;

/**
 * McuMgrGroup
 * -----------------------------------------------------------------------------
 * Command group: the 16-bit namespace that partitions command ids.
 *
 * <p>The set of groups is open-ended. Groups the library knows about are
 * modelled by {@link Known}; every other 16-bit value is carried verbatim by
 * {@link Custom}. Conversion is total and lossless:</p>
 *
 * <pre>
 *   McuMgrGroup.of(n).value() == n      for every n in 0..65535
 * </pre>
 *
 * <p>A {@code Custom} can never hold a value that a {@code Known} constant owns,
 * so two groups with the same numeric value are always equal.</p>
 */
public sealed interface McuMgrGroup permits McuMgrGroup.Known, McuMgrGroup.Custom
{
    int MIN_VALUE = 0;
    int MAX_VALUE = 0xFFFF;

    /**
     * Wire value (unsigned 16-bit).
     */
    int value();

    /**
     * Resolves a raw wire value to its group.
     *
     * @throws IllegalArgumentException if {@code value} is not an unsigned 16-bit value
     */
    static McuMgrGroup of(int value)
    {
        checkRange(value);
        for (Known k : Known.values()) {
            if (k.value == value) {
                return k;
            }
        }
        return new Custom(value);
    }

    private static void checkRange(int value)
    {
        if (value < MIN_VALUE || value > MAX_VALUE) {
            throw new IllegalArgumentException(
                    "Command group must be in range " + MIN_VALUE + ".." + MAX_VALUE
                            + " (was " + value + ")");
        }
    }

    /**
     * Groups defined by the upstream protocol (plus the Zephyr basic group).
     */
    enum Known implements McuMgrGroup
    {
        OS(0),
        IMAGE(1),
        STATISTICS(2),
        SETTINGS(3),
        LOGS(4),
        CRASH(5),
        SPLIT(6),
        RUN(7),
        FILESYSTEM(8),
        SHELL(9),
        /** Zephyr-specific groups count down from PER_USER to avoid collisions. */
        BASIC(63),
        /** First value available to application-defined groups. */
        PER_USER(64),
        SUIT(66);

        private final int value;

        Known(int value)
        {
            this.value = value;
        }

        @Override
        public int value()
        {
            return value;
        }
    }

    /**
     * Numeric passthrough for any group without a {@link Known} constant.
     */
    record Custom(int value) implements McuMgrGroup
    {
        public Custom
        {
            checkRange(value);
            for (Known k : Known.values()) {
                if (k.value == value) {
                    throw new IllegalArgumentException(
                            "Group " + value + " is " + k + "; use McuMgrGroup.of(int)");
                }
            }
        }

        @Override
        public String toString()
        {
            return "CUSTOM(" + value + ")";
        }
    }
}

package org.ls8.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Typed view of the {@code ls8} configuration block.
 * <pre>
 * ls8 {
 *   initial-stack-pointer = 244
 *   trace = false
 * }
 * </pre>
 */
public final class MachineSettings {

    private static final String ROOT_PATH = "ls8";
    private static final String INITIAL_SP_KEY = "initial-stack-pointer";
    private static final String TRACE_KEY = "trace";

    private final int initialStackPointer;
    private final boolean trace;

    public MachineSettings(final int initialStackPointer, final boolean trace) {
        this.initialStackPointer = initialStackPointer;
        this.trace = trace;
    }

    /**
     * Reads the settings from a resolved configuration.
     *
     * @param config the application configuration, which must contain the {@code ls8} block.
     * @return the settings.
     * @throws ConfigException.Missing if a key is absent.
     * @throws ConfigException.BadValue if the initial stack pointer is not a valid address.
     */
    public static MachineSettings fromConfig(final Config config) {
        final Config machineConfig = config.getConfig(ROOT_PATH);
        final int initialStackPointer = machineConfig.getInt(INITIAL_SP_KEY);
        if (initialStackPointer < 0 || initialStackPointer > 0xFF) {
            throw new ConfigException.BadValue(ROOT_PATH + "." + INITIAL_SP_KEY,
                    "must be an address between 0 and 255, was " + initialStackPointer);
        }
        return new MachineSettings(initialStackPointer, machineConfig.getBoolean(TRACE_KEY));
    }

    public int getInitialStackPointer() {
        return initialStackPointer;
    }

    public boolean isTrace() {
        return trace;
    }
}

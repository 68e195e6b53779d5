package org.kaleido.compiler.config;

import com.typesafe.config.Config;
import org.kaleido.compiler.frontend.parser.OperatorTable;

/**
 * Settings of the front end, read from the {@code kaleido.frontend} section of the configuration.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * kaleido {
 *   frontend {
 *     recover = true                  # resynchronize at the next ';' after an error
 *     max-errors = 20                 # give up after this many errors
 *     default-binary-precedence = 30  # for 'binary' declarations without a precedence
 *     max-nesting-depth = 256         # deeper expressions are rejected
 *   }
 * }
 * </pre>
 *
 * @param recover Whether the driver continues with the next top-level item after an error.
 * @param maxErrors The number of errors after which the driver stops.
 * @param defaultBinaryPrecedence The precedence of binary operators declared without one.
 * @param maxNestingDepth The deepest expression nesting the parser accepts.
 */
public record FrontEndOptions(
        boolean recover,
        int maxErrors,
        int defaultBinaryPrecedence,
        int maxNestingDepth
) {

    private static final String FRONTEND_CONFIG_PATH = "kaleido.frontend";

    public FrontEndOptions {
        if (maxErrors < 1) {
            throw new IllegalArgumentException("max-errors must be at least 1, was " + maxErrors);
        }
        if (defaultBinaryPrecedence < OperatorTable.MIN_PRECEDENCE || defaultBinaryPrecedence > OperatorTable.MAX_PRECEDENCE) {
            throw new IllegalArgumentException("default-binary-precedence must be between "
                    + OperatorTable.MIN_PRECEDENCE + " and " + OperatorTable.MAX_PRECEDENCE
                    + ", was " + defaultBinaryPrecedence);
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("max-nesting-depth must be at least 1, was " + maxNestingDepth);
        }
    }

    /**
     * @return The built-in defaults, identical to {@code reference.conf}.
     */
    public static FrontEndOptions defaults() {
        return new FrontEndOptions(true, 20, 30, 256);
    }

    /**
     * Reads the options from a resolved configuration. Missing keys fall back to {@link #defaults()}.
     * @param config The application configuration.
     * @return The options.
     * @throws com.typesafe.config.ConfigException.WrongType if a value has the wrong type.
     * @throws IllegalArgumentException if a value is out of range.
     */
    public static FrontEndOptions fromConfig(Config config) {
        FrontEndOptions defaults = defaults();
        if (!config.hasPath(FRONTEND_CONFIG_PATH)) {
            return defaults;
        }
        Config frontend = config.getConfig(FRONTEND_CONFIG_PATH);
        return new FrontEndOptions(
                frontend.hasPath("recover") ? frontend.getBoolean("recover") : defaults.recover(),
                frontend.hasPath("max-errors") ? frontend.getInt("max-errors") : defaults.maxErrors(),
                frontend.hasPath("default-binary-precedence")
                        ? frontend.getInt("default-binary-precedence")
                        : defaults.defaultBinaryPrecedence(),
                frontend.hasPath("max-nesting-depth")
                        ? frontend.getInt("max-nesting-depth")
                        : defaults.maxNestingDepth());
    }
}

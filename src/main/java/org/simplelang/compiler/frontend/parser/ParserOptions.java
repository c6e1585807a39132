package org.simplelang.compiler.frontend.parser;

import com.typesafe.config.Config;

/**
 * Tunables of the parser.
 *
 * @param strictOperands When true, expression operands must be identifiers, numbers or
 *                       boolean literals. When false, any token is accepted as an operand.
 */
public record ParserOptions(boolean strictOperands) {

    public static final String STRICT_OPERANDS_PATH = "simplelang.parser.strict-operands";

    public static ParserOptions defaults() {
        return new ParserOptions(false);
    }

    /**
     * Reads the options from the {@code simplelang.parser} section.
     * Missing keys fall back to {@link #defaults()}.
     *
     * @param config The application configuration.
     * @return The parser options.
     */
    public static ParserOptions fromConfig(Config config) {
        boolean strict = config.hasPath(STRICT_OPERANDS_PATH) && config.getBoolean(STRICT_OPERANDS_PATH);
        return new ParserOptions(strict);
    }
}

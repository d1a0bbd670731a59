package com.lfunc.prelabel.literal;

import com.lfunc.prelabel.literal.grammar.GammaLiteralLexer;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

/** Switches for dumping literal tokens while chasing down rejected input. */
public final class DebugFlags {
    private static final Logger LOGGER = Logger.getLogger(DebugFlags.class.getName());
    private static final String TOKENS_PROPERTY = "lfunc.prelabel.debugTokens";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String TOKENS_ENV = "LFUNC_PRELABEL_DEBUG_TOKENS";

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        String value = System.getProperty(TOKENS_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(TOKENS_ENV));
    }

    static void logTokens(CommonTokenStream tokens, GammaLiteralLexer lexer) {
        if (!LOGGER.isLoggable(Level.INFO)) {
            return;
        }
        StringBuilder dump = new StringBuilder("Literal token dump:");
        for (Token token : tokens.getTokens()) {
            String symbolic =
                    token.getType() == Token.EOF
                            ? "EOF"
                            : lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            dump.append(
                    String.format(
                            Locale.ROOT,
                            "%n  %-8s @ %-3d -> %s",
                            symbolic,
                            token.getCharPositionInLine(),
                            token.getText()));
        }
        LOGGER.info(dump.toString());
    }
}

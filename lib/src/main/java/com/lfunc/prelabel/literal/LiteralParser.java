package com.lfunc.prelabel.literal;

import com.lfunc.prelabel.gamma.GammaData;
import com.lfunc.prelabel.literal.grammar.GammaLiteralBaseVisitor;
import com.lfunc.prelabel.literal.grammar.GammaLiteralLexer;
import com.lfunc.prelabel.literal.grammar.GammaLiteralParser;
import com.lfunc.prelabel.number.ExactComplex;
import com.lfunc.prelabel.number.ExactReal;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Parses real and complex literals ({@code 0}, {@code -1.5e3}, {@code 2.5-3.1i}, {@code i},
 * {@code -I}, {@code 3*I}) and gamma-factor lists ({@code [[0,1],[0.5+2i]]}) into exact numbers.
 *
 * <p>A whole literal prints back exactly as given. The individual parts of a complex literal print
 * as their sign and digits, with a leading {@code +} and any whitespace dropped; a missing
 * imaginary coefficient prints as {@code 1} or {@code -1}.</p>
 *
 * <p>The working precision of a literal is the number of digits of its longest part converted to
 * bits, and never less than {@value ExactReal#MIN_PRECISION_BITS}. Decimal exponents beyond
 * {@value #MAX_EXPONENT} in magnitude are rejected.</p>
 */
public final class LiteralParser {

    public static final int MAX_EXPONENT = 1000;

    private static final double LOG2_10 = Math.log(10) / Math.log(2);

    private LiteralParser() {}

    public static ExactReal parseReal(String text) throws LiteralFormatException {
        return parse(
                text,
                parser -> {
                    GammaLiteralParser.SignedNumberContext number =
                            parser.realLiteral().signedNumber();
                    String normalized = normalizedNumber(number.sign(), number.NUMBER().getSymbol());
                    return ExactReal.parsed(
                            text, new BigDecimal(normalized), precisionBits(normalized));
                });
    }

    public static ExactComplex parseComplex(String text) throws LiteralFormatException {
        return parse(
                text,
                parser -> {
                    GammaLiteralParser.ComplexValueContext value =
                            parser.complexLiteral().complexValue();
                    return new ValueBuilder(text).visit(value);
                });
    }

    /**
     * Parses the {@code gamma_factors} field: a list holding the list of real (R-type) parameters
     * followed by the list of complex (C-type) parameters.
     */
    public static GammaData parseGammaFactors(String text) throws LiteralFormatException {
        return parse(
                text,
                parser -> {
                    GammaLiteralParser.GammaFactorsContext factors = parser.gammaFactors();
                    ValueBuilder builder = new ValueBuilder(factors.start.getInputStream());
                    List<ExactComplex> gr = collect(builder, factors.parameterList(0));
                    List<ExactComplex> gc = collect(builder, factors.parameterList(1));
                    return new GammaData(gr, gc);
                });
    }

    /** Bits needed to hold every digit of {@code numbers}, floored at double precision. */
    static int precisionBits(String... numbers) {
        int bits = ExactReal.MIN_PRECISION_BITS;
        for (String number : numbers) {
            int digits = 0;
            for (int i = 0; i < number.length(); i++) {
                char ch = number.charAt(i);
                if (ch == 'e' || ch == 'E') {
                    break;
                }
                if (ch >= '0' && ch <= '9') {
                    digits++;
                }
            }
            bits = Math.max(bits, (int) Math.ceil(digits * LOG2_10));
        }
        return bits;
    }

    private static <T> T parse(String text, Function<GammaLiteralParser, T> entryPoint)
            throws LiteralFormatException {
        Objects.requireNonNull(text, "text");
        GammaLiteralLexer lexer = new GammaLiteralLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        try {
            if (DebugFlags.isTokenDebugEnabled()) {
                tokens.fill();
                DebugFlags.logTokens(tokens, lexer);
                tokens.seek(0);
            }
            GammaLiteralParser parser = new GammaLiteralParser(tokens);
            parser.removeErrorListeners();
            parser.addErrorListener(ThrowingErrorListener.INSTANCE);
            return entryPoint.apply(parser);
        } catch (ParseCancellationException ex) {
            throw new LiteralFormatException(text, ex.getMessage(), ex);
        } catch (NumberFormatException ex) {
            throw new LiteralFormatException(text, "unreadable number: " + ex.getMessage(), ex);
        }
    }

    private static List<ExactComplex> collect(
            ValueBuilder builder, GammaLiteralParser.ParameterListContext list) {
        List<ExactComplex> values = new ArrayList<>(list.complexValue().size());
        for (GammaLiteralParser.ComplexValueContext value : list.complexValue()) {
            values.add(builder.visit(value));
        }
        return values;
    }

    private static String normalizedNumber(GammaLiteralParser.SignContext sign, Token number) {
        checkExponent(number.getText());
        return isMinus(sign) ? "-" + number.getText() : number.getText();
    }

    /** Throws {@link NumberFormatException} when the exponent of {@code number} is out of range. */
    static void checkExponent(String number) {
        int e = Math.max(number.indexOf('e'), number.indexOf('E'));
        if (e < 0) {
            return;
        }
        String exponent = number.substring(e + 1);
        if (exponent.startsWith("+")) {
            exponent = exponent.substring(1);
        }
        String digits = exponent.startsWith("-") ? exponent.substring(1) : exponent;
        digits = digits.replaceFirst("^0+(?=\\d)", "");
        if (digits.length() > 4 || Integer.parseInt(digits) > MAX_EXPONENT) {
            throw new NumberFormatException(
                    "exponent " + exponent + " exceeds " + MAX_EXPONENT + " in magnitude");
        }
    }

    private static boolean isMinus(GammaLiteralParser.SignContext sign) {
        return sign != null && sign.MINUS() != null;
    }

    private static final class ValueBuilder extends GammaLiteralBaseVisitor<ExactComplex> {
        private final CharStream input;
        private final String wholeText;

        /** Builder for a single literal that spans the whole input text. */
        ValueBuilder(String wholeText) {
            this.input = null;
            this.wholeText = wholeText;
        }

        /** Builder for values embedded in a larger input; each keeps its own source span. */
        ValueBuilder(CharStream input) {
            this.input = input;
            this.wholeText = null;
        }

        @Override
        public ExactComplex visitRealValue(GammaLiteralParser.RealValueContext ctx) {
            GammaLiteralParser.SignedNumberContext number = ctx.signedNumber();
            String real = normalizedNumber(number.sign(), number.NUMBER().getSymbol());
            int bits = precisionBits(real);
            return ExactComplex.parsed(
                    ExactReal.ofLiteral(real, bits), ExactReal.zero(), sourceText(ctx));
        }

        @Override
        public ExactComplex visitMixedValue(GammaLiteralParser.MixedValueContext ctx) {
            GammaLiteralParser.SignedNumberContext number = ctx.signedNumber();
            String real = normalizedNumber(number.sign(), number.NUMBER().getSymbol());
            String imag = imaginaryCoefficient(ctx.imagSign, ctx.imagDigits);
            int bits = precisionBits(real, imag);
            return ExactComplex.parsed(
                    ExactReal.ofLiteral(real, bits), ExactReal.ofLiteral(imag, bits), sourceText(ctx));
        }

        @Override
        public ExactComplex visitImaginaryValue(GammaLiteralParser.ImaginaryValueContext ctx) {
            String imag = imaginaryCoefficient(ctx.imagSign, ctx.imagDigits);
            int bits = precisionBits(imag);
            ExactReal zero = ExactReal.ofLiteral("0", bits);
            return ExactComplex.parsed(zero, ExactReal.ofLiteral(imag, bits), sourceText(ctx));
        }

        private String sourceText(ParserRuleContext ctx) {
            if (wholeText != null) {
                return wholeText;
            }
            return input.getText(Interval.of(ctx.start.getStartIndex(), ctx.stop.getStopIndex()));
        }

        private static String imaginaryCoefficient(
                GammaLiteralParser.SignContext sign, Token digits) {
            if (digits != null) {
                checkExponent(digits.getText());
            }
            String magnitude = digits == null ? "1" : digits.getText();
            return isMinus(sign) ? "-" + magnitude : magnitude;
        }
    }
}

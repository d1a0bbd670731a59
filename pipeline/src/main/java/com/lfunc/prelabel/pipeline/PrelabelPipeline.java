package com.lfunc.prelabel.pipeline;

import com.lfunc.prelabel.InvariantViolationException;
import com.lfunc.prelabel.PrelabelException;
import com.lfunc.prelabel.arith.IntegerFactorization;
import com.lfunc.prelabel.character.CentralCharacterReducer;
import com.lfunc.prelabel.character.CharacterCache;
import com.lfunc.prelabel.character.ConreyCharacterReducer;
import com.lfunc.prelabel.conductor.AnalyticConductor;
import com.lfunc.prelabel.conductor.DigammaAnalyticConductor;
import com.lfunc.prelabel.gamma.CanonicalSpectralForm;
import com.lfunc.prelabel.gamma.SpectralCanonicalizer;
import com.lfunc.prelabel.label.LabelBuilder;
import com.lfunc.prelabel.label.LabelRecord;
import com.lfunc.prelabel.record.RecordCodec;
import com.lfunc.prelabel.record.RecordLayout;
import com.lfunc.prelabel.record.TypeMismatchException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Labels one L-function record at a time: primitive central character, canonical spectral form,
 * prelabel, spectral arrays, analytic conductor and bad primes.
 *
 * <p>Instances are safe to share between threads as long as the collaborators are; the default
 * character reducer caches through a concurrent map.</p>
 */
public final class PrelabelPipeline {
    private static final Logger LOGGER = Logger.getLogger(PrelabelPipeline.class.getName());

    private final CentralCharacterReducer characterReducer;
    private final SpectralCanonicalizer canonicalizer;
    private final LabelBuilder labelBuilder;
    private final AnalyticConductor analyticConductor;
    private final RecordCodec inputCodec = new RecordCodec(RecordLayout.INPUT);
    private final RecordCodec outputCodec = new RecordCodec(RecordLayout.OUTPUT);

    public PrelabelPipeline(
            CentralCharacterReducer characterReducer,
            SpectralCanonicalizer canonicalizer,
            LabelBuilder labelBuilder,
            AnalyticConductor analyticConductor) {
        this.characterReducer = Objects.requireNonNull(characterReducer, "characterReducer");
        this.canonicalizer = Objects.requireNonNull(canonicalizer, "canonicalizer");
        this.labelBuilder = Objects.requireNonNull(labelBuilder, "labelBuilder");
        this.analyticConductor = Objects.requireNonNull(analyticConductor, "analyticConductor");
    }

    public static PrelabelPipeline withDefaults() {
        return new PrelabelPipeline(
                new ConreyCharacterReducer(new CharacterCache()),
                new SpectralCanonicalizer(),
                new LabelBuilder(),
                new DigammaAnalyticConductor());
    }

    /** Decodes an input line, labels it and encodes the enriched record as an output line. */
    public String processLine(String line) throws PrelabelException {
        LabelRecord record = LabelRecord.fromFieldMap(inputCodec.decode(line));
        return outputCodec.encode(process(record).toFieldMap());
    }

    /**
     * Fills the derived fields of {@code record} in place and returns it.
     *
     * @throws InvariantViolationException if a required field is missing, the degree does not
     *     match the gamma factors, or a spectral parameter is out of the computable range.
     * @throws TypeMismatchException if the central character is not a valid Conrey label.
     */
    public LabelRecord process(LabelRecord record) throws PrelabelException {
        Objects.requireNonNull(record, "record");
        require(record.getConductor(), LabelRecord.CONDUCTOR, record);
        require(record.getCentralCharacter(), LabelRecord.CENTRAL_CHARACTER, record);
        require(record.getMotivicWeight(), LabelRecord.MOTIVIC_WEIGHT, record);
        require(record.getDegree(), LabelRecord.DEGREE, record);
        require(record.getGammaFactors(), LabelRecord.GAMMA_FACTORS, record);
        if (record.getConductor().signum() <= 0) {
            throw new InvariantViolationException(
                    "record " + record.getId() + ": conductor must be positive");
        }

        String character = record.getCentralCharacter();
        try {
            record.setCentralCharacter(characterReducer.primitivize(character));
        } catch (IllegalArgumentException ex) {
            throw new TypeMismatchException(
                    LabelRecord.CENTRAL_CHARACTER, character, ex.getMessage(), ex);
        }

        String prelabel;
        try {
            CanonicalSpectralForm form =
                    canonicalizer.canonicalize(
                            record.getGammaFactors(), record.getMotivicWeight(), record.getDegree());
            prelabel = labelBuilder.build(record, form);
            record.setAnalyticConductor(analyticConductor.compute(record.getConductor(), form));
        } catch (IllegalArgumentException | ArithmeticException ex) {
            throw new InvariantViolationException(
                    "record " + record.getId() + ": spectral data out of range: " + ex.getMessage(),
                    ex);
        }
        record.setBadPrimes(IntegerFactorization.primeDivisors(record.getConductor()));

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Labeled record " + record.getId() + " as " + prelabel);
        }
        return record;
    }

    private static void require(Object value, String field, LabelRecord record)
            throws InvariantViolationException {
        if (value == null) {
            throw new InvariantViolationException(
                    "record " + record.getId() + ": required field '" + field + "' is null");
        }
    }
}

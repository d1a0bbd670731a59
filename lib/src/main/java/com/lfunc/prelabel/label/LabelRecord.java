package com.lfunc.prelabel.label;

import com.lfunc.prelabel.gamma.GammaData;
import com.lfunc.prelabel.number.ExactReal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One L-function entry: the invariants read from an input line and the fields derived from them.
 * Input fields are fixed at construction; derived fields are filled in by the labeling pipeline.
 */
public final class LabelRecord {
    public static final String ID = "id";
    public static final String ORIGIN = "origin";
    public static final String PRIMITIVE = "primitive";
    public static final String CONDUCTOR = "conductor";
    public static final String CENTRAL_CHARACTER = "central_character";
    public static final String SELF_DUAL = "self_dual";
    public static final String MOTIVIC_WEIGHT = "motivic_weight";
    public static final String LHASH = "Lhash";
    public static final String DEGREE = "degree";
    public static final String ORDER_OF_VANISHING = "order_of_vanishing";
    public static final String ALGEBRAIC = "algebraic";
    public static final String Z1 = "z1";
    public static final String GAMMA_FACTORS = "gamma_factors";
    public static final String TRACE_HASH = "trace_hash";
    public static final String ROOT_ANGLE = "root_angle";
    public static final String PRELABEL = "prelabel";
    public static final String ANALYTIC_CONDUCTOR = "analytic_conductor";
    public static final String MU_REAL = "mu_real";
    public static final String MU_IMAG = "mu_imag";
    public static final String DOUBLE_NU_REAL = "double_nu_real";
    public static final String DOUBLE_NU_IMAG = "double_nu_imag";
    public static final String BAD_PRIMES = "bad_primes";

    private final Long id;
    private final String origin;
    private final Boolean primitive;
    private final BigInteger conductor;
    private String centralCharacter;
    private final Boolean selfDual;
    private final Integer motivicWeight;
    private final String lhash;
    private final Integer degree;
    private final Integer orderOfVanishing;
    private final Boolean algebraic;
    private final ExactReal z1;
    private final GammaData gammaFactors;
    private final Long traceHash;
    private final ExactReal rootAngle;

    private String prelabel;
    private Double analyticConductor;
    private List<Integer> muReal;
    private List<ExactReal> muImag;
    private List<Integer> doubleNuReal;
    private List<ExactReal> doubleNuImag;
    private List<BigInteger> badPrimes;

    private LabelRecord(Builder builder) {
        this.id = builder.id;
        this.origin = builder.origin;
        this.primitive = builder.primitive;
        this.conductor = builder.conductor;
        this.centralCharacter = builder.centralCharacter;
        this.selfDual = builder.selfDual;
        this.motivicWeight = builder.motivicWeight;
        this.lhash = builder.lhash;
        this.degree = builder.degree;
        this.orderOfVanishing = builder.orderOfVanishing;
        this.algebraic = builder.algebraic;
        this.z1 = builder.z1;
        this.gammaFactors = builder.gammaFactors;
        this.traceHash = builder.traceHash;
        this.rootAngle = builder.rootAngle;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a record from decoded input fields. Values must already have the Java types the
     * getters return; missing keys leave the field null.
     *
     * @throws ClassCastException if a value has the wrong type.
     */
    public static LabelRecord fromFieldMap(Map<String, ?> fields) {
        return builder()
                .id((Long) fields.get(ID))
                .origin((String) fields.get(ORIGIN))
                .primitive((Boolean) fields.get(PRIMITIVE))
                .conductor((BigInteger) fields.get(CONDUCTOR))
                .centralCharacter((String) fields.get(CENTRAL_CHARACTER))
                .selfDual((Boolean) fields.get(SELF_DUAL))
                .motivicWeight(intValue(fields.get(MOTIVIC_WEIGHT)))
                .lhash((String) fields.get(LHASH))
                .degree(intValue(fields.get(DEGREE)))
                .orderOfVanishing(intValue(fields.get(ORDER_OF_VANISHING)))
                .algebraic((Boolean) fields.get(ALGEBRAIC))
                .z1((ExactReal) fields.get(Z1))
                .gammaFactors((GammaData) fields.get(GAMMA_FACTORS))
                .traceHash((Long) fields.get(TRACE_HASH))
                .rootAngle((ExactReal) fields.get(ROOT_ANGLE))
                .build();
    }

    /** All fields, input then derived, keyed by column name in output order. */
    public Map<String, Object> toFieldMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(ID, id);
        fields.put(ORIGIN, origin);
        fields.put(PRIMITIVE, primitive);
        fields.put(CONDUCTOR, conductor);
        fields.put(CENTRAL_CHARACTER, centralCharacter);
        fields.put(SELF_DUAL, selfDual);
        fields.put(MOTIVIC_WEIGHT, motivicWeight);
        fields.put(LHASH, lhash);
        fields.put(DEGREE, degree);
        fields.put(ORDER_OF_VANISHING, orderOfVanishing);
        fields.put(ALGEBRAIC, algebraic);
        fields.put(Z1, z1);
        fields.put(GAMMA_FACTORS, gammaFactors);
        fields.put(TRACE_HASH, traceHash);
        fields.put(ROOT_ANGLE, rootAngle);
        fields.put(PRELABEL, prelabel);
        fields.put(ANALYTIC_CONDUCTOR, analyticConductor);
        fields.put(MU_REAL, muReal);
        fields.put(MU_IMAG, muImag);
        fields.put(DOUBLE_NU_REAL, doubleNuReal);
        fields.put(DOUBLE_NU_IMAG, doubleNuImag);
        fields.put(BAD_PRIMES, badPrimes);
        return Collections.unmodifiableMap(fields);
    }

    public Long getId() {
        return id;
    }

    public String getOrigin() {
        return origin;
    }

    public Boolean getPrimitive() {
        return primitive;
    }

    public BigInteger getConductor() {
        return conductor;
    }

    public String getCentralCharacter() {
        return centralCharacter;
    }

    /** Replaces the central character, normally by its primitive form. */
    public void setCentralCharacter(String centralCharacter) {
        this.centralCharacter = centralCharacter;
    }

    public Boolean getSelfDual() {
        return selfDual;
    }

    public Integer getMotivicWeight() {
        return motivicWeight;
    }

    public String getLhash() {
        return lhash;
    }

    public Integer getDegree() {
        return degree;
    }

    public Integer getOrderOfVanishing() {
        return orderOfVanishing;
    }

    public Boolean getAlgebraic() {
        return algebraic;
    }

    public ExactReal getZ1() {
        return z1;
    }

    public GammaData getGammaFactors() {
        return gammaFactors;
    }

    public Long getTraceHash() {
        return traceHash;
    }

    public ExactReal getRootAngle() {
        return rootAngle;
    }

    public String getPrelabel() {
        return prelabel;
    }

    public void setPrelabel(String prelabel) {
        this.prelabel = prelabel;
    }

    public Double getAnalyticConductor() {
        return analyticConductor;
    }

    public void setAnalyticConductor(Double analyticConductor) {
        this.analyticConductor = analyticConductor;
    }

    public List<Integer> getMuReal() {
        return muReal;
    }

    public void setMuReal(List<Integer> muReal) {
        this.muReal = List.copyOf(muReal);
    }

    public List<ExactReal> getMuImag() {
        return muImag;
    }

    public void setMuImag(List<ExactReal> muImag) {
        this.muImag = List.copyOf(muImag);
    }

    public List<Integer> getDoubleNuReal() {
        return doubleNuReal;
    }

    public void setDoubleNuReal(List<Integer> doubleNuReal) {
        this.doubleNuReal = List.copyOf(doubleNuReal);
    }

    public List<ExactReal> getDoubleNuImag() {
        return doubleNuImag;
    }

    public void setDoubleNuImag(List<ExactReal> doubleNuImag) {
        this.doubleNuImag = List.copyOf(doubleNuImag);
    }

    public List<BigInteger> getBadPrimes() {
        return badPrimes;
    }

    public void setBadPrimes(List<BigInteger> badPrimes) {
        this.badPrimes = List.copyOf(badPrimes);
    }

    private static Integer intValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigInteger big) {
            return big.intValueExact();
        }
        return (Integer) value;
    }

    public static final class Builder {
        private Long id;
        private String origin;
        private Boolean primitive;
        private BigInteger conductor;
        private String centralCharacter;
        private Boolean selfDual;
        private Integer motivicWeight;
        private String lhash;
        private Integer degree;
        private Integer orderOfVanishing;
        private Boolean algebraic;
        private ExactReal z1;
        private GammaData gammaFactors;
        private Long traceHash;
        private ExactReal rootAngle;

        private Builder() {}

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder origin(String origin) {
            this.origin = origin;
            return this;
        }

        public Builder primitive(Boolean primitive) {
            this.primitive = primitive;
            return this;
        }

        public Builder conductor(BigInteger conductor) {
            this.conductor = conductor;
            return this;
        }

        public Builder centralCharacter(String centralCharacter) {
            this.centralCharacter = centralCharacter;
            return this;
        }

        public Builder selfDual(Boolean selfDual) {
            this.selfDual = selfDual;
            return this;
        }

        public Builder motivicWeight(Integer motivicWeight) {
            this.motivicWeight = motivicWeight;
            return this;
        }

        public Builder lhash(String lhash) {
            this.lhash = lhash;
            return this;
        }

        public Builder degree(Integer degree) {
            this.degree = degree;
            return this;
        }

        public Builder orderOfVanishing(Integer orderOfVanishing) {
            this.orderOfVanishing = orderOfVanishing;
            return this;
        }

        public Builder algebraic(Boolean algebraic) {
            this.algebraic = algebraic;
            return this;
        }

        public Builder z1(ExactReal z1) {
            this.z1 = z1;
            return this;
        }

        public Builder gammaFactors(GammaData gammaFactors) {
            this.gammaFactors = gammaFactors;
            return this;
        }

        public Builder traceHash(Long traceHash) {
            this.traceHash = traceHash;
            return this;
        }

        public Builder rootAngle(ExactReal rootAngle) {
            this.rootAngle = rootAngle;
            return this;
        }

        public LabelRecord build() {
            return new LabelRecord(this);
        }
    }
}

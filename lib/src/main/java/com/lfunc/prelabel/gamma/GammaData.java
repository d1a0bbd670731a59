package com.lfunc.prelabel.gamma;

import com.lfunc.prelabel.number.ExactComplex;
import java.util.List;
import java.util.Objects;

/**
 * Gamma-factor parameters of an L-function: the shifts of its real ({@code Gamma_R}) factors and of
 * its complex ({@code Gamma_C}) factors, in the order they were supplied.
 */
public final class GammaData {
    private final List<ExactComplex> gr;
    private final List<ExactComplex> gc;

    public GammaData(List<ExactComplex> gr, List<ExactComplex> gc) {
        this.gr = List.copyOf(Objects.requireNonNull(gr, "gr"));
        this.gc = List.copyOf(Objects.requireNonNull(gc, "gc"));
    }

    public List<ExactComplex> getGr() {
        return gr;
    }

    public List<ExactComplex> getGc() {
        return gc;
    }

    /** Degree implied by the data: one per real factor, two per complex factor. */
    public int impliedDegree() {
        return gr.size() + 2 * gc.size();
    }

    /** Renders as {@code [[r1,r2],[c1]]} with every parameter in its printed form. */
    public String render() {
        return "[" + renderList(gr) + "," + renderList(gc) + "]";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof GammaData)) {
            return false;
        }
        GammaData other = (GammaData) obj;
        return gr.equals(other.gr) && gc.equals(other.gc);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gr, gc);
    }

    @Override
    public String toString() {
        return render();
    }

    private static String renderList(List<ExactComplex> values) {
        StringBuilder builder = new StringBuilder("[");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(values.get(i).render().replace(" ", ""));
        }
        return builder.append(']').toString();
    }
}

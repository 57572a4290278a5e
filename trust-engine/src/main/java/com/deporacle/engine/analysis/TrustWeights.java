package com.deporacle.engine.analysis;

import com.deporacle.engine.config.EngineConfig;

import java.util.Locale;

/**
 * Per-dimension weights of the trust score. Construction fails unless every
 * weight is non-negative and the weights sum to 1.0 within 0.01.
 *
 * @author Naveed Gung
 */
public record TrustWeights(double security, double maintainer, double activity,
        double popularity, double funding, double license) {

    private static final double TOLERANCE = 0.01;

    public TrustWeights {
        double[] all = {security, maintainer, activity, popularity, funding, license};
        for (double weight : all) {
            if (weight < 0 || Double.isNaN(weight)) {
                throw new IllegalArgumentException("Trust score weights must not be negative, got " + weight);
            }
        }
        double total = security + maintainer + activity + popularity + funding + license;
        if (Math.abs(total - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, "Trust score weights must sum to 1.0, got %.4f", total));
        }
    }

    public static TrustWeights defaults() {
        return new TrustWeights(0.25, 0.25, 0.20, 0.15, 0.10, 0.05);
    }

    public static TrustWeights from(EngineConfig.Weights w) {
        return new TrustWeights(w.getSecurity(), w.getMaintainer(), w.getActivity(),
                w.getPopularity(), w.getFunding(), w.getLicense());
    }

    public double weightOf(TrustDimension dimension) {
        return switch (dimension) {
            case SECURITY -> security;
            case MAINTAINER -> maintainer;
            case ACTIVITY -> activity;
            case POPULARITY -> popularity;
            case FUNDING -> funding;
            case LICENSE -> license;
        };
    }
}

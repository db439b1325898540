package com.spectral.rtm.api;

/**
 * One named, retrieved state vector element.
 */
public record StateElement(String name, double lowerBound, double upperBound, double scale,
        double init, double priorMean, double priorSigma) {

    public StateElement {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("State element needs a name");
        if (lowerBound > upperBound)
            throw new IllegalArgumentException("Invalid bounds for " + name + ": [" + lowerBound + ", "
                    + upperBound + "]");
    }
}

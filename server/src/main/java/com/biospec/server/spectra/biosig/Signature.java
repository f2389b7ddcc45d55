package com.biospec.server.spectra.biosig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Signature {
    private final String name;
    private final List<SignatureFeature> features;
    private final double totalWeight;

    public Signature(String name, List<SignatureFeature> features) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Signature name is required");
        }
        if (features == null || features.isEmpty()) {
            throw new IllegalArgumentException("Signature '" + name + "' has no features");
        }
        this.name = name.trim();
        this.features = Collections.unmodifiableList(new ArrayList<>(features));
        double total = 0.0;
        for (SignatureFeature f : this.features) {
            total += f.getWeight();
        }
        this.totalWeight = total;
    }

    public String getName() {
        return name;
    }

    public List<SignatureFeature> getFeatures() {
        return features;
    }

    public double getTotalWeight() {
        return totalWeight;
    }

    @Override
    public String toString() {
        return name + features;
    }
}

package com.biospec.server.spectra.biosig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only reference signatures, kept in definition order. Loaded once at
 * start-up and shared by every pipeline run without synchronization.
 */
public final class SignatureLibrary {
    private final Map<String, Signature> signatures;

    private SignatureLibrary(Map<String, Signature> signatures) {
        this.signatures = signatures;
    }

    public static SignatureLibrary of(List<Signature> signatures) {
        Map<String, Signature> byName = new LinkedHashMap<>();
        if (signatures != null) {
            for (Signature s : signatures) {
                if (byName.putIfAbsent(s.getName(), s) != null) {
                    throw new IllegalArgumentException("Duplicate signature '" + s.getName() + "'");
                }
            }
        }
        return new SignatureLibrary(Collections.unmodifiableMap(byName));
    }

    /**
     * Builds a library from name to feature definitions, in the map's iteration order.
     */
    public static SignatureLibrary fromDefinitions(Map<String, List<SignatureFeature>> definitions) {
        List<Signature> list = new ArrayList<>();
        if (definitions != null) {
            for (Map.Entry<String, List<SignatureFeature>> e : definitions.entrySet()) {
                list.add(new Signature(e.getKey(), e.getValue()));
            }
        }
        return of(list);
    }

    public boolean isEmpty() {
        return signatures.isEmpty();
    }

    public int size() {
        return signatures.size();
    }

    public Signature get(String name) {
        return signatures.get(name);
    }

    public List<Signature> getSignatures() {
        return new ArrayList<>(signatures.values());
    }

    @Override
    public String toString() {
        return "SignatureLibrary" + signatures.keySet();
    }
}

package com.routergen.core.dedup;

import com.routergen.core.example.Example;

/**
 * Deduplicator verdict: the stripped example was admitted, or its fingerprint
 * was already seen in this run.
 */
public final class AdmissionResult {

    private final Example     example;
    private final Fingerprint fingerprint;
    private final boolean     admitted;

    private AdmissionResult(Example example, Fingerprint fingerprint, boolean admitted) {
        this.example     = example;
        this.fingerprint = fingerprint;
        this.admitted    = admitted;
    }

    public static AdmissionResult admitted(Example stripped, Fingerprint fingerprint) {
        return new AdmissionResult(stripped, fingerprint, true);
    }

    public static AdmissionResult duplicate(Fingerprint fingerprint) {
        return new AdmissionResult(null, fingerprint, false);
    }

    public boolean     isAdmitted()     { return admitted; }
    public Example     getExample()     { return example; }
    public Fingerprint getFingerprint() { return fingerprint; }
}

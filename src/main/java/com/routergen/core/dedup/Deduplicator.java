package com.routergen.core.dedup;

import com.routergen.core.example.Example;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deduplicator - strips null-sentinel fields, fingerprints, and admits each
 * fingerprint at most once per run.
 *
 * Check-and-insert is a single {@code Set.add} on a concurrent set, so two
 * workers racing on equal examples admit exactly one.
 */
@Component
public class Deduplicator {

    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

    private final NullFieldStripper stripper;
    private final Set<Fingerprint>  seen = ConcurrentHashMap.newKeySet();

    public Deduplicator(NullFieldStripper stripper) {
        this.stripper = stripper;
    }

    public AdmissionResult admit(Example example) {
        Example stripped = stripper.strip(example);
        Fingerprint fingerprint = Fingerprint.of(stripped);

        if (!seen.add(fingerprint)) {
            log.debug("[Dedup] Duplicate {} for query '{}'", fingerprint, stripped.getQuery());
            return AdmissionResult.duplicate(fingerprint);
        }
        return AdmissionResult.admitted(stripped, fingerprint);
    }

    /** Forget everything; called at the start of each run. */
    public void reset() {
        seen.clear();
    }

    public int size() {
        return seen.size();
    }
}

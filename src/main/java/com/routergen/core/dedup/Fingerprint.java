package com.routergen.core.dedup;

import com.routergen.core.example.Example;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 of the normalized (query, tool call) pair.
 *
 * Normalization lowercases and collapses whitespace in the query and in every
 * argument value; argument keys are sorted. Reasoning, domain and persona do
 * not participate.
 */
public final class Fingerprint {

    private static final char SEPARATOR = '\u001F';

    private final String hex;

    private Fingerprint(String hex) {
        this.hex = hex;
    }

    public static Fingerprint of(Example example) {
        StringBuilder canonical = new StringBuilder();
        canonical.append(normalize(example.getQuery()))
                 .append(SEPARATOR)
                 .append(example.getToolCall().getKind().getTag());

        Map<String, Object> sorted = new TreeMap<>(example.getToolCall().arguments());
        for (Map.Entry<String, Object> arg : sorted.entrySet()) {
            canonical.append(SEPARATOR)
                     .append(arg.getKey())
                     .append('=')
                     .append(normalize(String.valueOf(arg.getValue())));
        }
        return new Fingerprint(DigestUtils.sha256Hex(canonical.toString()));
    }

    static String normalize(String value) {
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public String getHex() {
        return hex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fingerprint)) return false;
        return hex.equals(((Fingerprint) o).hex);
    }

    @Override
    public int hashCode() {
        return hex.hashCode();
    }

    @Override
    public String toString() {
        return hex.substring(0, 12);
    }
}

package org.strata.naming;

import org.strata.options.StrataOptions;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class DefaultNaming implements Naming {
    private final int maxLength;

    public DefaultNaming() {
        this(StrataOptions.Naming.MAX_LENGTH_DEFAULT);
    }

    public DefaultNaming(int maxNameLength) {
        if (maxNameLength < 16) {
            throw new IllegalArgumentException("naming.maxLength must be at least 16, got " + maxNameLength);
        }
        this.maxLength = maxNameLength;
    }

    @Override
    public String uqName(String table, List<String> cols) {
        return withColumns("uq_", table, cols);
    }

    @Override
    public String ixName(String table, List<String> cols) {
        return withColumns("ix_", table, cols);
    }

    private String withColumns(String prefix, String table, List<String> cols) {
        return clampWithHash(prefix + norm(table) + "__" + joinColumns(cols));
    }

    /** Normalized, case-insensitively sorted, joined with '_'. */
    private String joinColumns(List<String> cols) {
        if (cols == null || cols.isEmpty()) return "";
        List<String> normalized = cols.stream()
                .map(this::norm)
                .collect(Collectors.toCollection(ArrayList::new));
        normalized.sort(String.CASE_INSENSITIVE_ORDER);
        return String.join("_", normalized);
    }

    /**
     * Lower-cases and replaces anything outside {@code [A-Za-z0-9_]} with a single '_'.
     * A name with nothing left becomes {@code x}.
     */
    private String norm(String s) {
        if (s == null) return "null";
        String x = s.replaceAll("[^A-Za-z0-9_]", "_")
                .replaceAll("_+", "_")
                .toLowerCase();
        if (x.isEmpty() || x.chars().allMatch(ch -> ch == '_')) {
            return "x";
        }
        return x;
    }

    // Too long: keep a prefix and append '_' + 8 hex chars of SHA-256.
    private String clampWithHash(String name) {
        if (name.length() <= maxLength) return name;
        String hash = stableHash(name);
        int keep = Math.max(1, maxLength - (hash.length() + 1));
        return name.substring(0, keep) + "_" + hash;
    }

    private String stableHash(String input) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
            return String.format("%02x%02x%02x%02x", hash[0], hash[1], hash[2], hash[3]);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package org.synphot.core;

import java.util.*;

/**
 * Descriptive label of a spectrum plus free-form header entries.
 */
public final class Metadata {
    private final String expr;
    private final Map<String, String> extras;

    private Metadata(String expr, Map<String, String> extras) {
        this.expr = expr;
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public static Metadata empty() {
        return new Metadata(null, Collections.emptyMap());
    }

    public static Metadata of(String expr) {
        return new Metadata(expr, Collections.emptyMap());
    }

    /**
     * An {@code expr} entry in {@code extras} is taken as the label.
     */
    public static Metadata of(String expr, Map<String, String> extras) {
        Map<String, String> copy = new LinkedHashMap<>(extras);
        String fromMap = copy.remove("expr");
        return new Metadata(expr != null ? expr : fromMap, copy);
    }

    public static Metadata fromHeader(Map<String, String> header) {
        return of(null, header);
    }

    /**
     * The label, or null if none was given yet.
     */
    public String getExpr() { return expr; }
    public boolean hasExpr() { return expr != null; }

    public Map<String, String> getExtras() { return extras; }
    public String get(String key) { return "expr".equals(key) ? expr : extras.get(key); }

    public Metadata withExpr(String newExpr) {
        return new Metadata(newExpr, extras);
    }

    public Metadata withDefaultExpr(String defaultExpr) {
        return expr != null ? this : new Metadata(defaultExpr, extras);
    }

    public Metadata with(String key, String value) {
        if ("expr".equals(key)) return withExpr(value);
        Map<String, String> copy = new LinkedHashMap<>(extras);
        copy.put(key, value);
        return new Metadata(expr, copy);
    }

    /**
     * Entries of {@code right} overlaid with the entries of this one. The
     * label is dropped so the new spectrum derives its own.
     */
    public Metadata mergeOver(Metadata right) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (right != null) merged.putAll(right.extras);
        merged.putAll(extras);
        return new Metadata(null, merged);
    }

    /**
     * All entries as a flat header map, label under {@code expr}.
     */
    public Map<String, String> toHeader() {
        Map<String, String> header = new LinkedHashMap<>();
        if (expr != null) header.put("expr", expr);
        header.putAll(extras);
        return header;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Metadata)) return false;
        Metadata other = (Metadata) o;
        return Objects.equals(expr, other.expr) && extras.equals(other.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expr, extras);
    }

    @Override
    public String toString() {
        return "Metadata(expr=" + expr + ", " + extras + ")";
    }
}

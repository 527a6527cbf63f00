package com.example.sqlpilot.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.springframework.stereotype.Service;

import com.example.sqlpilot.model.CanonicalResult;
import com.example.sqlpilot.model.EquivalenceResult;

/**
 * Decides whether two result sets are the same. Equal means same row count, same column labels in
 * the same order, same ordering mode and same content.
 */
@Service
public class SemanticEquivalenceChecker {

    private static final Comparator<Object> VALUE_ORDER = SemanticEquivalenceChecker::compareValues;
    private static final Comparator<List<Object>> ROW_ORDER = (a, b) -> {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = VALUE_ORDER.compare(a.get(i), b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    };

    public EquivalenceResult compare(CanonicalResult original, CanonicalResult candidate, double epsilon) {
        if (original.isTruncated() || candidate.isTruncated()) {
            return EquivalenceResult.mismatch("result truncated at the row cap; equivalence cannot be proven");
        }
        if (original.getRowCount() != candidate.getRowCount()) {
            return EquivalenceResult.mismatch(String.format("row count mismatch: %d vs %d",
                    candidate.getRowCount(), original.getRowCount()));
        }
        if (!sameColumns(original.getColumns(), candidate.getColumns())) {
            return EquivalenceResult.mismatch("column mismatch: " + candidate.getColumns() + " vs "
                    + original.getColumns());
        }
        if (original.isOrdered() != candidate.isOrdered()) {
            return EquivalenceResult.mismatch("ordering mismatch: original is " + orderLabel(original)
                    + ", candidate is " + orderLabel(candidate));
        }
        if (original.getDigest().equals(candidate.getDigest())) {
            return EquivalenceResult.match("identical results: " + original.getRowCount() + " rows, digest "
                    + abbreviate(original.getDigest()));
        }
        if (original.isFullyRetained() && candidate.isFullyRetained()) {
            return compareRows(original, candidate, epsilon);
        }
        return EquivalenceResult.mismatch("content mismatch: digests differ (" + abbreviate(original.getDigest())
                + " vs " + abbreviate(candidate.getDigest()) + ")");
    }

    private EquivalenceResult compareRows(CanonicalResult original, CanonicalResult candidate, double epsilon) {
        List<List<Object>> left = new ArrayList<>(original.getRetainedRows());
        List<List<Object>> right = new ArrayList<>(candidate.getRetainedRows());
        if (!original.isOrdered()) {
            left.sort(ROW_ORDER);
            right.sort(ROW_ORDER);
        }
        for (int i = 0; i < left.size(); i++) {
            if (!rowsEqual(left.get(i), right.get(i), epsilon)) {
                return EquivalenceResult.mismatch("content mismatch: row " + (i + 1) + " differs: "
                        + left.get(i) + " vs " + right.get(i));
            }
        }
        return EquivalenceResult.match("results equal within epsilon " + epsilon + ": " + left.size() + " rows");
    }

    private static boolean rowsEqual(List<Object> a, List<Object> b, double epsilon) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!valuesEqual(a.get(i), b.get(i), epsilon)) {
                return false;
            }
        }
        return true;
    }

    static boolean valuesEqual(Object a, Object b, double epsilon) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number && b instanceof Number) {
            if (a instanceof Double || b instanceof Double) {
                double x = ((Number) a).doubleValue();
                double y = ((Number) b).doubleValue();
                if (Double.isNaN(x) || Double.isNaN(y)) {
                    return Double.isNaN(x) && Double.isNaN(y);
                }
                return x == y || Math.abs(x - y) <= epsilon;
            }
            return ((BigDecimal) a).compareTo((BigDecimal) b) == 0;
        }
        return Objects.equals(a, b);
    }

    private static int compareValues(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof Boolean && b instanceof Boolean) {
            return ((Boolean) a).compareTo((Boolean) b);
        }
        return a.toString().compareTo(b.toString());
    }

    private static boolean sameColumns(List<String> a, List<String> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!a.get(i).toLowerCase(Locale.ROOT).equals(b.get(i).toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }

    private static String orderLabel(CanonicalResult result) {
        return result.isOrdered() ? "ordered" : "unordered";
    }

    private static String abbreviate(String digest) {
        return digest.length() > 12 ? digest.substring(0, 12) : digest;
    }
}

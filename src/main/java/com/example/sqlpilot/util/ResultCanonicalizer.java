package com.example.sqlpilot.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;

import com.example.sqlpilot.model.CanonicalResult;
import com.example.sqlpilot.shadow.RowSink;

/**
 * Reduces a result set to a SHA-256 digest that two result sets share exactly when they hold the
 * same rows. Ordered results hash row by row in sequence. Unordered results hash the sorted
 * multiset of row hashes, so row order returned by the engine does not matter.
 *
 * <p>Floating point values are quantized to a multiple of {@code epsilon} before hashing and
 * other numbers are compared by value, so {@code 1.0} and {@code 1.00} hash alike.
 */
public class ResultCanonicalizer implements RowSink {

    private static final HexFormat HEX = HexFormat.of();

    private final boolean ordered;
    private final BigDecimal epsilon;
    private final int retainedRowLimit;

    private final MessageDigest orderedDigest;
    private final List<byte[]> rowHashes = new ArrayList<>();
    private List<List<Object>> retainedRows = new ArrayList<>();
    private List<String> columns = Collections.emptyList();
    private long rowCount;

    public ResultCanonicalizer(boolean ordered, double epsilon, int retainedRowLimit) {
        this.ordered = ordered;
        this.epsilon = BigDecimal.valueOf(epsilon);
        this.retainedRowLimit = retainedRowLimit;
        this.orderedDigest = sha256();
    }

    @Override
    public void begin(List<String> columns) {
        this.columns = List.copyOf(columns);
    }

    @Override
    public void accept(Object[] row) {
        MessageDigest rowDigest = sha256();
        List<Object> normalized = new ArrayList<>(row.length);
        for (Object value : row) {
            Object canonical = normalize(value);
            normalized.add(canonical);
            byte[] token = token(canonical).getBytes(StandardCharsets.UTF_8);
            rowDigest.update(Integer.toString(token.length).getBytes(StandardCharsets.UTF_8));
            rowDigest.update((byte) ':');
            rowDigest.update(token);
        }
        byte[] rowHash = rowDigest.digest();
        if (ordered) {
            orderedDigest.update(rowHash);
        } else {
            rowHashes.add(rowHash);
        }
        rowCount++;
        if (retainedRows != null) {
            if (rowCount <= retainedRowLimit) {
                retainedRows.add(Collections.unmodifiableList(normalized));
            } else {
                retainedRows = null;
            }
        }
    }

    public CanonicalResult finish(boolean truncated) {
        byte[] digest;
        if (ordered) {
            digest = orderedDigest.digest();
        } else {
            rowHashes.sort(Arrays::compare);
            MessageDigest multiset = sha256();
            for (byte[] rowHash : rowHashes) {
                multiset.update(rowHash);
            }
            digest = multiset.digest();
        }
        return CanonicalResult.builder()
                .digest(HEX.formatHex(digest))
                .rowCount(rowCount)
                .columns(columns)
                .ordered(ordered)
                .truncated(truncated)
                .retainedRows(retainedRows != null ? Collections.unmodifiableList(retainedRows) : List.of())
                .build();
    }

    /**
     * Maps a JDBC value onto one of: null, Double, BigDecimal, Boolean or String.
     */
    static Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Double || value instanceof Float) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof BigDecimal) {
            BigDecimal decimal = ((BigDecimal) value).stripTrailingZeros();
            return decimal.signum() == 0 ? BigDecimal.ZERO : decimal;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Number) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof byte[]) {
            return "0x" + HEX.formatHex((byte[]) value);
        }
        return value.toString();
    }

    private String token(Object canonical) {
        if (canonical == null) {
            return "\u0000";
        }
        if (canonical instanceof Double) {
            double d = (Double) canonical;
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return "F" + d;
            }
            BigDecimal quantized = BigDecimal.valueOf(d).divide(epsilon, 0, RoundingMode.HALF_EVEN);
            return "F" + quantized.toPlainString();
        }
        if (canonical instanceof BigDecimal) {
            return "N" + ((BigDecimal) canonical).toPlainString();
        }
        if (canonical instanceof Boolean) {
            return "Z" + canonical;
        }
        return "S" + canonical;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

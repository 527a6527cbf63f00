package com.example.sqlpilot.shadow;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.example.sqlpilot.exception.ShadowExecutionException;

/**
 * Per-table locks shared by every isolation scope of one shadow database.
 *
 * <p>On engines where {@code CREATE INDEX} commits implicitly, an index applied by one request is
 * visible to every other connection until it is dropped. The applying request holds the table
 * exclusively for as long as the index exists. Every other statement holds its tables shared for
 * the duration of that single statement. A request never blocks on its own locks.
 */
class TableLocks {

    private final Map<String, TableState> tables = new HashMap<>();

    private static class TableState {
        private UUID exclusiveOwner;
        private final Map<UUID, Integer> readers = new HashMap<>();

        boolean idle() {
            return exclusiveOwner == null && readers.isEmpty();
        }
    }

    synchronized void acquireShared(UUID owner, Collection<String> names, Duration timeout) {
        long deadline = deadline(timeout);
        while (!sharedAvailable(owner, names)) {
            awaitUntil(deadline, "shared lock on " + names);
        }
        for (String name : names) {
            TableState state = tables.computeIfAbsent(key(name), k -> new TableState());
            state.readers.merge(owner, 1, Integer::sum);
        }
    }

    synchronized void releaseShared(UUID owner, Collection<String> names) {
        for (String name : names) {
            String key = key(name);
            TableState state = tables.get(key);
            if (state == null) {
                continue;
            }
            Integer held = state.readers.get(owner);
            if (held != null) {
                if (held <= 1) {
                    state.readers.remove(owner);
                } else {
                    state.readers.put(owner, held - 1);
                }
            }
            if (state.idle()) {
                tables.remove(key);
            }
        }
        notifyAll();
    }

    synchronized void acquireExclusive(UUID owner, String name, Duration timeout) {
        long deadline = deadline(timeout);
        TableState state = tables.computeIfAbsent(key(name), k -> new TableState());
        while (!exclusiveAvailable(owner, state)) {
            awaitUntil(deadline, "exclusive lock on " + name);
            state = tables.computeIfAbsent(key(name), k -> new TableState());
        }
        state.exclusiveOwner = owner;
    }

    synchronized void releaseExclusive(UUID owner, String name) {
        String key = key(name);
        TableState state = tables.get(key);
        if (state != null && owner.equals(state.exclusiveOwner)) {
            state.exclusiveOwner = null;
            if (state.idle()) {
                tables.remove(key);
            }
        }
        notifyAll();
    }

    synchronized boolean isExclusivelyHeld(String name) {
        TableState state = tables.get(key(name));
        return state != null && state.exclusiveOwner != null;
    }

    private boolean sharedAvailable(UUID owner, Collection<String> names) {
        for (String name : names) {
            TableState state = tables.get(key(name));
            if (state != null && state.exclusiveOwner != null && !state.exclusiveOwner.equals(owner)) {
                return false;
            }
        }
        return true;
    }

    private static boolean exclusiveAvailable(UUID owner, TableState state) {
        if (state.exclusiveOwner != null && !state.exclusiveOwner.equals(owner)) {
            return false;
        }
        for (UUID reader : state.readers.keySet()) {
            if (!reader.equals(owner)) {
                return false;
            }
        }
        return true;
    }

    private void awaitUntil(long deadline, String what) {
        long remaining = deadline - System.currentTimeMillis();
        if (remaining <= 0) {
            throw new ShadowExecutionException("Timed out waiting for " + what, true, null);
        }
        try {
            wait(remaining);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ShadowExecutionException("Interrupted while waiting for " + what, false, e);
        }
    }

    private static long deadline(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return Long.MAX_VALUE;
        }
        return System.currentTimeMillis() + timeout.toMillis();
    }

    static String key(String table) {
        String cleaned = table.replace("\"", "").replace("`", "");
        int dot = cleaned.lastIndexOf('.');
        if (dot >= 0) {
            cleaned = cleaned.substring(dot + 1);
        }
        return cleaned.toLowerCase(Locale.ROOT);
    }
}

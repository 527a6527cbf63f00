package com.example.sqlpilot.shadow;

import java.util.List;

/**
 * Receives the rows of one statement execution as they are read.
 */
public interface RowSink {

    RowSink DISCARD = new RowSink() {
        @Override
        public void begin(List<String> columns) {
        }

        @Override
        public void accept(Object[] row) {
        }
    };

    void begin(List<String> columns);

    void accept(Object[] row);
}

package com.example.sqlpilot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;

import com.example.sqlpilot.model.SchemaContext;
import com.example.sqlpilot.model.TableMetadata;
import com.example.sqlpilot.shadow.AttemptScope;

public class SchemaInspectorTest {

    private static final String SQL = "SELECT o.id FROM orders o JOIN customers c ON c.id = o.customer_id";

    @Test
    public void inspect_CachesMetadataAcrossRequests() {
        AttemptScope scope = mock(AttemptScope.class);
        when(scope.describeTable(any(), eq("orders"))).thenReturn(TableMetadata.builder().name("ORDERS").build());
        when(scope.describeTable(any(), eq("customers"))).thenReturn(null);
        SchemaInspector inspector = new SchemaInspector();

        SchemaContext first = inspector.inspect(SQL, null, scope);
        SchemaContext second = inspector.inspect(SQL, null, scope);

        assertThat(first.table("orders")).isPresent();
        assertThat(first.table("customers")).isEmpty();
        assertThat(second.getTables()).containsOnlyKeys("orders");
        assertThat(inspector.cachedTableCount()).isEqualTo(1);
        verify(scope, times(1)).describeTable(null, "orders");
        verify(scope, times(2)).describeTable(null, "customers");

        inspector.evictAll();
        assertThat(inspector.cachedTableCount()).isZero();
    }

    @Test
    public void inspect_WhileIndexApplied_DoesNotCache() {
        AttemptScope scope = mock(AttemptScope.class);
        when(scope.hasAppliedIndexes()).thenReturn(true);
        when(scope.describeTable(any(), eq("orders"))).thenReturn(TableMetadata.builder().name("ORDERS").build());
        SchemaInspector inspector = new SchemaInspector();

        SchemaContext context = inspector.inspect("SELECT id FROM orders", null, scope);

        assertThat(context.table("orders")).isPresent();
        assertThat(inspector.cachedTableCount()).isZero();
    }
}

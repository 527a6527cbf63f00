package com.example.sqlpilot.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.example.sqlpilot.exception.UnsafeSqlException;
import com.example.sqlpilot.util.SqlStatementInspector.ColumnRef;
import com.example.sqlpilot.util.SqlStatementInspector.IndexTarget;
import com.example.sqlpilot.util.SqlStatementInspector.PredicateReport;

public class SqlStatementInspectorTest {

    @Test
    public void parseSingle_MultipleStatements_Throws() {
        assertThatThrownBy(() -> SqlStatementInspector.parseSingle("SELECT 1; SELECT 2"))
                .isInstanceOf(UnsafeSqlException.class)
                .hasMessageContaining("Multiple statements");
    }

    @Test
    public void parseSingle_Garbage_ThrowsInvalidSql() {
        assertThatThrownBy(() -> SqlStatementInspector.parseSingle("SELEC id FORM orders"))
                .isInstanceOf(UnsafeSqlException.class)
                .hasMessageStartingWith("Invalid SQL");
    }

    @Test
    public void parseSingle_Blank_Throws() {
        assertThatThrownBy(() -> SqlStatementInspector.parseSingle("   "))
                .isInstanceOf(UnsafeSqlException.class);
    }

    @Test
    public void hasTopLevelOrderBy_OnlyOuterOrderCounts() {
        assertThat(SqlStatementInspector.hasTopLevelOrderBy("SELECT id FROM orders ORDER BY id")).isTrue();
        assertThat(SqlStatementInspector.hasTopLevelOrderBy(
                "SELECT x.id FROM (SELECT id FROM orders ORDER BY id) x")).isFalse();
        assertThat(SqlStatementInspector.hasTopLevelOrderBy("SELECT id FROM orders")).isFalse();
    }

    @Test
    public void analyzePredicates_FunctionWrappedColumn_IsReportedAsWrapped() {
        PredicateReport report = SqlStatementInspector.analyzePredicates(
                "SELECT id, total FROM orders WHERE YEAR(created_at) = 2024");

        assertThat(report.getWrappedColumns()).hasSize(1);
        assertThat(report.getWrappedColumns().get(0).getFunction()).isEqualToIgnoringCase("YEAR");
        assertThat(report.getWrappedColumns().get(0).getTable()).isEqualTo("orders");
        assertThat(report.getWrappedColumns().get(0).getColumn()).isEqualTo("created_at");
        assertThat(report.getFilterColumns()).isEmpty();
        assertThat(report.isSelectStar()).isFalse();
    }

    @Test
    public void analyzePredicates_ResolvesAliasesAndLeadingWildcard() {
        PredicateReport report = SqlStatementInspector.analyzePredicates(
                "SELECT * FROM orders o JOIN customers c ON c.id = o.customer_id "
                        + "WHERE o.status = 'NEW' AND c.name LIKE '%smith'");

        assertThat(report.isSelectStar()).isTrue();
        assertThat(report.getFilterColumns())
                .contains(new ColumnRef("orders", "status"), new ColumnRef("customers", "name"));
        assertThat(report.getLeadingWildcardLikes()).containsExactly(new ColumnRef("customers", "name"));
    }

    @Test
    public void analyzePredicates_CastCountsAsWrapping() {
        PredicateReport report = SqlStatementInspector.analyzePredicates(
                "SELECT id FROM orders WHERE CAST(total AS INT) > 10");

        assertThat(report.getWrappedColumns()).extracting("column").containsExactly("total");
        assertThat(report.getWrappedColumns()).extracting("function").containsExactly("CAST");
    }

    @Test
    public void indexTarget_ReadsIndexAndTableName() {
        IndexTarget target = SqlStatementInspector.indexTarget(
                "CREATE INDEX idx_orders_created ON orders (created_at)");

        assertThat(target.getIndexName()).isEqualTo("idx_orders_created");
        assertThat(target.getTableName()).isEqualTo("orders");
    }

    @Test
    public void indexTarget_NotAnIndex_Throws() {
        assertThatThrownBy(() -> SqlStatementInspector.indexTarget("SELECT 1"))
                .isInstanceOf(UnsafeSqlException.class);
    }
}

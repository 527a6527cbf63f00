package com.example.sqlpilot.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.example.sqlpilot.exception.UnsafeSqlException;

import lombok.Value;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.CastExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.relational.LikeExpression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.create.index.CreateIndex;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.AllTableColumns;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectBody;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;

/**
 * Read-only structural questions about a SQL statement, answered with JSqlParser.
 */
public class SqlStatementInspector {

    @Value
    public static class ColumnRef {
        String table;
        String column;
    }

    @Value
    public static class WrappedColumn {
        String function;
        String table;
        String column;
    }

    @Value
    public static class PredicateReport {
        List<ColumnRef> filterColumns;
        List<WrappedColumn> wrappedColumns;
        List<ColumnRef> leadingWildcardLikes;
        boolean selectStar;
    }

    @Value
    public static class IndexTarget {
        String indexName;
        String tableName;
    }

    public static Statement parseSingle(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new UnsafeSqlException("SQL statement is empty");
        }
        Statements statements;
        try {
            statements = CCJSqlParserUtil.parseStatements(sql);
        } catch (JSQLParserException e) {
            throw new UnsafeSqlException("Invalid SQL: " + firstLine(e.getMessage()), e);
        }
        List<Statement> parsed = statements.getStatements();
        if (parsed == null || parsed.isEmpty()) {
            throw new UnsafeSqlException("SQL statement is empty");
        }
        if (parsed.size() > 1) {
            throw new UnsafeSqlException("Multiple statements are not allowed");
        }
        return parsed.get(0);
    }

    /**
     * True when the outermost query fixes its row order, which makes order part of its result.
     */
    public static boolean hasTopLevelOrderBy(String sql) {
        Statement statement = parseSingle(sql);
        if (!(statement instanceof Select)) {
            return false;
        }
        SelectBody body = ((Select) statement).getSelectBody();
        List<OrderByElement> orderBy = null;
        if (body instanceof PlainSelect) {
            orderBy = ((PlainSelect) body).getOrderByElements();
        } else if (body instanceof SetOperationList) {
            orderBy = ((SetOperationList) body).getOrderByElements();
        }
        return orderBy != null && !orderBy.isEmpty();
    }

    public static IndexTarget indexTarget(String ddl) {
        Statement statement = parseSingle(ddl);
        if (!(statement instanceof CreateIndex)) {
            throw new UnsafeSqlException("Not a CREATE INDEX statement");
        }
        CreateIndex createIndex = (CreateIndex) statement;
        if (createIndex.getIndex() == null || createIndex.getIndex().getName() == null) {
            throw new UnsafeSqlException("Index DDL must name the index");
        }
        return new IndexTarget(createIndex.getIndex().getName(), createIndex.getTable().getFullyQualifiedName());
    }

    public static PredicateReport analyzePredicates(String sql) {
        Statement statement = parseSingle(sql);
        PredicateCollector collector = new PredicateCollector();
        if (statement instanceof Select) {
            collectFromBody(((Select) statement).getSelectBody(), collector);
        }
        return new PredicateReport(
                Collections.unmodifiableList(collector.filterColumns),
                Collections.unmodifiableList(collector.wrappedColumns),
                Collections.unmodifiableList(collector.leadingWildcardLikes),
                collector.selectStar);
    }

    private static void collectFromBody(SelectBody body, PredicateCollector collector) {
        if (body instanceof SetOperationList) {
            for (SelectBody select : ((SetOperationList) body).getSelects()) {
                collectFromBody(select, collector);
            }
            return;
        }
        if (!(body instanceof PlainSelect)) {
            return;
        }
        PlainSelect plainSelect = (PlainSelect) body;
        for (SelectItem item : plainSelect.getSelectItems()) {
            if (item instanceof AllColumns || item instanceof AllTableColumns) {
                collector.selectStar = true;
            }
        }
        Map<String, String> aliases = new HashMap<>();
        List<String> tables = new ArrayList<>();
        registerFromItem(plainSelect.getFromItem(), aliases, tables);
        if (plainSelect.getJoins() != null) {
            for (Join join : plainSelect.getJoins()) {
                registerFromItem(join.getRightItem(), aliases, tables);
            }
        }
        Expression where = plainSelect.getWhere();
        if (where != null) {
            collector.aliases = aliases;
            collector.defaultTable = tables.size() == 1 ? tables.get(0) : null;
            where.accept(collector);
        }
    }

    private static void registerFromItem(FromItem fromItem, Map<String, String> aliases, List<String> tables) {
        if (fromItem instanceof Table) {
            Table table = (Table) fromItem;
            tables.add(table.getName());
            aliases.put(table.getName().toLowerCase(Locale.ROOT), table.getName());
            if (table.getAlias() != null) {
                aliases.put(table.getAlias().getName().toLowerCase(Locale.ROOT), table.getName());
            }
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "parse error";
        }
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }

    private static class PredicateCollector extends ExpressionVisitorAdapter {
        private final List<ColumnRef> filterColumns = new ArrayList<>();
        private final List<WrappedColumn> wrappedColumns = new ArrayList<>();
        private final List<ColumnRef> leadingWildcardLikes = new ArrayList<>();
        private boolean selectStar;
        private Map<String, String> aliases = new HashMap<>();
        private String defaultTable;

        @Override
        public void visit(Column column) {
            filterColumns.add(resolve(column));
        }

        @Override
        public void visit(Function function) {
            recordWrapped(function.getName(), function);
        }

        @Override
        public void visit(CastExpression cast) {
            recordWrapped("CAST", cast.getLeftExpression());
        }

        @Override
        public void visit(LikeExpression like) {
            Expression left = like.getLeftExpression();
            Expression right = like.getRightExpression();
            if (!like.isNot() && left instanceof Column && right instanceof StringValue
                    && ((StringValue) right).getValue().startsWith("%")) {
                leadingWildcardLikes.add(resolve((Column) left));
            }
            super.visit(like);
        }

        private void recordWrapped(String functionName, Expression wrapped) {
            if (wrapped == null) {
                return;
            }
            List<Column> inner = new ArrayList<>();
            wrapped.accept(new ExpressionVisitorAdapter() {
                @Override
                public void visit(Column column) {
                    inner.add(column);
                }
            });
            for (Column column : inner) {
                ColumnRef ref = resolve(column);
                wrappedColumns.add(new WrappedColumn(functionName, ref.getTable(), ref.getColumn()));
            }
        }

        private ColumnRef resolve(Column column) {
            String table = defaultTable;
            Table qualifier = column.getTable();
            if (qualifier != null && qualifier.getName() != null) {
                table = aliases.getOrDefault(qualifier.getName().toLowerCase(Locale.ROOT), qualifier.getName());
            }
            return new ColumnRef(table, column.getColumnName());
        }
    }
}

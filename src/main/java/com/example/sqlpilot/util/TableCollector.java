package com.example.sqlpilot.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectBody;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.SubJoin;
import net.sf.jsqlparser.statement.select.SubSelect;
import net.sf.jsqlparser.statement.select.WithItem;

/**
 * Collects the physical tables a query reads, including those behind joins, derived tables,
 * set operations and CTEs. CTE names themselves are not reported.
 */
public class TableCollector {

    public static List<String> collectTables(String sql) {
        return collectTables(SqlStatementInspector.parseSingle(sql));
    }

    public static List<String> collectTables(Statement statement) {
        Set<String> tables = new LinkedHashSet<>();
        Set<String> cteNames = new LinkedHashSet<>();
        if (statement instanceof Select) {
            Select select = (Select) statement;
            if (select.getWithItemsList() != null) {
                for (WithItem withItem : select.getWithItemsList()) {
                    cteNames.add(withItem.getName().toLowerCase(Locale.ROOT));
                    if (withItem.getSubSelect() != null) {
                        collectTablesFromSelectBody(withItem.getSubSelect().getSelectBody(), tables);
                    }
                }
            }
            collectTablesFromSelectBody(select.getSelectBody(), tables);
        }
        List<String> result = new ArrayList<>();
        for (String table : tables) {
            if (!cteNames.contains(table.toLowerCase(Locale.ROOT))) {
                result.add(table);
            }
        }
        return result;
    }

    private static void collectTablesFromSelectBody(SelectBody selectBody, Set<String> tables) {
        if (selectBody instanceof PlainSelect) {
            PlainSelect plainSelect = (PlainSelect) selectBody;
            collectTablesFromFromItem(plainSelect.getFromItem(), tables);

            if (plainSelect.getJoins() != null) {
                for (Join join : plainSelect.getJoins()) {
                    collectTablesFromFromItem(join.getRightItem(), tables);
                }
            }
        } else if (selectBody instanceof SetOperationList) {
            SetOperationList setOpList = (SetOperationList) selectBody;
            for (SelectBody select : setOpList.getSelects()) {
                collectTablesFromSelectBody(select, tables);
            }
        }
    }

    private static void collectTablesFromFromItem(FromItem fromItem, Set<String> tables) {
        if (fromItem instanceof Table) {
            Table table = (Table) fromItem;
            tables.add(table.getName());
        } else if (fromItem instanceof SubJoin) {
            SubJoin subJoin = (SubJoin) fromItem;
            collectTablesFromFromItem(subJoin.getLeft(), tables);
            for (Join join : subJoin.getJoinList()) {
                collectTablesFromFromItem(join.getRightItem(), tables);
            }
        } else if (fromItem instanceof SubSelect) {
            collectTablesFromSelectBody(((SubSelect) fromItem).getSelectBody(), tables);
        }
    }
}

package db.embed.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.embed.catalog.CatalogManager;
import db.embed.error.DbException;
import db.embed.exec.JoinOperator;
import db.embed.exec.Operator;
import db.embed.exec.ProjectionOperator;
import db.embed.exec.SeqScanOperator;
import db.embed.storage.Table;

/**
 * Planner: builds physical pipeline for a SelectQuery.
 * Current strategy:
 *  1. Single table: SeqScanOperator over the table rows.
 *  2. JOIN: SeqScanOperator on both sides feeding a nested-loop JoinOperator; labels are qualified.
 *  3. Apply ProjectionOperator if a non-empty column list was specified (empty list means SELECT *).
 * All table and column names are resolved here, before any row is produced.
 */
public class QueryPlanner {
    private static final Logger logger = LoggerFactory.getLogger(QueryPlanner.class);

    private final CatalogManager catalog;

    public QueryPlanner(CatalogManager catalog) {
        this.catalog = catalog;
    }

    public Operator plan(SelectQuery query) {
        Operator root;
        Table left = catalog.table(query.tableName());
        if (query.join() != null) {
            JoinSpec join = query.join();
            Table right = catalog.table(join.rightTable());
            int leftIdx = left.schema().indexOf(join.leftColumn());
            if (leftIdx < 0) throw DbException.unknownColumn(join.leftColumn());
            int rightIdx = right.schema().indexOf(join.rightColumn());
            if (rightIdx < 0) throw DbException.unknownColumn(join.rightColumn());
            root = new JoinOperator(new SeqScanOperator(left, true), new SeqScanOperator(right, true), leftIdx, rightIdx);
            logger.debug("Planned nested-loop join {}.{} = {}.{}", left.name(), join.leftColumn(), right.name(), join.rightColumn());
        } else {
            root = new SeqScanOperator(left);
        }
        if (!query.isStar()) {
            root = ProjectionOperator.forColumnNames(root, query.columns());
        }
        return root;
    }
}

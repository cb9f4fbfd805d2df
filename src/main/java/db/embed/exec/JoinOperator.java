package db.embed.exec;

import java.util.ArrayList;
import java.util.List;

import db.embed.storage.Record;
import db.embed.storage.Value;

/**
 * Nested loop INNER JOIN operator for equality join: left[leftIndex] == right[rightIndex].
 * The right side is materialized once on open; output order is left rows in order, and for
 * each of them the matching right rows in order. Values of different kinds never match.
 * No index is consulted: cost is |left| * |right| comparisons.
 */
public class JoinOperator implements Operator {
    private final Operator left;
    private final Operator right;
    private final int leftIndex;
    private final int rightIndex;
    private final List<String> joinedColumns;

    private List<Row> rightRows;
    private Row currentLeft;
    private int rightPos;

    public JoinOperator(Operator left, Operator right, int leftIndex, int rightIndex) {
        this.left = left; this.right = right; this.leftIndex = leftIndex; this.rightIndex = rightIndex;
        List<String> cols = new ArrayList<>(left.columns().size() + right.columns().size());
        cols.addAll(left.columns());
        cols.addAll(right.columns());
        this.joinedColumns = List.copyOf(cols);
    }

    @Override
    public void open() {
        left.open();
        right.open();
        rightRows = new ArrayList<>();
        Row r;
        while ((r = right.next()) != null) rightRows.add(r);
        right.close(); // no longer needed
        currentLeft = left.next();
        rightPos = 0;
    }

    @Override
    public Row next() {
        while (currentLeft != null) {
            Value key = currentLeft.values().get(leftIndex);
            while (rightPos < rightRows.size()) {
                Row candidate = rightRows.get(rightPos++);
                if (key.equals(candidate.values().get(rightIndex))) {
                    List<Value> combined = new ArrayList<>(currentLeft.values().size() + candidate.values().size());
                    combined.addAll(currentLeft.values());
                    combined.addAll(candidate.values());
                    return Row.of(new Record(combined), joinedColumns);
                }
            }
            // right side exhausted for this left row
            currentLeft = left.next();
            rightPos = 0;
        }
        return null;
    }

    @Override
    public void close() {
        left.close();
        rightRows = null;
        currentLeft = null;
    }

    @Override
    public List<String> columns() { return joinedColumns; }
}

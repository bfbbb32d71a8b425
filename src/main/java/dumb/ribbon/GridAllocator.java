package dumb.ribbon;

import dumb.ribbon.RibbonException.ConfigurationException;
import dumb.ribbon.RibbonException.InvalidSpanException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Hands out rectangular regions of a grid with a fixed number of rows and a
 * number of columns that grows on demand. Reservations are permanent: there is
 * no way to give cells back.
 */
public class GridAllocator {
    private static final Logger logger = LoggerFactory.getLogger(GridAllocator.class);

    private int rows;
    /** cells[row][col], true while free. Every row has the same length. */
    private boolean[][] cells;
    private boolean placed = false;

    public GridAllocator(int rows) {
        this.rows = checkRows(rows);
        this.cells = freeGrid(rows, 1);
    }

    private static int checkRows(int rows) {
        if (rows < 1) throw new ConfigurationException("Row count must be positive, got " + rows);
        return rows;
    }

    private static boolean[][] freeGrid(int rows, int cols) {
        var grid = new boolean[rows][cols];
        for (var row : grid) Arrays.fill(row, true);
        return grid;
    }

    public int rowCount() {
        return rows;
    }

    public int columnCount() {
        return cells[0].length;
    }

    public boolean isFree(int row, int col) {
        return cells[row][col];
    }

    public boolean hasPlacements() {
        return placed;
    }

    /**
     * Changes the row count of an allocator that has not placed anything yet.
     *
     * @throws ConfigurationException once any cells have been handed out
     */
    public void setRowCount(int rows) {
        if (placed)
            throw new ConfigurationException("Row count is fixed once cells have been requested");
        this.rows = checkRows(rows);
        this.cells = freeGrid(rows, 1);
    }

    /**
     * Reserves a {@code rowSpan x colSpan} region and returns its top-left cell.
     *
     * @throws InvalidSpanException if a span is not positive or {@code rowSpan} exceeds the row count;
     *                              the grid is left untouched
     */
    public Placement requestCells(int rowSpan, int colSpan, Mode mode) {
        if (rowSpan > rows) throw new InvalidSpanException("Row span " + rowSpan + " exceeds " + rows + " rows");
        if (rowSpan < 1 || colSpan < 1)
            throw new InvalidSpanException("Spans must be positive, got " + rowSpan + "x" + colSpan);

        var p = switch (mode) {
            case COLUMN_WISE -> findColumnWise(rowSpan, colSpan);
            case ROW_WISE -> findRowWise(colSpan);
        };
        if (p == null) p = growAndPlace(rowSpan, colSpan);
        placed = true;
        logger.debug("Placed {}x{} {} at {}, grid now {}x{}", rowSpan, colSpan, mode, p, rows, columnCount());
        return p;
    }

    private Placement findColumnWise(int rowSpan, int colSpan) {
        var cols = columnCount();
        for (var r = 0; r <= rows - rowSpan; r++) {
            for (var c = 0; c <= cols - colSpan; c++) {
                if (allFree(r, c, rowSpan, colSpan)) {
                    occupy(r, c, rowSpan, colSpan);
                    return new Placement(r, c);
                }
            }
        }
        return null;
    }

    /** First column whose run of free cells in row 0 reaches the right edge. */
    private Placement findRowWise(int colSpan) {
        var cols = columnCount();
        for (var c = 0; c < cols; c++) {
            if (allFree(0, c, 1, cols - c)) {
                var run = cols - c;
                if (run < colSpan) appendColumns(colSpan - run);
                occupy(0, c, 1, colSpan);
                return new Placement(0, c);
            }
        }
        return null;
    }

    /**
     * Opens new columns at the right edge and places the region at row 0. A
     * completely free last column is reused as the first column of the region.
     */
    private Placement growAndPlace(int rowSpan, int colSpan) {
        var start = columnCount();
        var added = colSpan;
        if (allFree(0, start - 1, rows, 1)) {
            start--;
            added--;
        }
        appendColumns(added);
        occupy(0, start, rowSpan, colSpan);
        return new Placement(0, start);
    }

    private void appendColumns(int n) {
        if (n <= 0) return;
        var cols = columnCount() + n;
        for (var r = 0; r < rows; r++) {
            var from = cells[r].length;
            cells[r] = Arrays.copyOf(cells[r], cols);
            Arrays.fill(cells[r], from, cols, true);
        }
    }

    private boolean allFree(int row, int col, int rowSpan, int colSpan) {
        for (var r = row; r < row + rowSpan; r++)
            for (var c = col; c < col + colSpan; c++)
                if (!cells[r][c]) return false;
        return true;
    }

    private void occupy(int row, int col, int rowSpan, int colSpan) {
        for (var r = row; r < row + rowSpan; r++)
            Arrays.fill(cells[r], col, col + colSpan, false);
    }

    /** How free space is searched. */
    public enum Mode {
        /** Lowest free row first, then lowest column: fills a column before opening the next. */
        COLUMN_WISE,
        /** Appends along row 0 only. */
        ROW_WISE
    }

    /** Top-left cell of a reserved region. */
    public record Placement(int row, int col) {
        @Override
        public String toString() {
            return "(" + row + "," + col + ")";
        }
    }
}

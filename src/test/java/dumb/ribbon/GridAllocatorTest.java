package dumb.ribbon;

import dumb.ribbon.GridAllocator.Mode;
import dumb.ribbon.GridAllocator.Placement;
import dumb.ribbon.RibbonException.ConfigurationException;
import dumb.ribbon.RibbonException.InvalidSpanException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class GridAllocatorTest {

    @Test
    void startsWithOneFreeColumn() {
        var g = new GridAllocator(4);
        assertEquals(4, g.rowCount());
        assertEquals(1, g.columnCount());
        for (var r = 0; r < 4; r++) assertTrue(g.isFree(r, 0));
        assertFalse(g.hasPlacements());
    }

    @Test
    void columnWiseFillsColumnBeforeOpeningNext() {
        var g = new GridAllocator(6);
        assertEquals(new Placement(0, 0), g.requestCells(2, 1, Mode.COLUMN_WISE));
        assertEquals(new Placement(2, 0), g.requestCells(2, 1, Mode.COLUMN_WISE));
        assertEquals(new Placement(4, 0), g.requestCells(2, 1, Mode.COLUMN_WISE));
        assertEquals(1, g.columnCount());
        assertEquals(new Placement(0, 1), g.requestCells(2, 1, Mode.COLUMN_WISE));
        assertEquals(2, g.columnCount());
    }

    @Test
    void columnWisePrefersLowestRowThenLowestColumn() {
        var g = new GridAllocator(3);
        g.requestCells(3, 1, Mode.COLUMN_WISE);
        g.requestCells(1, 1, Mode.COLUMN_WISE); // opens column 1 at row 0
        assertEquals(new Placement(1, 1), g.requestCells(1, 1, Mode.COLUMN_WISE));
        assertEquals(new Placement(2, 1), g.requestCells(1, 1, Mode.COLUMN_WISE));
    }

    @Test
    void rowWiseAppendsAlongFirstRow() {
        var g = new GridAllocator(3);
        assertEquals(new Placement(0, 0), g.requestCells(1, 2, Mode.ROW_WISE));
        assertEquals(2, g.columnCount());
        assertEquals(new Placement(0, 2), g.requestCells(1, 2, Mode.ROW_WISE));
        assertEquals(4, g.columnCount());
        assertEquals(new Placement(0, 4), g.requestCells(1, 2, Mode.ROW_WISE));
        assertEquals(6, g.columnCount());
        for (var c = 0; c < 6; c++) {
            assertFalse(g.isFree(0, c));
            assertTrue(g.isFree(1, c));
            assertTrue(g.isFree(2, c));
        }
    }

    @Test
    void rowWiseOnSingleRowAllocator() {
        var g = new GridAllocator(1);
        assertEquals(new Placement(0, 0), g.requestCells(1, 2, Mode.ROW_WISE));
        assertEquals(new Placement(0, 2), g.requestCells(1, 2, Mode.ROW_WISE));
        assertEquals(new Placement(0, 4), g.requestCells(1, 2, Mode.ROW_WISE));
        assertEquals(6, g.columnCount());
    }

    @Test
    void rowWiseLeavesLowerRowsToColumnWise() {
        var g = new GridAllocator(2);
        g.requestCells(1, 1, Mode.ROW_WISE);
        assertEquals(new Placement(1, 0), g.requestCells(1, 1, Mode.COLUMN_WISE));
        assertEquals(new Placement(0, 1), g.requestCells(1, 1, Mode.ROW_WISE));
    }

    @Test
    void growthReusesFreeTrailingColumn() {
        var g = new GridAllocator(6);
        assertEquals(new Placement(0, 0), g.requestCells(2, 3, Mode.COLUMN_WISE));
        assertEquals(3, g.columnCount(), "one free column reused, two appended");
        for (var c = 0; c < 3; c++) {
            assertFalse(g.isFree(0, c));
            assertFalse(g.isFree(1, c));
            assertTrue(g.isFree(2, c));
        }
    }

    @Test
    void growthAppendsFullSpanWhenLastColumnIsUsed() {
        var g = new GridAllocator(2);
        g.requestCells(1, 1, Mode.COLUMN_WISE);
        assertEquals(new Placement(0, 1), g.requestCells(1, 2, Mode.COLUMN_WISE));
        assertEquals(3, g.columnCount());
        assertTrue(g.isFree(1, 0));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 6})
    void rejectsRowSpanBeyondRowCount(int rows) {
        var g = new GridAllocator(rows);
        assertThrows(InvalidSpanException.class, () -> g.requestCells(rows + 1, 1, Mode.COLUMN_WISE));
        assertThrows(InvalidSpanException.class, () -> g.requestCells(rows + 1, 1, Mode.ROW_WISE));
        assertEquals(1, g.columnCount());
        assertFalse(g.hasPlacements());
    }

    @Test
    void rejectsNonPositiveSpans() {
        var g = new GridAllocator(3);
        assertThrows(InvalidSpanException.class, () -> g.requestCells(0, 1, Mode.COLUMN_WISE));
        assertThrows(InvalidSpanException.class, () -> g.requestCells(1, 0, Mode.ROW_WISE));
    }

    @Test
    void failedRequestLeavesGridUntouched() {
        var g = new GridAllocator(3);
        g.requestCells(2, 2, Mode.COLUMN_WISE);
        var before = snapshot(g);
        assertThrows(InvalidSpanException.class, () -> g.requestCells(4, 1, Mode.COLUMN_WISE));
        assertEquals(before, snapshot(g));
    }

    @Test
    void rejectsNonPositiveRowCount() {
        assertThrows(ConfigurationException.class, () -> new GridAllocator(0));
    }

    @Test
    void rowCountFixedAfterFirstPlacement() {
        var g = new GridAllocator(6);
        g.setRowCount(4);
        assertEquals(4, g.rowCount());
        g.requestCells(1, 1, Mode.COLUMN_WISE);
        assertThrows(ConfigurationException.class, () -> g.setRowCount(6));
        assertEquals(4, g.rowCount());
    }

    @Test
    void repeatedRequestsNeverOverlapAndGridOnlyGrows() {
        var rnd = new Random(42);
        var rows = 6;
        var g = new GridAllocator(rows);
        List<int[]> rects = new ArrayList<>();
        var cols = g.columnCount();
        for (var i = 0; i < 400; i++) {
            var mode = rnd.nextInt(3) == 0 ? Mode.ROW_WISE : Mode.COLUMN_WISE;
            var rowSpan = mode == Mode.ROW_WISE ? 1 : 1 + rnd.nextInt(rows);
            var colSpan = 1 + rnd.nextInt(3);

            var expected = mode == Mode.COLUMN_WISE ? firstFit(g, rowSpan, colSpan) : null;
            var p = g.requestCells(rowSpan, colSpan, mode);
            if (expected != null) assertEquals(expected, p, "column-wise takes the first fit");
            if (mode == Mode.ROW_WISE) assertEquals(0, p.row());

            assertTrue(g.columnCount() >= cols);
            cols = g.columnCount();

            var rect = new int[]{p.row(), p.col(), rowSpan, colSpan};
            for (var other : rects) assertFalse(intersects(rect, other), "overlap at request " + i);
            for (var r = p.row(); r < p.row() + rowSpan; r++)
                for (var c = p.col(); c < p.col() + colSpan; c++)
                    assertFalse(g.isFree(r, c));
            rects.add(rect);
        }
    }

    private static Placement firstFit(GridAllocator g, int rowSpan, int colSpan) {
        for (var r = 0; r <= g.rowCount() - rowSpan; r++)
            for (var c = 0; c <= g.columnCount() - colSpan; c++) {
                var free = true;
                for (var rr = r; rr < r + rowSpan && free; rr++)
                    for (var cc = c; cc < c + colSpan && free; cc++)
                        free = g.isFree(rr, cc);
                if (free) return new Placement(r, c);
            }
        return null;
    }

    private static boolean intersects(int[] a, int[] b) {
        return a[0] < b[0] + b[2] && b[0] < a[0] + a[2] && a[1] < b[1] + b[3] && b[1] < a[1] + a[3];
    }

    private static String snapshot(GridAllocator g) {
        var sb = new StringBuilder();
        for (var r = 0; r < g.rowCount(); r++) {
            for (var c = 0; c < g.columnCount(); c++) sb.append(g.isFree(r, c) ? '.' : '#');
            sb.append('\n');
        }
        return sb.toString();
    }
}

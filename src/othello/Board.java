package othello;

import java.util.Arrays;

/**
 * A fixed DIM x DIM grid of cell states addressed by zero-based (row, column). The dimensions never
 * change and no cell is ever null
 */
public class Board {

    public static final byte DIM = 8; // the dimension of the board
    public static final byte MAX = DIM * DIM;
    // total number of cells on the board

    private final CellState[][] cells;

    /**
     * Create an empty board
     */
    public Board() {
        cells = new CellState[DIM][DIM];
        fill(CellState.EMPTY);
    }

    /**
     * Create a copy of an original Board.
     * @param original
     */
    public Board(Board original) {
        cells = new CellState[DIM][];
        for (byte i = 0; i < DIM; i++)
            cells[i] = Arrays.copyOf(original.cells[i], DIM);
    }

    /**
     * Build a board from DIM lines of DIM display chars each ('O', 'X' or '.'). Whitespace inside a
     * line is ignored, so rows may be written with spaces between the cells
     * @param text
     * @return
     */
    public static Board parse(String text) {
        String[] lines = text.strip().split("\\R");
        if (lines.length != DIM)
            throw new IllegalArgumentException("Expected " + DIM + " rows, got " + lines.length);
        Board board = new Board();
        for (byte i = 0; i < DIM; i++) {
            String row = lines[i].replaceAll("\\s", "");
            if (row.length() != DIM)
                throw new IllegalArgumentException("Row " + i + " has " + row.length() + " cells");
            for (byte j = 0; j < DIM; j++)
                board.cells[i][j] = CellState.fromName(row.charAt(j));
        }
        return board;
    }

    /**
     * Whether (row, column) lies on the board
     * @param row
     * @param col
     * @return
     */
    public static boolean inBounds(int row, int col) {
        return row >= 0 && row < DIM && col >= 0 && col < DIM;
    }

    /**
     * A getter
     * @throws IndexOutOfBoundsException if (row, col) is off the board
     */
    public CellState get(int row, int col) {
        checkBounds(row, col);
        return cells[row][col];
    }

    /**
     * A setter
     * @throws IndexOutOfBoundsException if (row, col) is off the board
     */
    public void set(int row, int col, CellState state) {
        checkBounds(row, col);
        if (state == null)
            throw new IllegalArgumentException("Cell state must not be null");
        cells[row][col] = state;
    }

    /**
     * Overwrite every cell with the given state
     * @param state
     */
    public void fill(CellState state) {
        if (state == null)
            throw new IllegalArgumentException("Cell state must not be null");
        for (CellState[] row : cells)
            Arrays.fill(row, state);
    }

    /**
     * Number of cells currently holding the given state
     * @param state
     * @return
     */
    public int count(CellState state) {
        int result = 0;
        for (CellState[] row : cells)
            for (CellState cell : row)
                if (cell == state)
                    result++;
        return result;
    }

    /**
     * Whether at least one cell holds the given state
     * @param state
     * @return
     */
    public boolean contains(CellState state) {
        for (CellState[] row : cells)
            for (CellState cell : row)
                if (cell == state)
                    return true;
        return false;
    }

    private static void checkBounds(int row, int col) {
        if (!inBounds(row, col))
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") is off the board");
    }

    /**
     * Get a string representation of the board, one line per row
     * O corresponds to disks of the FIRST player
     * X corresponds to disks of the SECOND player
     * . corresponds to empty cells
     *
     * @return
     */
    @Override
    public String toString() {
        StringBuilder result = new StringBuilder(MAX + DIM);
        for (CellState[] row : cells) {
            for (CellState cell : row)
                result.append(cell.name);
            result.append('\n');
        }
        return result.toString();
    }

    /**
     * Two boards are equal if they hold the same state in every cell
     * @param other
     * @return
     */
    @Override
    public boolean equals(Object other) {
        if (this == other)
            return true;
        if (!(other instanceof Board))
            return false;
        return Arrays.deepEquals(cells, ((Board) other).cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }

    /**
     * A class representing a step on the board (pair of ints)
     */
    static final class Coord {
        final int r, c; // row and column

        Coord(int r, int c) {
            this.r = r;
            this.c = c;
        }
    }
}

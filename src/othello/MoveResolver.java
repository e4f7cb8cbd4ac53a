package othello;

import org.apache.log4j.Logger;

/**
 * Applies the Reversi placement rule. To understand this class it is necessary to understand
 * Reversi game rules (https://en.wikipedia.org/wiki/Reversi - Modern Version)
 */
public final class MoveResolver {

    private final static Logger logger = Logger.getLogger(MoveResolver.class);
    private static final Board.Coord[] DIRS = {new Board.Coord(0, 1), new Board.Coord(1, 1),
            new Board.Coord(1, 0), new Board.Coord(1, -1),
            new Board.Coord(0, -1), new Board.Coord(-1, -1),
            new Board.Coord(-1, 0), new Board.Coord(-1, 1)};
    // the 8 directions in which one can go from a cell.

    private MoveResolver() {
    }

    /**
     * Attempt to place a disk of the active player at (r, c). Every direction is scanned on its
     * own: a ray "ignites" when it starts with one or more opponent disks and ends in a disk of the
     * active player. The disks between the target and the igniting disk are flipped. If no
     * direction ignites, nothing on the board changes.
     * The turn is not advanced here.
     *
     * @param state the game to play in
     * @param r the row where the disk is to be placed
     * @param c the column where the disk is to be placed
     * @return true if the move was legal and has been applied
     */
    public static boolean attemptMove(GameState state, int r, int c) {
        if (!Board.inBounds(r, c)) {
            logger.warn("Rejected move off the board: (" + r + ", " + c + ")");
            return false;
        }
        Board board = state.getBoard();
        if (board.get(r, c) != CellState.EMPTY) {
            logger.debug("Rejected move on occupied cell (" + r + ", " + c + ")");
            return false;
        }
        CellState current = CellState.of(state.getTurn());
        CellState target = CellState.of(state.getTurn().getOpponent());

        int[] reach = new int[DIRS.length];
        // reach[d] - distance to the igniting disk in direction d, 0 if the ray does not ignite
        boolean found = false;
        for (byte d = 0; d < DIRS.length; d++) {
            reach[d] = ignitionDistance(board, r, c, DIRS[d], current, target);
            if (reach[d] > 0)
                found = true;
        }
        if (!found) {
            logger.debug("Rejected move without flips at (" + r + ", " + c + ")");
            return false;
        }

        int flipped = 0;
        for (byte d = 0; d < DIRS.length; d++)
            for (int m = 1; m < reach[d]; m++) { // flipping disks
                board.set(r + DIRS[d].r * m, c + DIRS[d].c * m, current);
                flipped++;
            }
        board.set(r, c, current);
        logger.debug(state.getTurn() + " played (" + r + ", " + c + "), flipped " + flipped);
        return true;
    }

    /**
     * Walk from (r, c) along dir. The first cell must hold an opponent disk, then any number of
     * opponent disks may follow; the first own disk after them ignites the ray
     *
     * @return the multiplier at which the igniting disk sits, or 0 if the ray does not ignite
     */
    private static int ignitionDistance(Board board, int r, int c, Board.Coord dir,
                                        CellState current, CellState target) {
        boolean disksToFlip = false; // there are disks of the opposite color to be flipped
        int m = 1; // multiplier
        while (Board.inBounds(r + dir.r * m, c + dir.c * m)) {
            CellState cell = board.get(r + dir.r * m, c + dir.c * m);
            if (cell == current)
                return disksToFlip ? m : 0;
            if (cell != target)
                return 0;
            disksToFlip = true;
            m++;
        }
        return 0;
    }
}

package othello;

import org.apache.log4j.Logger;

/**
 * Puts a game into the standard starting position
 */
public final class BoardInitializer {

    private final static Logger logger = Logger.getLogger(BoardInitializer.class);

    private BoardInitializer() {
    }

    /**
     * Wipe the board, set both scores to 2 and give the move to FIRST, then place the four centre
     * disks: FIRST on the main diagonal of the centre 2x2 block, SECOND on the anti-diagonal
     * @param state the state to overwrite
     */
    public static void reset(GameState state) {
        Board board = state.getBoard();
        board.fill(CellState.EMPTY);
        state.setScore(Player.FIRST, (byte) (GameState.INIT / 2));
        state.setScore(Player.SECOND, (byte) (GameState.INIT / 2));
        state.setTurn(Player.FIRST);

        int b = Board.DIM / 2;
        int a = b - 1;
        board.set(a, a, CellState.FIRST);
        board.set(b, b, CellState.FIRST);
        board.set(a, b, CellState.SECOND);
        board.set(b, a, CellState.SECOND);
        logger.debug("Board reset to the starting position");
    }
}

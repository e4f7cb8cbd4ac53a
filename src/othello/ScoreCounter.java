package othello;

/**
 * Recomputes the per-player disk counts of a game from its board
 */
public final class ScoreCounter {

    private ScoreCounter() {
    }

    /**
     * Scan every cell and overwrite both scores with the counts found. Idempotent
     * @param state
     */
    public static void recompute(GameState state) {
        byte first = 0;
        byte second = 0;
        Board board = state.getBoard();
        for (byte i = 0; i < Board.DIM; i++)
            for (byte j = 0; j < Board.DIM; j++) {
                CellState cell = board.get(i, j);
                if (cell == CellState.FIRST)
                    first++;
                else if (cell == CellState.SECOND)
                    second++;
            }
        state.setScore(Player.FIRST, first);
        state.setScore(Player.SECOND, second);
    }
}

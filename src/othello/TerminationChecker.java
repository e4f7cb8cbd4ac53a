package othello;

/**
 * Detects the end of a game. Only reports it: stopping input is up to the caller
 */
public final class TerminationChecker {

    private TerminationChecker() {
    }

    /**
     * The game is over once either player has no disks left or the board is full
     * @param state
     * @return
     */
    public static boolean isGameOver(GameState state) {
        Board board = state.getBoard();
        return !board.contains(CellState.FIRST) || !board.contains(CellState.SECOND)
                || !board.contains(CellState.EMPTY);
    }

    /**
     * The player with more disks according to the current scores, or null on a tie. Meaningful
     * once isGameOver() holds, but can be asked at any time
     * @param state
     * @return
     */
    public static Player getWinner(GameState state) {
        int diff = state.getScore(Player.FIRST) - state.getScore(Player.SECOND);
        if (diff > 0)
            return Player.FIRST;
        if (diff < 0)
            return Player.SECOND;
        return null;
    }
}

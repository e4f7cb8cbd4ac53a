package othello;

/**
 * Receives the state of a game after every handled input. Rendering collaborators implement this
 * and read the board through GameState.getBoard() or Game.readCell()
 */
public interface GameListener {

    /**
     * Called at the end of every click, reset and pass, whether or not anything changed
     * @param state
     */
    void boardChanged(GameState state);

    /**
     * Called after a click leaves the game in a finished position. Input is still accepted
     * afterwards
     * @param state
     */
    default void gameOver(GameState state) {
    }
}

package othello;

import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry points for the collaborators around the rules engine. Each handler runs its fixed chain of
 * steps to completion before returning:
 * click: MoveResolver, TurnController.advance (on success only), ScoreCounter, TerminationChecker;
 * reset: BoardInitializer, ScoreCounter;
 * pass: TurnController.toggleManual.
 * Listeners are notified at the end of every chain. Not thread-safe: calls must be serialized by
 * the caller.
 */
public class Game {

    private final static Logger logger = Logger.getLogger(Game.class);

    private final GameState state;
    private final List<GameListener> listeners = new ArrayList<>();

    private Game(GameState state) {
        this.state = state;
    }

    /**
     * Create a game in the starting position. Called once at startup
     * @return
     */
    public static Game initialize() {
        GameState state = new GameState();
        BoardInitializer.reset(state);
        ScoreCounter.recompute(state);
        logger.info("New game, " + state.getTurn() + " to move");
        return new Game(state);
    }

    /**
     * Wrap an existing state, e.g. a position built for analysis or testing
     * @param state
     * @return
     */
    public static Game of(GameState state) {
        if (state == null)
            throw new IllegalArgumentException("state must not be null");
        return new Game(state);
    }

    public void addListener(GameListener listener) {
        if (listener == null)
            throw new IllegalArgumentException("listener must not be null");
        listeners.add(listener);
    }

    public void removeListener(GameListener listener) {
        listeners.remove(listener);
    }

    /**
     * A click resolved to board coordinates. Illegal and off-board clicks change nothing
     * @param row
     * @param col
     * @return true if a disk was placed
     */
    public boolean handleCellClick(int row, int col) {
        boolean moved = MoveResolver.attemptMove(state, row, col);
        if (moved)
            TurnController.advance(state);
        ScoreCounter.recompute(state);
        boolean over = TerminationChecker.isGameOver(state);
        if (over)
            logger.info("Game Over");
        for (GameListener listener : listeners) {
            listener.boardChanged(state);
            if (over)
                listener.gameOver(state);
        }
        return moved;
    }

    /**
     * Start a new game
     */
    public void handleResetSignal() {
        BoardInitializer.reset(state);
        ScoreCounter.recompute(state);
        logger.info("Game reset");
        notifyChanged();
    }

    /**
     * Skip the active player's turn
     */
    public void handlePassSignal() {
        TurnController.toggleManual(state);
        logger.info("Turn passed, " + state.getTurn() + " to move");
        notifyChanged();
    }

    /**
     * The content of a cell, for rendering
     * @throws IndexOutOfBoundsException if (row, col) is off the board
     */
    public CellState readCell(int row, int col) {
        return state.getBoard().get(row, col);
    }

    /**
     * Scores as {FIRST, SECOND}
     * @return
     */
    public byte[] readScores() {
        return new byte[] {state.getScore(Player.FIRST), state.getScore(Player.SECOND)};
    }

    public boolean isGameOver() {
        return TerminationChecker.isGameOver(state);
    }

    public Player getActivePlayer() {
        return state.getTurn();
    }

    /**
     * A getter
     */
    public GameState getState() {
        return state;
    }

    private void notifyChanged() {
        for (GameListener listener : listeners)
            listener.boardChanged(state);
    }
}

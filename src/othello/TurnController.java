package othello;

/**
 * Hands the move from one player to the other
 */
public final class TurnController {

    private TurnController() {
    }

    /**
     * Give the move to the opponent after a successful move
     * @param state
     */
    public static void advance(GameState state) {
        state.reverseTurn();
    }

    /**
     * Give the move to the opponent on an explicit skip, whether or not the player could move.
     * Same effect as advance()
     * @param state
     */
    public static void toggleManual(GameState state) {
        state.reverseTurn();
    }
}

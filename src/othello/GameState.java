package othello;

import java.util.Arrays;

/**
 * The single mutable aggregate of a game: the board, the player to make the next move and the
 * number of disks each player has. Scores are derived from the board and can be recomputed at any
 * time with ScoreCounter. Instances are not thread-safe; all mutation is expected to happen on one
 * thread, one event at a time.
 */
public class GameState {

    public static final byte INIT = 4;
    // total number of disks on the board at the start of a game

    private final Board board;
    private Player turn; // the player to make the next move
    private final byte[] scores; // scores[Player.FIRST.id] - number of FIRST disks on board,
    // scores[Player.SECOND.id] - number of SECOND disks on the board

    /**
     * Create a state with an empty board and FIRST to move. Use BoardInitializer to get the
     * starting position
     */
    public GameState() {
        this(new Board(), Player.FIRST);
    }

    /**
     * Create a state around an arbitrary position. The board is copied and scores are counted
     * from it
     * @param board
     * @param turn
     */
    public GameState(Board board, Player turn) {
        if (board == null || turn == null)
            throw new IllegalArgumentException("board and turn must not be null");
        this.board = new Board(board);
        this.turn = turn;
        this.scores = new byte[2];
        ScoreCounter.recompute(this);
    }

    /**
     * A getter. The returned board is live: changes to it are changes to the game
     */
    public Board getBoard() {
        return board;
    }

    /**
     * A getter
     */
    public Player getTurn() {
        return turn;
    }

    void setTurn(Player turn) {
        this.turn = turn;
    }

    /**
     * Reverses the turn variable
     */
    void reverseTurn() {
        turn = turn.getOpponent();
    }

    /**
     * Number of disks the given player has, as of the last recompute
     * @param player
     * @return
     */
    public byte getScore(Player player) {
        return scores[player.id];
    }

    /**
     * Both scores indexed by Player.id. The returned array is a copy
     * @return
     */
    public byte[] getScores() {
        return Arrays.copyOf(scores, scores.length);
    }

    void setScore(Player player, byte score) {
        scores[player.id] = score;
    }

    @Override
    public String toString() {
        return board.toString() + CellState.FIRST.name + ": " + scores[Player.FIRST.id] + "  "
                + CellState.SECOND.name + ": " + scores[Player.SECOND.id] + "  to move: "
                + CellState.of(turn).name + "\n";
    }
}

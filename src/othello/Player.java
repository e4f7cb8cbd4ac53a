package othello;

/**
 * The two sides of the game. Exactly one of them is active at any time. FIRST moves first and was
 * historically the white side, SECOND was the black one
 */
public enum Player {
    FIRST((byte) 0), SECOND((byte) 1);

    public final byte id; // index into score arrays

    Player(byte id) {
        this.id = id;
    }

    /**
     * Get the other side
     * @return
     */
    public Player getOpponent() {
        return this == FIRST ? SECOND : FIRST;
    }
}

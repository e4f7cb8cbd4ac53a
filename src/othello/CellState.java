package othello;

/***
 * The three states a board cell can be in. The cell can either
 * hold a disk of the FIRST player, one of the SECOND player, or be EMPTY. Unlike Player, a cell
 * may be empty; of() and getOwner() map between the two
 */
public enum CellState {
    FIRST('O'), SECOND('X'), EMPTY('.');

    public final char name; // a char representation used in toString()

    CellState(char name) {
        this.name = name;
    }

    /**
     * The cell state of a disk placed by the given player
     * @param player
     * @return
     */
    public static CellState of(Player player) {
        if (player == null)
            throw new IllegalArgumentException("player must not be null");
        return player == Player.FIRST ? FIRST : SECOND;
    }

    /**
     * The player owning the disk on this cell, null for EMPTY
     * @return
     */
    public Player getOwner() {
        if (this == FIRST)
            return Player.FIRST;
        if (this == SECOND)
            return Player.SECOND;
        return null;
    }

    /**
     * Parse a display char back into a cell state. Used for building boards from text
     * @param name
     * @return
     */
    public static CellState fromName(char name) {
        for (CellState state : values())
            if (state.name == name)
                return state;
        throw new IllegalArgumentException("Unknown cell char: '" + name + "'");
    }
}

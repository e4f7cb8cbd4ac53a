package othello;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class BoardTest {

    @Test
    void newBoardIsEmpty() {
        Board board = new Board();
        assertEquals(Board.MAX, board.count(CellState.EMPTY));
        assertFalse(board.contains(CellState.FIRST));
        assertFalse(board.contains(CellState.SECOND));
    }

    @Test
    void parseAndToStringAgree() {
        String text =
                "O.......\n" +
                ".X......\n" +
                "........\n" +
                "........\n" +
                "........\n" +
                "........\n" +
                "........\n" +
                ".......O\n";
        Board board = Board.parse(text);
        assertEquals(text, board.toString());
        assertEquals(CellState.SECOND, board.get(1, 1));
        assertEquals(2, board.count(CellState.FIRST));
    }

    @Test
    void parseIgnoresSpacesBetweenCells() {
        Board spaced = Board.parse(
                "O . . . . . . .\n" +
                ". . . . . . . .\n" +
                ". . . . . . . .\n" +
                ". . . . . . . .\n" +
                ". . . . . . . .\n" +
                ". . . . . . . .\n" +
                ". . . . . . . .\n" +
                ". . . . . . . X");
        assertEquals(CellState.FIRST, spaced.get(0, 0));
        assertEquals(CellState.SECOND, spaced.get(7, 7));
    }

    @Test
    void parseRejectsMalformedText() {
        assertThrows(IllegalArgumentException.class, () -> Board.parse("........"));
        assertThrows(IllegalArgumentException.class, () -> Board.parse(
                "........\n........\n........\n........\n........\n........\n........\n......."));
        assertThrows(IllegalArgumentException.class, () -> Board.parse(
                "........\n........\n........\n........\n........\n........\n........\n.......?"));
    }

    @Test
    void copyIsIndependent() {
        Board original = new Board();
        Board copy = new Board(original);
        copy.set(0, 0, CellState.FIRST);
        assertEquals(CellState.EMPTY, original.get(0, 0));
        assertNotEquals(original, copy);
    }

    @Test
    void cellsCannotBeCleared() {
        Board board = new Board();
        assertThrows(IllegalArgumentException.class, () -> board.set(0, 0, null));
        assertThrows(IllegalArgumentException.class, () -> board.fill(null));
        assertThrows(IndexOutOfBoundsException.class, () -> board.set(8, 0, CellState.FIRST));
        assertThrows(IndexOutOfBoundsException.class, () -> board.get(0, -1));
    }

    @Test
    void cellStateMapsToPlayersAndBack() {
        for (Player player : Player.values())
            assertEquals(player, CellState.of(player).getOwner());
        assertNull(CellState.EMPTY.getOwner());
        assertEquals(Player.SECOND, Player.FIRST.getOpponent());
        assertEquals(Player.FIRST, Player.SECOND.getOpponent());
        assertThrows(IllegalArgumentException.class, () -> CellState.of(null));
    }
}

package othello;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

class MainTest {

    private static String play(String input, Game[] result) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        result[0] = Main.run(new StringReader(input), out);
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void commandsDriveTheGame() throws IOException {
        Game[] game = new Game[1];
        String output = play("2 4\n\npass\nbogus\npass\n2,3\nquit\n5 3\n", game);

        // "5 3" comes after quit and is never played
        assertEquals(CellState.FIRST, game[0].readCell(2, 4));
        assertEquals(CellState.SECOND, game[0].readCell(2, 3));
        assertEquals(CellState.SECOND, game[0].readCell(3, 3));
        assertArrayEquals(new byte[] {3, 3}, game[0].readScores());
        assertEquals(Player.FIRST, game[0].getActivePlayer());
        assertEquals(CellState.EMPTY, game[0].readCell(5, 3));
        assertTrue(output.contains("Unknown command: bogus"));
        assertTrue(output.contains("O: 4  X: 1  to move: X"));
    }

    @Test
    void resetAndSkipKeysAreAccepted() throws IOException {
        Game[] game = new Game[1];
        play("2 4\nspace\ns\n", game);

        assertEquals(CellState.EMPTY, game[0].readCell(2, 4));
        assertArrayEquals(new byte[] {2, 2}, game[0].readScores());
        assertEquals(Player.SECOND, game[0].getActivePlayer());
    }

    @Test
    void renderShowsIndicesBoardAndScores() {
        GameState state = new GameState();
        BoardInitializer.reset(state);
        String[] lines = Main.render(state).split("\n");

        assertEquals(10, lines.length);
        assertEquals("  01234567", lines[0]);
        assertEquals("3 ...OX...", lines[4]);
        assertEquals("O: 2  X: 2  to move: O", lines[9]);
    }

    @Test
    void announceNamesTheWinner() {
        GameState won = new GameState(Board.parse(
                "OOX.....\n" +
                "........\n" +
                "........\n" +
                "........\n" +
                "........\n" +
                "........\n" +
                "........\n" +
                "........"), Player.SECOND);
        assertEquals("Game Over. O wins!", Main.announce(won));
        assertEquals("Game Over. Truce!", Main.announce(new GameState()));
    }
}

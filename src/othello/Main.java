package othello;

import org.apache.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * A text front end standing in for the window: reads commands from standard input, feeds them to
 * a Game and prints the board after each one, i.e. nothing interesting is happening here.
 * Commands:
 * "row col" - click on a cell,
 * "reset" or "space" - start a new game,
 * "pass" or "s" - skip the current turn,
 * "quit" - exit (so does the end of input).
 */
public class Main {
    private final static Logger logger = Logger.getLogger(Main.class);

    /**
     * Run the game on the console
     * @param args ignored
     */
    public static void main(String[] args) {
        logger.info("Program launched");
        try {
            run(new InputStreamReader(System.in, StandardCharsets.UTF_8), System.out);
        } catch (IOException e) {
            logger.error("Could not read from standard input", e);
            System.exit(1);
        }
    }

    /**
     * Play one session, reading commands from in until "quit" or the end of input
     * @param in
     * @param out
     * @return the game as it was left
     * @throws IOException if in cannot be read
     */
    public static Game run(Reader in, PrintStream out) throws IOException {
        Game game = Game.initialize();
        game.addListener(new ConsoleListener(out));
        out.print(render(game.getState()));

        BufferedReader reader = new BufferedReader(in);
        String line;
        while ((line = reader.readLine()) != null) {
            String command = line.trim().toLowerCase();
            if (command.isEmpty())
                continue;
            if (command.equals("quit"))
                break;
            if (command.equals("reset") || command.equals("space"))
                game.handleResetSignal();
            else if (command.equals("pass") || command.equals("s"))
                game.handlePassSignal();
            else if (!click(game, command))
                out.println("Unknown command: " + line.trim());
        }
        logger.info("Program finished");
        return game;
    }

    /**
     * Parse "row col" and click there
     * @return false if the command is not a pair of integers
     */
    private static boolean click(Game game, String command) {
        String[] parts = command.split("[\\s,]+");
        if (parts.length != 2)
            return false;
        int row, col;
        try {
            row = Integer.parseInt(parts[0]);
            col = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            logger.debug("Not a cell: " + command);
            return false;
        }
        if (!game.handleCellClick(row, col))
            logger.debug("Illegal move (" + row + ", " + col + ")");
        return true;
    }

    /**
     * The board with row and column indices, followed by the score line and the player to move
     * @param state
     * @return
     */
    static String render(GameState state) {
        StringBuilder result = new StringBuilder("  ");
        for (byte j = 0; j < Board.DIM; j++)
            result.append(j);
        result.append('\n');
        String[] rows = state.getBoard().toString().split("\n");
        for (byte i = 0; i < rows.length; i++)
            result.append(i).append(' ').append(rows[i]).append('\n');
        result.append(CellState.FIRST.name).append(": ").append(state.getScore(Player.FIRST))
                .append("  ").append(CellState.SECOND.name).append(": ")
                .append(state.getScore(Player.SECOND)).append("  to move: ")
                .append(CellState.of(state.getTurn()).name).append('\n');
        return result.toString();
    }

    /**
     * Announce the result
     * @param state
     * @return
     */
    static String announce(GameState state) {
        Player winner = TerminationChecker.getWinner(state);
        if (winner == null)
            return "Game Over. Truce!";
        return "Game Over. " + CellState.of(winner).name + " wins!";
    }

    /**
     * Prints the board after each event
     */
    private static class ConsoleListener implements GameListener {
        private final PrintStream out;

        ConsoleListener(PrintStream out) {
            this.out = out;
        }

        @Override
        public void boardChanged(GameState state) {
            out.print(render(state));
        }

        @Override
        public void gameOver(GameState state) {
            out.println(announce(state));
        }
    }
}

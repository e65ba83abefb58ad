package soup.tadpole.engine.uci;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import soup.tadpole.engine.game.BoardGenerator;
import soup.tadpole.engine.game.Position;
import soup.tadpole.engine.search.SearchConfig;
import soup.tadpole.engine.utils.notations.FENUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PipedReader;
import java.io.PipedWriter;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class UciServerTest {
    private static final SearchConfig CFG = new SearchConfig.Builder()
            .threads(2)
            .ttMaxEntries(1 << 16)
            .build();

    private final BlockingQueue<String> uciMessages = new LinkedBlockingQueue<>();
    private PipedWriter input;
    private Thread serverThread;

    @BeforeEach
    public void setUp() throws IOException {
        input = new PipedWriter();
        BufferedReader in = new BufferedReader(new PipedReader(input));
        PrintWriter out = new PrintWriter(new LineCollector(uciMessages), true);
        UciServer server = new UciServer("Tadpole", "soup", CFG, in, out);
        serverThread = new Thread(server::run, "uci-test");
        serverThread.start();
    }

    @AfterEach
    public void tearDown() throws Exception {
        if (serverThread.isAlive()) {
            send("quit");
            serverThread.join(TimeUnit.SECONDS.toMillis(10));
        }
    }

    @Test
    public void handshake() throws Exception {
        send("uci");
        assertEquals("id name Tadpole", awaitLine("id name"));
        assertTrue(awaitLine("option name Hash").contains("type spin"));
        awaitLine("uciok");

        send("isready");
        awaitLine("readyok");
    }

    @Test
    public void playsTheMate() throws Exception {
        // Given
        send("ucinewgame");
        send("position fen 6k1/5ppp/8/8/8/8/5PPP/R5K1 w - - 0 1");

        // When
        send("go depth 2");

        // Then
        assertEquals("info score cp 20000", awaitLine("info score cp"));
        assertEquals("bestmove a1a8", awaitLine("bestmove"));
    }

    @Test
    public void searchesAfterTheGivenMoves() throws Exception {
        send("position startpos moves e2e4 e7e5");
        send("go depth 1");

        String bestMove = awaitLine("bestmove").substring("bestmove ".length());
        Position position = FENUtils.getPositionFrom(BoardGenerator.STANDARD_GAME, List.of("e2e4", "e7e5"));
        assertDoesNotThrow(() -> FENUtils.resolveMove(position, bestMove));
    }

    @Test
    public void stopEndsAnInfiniteSearch() throws Exception {
        send("position startpos");
        send("go infinite");
        awaitLine("info depth 1 ");
        send("stop");
        assertTrue(awaitLine("bestmove").matches("bestmove [a-h][1-8][a-h][1-8]"));
    }

    @Test
    public void invalidPositionIsReported() throws Exception {
        send("position fen this is not a fen");
        assertTrue(awaitLine("info string invalid position").length() > 0);
        send("position startpos moves e2e5");
        awaitLine("info string invalid position");

        // Still alive
        send("isready");
        awaitLine("readyok");
    }

    @Test
    public void quitTerminates() throws Exception {
        send("quit");
        serverThread.join(TimeUnit.SECONDS.toMillis(10));
        assertFalse(serverThread.isAlive());
    }

    @Test
    public void endOfInputAnswersTheRunningSearchThenQuits() {
        // Given
        StringWriter output = new StringWriter();
        BufferedReader in = new BufferedReader(new StringReader("position startpos\ngo infinite\n"));
        UciServer server = new UciServer("Tadpole", "soup", CFG, in, new PrintWriter(output, true));

        // When
        server.run();

        // Then
        assertTrue(output.toString().contains("bestmove "));
    }

    @Test
    public void parsesGoParameters() {
        UciServer.GoParams go = UciServer.parseGo("go wtime 60000 btime 50000 winc 1000 binc 900 movestogo 20");
        assertEquals(60000, go.wtime);
        assertEquals(50000, go.btime);
        assertEquals(1000, go.winc);
        assertEquals(900, go.binc);
        assertEquals(20, go.movestogo);
        assertEquals(-1, go.depth);
        assertFalse(go.infinite);

        UciServer.GoParams depth = UciServer.parseGo("go depth 4 movetime 250 infinite");
        assertEquals(4, depth.depth);
        assertEquals(250, depth.movetime);
        assertTrue(depth.infinite);
    }

    private void send(String command) throws IOException {
        input.write(command + "\n");
        input.flush();
    }

    private String awaitLine(String prefix) throws InterruptedException {
        while (true) {
            String line = uciMessages.poll(60, TimeUnit.SECONDS);
            assertNotNull(line, "no line starting with '" + prefix + "'");
            if (line.startsWith(prefix)) return line;
        }
    }

    /** Splits what the server prints into lines. */
    private static final class LineCollector extends Writer {
        private final BlockingQueue<String> lines;
        private final StringBuilder current = new StringBuilder();

        LineCollector(BlockingQueue<String> lines) {
            this.lines = lines;
        }

        @Override
        public synchronized void write(char[] buffer, int offset, int length) {
            for (int i = offset; i < offset + length; i++) {
                char c = buffer[i];
                if (c == '\n') {
                    lines.add(current.toString());
                    current.setLength(0);
                } else if (c != '\r') {
                    current.append(c);
                }
            }
        }

        @Override
        public void flush() {}

        @Override
        public void close() {}
    }
}

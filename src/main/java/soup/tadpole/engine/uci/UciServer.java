package soup.tadpole.engine.uci;

import soup.tadpole.engine.actor.EngineActor;
import soup.tadpole.engine.actor.EngineMessage;
import soup.tadpole.engine.actor.EngineReply;
import soup.tadpole.engine.actor.SearchLimits;
import soup.tadpole.engine.game.BoardGenerator;
import soup.tadpole.engine.game.Position;
import soup.tadpole.engine.search.SearchConfig;
import soup.tadpole.engine.search.SearchConstants;
import soup.tadpole.engine.search.TimeControl;
import soup.tadpole.engine.utils.ColorUtils;
import soup.tadpole.engine.utils.notations.FENUtils;
import soup.tadpole.engine.utils.notations.MoveIOUtils;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * UCI front end for cutechess / GUIs. Reads commands line by line, turns them into {@link EngineMessage}s
 * for the {@link EngineActor}, and prints the actor's replies from a dedicated thread.
 */
public final class UciServer {
    private final String name;
    private final String author;
    private final SearchConfig cfg;

    private final PrintWriter out;
    private final BufferedReader in;

    // Position the next "go" will search, used for the side to move in time control
    private Position position = BoardGenerator.newStandardGameBoard();

    public UciServer(String name, String author, SearchConfig cfg) {
        this(name, author, cfg,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.US_ASCII)),
                new PrintWriter(new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.US_ASCII)), true));
    }

    public UciServer(String name, String author, SearchConfig cfg, BufferedReader in, PrintWriter out) {
        this.name = Objects.requireNonNull(name);
        this.author = Objects.requireNonNull(author);
        this.cfg = Objects.requireNonNull(cfg);
        this.in = Objects.requireNonNull(in);
        this.out = Objects.requireNonNull(out);
    }

    /** Run the UCI loop on the current thread, until "quit" or the end of the input. */
    public void run() {
        final EngineActor actor = new EngineActor(cfg);
        final Thread actorThread = actor.start();
        final Thread printer = new Thread(() -> printReplies(actor.replies(), actorThread), "uci-printer");
        printer.start();

        try {
            String line;
            while ((line = in.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;
                if (line.equals("quit")) break;
                handle(line, actor);
            }
        } catch (IOException e) {
            // GUIs sometimes close pipes abruptly, treat it as a quit
            send("info string input closed: " + e.getMessage());
        }
        actor.send(new EngineMessage.Quit());

        try {
            actorThread.join();
            printer.join();
        } catch (InterruptedException e) {
            actorThread.interrupt();
            Thread.currentThread().interrupt();
        }
    }

    private void handle(String line, EngineActor actor) {
        if (line.equals("uci")) {
            send("id name " + name);
            send("id author " + author);
            send("option name Hash type spin default " + cfg.ttSizeMb + " min 1 max 4096");
            send("option name Threads type spin default " + cfg.threads + " min 1 max 256");
            send("option name Depth type spin default " + cfg.maxDepth + " min 1 max " + SearchConstants.MAX_DEPTH);
            send("option name AspirationWindow type spin default " + cfg.aspirationCp + " min 1 max 10000");
            send("uciok");
        } else if (line.equals("isready")) {
            actor.send(new EngineMessage.ReadyCheck());
        } else if (line.startsWith("setoption")) {
            handleSetOption(line, actor);
        } else if (line.equals("ucinewgame")) {
            position = BoardGenerator.newStandardGameBoard();
            actor.send(new EngineMessage.NewGame());
        } else if (line.startsWith("position")) {
            handlePosition(line, actor);
        } else if (line.startsWith("go")) {
            try {
                actor.send(new EngineMessage.Go(toLimits(parseGo(line))));
            } catch (IllegalArgumentException e) {
                send("info string invalid go: " + e.getMessage());
            }
        } else if (line.equals("stop")) {
            actor.send(new EngineMessage.Stop());
        } else if (line.equals("print")) { // handy debug
            send("info string " + position);
        }
        // ignore unknown commands per UCI tolerance
    }

    /* -------------------- command handlers -------------------- */

    private void handleSetOption(String line, EngineActor actor) {
        // Syntax: setoption name <id> [value <x>]
        String rest = line.substring("setoption".length()).trim();
        if (rest.isEmpty()) return;

        String optionName = null, value = null;
        List<String> toks = Arrays.asList(rest.split("\\s+"));
        for (int i = 0; i < toks.size(); i++) {
            String t = toks.get(i);
            if (t.equals("name")) {
                StringBuilder sb = new StringBuilder();
                i++;
                while (i < toks.size() && !toks.get(i).equals("value")) {
                    if (sb.length() > 0) sb.append(' ');
                    sb.append(toks.get(i++));
                }
                i--; // step back one, for loop will ++
                optionName = sb.toString();
            } else if (t.equals("value")) {
                StringBuilder sb = new StringBuilder();
                i++;
                while (i < toks.size()) {
                    if (sb.length() > 0) sb.append(' ');
                    sb.append(toks.get(i++));
                }
                i--;
                value = sb.toString();
            }
        }
        if (optionName != null) actor.send(new EngineMessage.SetOption(optionName, value == null ? "" : value));
    }

    private void handlePosition(String line, EngineActor actor) {
        // position [startpos | fen <FEN...>] [moves <m1> <m2> ...]
        String rest = line.substring("position".length()).trim();
        String fen, movesPart = null;
        if (rest.startsWith("startpos")) {
            fen = BoardGenerator.STANDARD_GAME;
            int idx = rest.indexOf("moves");
            if (idx >= 0) movesPart = rest.substring(idx + "moves".length()).trim();
        } else if (rest.startsWith("fen")) {
            String afterFen = rest.substring(3).trim();
            int movesIdx = afterFen.indexOf(" moves");
            if (movesIdx >= 0) {
                fen = afterFen.substring(0, movesIdx).trim();
                movesPart = afterFen.substring(movesIdx + " moves".length()).trim();
            } else {
                fen = afterFen;
            }
        } else {
            // tolerant: if someone sends just "position" we ignore
            return;
        }

        try {
            Position next = FENUtils.getPositionFrom(fen, splitMoves(movesPart));
            position = next;
            actor.send(new EngineMessage.SetPosition(next));
        } catch (IllegalArgumentException e) {
            send("info string invalid position: " + e.getMessage());
        }
    }

    private static List<String> splitMoves(String s) {
        if (s == null || s.isEmpty()) return Collections.emptyList();
        return Arrays.asList(s.trim().split("\\s+"));
    }

    static GoParams parseGo(String line) {
        GoParams gp = new GoParams();
        String[] t = line.split("\\s+");
        for (int i = 1; i < t.length; i++) {
            switch (t[i]) {
                case "wtime": gp.wtime = parseLong(t, ++i); break;
                case "btime": gp.btime = parseLong(t, ++i); break;
                case "winc": gp.winc = parseLong(t, ++i); break;
                case "binc": gp.binc = parseLong(t, ++i); break;
                case "movestogo": gp.movestogo = (int) parseLong(t, ++i); break;
                case "movetime": gp.movetime = parseLong(t, ++i); break;
                case "depth": gp.depth = (int) parseLong(t, ++i); break;
                case "infinite": gp.infinite = true; break;
                default: /* ignore others (e.g., searchmoves, ponder) */ break;
            }
        }
        return gp;
    }

    private static long parseLong(String[] tok, int i) {
        if (i >= tok.length) return 0;
        try { return Long.parseLong(tok[i]); } catch (NumberFormatException e) { return 0; }
    }

    private SearchLimits toLimits(GoParams go) {
        if (go.infinite) {
            return SearchLimits.depth(SearchConstants.MAX_DEPTH);
        }
        long budgetMs = TimeControl.computeBudgetMs(ColorUtils.isWhite(position.currentPlayer),
                go.movetime, go.wtime, go.btime, go.winc, go.binc, go.movestogo);
        int depth = go.depth > 0 ? go.depth : (budgetMs > 0 ? SearchConstants.MAX_DEPTH : 0);
        return new SearchLimits(depth, budgetMs);
    }

    /* -------------------- replies -------------------- */

    private void printReplies(BlockingQueue<EngineReply> replies, Thread actorThread) {
        try {
            while (true) {
                EngineReply reply = replies.poll(20, TimeUnit.MILLISECONDS);
                if (reply == null && !actorThread.isAlive()) {
                    // Last look: the actor may have replied right before terminating
                    reply = replies.poll();
                    if (reply == null) return;
                }
                if (reply != null) print(reply);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void print(EngineReply reply) {
        if (reply instanceof EngineReply.ReadyMessage) {
            send("readyok");
        } else if (reply instanceof EngineReply.Info info) {
            sendInfo(info.line());
        } else if (reply instanceof EngineReply.BestMove bestMove) {
            send("info score cp " + bestMove.score());
            send("bestmove " + MoveIOUtils.writeAlgebraicNotation(bestMove.move()));
        }
    }

    private synchronized void send(String line) {
        out.println(line);
        out.flush();
    }

    private void sendInfo(String infoLine) {
        if (infoLine == null || infoLine.isEmpty()) return;
        if (!infoLine.startsWith("info")) send("info " + infoLine);
        else send(infoLine);
    }

    /** Search parameters passed on "go". All values are milliseconds unless noted. */
    static final class GoParams {
        long wtime = -1, btime = -1, winc = 0, binc = 0;
        int movestogo = -1;
        long movetime = -1;
        int depth = -1;
        boolean infinite = false;
    }
}

package soup.tadpole.engine.actor;

import soup.tadpole.engine.search.SearchConfig;
import soup.tadpole.engine.search.SearchConstants;
import soup.tadpole.engine.search.SearchFacade;
import soup.tadpole.engine.search.SearchResult;

import java.util.Locale;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-threaded owner of the engine state. Commands come in through one queue and replies leave through
 * another, so nothing here needs a lock.
 * <p>
 * While a search runs on the {@link SearchFacade} threads, the actor keeps polling its inbox every
 * {@link SearchConfig#pollIntervalMs} to react to {@code Stop}, {@code ReadyCheck} and {@code Quit},
 * and to stop the search when its time budget is spent.
 */
public final class EngineActor implements Runnable {
    private final BlockingQueue<EngineMessage> inbox;
    private final BlockingQueue<EngineReply> outbox;

    private SearchConfig cfg;
    private SearchFacade facade;
    private final SearchState state;

    public EngineActor(SearchConfig cfg) {
        this(cfg, new LinkedBlockingQueue<>(), new LinkedBlockingQueue<>());
    }

    public EngineActor(SearchConfig cfg, BlockingQueue<EngineMessage> inbox, BlockingQueue<EngineReply> outbox) {
        this.cfg = cfg;
        this.inbox = inbox;
        this.outbox = outbox;
        this.facade = new SearchFacade(cfg);
        this.state = new SearchState(cfg.newTranspositionTable());
    }

    /** Runs the actor on its own thread. */
    public Thread start() {
        Thread thread = new Thread(this, "engine-actor");
        thread.start();
        return thread;
    }

    public void send(EngineMessage message) {
        inbox.add(message);
    }

    public BlockingQueue<EngineReply> replies() {
        return outbox;
    }

    @Override
    public void run() {
        try {
            boolean running = true;
            while (running) {
                running = handleIdle(inbox.take());
            }
        } catch (InterruptedException e) {
            // Nobody will talk to us anymore
            state.stopFlag().set(true);
            Thread.currentThread().interrupt();
        } finally {
            facade.close();
        }
    }

    /** @return false when the actor must terminate */
    private boolean handleIdle(EngineMessage message) throws InterruptedException {
        if (message instanceof EngineMessage.SetPosition setPosition) {
            state.setPosition(setPosition.position());
        } else if (message instanceof EngineMessage.Go go) {
            return search(go.limits());
        } else if (message instanceof EngineMessage.NewGame) {
            state.replaceTable(cfg.newTranspositionTable());
        } else if (message instanceof EngineMessage.ReadyCheck) {
            outbox.put(new EngineReply.ReadyMessage());
        } else if (message instanceof EngineMessage.SetOption option) {
            setOption(option.name(), option.value());
        } else if (message instanceof EngineMessage.Stop) {
            info("info string stop ignored: no search running");
        } else if (message instanceof EngineMessage.Quit) {
            return false;
        }
        return true;
    }

    private boolean search(SearchLimits limits) throws InterruptedException {
        state.table().age();
        final AtomicBoolean stop = state.newStopFlag();
        final int depth = limits.depth() > 0 ? Math.min(limits.depth(), SearchConstants.MAX_DEPTH) : cfg.maxDepth;
        final long deadline = limits.hasDeadline()
                ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(limits.moveTimeMs())
                : Long.MAX_VALUE;

        final Future<SearchResult> future = facade.submit(state.position(), state.table(), stop, depth, this::info);
        boolean keepRunning = true;
        while (!future.isDone()) {
            EngineMessage message = inbox.poll(cfg.pollIntervalMs, TimeUnit.MILLISECONDS);
            if (message instanceof EngineMessage.Stop) {
                stop.set(true);
            } else if (message instanceof EngineMessage.ReadyCheck) {
                outbox.put(new EngineReply.ReadyMessage());
            } else if (message instanceof EngineMessage.Quit) {
                stop.set(true);
                keepRunning = false;
            } else if (message != null) {
                info("info string ignored while searching: " + message);
            }
            if (System.nanoTime() >= deadline) {
                stop.set(true);
            }
        }

        SearchResult result;
        try {
            result = future.get();
        } catch (ExecutionException e) {
            info("info string search failed: " + e.getCause());
            result = SearchFacade.fallback(state.position());
        }
        outbox.put(new EngineReply.BestMove(result.move(), result.score()));
        return keepRunning;
    }

    private void setOption(String name, String value) {
        final String raw = value == null ? "" : value.trim();
        try {
            switch (name.toLowerCase(Locale.ROOT)) {
                case "hash" -> {
                    cfg = cfg.toBuilder().ttSizeMb(Integer.parseInt(raw)).ttMaxEntries(-1).build();
                    state.replaceTable(cfg.newTranspositionTable());
                }
                case "threads" -> {
                    cfg = cfg.toBuilder().threads(Integer.parseInt(raw)).build();
                    refreshFacade();
                }
                case "depth" -> {
                    cfg = cfg.toBuilder().maxDepth(Integer.parseInt(raw)).build();
                    refreshFacade();
                }
                case "aspirationwindow" -> {
                    cfg = cfg.toBuilder().aspirationCp(Integer.parseInt(raw)).build();
                    refreshFacade();
                }
                default -> info("info string unknown option " + name);
            }
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            info("info string invalid value '" + value + "' for option " + name + ": " + e.getMessage());
        }
    }

    // The facade reads its configuration at construction
    private void refreshFacade() {
        facade.close();
        facade = new SearchFacade(cfg);
    }

    private void info(String line) {
        outbox.add(new EngineReply.Info(line));
    }
}

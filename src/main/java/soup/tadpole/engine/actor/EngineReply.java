package soup.tadpole.engine.actor;

import soup.tadpole.engine.movegen.Move;

/** Replies sent by the {@link EngineActor}. */
public sealed interface EngineReply {

    record ReadyMessage() implements EngineReply {}

    /**
     * @param move  the chosen move, {@code null} only when the searched game was already over
     * @param score centipawns from the mover's point of view
     */
    record BestMove(Move move, int score) implements EngineReply {}

    /** A UCI {@code info} line: search progress or diagnostics. */
    record Info(String line) implements EngineReply {}
}

package soup.tadpole.engine.actor;

import soup.tadpole.engine.game.Position;

/** Commands accepted by the {@link EngineActor}. */
public sealed interface EngineMessage {

    /** Replace the position to search. Idle only. */
    record SetPosition(Position position) implements EngineMessage {}

    /** Search the current position; answered by exactly one {@link EngineReply.BestMove}. */
    record Go(SearchLimits limits) implements EngineMessage {}

    /** Cancel the running search. */
    record Stop() implements EngineMessage {}

    /** Forget everything learnt so far. Idle only. */
    record NewGame() implements EngineMessage {}

    /** Answered by {@link EngineReply.ReadyMessage} whatever the state. */
    record ReadyCheck() implements EngineMessage {}

    record SetOption(String name, String value) implements EngineMessage {}

    /** Terminate the engine, after answering the running search if any. */
    record Quit() implements EngineMessage {}
}

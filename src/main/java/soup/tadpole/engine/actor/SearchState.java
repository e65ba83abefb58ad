package soup.tadpole.engine.actor;

import soup.tadpole.engine.game.BoardGenerator;
import soup.tadpole.engine.game.Position;
import soup.tadpole.engine.search.transpositiontable.TranspositionTable;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * What the actor keeps between commands. Only touched from the actor thread; the search threads get
 * the position, table and flag handed over at {@code go}.
 */
final class SearchState {
    private Position position = BoardGenerator.newStandardGameBoard();
    private TranspositionTable table;
    private AtomicBoolean stop = new AtomicBoolean(false);

    SearchState(TranspositionTable table) {
        this.table = table;
    }

    Position position() {
        return position;
    }

    void setPosition(Position position) {
        this.position = position;
    }

    TranspositionTable table() {
        return table;
    }

    void replaceTable(TranspositionTable table) {
        this.table = table;
    }

    AtomicBoolean stopFlag() {
        return stop;
    }

    /** A search never shares its flag with the previous one. */
    AtomicBoolean newStopFlag() {
        stop = new AtomicBoolean(false);
        return stop;
    }
}

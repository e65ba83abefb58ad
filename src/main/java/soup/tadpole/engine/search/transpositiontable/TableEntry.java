package soup.tadpole.engine.search.transpositiontable;

import soup.tadpole.engine.movegen.Move;

/**
 * Best knowledge about one position at the time it was stored.
 *
 * @param bestResponse move that produced the score, searched first when the entry is only a hint
 * @param depth        remaining depth (plies) the score was searched with
 * @param score        centipawns, from the side to move in the keyed position
 * @param node         bound type of {@code score}
 * @param age          number of searches started since the entry was stored
 */
public record TableEntry(Move bestResponse, int depth, int score, NodeType node, int age) {

    public TableEntry(Move bestResponse, int depth, int score, NodeType node) {
        this(bestResponse, depth, score, node, 0);
    }

    TableEntry aged() {
        return new TableEntry(bestResponse, depth, score, node, age + 1);
    }
}

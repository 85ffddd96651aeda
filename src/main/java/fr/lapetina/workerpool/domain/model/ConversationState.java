package fr.lapetina.workerpool.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversation carried across jobs on a single worker instance.
 *
 * Owned exclusively by its instance and discarded when the instance is recycled.
 * Only the thread holding the instance appends to it; readers get a copy.
 */
public final class ConversationState {

    private final List<ConversationTurn> turns = new ArrayList<>();

    public synchronized void append(ConversationTurn turn) {
        turns.add(turn);
    }

    public synchronized List<ConversationTurn> turns() {
        return List.copyOf(turns);
    }

    public synchronized int size() {
        return turns.size();
    }
}

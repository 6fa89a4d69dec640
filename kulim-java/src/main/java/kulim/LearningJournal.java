package kulim;

import java.util.ArrayList;
import java.util.List;

/**
 * Undo log of dictionary changes made while learning.
 *
 * Every cost change records the previous cost, every insertion the entry, so
 * a batch can be rolled back exactly, in reverse order. Rolled-back insertions
 * give their ids back when nothing was registered after them.
 */
public final class LearningJournal {

    private final List<Change> changes = new ArrayList<>();

    void recordInsert(DictionaryEntry entry) {
        changes.add(new Change(entry, 0, true));
    }

    void recordCost(DictionaryEntry entry, int previousCost) {
        changes.add(new Change(entry, previousCost, false));
    }

    void append(LearningJournal other) {
        changes.addAll(other.changes);
    }

    public int size() {
        return changes.size();
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    /**
     * Entries registered by the recorded changes.
     */
    public List<DictionaryEntry> insertedEntries() {
        List<DictionaryEntry> inserted = new ArrayList<>();
        for (Change change : changes) {
            if (change.insert) inserted.add(change.entry);
        }
        return inserted;
    }

    void rollback(DictionaryStore store) {
        rollbackTo(store, 0);
    }

    /**
     * Undoes every change recorded after {@code mark} (a previous {@link #size()}).
     */
    void rollbackTo(DictionaryStore store, int mark) {
        for (int i = changes.size() - 1; i >= mark; i--) {
            Change change = changes.remove(i);
            if (store.entry(change.entry.id()) != change.entry) {
                // removed by an explicit edit since; nothing left to restore
                continue;
            }
            if (change.insert) {
                store.discard(change.entry);
            } else {
                store.setCost(change.entry.id(), change.previousCost);
            }
        }
    }

    private static final class Change {
        final DictionaryEntry entry;
        final int previousCost;
        final boolean insert;

        Change(DictionaryEntry entry, int previousCost, boolean insert) {
            this.entry = entry;
            this.previousCost = previousCost;
            this.insert = insert;
        }
    }
}

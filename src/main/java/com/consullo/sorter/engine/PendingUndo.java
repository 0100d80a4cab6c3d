package com.consullo.sorter.engine;

import com.consullo.sorter.core.RecordStatus;
import com.consullo.sorter.session.PagedSession;
import java.util.Map;

/**
 * An undo applied locally whose restoring write has not completed yet.
 *
 * @param session session the undo was applied to
 * @param entry popped entry
 * @param action in-flight action the entry belonged to, null if its write had already completed
 * @param restored status written back per record; ids a later action had taken over are absent
 */
record PendingUndo(PagedSession session, UndoEntry entry, PendingAction action, Map<String, RecordStatus> restored) {
}

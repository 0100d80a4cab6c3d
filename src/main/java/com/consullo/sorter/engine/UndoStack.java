package com.consullo.sorter.engine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Bounded LIFO of undoable actions. Pushing onto a full stack evicts the oldest entry.
 *
 * <p>Not thread-safe; owned by the engine and only touched under its state lock.
 */
public final class UndoStack {

  private final int capacity;
  private final Deque<UndoEntry> entries = new ArrayDeque<>();

  public UndoStack(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive.");
    }
    this.capacity = capacity;
  }

  public void push(UndoEntry entry) {
    if (entry == null) {
      throw new IllegalArgumentException("entry must not be null.");
    }
    entries.addFirst(entry);
    while (entries.size() > capacity) {
      entries.removeLast();
    }
  }

  /**
   * Remove and return the most recent entry.
   *
   * @return entry, or null if the stack is empty
   */
  public UndoEntry pop() {
    return entries.pollFirst();
  }

  /**
   * Drop the entry pushed by a given action, if it is still on the stack.
   *
   * @param actionSequence sequence number of the action
   * @return true if an entry was removed
   */
  public boolean remove(long actionSequence) {
    Iterator<UndoEntry> it = entries.iterator();
    while (it.hasNext()) {
      if (it.next().actionSequence() == actionSequence) {
        it.remove();
        return true;
      }
    }
    return false;
  }

  /**
   * Whether the entry of a given action is still on the stack.
   *
   * @param actionSequence sequence number of the action
   * @return true if it can still be undone
   */
  public boolean contains(long actionSequence) {
    for (UndoEntry entry : entries) {
      if (entry.actionSequence() == actionSequence) {
        return true;
      }
    }
    return false;
  }

  public boolean canUndo() {
    return !entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  public void clear() {
    entries.clear();
  }
}

package com.codeheadsystems.lockbox.client.session;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link ActivityLog} keeping the most recent entries per user.
 */
public class InMemoryActivityLog implements ActivityLog {

  /**
   * Entries kept per user.
   */
  public static final int DEFAULT_CAPACITY = 100;

  private static final Logger log = LoggerFactory.getLogger(InMemoryActivityLog.class);

  private final ConcurrentHashMap<String, Deque<ActivityEntry>> entries = new ConcurrentHashMap<>();
  private final int capacity;
  private final Clock clock;

  public InMemoryActivityLog() {
    this(DEFAULT_CAPACITY, Clock.systemUTC());
  }

  /**
   * Instantiates a new In memory activity log.
   *
   * @param capacity entries kept per user
   * @param clock    the clock
   */
  public InMemoryActivityLog(final int capacity, final Clock clock) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be at least 1");
    }
    this.capacity = capacity;
    this.clock = clock;
  }

  @Override
  public void record(final String username, final ActivityEvent event) {
    if (username == null) {
      return;
    }
    Deque<ActivityEntry> deque = entries.computeIfAbsent(username, k -> new ArrayDeque<>());
    synchronized (deque) {
      deque.addFirst(new ActivityEntry(clock.instant(), username, event));
      while (deque.size() > capacity) {
        deque.removeLast();
      }
    }
    log.debug("record(username={}, event={})", username, event);
  }

  @Override
  public List<ActivityEntry> entries(final String username) {
    Deque<ActivityEntry> deque = entries.get(username);
    if (deque == null) {
      return List.of();
    }
    synchronized (deque) {
      return List.copyOf(deque);
    }
  }

  @Override
  public void clear(final String username) {
    entries.remove(username);
  }
}

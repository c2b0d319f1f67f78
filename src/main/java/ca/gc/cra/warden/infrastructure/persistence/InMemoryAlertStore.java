package ca.gc.cra.warden.infrastructure.persistence;

import ca.gc.cra.warden.application.port.AlertStorePort;
import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.net.PacketRecord;
import ca.gc.cra.warden.validation.Numbers;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

/**
 * <strong>What:</strong> Bounded in-process {@link AlertStorePort}.
 * <p><strong>Why:</strong> Default store when no alert log is configured; also backs the recent-alert index of
 * {@link NdjsonAlertStore}.</p>
 * <p><strong>Thread-safety:</strong> All methods synchronize on the instance.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryAlertStore implements AlertStorePort {
  /** Alerts retained before the oldest is evicted. */
  public static final int DEFAULT_CAPACITY = 10_000;

  private final int capacity;
  private final Deque<AlertRecord> alerts = new ArrayDeque<>();

  /**
   * Creates a store with {@link #DEFAULT_CAPACITY}.
   */
  public InMemoryAlertStore() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a store.
   *
   * @param capacity alerts retained; oldest evicted first
   */
  public InMemoryAlertStore(int capacity) {
    this.capacity = (int) Numbers.requireRange("capacity", capacity, 1, 10_000_000);
  }

  @Override
  public String insert(Detection detection, PacketRecord context) {
    AlertRecord record = AlertRecord.of(UUID.randomUUID().toString(), detection, context);
    add(record);
    return record.alertId();
  }

  @Override
  public synchronized boolean existsRecent(String sourceIp, String ruleId, int destPort, long sinceMillis) {
    Iterator<AlertRecord> newestFirst = alerts.descendingIterator();
    while (newestFirst.hasNext()) {
      if (newestFirst.next().matches(sourceIp, ruleId, destPort, sinceMillis)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Adds an already-built record.
   *
   * @param record stored alert
   */
  synchronized void add(AlertRecord record) {
    if (alerts.size() >= capacity) {
      alerts.pollFirst();
    }
    alerts.addLast(record);
  }

  /**
   * Returns the stored alerts, oldest first.
   *
   * @return snapshot copy
   */
  public synchronized List<AlertRecord> alerts() {
    return List.copyOf(alerts);
  }

  /**
   * Returns the number of stored alerts.
   *
   * @return alert count
   */
  public synchronized int size() {
    return alerts.size();
  }
}

package ca.gc.cra.warden.application.pipeline;

import ca.gc.cra.warden.application.port.PacketSource;
import ca.gc.cra.warden.domain.net.LinkType;
import ca.gc.cra.warden.domain.net.RawFrame;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/** Packet sources for supervisor and engine tests. */
final class StubSources {
  private StubSources() {}

  /** Replays frames once, then reports exhaustion. */
  static final class ListSource implements PacketSource {
    private final Deque<RawFrame> frames = new ArrayDeque<>();
    volatile boolean closed;

    ListSource(List<byte[]> payloads) {
      long ts = 1_000_000L;
      for (byte[] payload : payloads) {
        frames.add(new RawFrame(payload, ts, LinkType.ETHERNET));
        ts += 1_000_000L;
      }
    }

    @Override
    public void start() {}

    @Override
    public synchronized Optional<RawFrame> poll() {
      return Optional.ofNullable(frames.pollFirst());
    }

    @Override
    public synchronized boolean isExhausted() {
      return frames.isEmpty();
    }

    @Override
    public void close() {
      closed = true;
    }
  }

  /** Fails on start with the given exception. */
  static final class FailingSource implements PacketSource {
    private final Exception failure;

    FailingSource(Exception failure) {
      this.failure = failure;
    }

    @Override
    public void start() throws Exception {
      throw failure;
    }

    @Override
    public Optional<RawFrame> poll() {
      return Optional.empty();
    }

    @Override
    public void close() {}
  }

  /** Never yields a frame and never drains. */
  static final class IdleSource implements PacketSource {
    @Override
    public void start() {}

    @Override
    public Optional<RawFrame> poll() throws InterruptedException {
      Thread.sleep(5L);
      return Optional.empty();
    }

    @Override
    public void close() {}
  }
}

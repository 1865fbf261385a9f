package uitrace.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uitrace.capture.CaptureOrchestrator;
import uitrace.capture.CycleResult;
import uitrace.model.CompletedGesture;
import uitrace.model.UiSnapshot;
import uitrace.model.UiTraceException;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Continuous listener: records every tap the user performs on the device.
 *
 * <h3>Typical usage</h3>
 * <pre>{@code
 * ListenerSession session = new ListenerSession(orchestrator, reader, config);
 * session.start();
 * // user taps around on the device ...
 * session.stop();
 * }</pre>
 *
 * <p>A pre-snapshot is prepared before each tap so the "before" state is the
 * screen the user actually saw. When a tap completes it is recorded against
 * that snapshot and a fresh one is prepared, whether or not the recording
 * succeeded. Taps seen while no snapshot is available are dropped.
 *
 * <p>Lines are consumed by a single thread, so cycles run strictly one after
 * another.
 */
public class ListenerSession {

    private static final Logger log = LoggerFactory.getLogger(ListenerSession.class);

    private static final long POLL_MS = 1000;

    private final CaptureOrchestrator orchestrator;
    private final EventStreamReader reader;
    private final ClickDetector detector;
    private final boolean postCapture;
    private final long waitAfterMs;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger recorded = new AtomicInteger();
    private final AtomicInteger dropped = new AtomicInteger();
    private final CountDownLatch finished = new CountDownLatch(1);
    private Thread consumer;

    public ListenerSession(CaptureOrchestrator orchestrator, EventStreamReader reader, UiTraceConfig config) {
        this(orchestrator, reader, new ClickDetector(), config.isListenerPostCapture(), config.getWaitAfterMs());
    }

    ListenerSession(CaptureOrchestrator orchestrator, EventStreamReader reader, ClickDetector detector,
                    boolean postCapture, long waitAfterMs) {
        this.orchestrator = orchestrator;
        this.reader       = reader;
        this.detector     = detector;
        this.postCapture  = postCapture;
        this.waitAfterMs  = waitAfterMs;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    /**
     * Starts the event stream and the consumer thread.
     *
     * @throws IOException           if the event process cannot be started
     * @throws IllegalStateException if the session is already running
     */
    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Listener session already running");
        }
        reader.start();
        consumer = new Thread(this::consumeLoop, "listener-consumer");
        consumer.start();
        log.info("Listener started (post-capture {})", postCapture ? "on" : "off");
    }

    /**
     * Stops the event stream, waits for the consumer to finish its current
     * cycle and saves the exit screenshot. Idempotent.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) return;
        reader.stop();
        Thread t = consumer;
        if (t != null) {
            try {
                t.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        orchestrator.saveExitScreenshot();
        log.info("Listener stopped: {} tap(s) recorded, {} dropped", recorded.get(), dropped.get());
    }

    /** Blocks until the consumer loop ends (stop, or end of the event stream). */
    public void awaitTermination() throws InterruptedException {
        finished.await();
    }

    public boolean isRunning()    { return running.get(); }
    public int getRecordedCount() { return recorded.get(); }
    public int getDroppedCount()  { return dropped.get(); }

    // ── Consumer ──────────────────────────────────────────────────────────

    private void consumeLoop() {
        try {
            UiSnapshot pending = prepare();
            while (running.get()) {
                String line = reader.poll(POLL_MS);
                if (line == null) {
                    if (!reader.isRunning() && reader.getQueue().isEmpty()) {
                        log.warn("Event stream ended");
                        break;
                    }
                    continue;
                }
                Optional<CompletedGesture> gesture = detector.onLine(line);
                if (gesture.isPresent()) {
                    try {
                        handle(pending, gesture.get());
                    } catch (RuntimeException e) {
                        log.error("Recording tap at ({}, {}) failed", gesture.get().x(), gesture.get().y(), e);
                        dropped.incrementAndGet();
                    }
                    pending = prepare();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            finished.countDown();
        }
    }

    private void handle(UiSnapshot pending, CompletedGesture gesture) {
        log.info("Tap at ({}, {})", gesture.x(), gesture.y());
        if (pending == null) {
            log.warn("Tap at ({}, {}) ignored: no pre-snapshot was ready", gesture.x(), gesture.y());
            dropped.incrementAndGet();
            return;
        }
        CycleResult result = orchestrator.recordGesture(pending, gesture, postCapture, waitAfterMs);
        if (result.isRecorded()) {
            recorded.incrementAndGet();
        } else {
            dropped.incrementAndGet();
        }
    }

    private UiSnapshot prepare() {
        try {
            return orchestrator.prepareSnapshot();
        } catch (UiTraceException e) {
            log.warn("Pre-snapshot failed ({}): {}", e.getKind(), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.error("Pre-snapshot failed", e);
            return null;
        }
    }
}

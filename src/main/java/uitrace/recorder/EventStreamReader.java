package uitrace.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the {@code getevent -lt} producer process and pushes each output line
 * onto a bounded queue for a single consumer.
 *
 * <p>A full queue blocks the reader thread, which in turn back-pressures the
 * process through its stdout pipe, until {@link #stop()} is called. The end
 * of the process, or a read error, only ends the stream; nothing is
 * propagated to the consumer.
 */
public class EventStreamReader {

    private static final Logger log = LoggerFactory.getLogger(EventStreamReader.class);

    /** Starts the producer process; replaceable in tests. */
    @FunctionalInterface
    public interface ProcessLauncher {
        Process launch(List<String> command) throws IOException;
    }

    private final List<String> command;
    private final BlockingQueue<String> queue;
    private final long graceMs;
    private final ProcessLauncher launcher;

    private static final long OFFER_MS = 200;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile Process process;
    private Thread readerThread;

    public EventStreamReader(List<String> command, int capacity, long graceMs) {
        this(command, capacity, graceMs,
                cmd -> new ProcessBuilder(cmd).redirectErrorStream(true).start());
    }

    EventStreamReader(List<String> command, int capacity, long graceMs, ProcessLauncher launcher) {
        this.command  = List.copyOf(command);
        this.queue    = new ArrayBlockingQueue<>(capacity);
        this.graceMs  = graceMs;
        this.launcher = launcher;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    /**
     * Launches the process and the daemon reader thread.
     *
     * @throws IOException           if the process cannot be started
     * @throws IllegalStateException if already started
     */
    public synchronized void start() throws IOException {
        if (readerThread != null) {
            throw new IllegalStateException("EventStreamReader already started");
        }
        log.info("Starting event stream: {}", String.join(" ", command));
        process = launcher.launch(command);
        readerThread = new Thread(this::readLoop, "getevent-reader");
        readerThread.setDaemon(true);
        readerThread.start();
    }

    /**
     * Stops the producer: asks the process to terminate, waits up to the grace
     * period, then kills it. Idempotent.
     */
    public void stop() {
        if (!stopRequested.compareAndSet(false, true)) return;
        Process proc = process;
        if (proc == null || !proc.isAlive()) return;
        proc.destroy();
        try {
            if (!proc.waitFor(graceMs, TimeUnit.MILLISECONDS)) {
                log.warn("Event process did not exit within {} ms, killing it", graceMs);
                proc.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            proc.destroyForcibly();
        }
        log.info("Event stream stopped");
    }

    /**
     * Waits up to {@code timeoutMs} for the next line.
     *
     * @return the line, or {@code null} on timeout
     */
    public String poll(long timeoutMs) throws InterruptedException {
        return queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /** True while the reader thread is still delivering lines. */
    public boolean isRunning() {
        Thread t = readerThread;
        return t != null && t.isAlive();
    }

    public BlockingQueue<String> getQueue() { return queue; }

    // ── Reader thread ─────────────────────────────────────────────────────

    private void readLoop() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (!stopRequested.get() && (line = reader.readLine()) != null) {
                if (!enqueue(stripLineEnd(line))) break;
            }
        } catch (IOException e) {
            if (!stopRequested.get()) {
                log.warn("Event stream read error: {}", e.getMessage());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Event reader thread finished");
    }

    /** Waits for queue space; false once a stop is requested. */
    private boolean enqueue(String line) throws InterruptedException {
        while (!queue.offer(line, OFFER_MS, TimeUnit.MILLISECONDS)) {
            if (stopRequested.get()) {
                log.debug("Dropping queued line on stop: queue full");
                return false;
            }
        }
        return true;
    }

    private static String stripLineEnd(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\r' || line.charAt(end - 1) == '\n')) end--;
        return line.substring(0, end);
    }
}

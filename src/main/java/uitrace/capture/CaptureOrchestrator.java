package uitrace.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uitrace.device.DeviceBridge;
import uitrace.ledger.Ledger;
import uitrace.ledger.LedgerException;
import uitrace.model.ActionKind;
import uitrace.model.ActionOutcome;
import uitrace.model.ActionRequest;
import uitrace.model.BoundingRect;
import uitrace.model.CaptureRecord;
import uitrace.model.CompletedGesture;
import uitrace.model.ControlNode;
import uitrace.model.NodeQuery;
import uitrace.model.Point;
import uitrace.model.UiSnapshot;
import uitrace.model.UiTraceException;
import uitrace.resolve.HierarchySnapshot;
import uitrace.resolve.NodeResolver;
import uitrace.resolve.ResolutionException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs capture cycles: pre-snapshot, resolve, annotate, act, post-snapshot,
 * record.
 *
 * <p>The pre-snapshot is always taken before the action is dispatched. The
 * sequence id of a cycle is the ledger length at its start and is consumed
 * only by a successful append, so aborted cycles leave no gap.
 *
 * <p>Every cycle holds one lock for its whole duration: the device and the
 * ledger are a single critical section shared by the listener and the HTTP
 * control plane.
 */
public class CaptureOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CaptureOrchestrator.class);

    private final DeviceBridge bridge;
    private final Ledger ledger;
    private final CaptureLayout layout;
    private final NodeResolver resolver;
    private final SnapshotTaker snapshots;
    private final ScreenshotAnnotator annotator;
    private final ActionDispatcher dispatcher;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final ExecutorService actionExecutor;

    public CaptureOrchestrator(DeviceBridge bridge, Ledger ledger, CaptureLayout layout) {
        this(bridge, ledger, layout, new NodeResolver(), new ScreenshotAnnotator(), Clock.systemUTC());
    }

    public CaptureOrchestrator(DeviceBridge bridge, Ledger ledger, CaptureLayout layout,
                               NodeResolver resolver, ScreenshotAnnotator annotator, Clock clock) {
        this.bridge     = bridge;
        this.ledger     = ledger;
        this.layout     = layout;
        this.resolver   = resolver;
        this.annotator  = annotator;
        this.clock      = clock;
        this.snapshots  = new SnapshotTaker(bridge, layout);
        this.dispatcher = new ActionDispatcher(bridge);

        AtomicInteger threadNo = new AtomicInteger();
        this.actionExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "capture-action-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ── On-demand cycle ───────────────────────────────────────────────────

    /**
     * Runs one full cycle for an externally supplied target and action.
     * Fatal failures are returned as {@link CycleResult#aborted aborted}
     * results; a failed action is attached to the record instead.
     */
    public CycleResult capture(CaptureRequest request) {
        cycleLock.lock();
        try {
            bridge.ensureConnected();
            request.validate();

            int id = ledger.size();
            UiSnapshot pre = snapshots.takePre(id);
            try {
                return completeCycle(pre, request);
            } catch (UiTraceException e) {
                discardCycle(id);
                throw e;
            }
        } catch (UiTraceException e) {
            return abort(e);
        } finally {
            cycleLock.unlock();
        }
    }

    private CycleResult completeCycle(UiSnapshot pre, CaptureRequest request) {
        int id = pre.sequenceId();
        ActionRequest action = request.action();

        ControlNode node = ControlNode.empty();
        BoundingRect rect = null;
        if (action.kind().requiresTarget()) {
            node = resolve(pre, request.query());
            rect = node.rect().orElseThrow(() ->
                    new ResolutionException("Resolved node has no usable bounds"));
        }
        Point center = rect == null ? null : rect.center();
        annotate(pre, rect);

        CaptureTiming timing = request.timing();
        CompletableFuture<ActionOutcome> future;
        UiSnapshot post;
        String actionError = null;
        if (timing.mode() == CaptureTiming.Mode.MID) {
            future = CompletableFuture.supplyAsync(() -> dispatcher.dispatch(action, center), actionExecutor);
            pause(timing.midDelayMs());
            actionError = failureIfDone(future);
            post = snapshots.takePost(id);
            awaitQuietly(future, ActionDispatcher.joinTimeoutMs(action));
        } else {
            ActionOutcome outcome = dispatcher.dispatch(action, center);
            future = CompletableFuture.completedFuture(outcome);
            if (!outcome.ok()) actionError = outcome.error();
            pause(timing.waitAfterMs());
            post = snapshots.takePost(id);
        }
        if (actionError != null) {
            log.warn("Action {} of {} failed: {}", action.kind(), CaptureLayout.elemId(id), actionError);
        }

        CaptureRecord record = baseRecord(pre, node, center);
        record.setAction(action.kind());
        record.setActionParams(action.recordParams());
        record.setCaptureTiming(timing.mode().wireName());
        record.setActionError(actionError);
        applyPost(record, pre, post);

        ledger.append(record);
        log.info("Recorded {} {} at {} (activity {} → {})", record.getElemId(), action.kind(),
                center, record.getSourceActivity(), record.getDestActivity());
        return CycleResult.recorded(record, center, files(pre, post), future);
    }

    // ── Listener cycle ────────────────────────────────────────────────────

    /**
     * Takes the pre-snapshot for the next observed tap, tagged with the
     * sequence id that tap would receive.
     *
     * @throws uitrace.device.DeviceConnectionException if the device is gone
     * @throws CaptureException                         if the snapshot fails
     */
    public UiSnapshot prepareSnapshot() {
        cycleLock.lock();
        try {
            bridge.ensureConnected();
            return snapshots.takePre(ledger.size());
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Records a tap the user already performed, against the snapshot taken
     * before it.
     *
     * @param postCapture also capture the screen after the tap
     * @param waitAfterMs settle delay before that capture
     */
    public CycleResult recordGesture(UiSnapshot pre, CompletedGesture gesture,
                                     boolean postCapture, long waitAfterMs) {
        cycleLock.lock();
        try {
            int id = ledger.size();
            if (pre == null) {
                throw new CaptureException("No pre-snapshot available for tap at " + gesture.toPoint());
            }
            if (pre.sequenceId() != id) {
                throw new CaptureException("Stale pre-snapshot " + CaptureLayout.elemId(pre.sequenceId())
                        + ", next id is " + id);
            }

            try {
                return completeGesture(pre, gesture, postCapture, waitAfterMs);
            } catch (UiTraceException e) {
                discardCycle(id);
                throw e;
            }
        } catch (UiTraceException e) {
            return abort(e);
        } finally {
            cycleLock.unlock();
        }
    }

    private CycleResult completeGesture(UiSnapshot pre, CompletedGesture gesture,
                                        boolean postCapture, long waitAfterMs) {
        int id = pre.sequenceId();
        ControlNode node = resolve(pre, new NodeQuery.PointQuery(gesture.x(), gesture.y()));
        annotate(pre, node.rect().orElse(null));

        UiSnapshot post = null;
        if (postCapture) {
            pause(waitAfterMs);
            post = snapshots.takePost(id);
        }

        CaptureRecord record = baseRecord(pre, node, gesture.toPoint());
        record.setAction(ActionKind.SHORT_CLICK);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("source", "listener");
        record.setActionParams(params);
        if (post != null) {
            record.setCaptureTiming(CaptureTiming.Mode.POST.wireName());
            applyPost(record, pre, post);
        }

        ledger.append(record);
        log.info("Recorded {} tap at {} on {}", record.getElemId(), gesture.toPoint(), node);
        return CycleResult.recorded(record, gesture.toPoint(), files(pre, post), null);
    }

    // ── Final snapshot ────────────────────────────────────────────────────

    /** Records the current screen with no interaction (action {@code final}). */
    public CycleResult captureFinal() {
        cycleLock.lock();
        try {
            bridge.ensureConnected();
            int id = ledger.size();
            UiSnapshot pre = snapshots.takePre(id);
            try {
                annotate(pre, null);
                CaptureRecord record = baseRecord(pre, ControlNode.empty(), null);
                record.setAction(ActionKind.FINAL);
                ledger.append(record);
                log.info("Recorded final snapshot {}", record.getElemId());
                return CycleResult.recorded(record, null, files(pre, null), null);
            } catch (UiTraceException e) {
                discardCycle(id);
                throw e;
            }
        } catch (UiTraceException e) {
            return abort(e);
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Saves a plain screenshot to {@code image/final_screenshot.png}.
     *
     * @return the file, or empty if the screenshot failed
     */
    public Optional<Path> saveExitScreenshot() {
        cycleLock.lock();
        try {
            Path target = layout.exitScreenshot();
            snapshots.saveScreenshot(target);
            log.info("Saved exit screenshot: {}", target);
            return Optional.of(target);
        } catch (IOException e) {
            log.warn("Saving exit screenshot failed: {}", e.getMessage());
            return Optional.empty();
        } finally {
            cycleLock.unlock();
        }
    }

    public Ledger getLedger() { return ledger; }

    public CaptureLayout getLayout() { return layout; }

    /** Stops accepting mid-capture actions; running ones are left to finish. */
    @Override
    public void close() {
        actionExecutor.shutdown();
    }

    // ── Cycle steps ───────────────────────────────────────────────────────

    private ControlNode resolve(UiSnapshot pre, NodeQuery query) {
        HierarchySnapshot hierarchy;
        try {
            hierarchy = HierarchySnapshot.load(pre.hierarchyXmlPath());
        } catch (IOException e) {
            throw new CaptureException("Cannot read " + pre.hierarchyXmlPath() + ": " + e.getMessage(), e);
        }
        ControlNode node = resolver.resolve(hierarchy, query);
        log.debug("{} resolved to {}", query, node);
        return node;
    }

    private void annotate(UiSnapshot pre, BoundingRect rect) {
        Path boxed = layout.boxedImage(pre.sequenceId());
        try {
            annotator.annotate(pre.screenshotPath(), boxed, rect);
        } catch (IOException e) {
            throw new CaptureException("Cannot write " + boxed + ": " + e.getMessage(), e);
        }
    }

    private CaptureRecord baseRecord(UiSnapshot pre, ControlNode node, Point clickPoint) {
        int id = pre.sequenceId();
        CaptureRecord record = new CaptureRecord();
        record.setSequenceId(id);
        record.setElemId(CaptureLayout.elemId(id));
        record.setTimestamp(clock.instant());
        record.setClickPoint(clickPoint);
        record.setNode(new LinkedHashMap<>(node.getAttributes()));
        record.setPreImages(new CaptureRecord.ImageSet(
                pre.screenshotPath().toString(), layout.boxedImage(id).toString()));
        record.setPreXml(pre.hierarchyXmlPath().toString());
        record.setSourceActivity(pre.activity());
        return record;
    }

    private static void applyPost(CaptureRecord record, UiSnapshot pre, UiSnapshot post) {
        if (post.screenshotPath() != null) {
            record.setPostImages(new CaptureRecord.ImageSet(post.screenshotPath().toString(), null));
        }
        if (post.hierarchyXmlPath() != null) {
            record.setPostXml(post.hierarchyXmlPath().toString());
        }
        record.setDestActivity(post.activity());
        if (pre.hasActivity() && post.hasActivity()) {
            record.setActivityChanged(!pre.activity().equals(post.activity()));
        }
    }

    private Map<String, String> files(UiSnapshot pre, UiSnapshot post) {
        int id = pre.sequenceId();
        Map<String, String> files = new LinkedHashMap<>();
        files.put("raw", pre.screenshotPath().toString());
        files.put("boxed", layout.boxedImage(id).toString());
        files.put("xml", pre.hierarchyXmlPath().toString());
        files.put("json", ledger.getFile().toAbsolutePath().toString());
        if (post != null && post.screenshotPath() != null) files.put("dest", post.screenshotPath().toString());
        if (post != null && post.hierarchyXmlPath() != null) files.put("destXml", post.hierarchyXmlPath().toString());
        return files;
    }

    /** Deletes every file an abandoned cycle may have written, pre and post side. */
    private void discardCycle(int id) {
        snapshots.discard(layout.preXml(id), layout.rawImage(id), layout.boxedImage(id),
                layout.postImage(id), layout.postXml(id));
    }

    private static CycleResult abort(UiTraceException e) {
        if (e instanceof LedgerException) {
            log.error("Cycle failed while appending: {}", e.getMessage(), e);
        } else {
            log.error("Cycle aborted ({}): {}", e.getKind(), e.getMessage());
        }
        return CycleResult.aborted(e.getKind(), e.getMessage());
    }

    /** Error of an action that has already finished, else null. */
    private static String failureIfDone(CompletableFuture<ActionOutcome> future) {
        if (!future.isDone()) return null;
        try {
            ActionOutcome outcome = future.join();
            return outcome.ok() ? null : outcome.error();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return String.valueOf(cause.getMessage());
        }
    }

    private static void awaitQuietly(CompletableFuture<ActionOutcome> future, long timeoutMs) {
        try {
            future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Action still running after {} ms; continuing without it", timeoutMs);
        } catch (ExecutionException e) {
            log.warn("Action failed after capture: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void pause(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

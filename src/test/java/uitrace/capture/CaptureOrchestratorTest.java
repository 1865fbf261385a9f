package uitrace.capture;

import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import uitrace.device.DeviceBridge;
import uitrace.device.DeviceConnectionException;
import uitrace.ledger.Ledger;
import uitrace.model.ActionKind;
import uitrace.model.ActionOutcome;
import uitrace.model.ActionRequest;
import uitrace.model.CaptureRecord;
import uitrace.model.CompletedGesture;
import uitrace.model.FailureKind;
import uitrace.model.NodeQuery;
import uitrace.model.Point;
import uitrace.model.SwipeDirection;
import uitrace.model.UiSnapshot;
import uitrace.resolve.NodeResolver;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link CaptureOrchestrator} with a mocked {@link DeviceBridge}
 * serving the {@code hierarchy.xml} fixture. Files, resolver, annotator and
 * ledger are real.
 */
public class CaptureOrchestratorTest {

    private static final String MAIN   = "com.example.notes/com.example.notes.MainActivity";
    private static final String DETAIL = "com.example.notes/com.example.notes.DetailActivity";
    private static final String OK_BOUNDS = "[40,40][60,60]";
    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    @Mock
    private DeviceBridge bridge;

    private AutoCloseable mocks;
    private Path dir;
    private CaptureLayout layout;
    private CaptureOrchestrator orchestrator;
    private String hierarchy;
    private byte[] png;

    @BeforeMethod
    public void setUp() throws Exception {
        mocks = MockitoAnnotations.openMocks(this);
        dir = Files.createTempDirectory("uitrace-capture");
        try (InputStream in = getClass().getResourceAsStream("/fixtures/hierarchy.xml")) {
            hierarchy = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        png = ScreenshotAnnotatorTest.png(120, 120);

        when(bridge.dumpHierarchy()).thenReturn(hierarchy);
        when(bridge.screenshot()).thenReturn(png);
        when(bridge.foregroundActivity()).thenReturn(MAIN);
        when(bridge.tap(anyInt(), anyInt())).thenReturn(ActionOutcome.success());
        when(bridge.back()).thenReturn(ActionOutcome.success());

        layout = new CaptureLayout(dir);
        layout.ensureDirectories();
        Ledger ledger = Ledger.open(layout.ledgerFile(), false);
        orchestrator = new CaptureOrchestrator(bridge, ledger, layout, new NodeResolver(),
                new ScreenshotAnnotator(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterMethod
    public void tearDown() throws Exception {
        orchestrator.close();
        mocks.close();
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }

    private static CaptureRequest tapAt(String bounds) {
        return new CaptureRequest(new NodeQuery.BoundsQuery(bounds), new ActionRequest.ShortClick(),
                CaptureTiming.post(0));
    }

    // ── On-demand cycles ──────────────────────────────────────────────────

    @Test(description = "A short click by bounds records pre and post state and all files")
    public void capture_shortClick() throws Exception {
        when(bridge.foregroundActivity()).thenReturn(MAIN, DETAIL);

        CycleResult result = orchestrator.capture(tapAt("[40, 40][60, 60]"));

        assertThat(result.isRecorded()).isTrue();
        assertThat(result.getCenter()).contains(new Point(50, 50));
        verify(bridge).tap(50, 50);

        CaptureRecord record = result.getRecord();
        assertThat(record.getSequenceId()).isZero();
        assertThat(record.getElemId()).isEqualTo("elem_0");
        assertThat(record.getTimestamp()).isEqualTo(NOW);
        assertThat(record.getAction()).isEqualTo(ActionKind.SHORT_CLICK);
        assertThat(record.getNode()).containsEntry("text", "OK").containsEntry("bounds", OK_BOUNDS);
        assertThat(record.getSourceActivity()).isEqualTo(MAIN);
        assertThat(record.getDestActivity()).isEqualTo(DETAIL);
        assertThat(record.getActivityChanged()).isTrue();
        assertThat(record.getCaptureTiming()).isEqualTo("post");
        assertThat(record.getActionError()).isNull();

        assertThat(result.getFiles()).containsOnlyKeys("raw", "boxed", "xml", "json", "dest", "destXml");
        assertThat(layout.rawImage(0)).exists();
        assertThat(layout.boxedImage(0)).exists();
        assertThat(layout.preXml(0)).hasContent(hierarchy);
        assertThat(layout.postImage(0)).exists();
        assertThat(layout.postXml(0)).exists();
        assertThat(orchestrator.getLedger().size()).isEqualTo(1);
    }

    @Test(description = "Consecutive cycles get consecutive ids and the ledger reloads cleanly")
    public void capture_sequence() throws Exception {
        orchestrator.capture(tapAt(OK_BOUNDS));
        orchestrator.capture(new CaptureRequest(null, new ActionRequest.Back(), CaptureTiming.post(0)));
        CycleResult third = orchestrator.capture(tapAt(OK_BOUNDS));

        assertThat(third.getRecord().getElemId()).isEqualTo("elem_2");
        assertThat(layout.rawImage(2)).exists();

        Ledger reloaded = Ledger.open(layout.ledgerFile(), false);
        assertThat(reloaded.records()).extracting(CaptureRecord::getAction)
                .containsExactly(ActionKind.SHORT_CLICK, ActionKind.BACK, ActionKind.SHORT_CLICK);
    }

    @Test(description = "Back needs no target: no click point, empty node, unmarked boxed copy")
    public void capture_back() throws Exception {
        CycleResult result = orchestrator.capture(
                new CaptureRequest(null, new ActionRequest.Back(), CaptureTiming.post(0)));

        assertThat(result.isRecorded()).isTrue();
        assertThat(result.getCenter()).isEmpty();
        assertThat(result.getRecord().getClickPoint()).isNull();
        assertThat(result.getRecord().getNode()).isEmpty();
        assertThat(result.getRecord().getActivityChanged()).isFalse();
        assertThat(Files.mismatch(layout.rawImage(0), layout.boxedImage(0))).isEqualTo(-1L);
        verify(bridge).back();
        verify(bridge, never()).tap(anyInt(), anyInt());
    }

    @Test(description = "Swipe starts at the resolved center and records its parameters")
    public void capture_swipe() throws Exception {
        when(bridge.swipe(900, 1750, 900, 1650, 300)).thenReturn(ActionOutcome.success());

        CycleResult result = orchestrator.capture(new CaptureRequest(
                new NodeQuery.PathQuery("//node[@text='Submit']"),
                new ActionRequest.Swipe(SwipeDirection.UP, 100, null, null, 300),
                CaptureTiming.post(0)));

        assertThat(result.isRecorded()).isTrue();
        verify(bridge).swipe(900, 1750, 900, 1650, 300);
        assertThat(result.getRecord().getActionParams())
                .containsEntry("durationMs", 300)
                .containsEntry("swipeDirection", "up")
                .containsEntry("swipeDistance", 100);
    }

    @Test(description = "An unresolvable target aborts, removes the pre files and frees the id")
    public void capture_resolutionFailure() throws Exception {
        CycleResult result = orchestrator.capture(tapAt("[1,1][2,2]"));

        assertThat(result.isRecorded()).isFalse();
        assertThat(result.getFailureKind()).isEqualTo(FailureKind.RESOLUTION);
        assertThat(orchestrator.getLedger().size()).isZero();
        assertThat(layout.rawImage(0)).doesNotExist();
        assertThat(layout.preXml(0)).doesNotExist();
        assertThat(layout.boxedImage(0)).doesNotExist();
        verify(bridge, never()).tap(anyInt(), anyInt());

        assertThat(orchestrator.capture(tapAt(OK_BOUNDS)).getRecord().getSequenceId()).isZero();
    }

    @Test(description = "Invalid parameters are rejected before any capture")
    public void capture_validationFirst() throws Exception {
        CycleResult result = orchestrator.capture(new CaptureRequest(
                new NodeQuery.BoundsQuery(OK_BOUNDS), new ActionRequest.LongClick(0), CaptureTiming.post(0)));

        assertThat(result.getFailureKind()).isEqualTo(FailureKind.VALIDATION);
        assertThat(result.getMessage()).contains("durationMs");
        verify(bridge, never()).dumpHierarchy();
        verify(bridge, never()).screenshot();
    }

    @Test(description = "A targeted action without a query is a validation failure")
    public void capture_missingTarget() throws Exception {
        CycleResult result = orchestrator.capture(
                new CaptureRequest(null, new ActionRequest.ShortClick(), CaptureTiming.post(0)));

        assertThat(result.getFailureKind()).isEqualTo(FailureKind.VALIDATION);
        verify(bridge, never()).screenshot();
    }

    @Test(description = "A missing device aborts with a connection failure")
    public void capture_disconnected() throws Exception {
        doThrow(new DeviceConnectionException("no device")).when(bridge).ensureConnected();

        CycleResult result = orchestrator.capture(tapAt(OK_BOUNDS));

        assertThat(result.getFailureKind()).isEqualTo(FailureKind.CONNECTION);
        verify(bridge, never()).dumpHierarchy();
    }

    @Test(description = "A failed pre screenshot aborts and leaves no dump behind")
    public void capture_preScreenshotFails() throws Exception {
        when(bridge.screenshot()).thenThrow(new IOException("screencap died"));

        CycleResult result = orchestrator.capture(tapAt(OK_BOUNDS));

        assertThat(result.getFailureKind()).isEqualTo(FailureKind.CAPTURE);
        assertThat(result.getMessage()).contains("screencap died");
        assertThat(layout.preXml(0)).doesNotExist();
        assertThat(orchestrator.getLedger().size()).isZero();
    }

    @Test(description = "A failed action is attached to the record, not an abort")
    public void capture_actionErrorRecorded() throws Exception {
        when(bridge.tap(50, 50)).thenReturn(ActionOutcome.failure("input tap: exit 1"));

        CycleResult result = orchestrator.capture(tapAt(OK_BOUNDS));

        assertThat(result.isRecorded()).isTrue();
        assertThat(result.getRecord().getActionError()).isEqualTo("input tap: exit 1");
    }

    @Test(description = "A failed post screenshot only drops that artifact")
    public void capture_postScreenshotFails() throws Exception {
        when(bridge.screenshot()).thenReturn(png).thenThrow(new IOException("gone"));

        CycleResult result = orchestrator.capture(tapAt(OK_BOUNDS));

        assertThat(result.isRecorded()).isTrue();
        assertThat(result.getRecord().getPostImages()).isNull();
        assertThat(result.getRecord().getPostXml()).isEqualTo(layout.postXml(0).toString());
        assertThat(result.getFiles()).doesNotContainKey("dest").containsKey("destXml");
    }

    @Test(description = "Mid timing captures while a long press is still running", timeOut = 10000)
    public void capture_midTiming() throws Exception {
        when(bridge.longPress(50, 50, 1000)).thenAnswer(inv -> {
            Thread.sleep(400);
            return ActionOutcome.failure("too late to matter");
        });

        CycleResult result = orchestrator.capture(new CaptureRequest(
                new NodeQuery.BoundsQuery(OK_BOUNDS), new ActionRequest.LongClick(1000), CaptureTiming.mid(20)));

        assertThat(result.isRecorded()).isTrue();
        assertThat(result.getRecord().getCaptureTiming()).isEqualTo("mid");
        assertThat(result.getRecord().getActionError()).isNull();
        assertThat(result.getRecord().getActionParams()).containsEntry("durationMs", 1000);
        assertThat(result.getAction()).isPresent();
        assertThat(result.getAction().get().get().ok()).isFalse();
    }

    @Test(description = "Mid timing attaches a failure the action reported before the capture", timeOut = 10000)
    public void capture_midTiming_earlyFailure() throws Exception {
        when(bridge.longPress(50, 50, 600)).thenReturn(ActionOutcome.failure("input swipe: exit 255"));

        CycleResult result = orchestrator.capture(new CaptureRequest(
                new NodeQuery.BoundsQuery(OK_BOUNDS), new ActionRequest.LongClick(600), CaptureTiming.mid(300)));

        assertThat(result.isRecorded()).isTrue();
        assertThat(result.getRecord().getCaptureTiming()).isEqualTo("mid");
        assertThat(result.getRecord().getActionError()).isEqualTo("input swipe: exit 255");
    }

    @Test(description = "No-action capture resolves and snapshots the target but leaves the device alone")
    public void capture_noAction() throws Exception {
        CycleResult result = orchestrator.capture(new CaptureRequest(
                new NodeQuery.BoundsQuery(OK_BOUNDS), new ActionRequest.NoAction(), CaptureTiming.post(0)));

        assertThat(result.isRecorded()).isTrue();
        assertThat(result.getRecord().getAction()).isEqualTo(ActionKind.NONE);
        assertThat(result.getRecord().getNode()).containsEntry("text", "OK");
        assertThat(result.getCenter()).contains(new Point(50, 50));
        assertThat(layout.postImage(0)).exists();
        verify(bridge, never()).tap(anyInt(), anyInt());
        verify(bridge, never()).longPress(anyInt(), anyInt(), anyInt());
        verify(bridge, never()).back();
        assertThat(Ledger.open(layout.ledgerFile(), false).records().get(0).getAction()).isEqualTo(ActionKind.NONE);
    }

    @Test(description = "A failed ledger write removes every file of the cycle, post side included")
    public void capture_ledgerFailure_discardsAllFiles() throws Exception {
        Files.createDirectory(layout.ledgerFile().resolveSibling(Ledger.FILE_NAME + ".tmp"));

        CycleResult result = orchestrator.capture(tapAt(OK_BOUNDS));

        assertThat(result.getFailureKind()).isEqualTo(FailureKind.LEDGER);
        assertThat(orchestrator.getLedger().size()).isZero();
        assertThat(layout.rawImage(0)).doesNotExist();
        assertThat(layout.boxedImage(0)).doesNotExist();
        assertThat(layout.preXml(0)).doesNotExist();
        assertThat(layout.postImage(0)).doesNotExist();
        assertThat(layout.postXml(0)).doesNotExist();

        assertThat(orchestrator.capture(tapAt(OK_BOUNDS)).getRecord().getSequenceId()).isZero();
    }

    @Test(description = "Concurrent cycles run one at a time and get consecutive ids", timeOut = 30000)
    public void capture_concurrent_serialized() throws Exception {
        int cycles = 16;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<CycleResult>> tasks = new ArrayList<>();
            for (int i = 0; i < cycles; i++) {
                tasks.add(() -> orchestrator.capture(tapAt(OK_BOUNDS)));
            }
            List<Integer> ids = new ArrayList<>();
            for (Future<CycleResult> f : pool.invokeAll(tasks)) {
                CycleResult r = f.get();
                assertThat(r.isRecorded()).isTrue();
                ids.add(r.getRecord().getSequenceId());
            }

            assertThat(ids).containsExactlyInAnyOrderElementsOf(
                    IntStream.range(0, cycles).boxed().collect(Collectors.toList()));
            assertThat(Ledger.open(layout.ledgerFile(), false).records())
                    .extracting(CaptureRecord::getSequenceId)
                    .containsExactlyElementsOf(IntStream.range(0, cycles).boxed().collect(Collectors.toList()));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test(description = "Changing a returned record does not change what the ledger committed")
    public void capture_returnedRecordIsDetached() throws Exception {
        CycleResult first = orchestrator.capture(tapAt(OK_BOUNDS));
        CaptureRecord handedOut = first.getRecord();
        handedOut.setSequenceId(5);
        handedOut.getNode().put("bounds", "tampered");
        orchestrator.getLedger().records().get(0).getNode().put("text", "tampered");

        orchestrator.capture(tapAt(OK_BOUNDS));

        List<CaptureRecord> reloaded = Ledger.open(layout.ledgerFile(), false).records();
        assertThat(reloaded).extracting(CaptureRecord::getSequenceId).containsExactly(0, 1);
        assertThat(reloaded.get(0).getNode())
                .containsEntry("bounds", OK_BOUNDS)
                .containsEntry("text", "OK");
        assertThat(first.getRecord().getSequenceId()).isZero();
    }

    // ── Final ─────────────────────────────────────────────────────────────

    @Test(description = "Final snapshot records the screen with no action and no post capture")
    public void captureFinal() throws Exception {
        CycleResult result = orchestrator.captureFinal();

        assertThat(result.isRecorded()).isTrue();
        CaptureRecord record = result.getRecord();
        assertThat(record.getAction()).isEqualTo(ActionKind.FINAL);
        assertThat(record.getPostImages()).isNull();
        assertThat(record.getCaptureTiming()).isNull();
        assertThat(record.getSourceActivity()).isEqualTo(MAIN);
        assertThat(Files.mismatch(layout.rawImage(0), layout.boxedImage(0))).isEqualTo(-1L);
        verify(bridge, never()).tap(anyInt(), anyInt());
        verify(bridge, never()).back();
    }

    @Test(description = "Exit screenshot is written, or reported missing on failure")
    public void saveExitScreenshot() throws Exception {
        assertThat(orchestrator.saveExitScreenshot()).contains(layout.exitScreenshot());
        assertThat(layout.exitScreenshot()).exists();

        when(bridge.screenshot()).thenThrow(new IOException("gone"));
        assertThat(orchestrator.saveExitScreenshot()).isEqualTo(Optional.empty());
    }

    // ── Listener cycles ───────────────────────────────────────────────────

    @Test(description = "An observed tap is recorded against the prepared snapshot")
    public void recordGesture() throws Exception {
        UiSnapshot pre = orchestrator.prepareSnapshot();

        CycleResult result = orchestrator.recordGesture(pre, new CompletedGesture(50, 50), true, 0);

        assertThat(result.isRecorded()).isTrue();
        CaptureRecord record = result.getRecord();
        assertThat(record.getClickPoint()).isEqualTo(new Point(50, 50));
        assertThat(record.getNode()).containsEntry("text", "OK");
        assertThat(record.getActionParams()).containsEntry("source", "listener");
        assertThat(record.getCaptureTiming()).isEqualTo("post");
        verify(bridge, never()).tap(anyInt(), anyInt());
    }

    @Test(description = "Without post capture the record has no post side")
    public void recordGesture_noPost() throws Exception {
        UiSnapshot pre = orchestrator.prepareSnapshot();

        CycleResult result = orchestrator.recordGesture(pre, new CompletedGesture(200, 250), false, 0);

        assertThat(result.getRecord().getNode()).containsEntry("text", "Hello");
        assertThat(result.getRecord().getPostImages()).isNull();
        assertThat(result.getRecord().getCaptureTiming()).isNull();
        assertThat(layout.postImage(0)).doesNotExist();
    }

    @Test(description = "A snapshot made stale by another cycle is refused")
    public void recordGesture_stale() throws Exception {
        UiSnapshot pre = orchestrator.prepareSnapshot();
        orchestrator.capture(tapAt(OK_BOUNDS));

        CycleResult result = orchestrator.recordGesture(pre, new CompletedGesture(50, 50), false, 0);

        assertThat(result.getFailureKind()).isEqualTo(FailureKind.CAPTURE);
        assertThat(orchestrator.getLedger().size()).isEqualTo(1);
    }

    @Test(description = "A tap outside every node drops the prepared snapshot files")
    public void recordGesture_unresolved_discards() throws Exception {
        UiSnapshot pre = orchestrator.prepareSnapshot();

        CycleResult result = orchestrator.recordGesture(pre, new CompletedGesture(5000, 5000), true, 0);

        assertThat(result.getFailureKind()).isEqualTo(FailureKind.RESOLUTION);
        assertThat(layout.rawImage(0)).doesNotExist();
        assertThat(layout.preXml(0)).doesNotExist();
        assertThat(orchestrator.getLedger().size()).isZero();
    }

    @Test(description = "A tap with no snapshot is refused")
    public void recordGesture_noSnapshot() throws Exception {
        CycleResult result = orchestrator.recordGesture(null, new CompletedGesture(50, 50), false, 0);

        assertThat(result.isRecorded()).isFalse();
        assertThat(result.getFailureKind()).isEqualTo(FailureKind.CAPTURE);
    }
}

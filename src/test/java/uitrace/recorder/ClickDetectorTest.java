package uitrace.recorder;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import uitrace.model.CompletedGesture;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ClickDetector}.
 */
public class ClickDetectorTest {

    private ClickDetector detector;

    @BeforeMethod
    public void setUp() {
        detector = new ClickDetector();
    }

    private List<CompletedGesture> feed(String... lines) {
        List<CompletedGesture> out = new ArrayList<>();
        for (String line : lines) {
            detector.onLine(line).ifPresent(out::add);
        }
        return out;
    }

    @Test(description = "Captured getevent output yields exactly one tap at (500, 800)")
    public void fixture_singleTap() throws IOException {
        String text;
        try (InputStream in = getClass().getResourceAsStream("/fixtures/getevent-tap.txt")) {
            assertThat(in).as("fixture getevent-tap.txt").isNotNull();
            text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        List<CompletedGesture> gestures = feed(text.split("\n"));

        assertThat(gestures).containsExactly(new CompletedGesture(500, 800));
        assertThat(detector.isActive()).isFalse();
    }

    @Test(description = "BTN_TOUCH down/up around a position emits a tap")
    public void keyDownUp_emitsTap() {
        List<CompletedGesture> gestures = feed(
                "[1.0] EV_ABS ABS_MT_POSITION_X 0000000a",
                "[1.0] EV_ABS ABS_MT_POSITION_Y 00000014",
                "[1.0] EV_KEY BTN_TOUCH DOWN",
                "[1.1] EV_KEY BTN_TOUCH UP");

        assertThat(gestures).containsExactly(new CompletedGesture(10, 20));
    }

    @Test(description = "Up without a preceding down emits nothing")
    public void upWithoutDown_noGesture() {
        List<CompletedGesture> gestures = feed(
                "[1.0] EV_ABS ABS_MT_POSITION_X 0000000a",
                "[1.0] EV_ABS ABS_MT_POSITION_Y 00000014",
                "[1.1] EV_KEY BTN_TOUCH UP");

        assertThat(gestures).isEmpty();
    }

    @Test(description = "Down and up with no known position emit nothing")
    public void noPosition_noGesture() {
        assertThat(feed("[1.0] EV_KEY BTN_TOUCH DOWN", "[1.1] EV_KEY BTN_TOUCH UP")).isEmpty();
    }

    @Test(description = "Last position before lift wins when the finger moves")
    public void movement_lastPositionWins() {
        List<CompletedGesture> gestures = feed(
                "[1.0] EV_ABS ABS_MT_TRACKING_ID 00000001",
                "[1.0] EV_ABS ABS_MT_POSITION_X 00000064",
                "[1.0] EV_ABS ABS_MT_POSITION_Y 00000064",
                "[1.1] EV_ABS ABS_MT_POSITION_X 000000c8",
                "[1.2] EV_ABS ABS_MT_TRACKING_ID ffffffff");

        assertThat(gestures).containsExactly(new CompletedGesture(200, 100));
    }

    @Test(description = "Position persists across gestures")
    public void positionPersistsAcrossGestures() {
        feed("[1.0] EV_ABS ABS_X 00000005",
             "[1.0] EV_ABS ABS_Y 00000006",
             "[1.0] EV_KEY BTN_TOOL_FINGER DOWN",
             "[1.1] EV_KEY BTN_TOOL_FINGER UP");

        List<CompletedGesture> second = feed(
                "[2.0] EV_KEY BTN_TOUCH DOWN",
                "[2.1] EV_KEY BTN_TOUCH UP");

        assertThat(second).containsExactly(new CompletedGesture(5, 6));
    }

    @Test(description = "Tracking id is remembered while the finger is down")
    public void trackingIdState() {
        detector.onLine("[1.0] EV_ABS ABS_MT_TRACKING_ID 0000002a");
        assertThat(detector.isActive()).isTrue();
        assertThat(detector.getTrackingId()).isEqualTo(42);

        Optional<CompletedGesture> g = detector.onLine("[1.1] EV_ABS ABS_MT_TRACKING_ID ffffffff");
        assertThat(g).isEmpty();
        assertThat(detector.isActive()).isFalse();
        assertThat(detector.getTrackingId()).isNull();
    }

    @Test(description = "Malformed and unrelated lines are ignored without changing state")
    public void malformedLines_ignored() {
        feed("garbage", "[1.0] EV_SYN SYN_REPORT 00000000", "[1.0] EV_KEY KEY_VOLUMEUP DOWN");
        assertThat(detector.isActive()).isFalse();
        assertThat(detector.getLastX()).isNull();
    }
}

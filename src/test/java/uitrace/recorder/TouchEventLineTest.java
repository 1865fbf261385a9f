package uitrace.recorder;

import org.testng.annotations.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TouchEventLine} parsing.
 */
public class TouchEventLineTest {

    @Test(description = "Labelled line with device prefix is fully decoded")
    public void parse_labelledLine() {
        Optional<TouchEventLine> line = TouchEventLine.parse(
                "[   12345.678901] /dev/input/event2: EV_ABS       ABS_MT_POSITION_X    000001f4");

        assertThat(line).isPresent();
        TouchEventLine ev = line.get();
        assertThat(ev.timestamp()).isEqualTo(12345.678901);
        assertThat(ev.device()).isEqualTo("/dev/input/event2");
        assertThat(ev.type()).isEqualTo(TouchEventLine.EV_ABS);
        assertThat(ev.code()).isEqualTo(TouchEventLine.ABS_MT_POSITION_X);
        assertThat(ev.value()).isEqualTo(500);
        assertThat(ev.isAbs()).isTrue();
        assertThat(ev.isKey()).isFalse();
    }

    @Test(description = "Device prefix is optional")
    public void parse_withoutDevice() {
        TouchEventLine ev = TouchEventLine.parse("[ 1.000000] EV_KEY BTN_TOUCH DOWN").orElseThrow();
        assertThat(ev.device()).isNull();
        assertThat(ev.isKey()).isTrue();
        assertThat(ev.value()).isEqualTo(1);
    }

    @Test(description = "Numeric type and code are mapped to symbolic names")
    public void parse_numericCodes() {
        TouchEventLine ev = TouchEventLine.parse("[ 2.5] /dev/input/event1: 0003 0036 00000320").orElseThrow();
        assertThat(ev.type()).isEqualTo(TouchEventLine.EV_ABS);
        assertThat(ev.code()).isEqualTo(TouchEventLine.ABS_MT_POSITION_Y);
        assertThat(ev.value()).isEqualTo(800);

        TouchEventLine key = TouchEventLine.parse("[ 2.5] 0001 014a 00000001").orElseThrow();
        assertThat(key.code()).isEqualTo(TouchEventLine.BTN_TOUCH);
        assertThat(key.value()).isEqualTo(1);
    }

    @Test(description = "UP decodes to 0 and ffffffff to -1")
    public void decodeValue_specialTokens() {
        assertThat(TouchEventLine.decodeValue("UP")).isZero();
        assertThat(TouchEventLine.decodeValue("down")).isEqualTo(1);
        assertThat(TouchEventLine.decodeValue("ffffffff")).isEqualTo(-1);
        assertThat(TouchEventLine.decodeValue("0000002a")).isEqualTo(42);
    }

    @Test(description = "Values beyond int range are rejected")
    public void decodeValue_outOfRange() {
        assertThat(TouchEventLine.decodeValue("80000000")).isNull();
        assertThat(TouchEventLine.decodeValue("1ffffffff")).isNull();
    }

    @Test(description = "Trailing carriage return is tolerated")
    public void parse_trailingCarriageReturn() {
        assertThat(TouchEventLine.parse("[ 3.0] EV_KEY BTN_TOUCH UP\r")).isPresent();
    }

    @Test(description = "Lines outside the grammar are ignored")
    public void parse_malformed() {
        assertThat(TouchEventLine.parse(null)).isEmpty();
        assertThat(TouchEventLine.parse("")).isEmpty();
        assertThat(TouchEventLine.parse("add device 1: /dev/input/event0")).isEmpty();
        assertThat(TouchEventLine.parse("  name:     \"synaptics_dsx\"")).isEmpty();
        assertThat(TouchEventLine.parse("EV_KEY BTN_TOUCH DOWN")).isEmpty();
    }
}

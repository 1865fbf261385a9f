package uitrace.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

/**
 * Reads collector settings from {@code config.properties} (classpath) and
 * exposes typed accessor methods with sensible defaults.
 *
 * <p>An optional {@code config.local.properties} file on the classpath
 * overrides any value from the base file (higher priority; not committed to VCS).
 * Command-line options are applied on top through the setters.
 *
 * <h3>Supported keys and defaults</h3>
 * <table>
 *   <tr><th>Key</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>capture.output.dir</td><td>UI_Automated_acquisition</td><td>Root of images, XML dumps and the ledger</td></tr>
 *   <tr><td>capture.backend</td><td>adb</td><td>{@code adb} or {@code native}</td></tr>
 *   <tr><td>capture.adb.executable</td><td>adb</td><td>adb binary</td></tr>
 *   <tr><td>capture.adb.serial</td><td>(empty)</td><td>Device serial; empty = first attached device</td></tr>
 *   <tr><td>capture.adb.timeout.sec</td><td>15</td><td>Timeout of one adb command</td></tr>
 *   <tr><td>capture.native.url</td><td>http://127.0.0.1:7912</td><td>On-device automation agent</td></tr>
 *   <tr><td>capture.native.timeout.sec</td><td>20</td><td>HTTP call timeout for the agent</td></tr>
 *   <tr><td>capture.wait.after.ms</td><td>400</td><td>Settle delay before the post-capture</td></tr>
 *   <tr><td>capture.mid.delay.ms</td><td>50</td><td>Delay before a mid-action capture</td></tr>
 *   <tr><td>capture.reset.ledger</td><td>false</td><td>Truncate the ledger at start-up</td></tr>
 *   <tr><td>listener.event.device</td><td>(empty)</td><td>Input device; empty = auto-detect</td></tr>
 *   <tr><td>listener.queue.capacity</td><td>1000</td><td>Raw line queue size</td></tr>
 *   <tr><td>listener.stop.grace.ms</td><td>2000</td><td>Wait for the event process before killing it</td></tr>
 *   <tr><td>listener.post.capture</td><td>true</td><td>Capture the screen after each observed tap</td></tr>
 *   <tr><td>server.host</td><td>127.0.0.1</td><td>HTTP bind address</td></tr>
 *   <tr><td>server.port</td><td>8001</td><td>HTTP port</td></tr>
 * </table>
 */
public class UiTraceConfig {

    private static final Logger log = LoggerFactory.getLogger(UiTraceConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    static final String KEY_OUTPUT_DIR         = "capture.output.dir";
    static final String KEY_BACKEND            = "capture.backend";
    static final String KEY_ADB_EXECUTABLE     = "capture.adb.executable";
    static final String KEY_ADB_SERIAL         = "capture.adb.serial";
    static final String KEY_ADB_TIMEOUT        = "capture.adb.timeout.sec";
    static final String KEY_NATIVE_URL         = "capture.native.url";
    static final String KEY_NATIVE_TIMEOUT     = "capture.native.timeout.sec";
    static final String KEY_WAIT_AFTER_MS      = "capture.wait.after.ms";
    static final String KEY_MID_DELAY_MS       = "capture.mid.delay.ms";
    static final String KEY_RESET_LEDGER       = "capture.reset.ledger";
    static final String KEY_EVENT_DEVICE       = "listener.event.device";
    static final String KEY_QUEUE_CAPACITY     = "listener.queue.capacity";
    static final String KEY_STOP_GRACE_MS      = "listener.stop.grace.ms";
    static final String KEY_POST_CAPTURE       = "listener.post.capture";
    static final String KEY_SERVER_HOST        = "server.host";
    static final String KEY_SERVER_PORT        = "server.port";

    // Defaults
    private static final String  DEFAULT_OUTPUT_DIR     = "UI_Automated_acquisition";
    private static final String  DEFAULT_BACKEND        = "adb";
    private static final String  DEFAULT_ADB_EXECUTABLE = "adb";
    private static final int     DEFAULT_ADB_TIMEOUT    = 15;
    private static final String  DEFAULT_NATIVE_URL     = "http://127.0.0.1:7912";
    private static final int     DEFAULT_NATIVE_TIMEOUT = 20;
    private static final long    DEFAULT_WAIT_AFTER_MS  = 400;
    private static final long    DEFAULT_MID_DELAY_MS   = 50;
    private static final int     DEFAULT_QUEUE_CAPACITY = 1000;
    private static final long    DEFAULT_STOP_GRACE_MS  = 2000;
    private static final String  DEFAULT_SERVER_HOST    = "127.0.0.1";
    private static final int     DEFAULT_SERVER_PORT    = 8001;

    /** Device backend selected by {@code capture.backend}. */
    public enum Backend { ADB, NATIVE }

    private final Properties props;

    // ── Construction ──────────────────────────────────────────────────────

    /**
     * Loads configuration from the classpath.
     *
     * <p>A missing {@code config.properties} is tolerated (all defaults apply).
     * {@code config.local.properties} is optional; if present its values
     * override the base file.
     */
    public UiTraceConfig() {
        props = new Properties();
        loadBase();
        loadLocalOverrides();
    }

    /**
     * Package-private constructor for tests: accepts a pre-populated
     * {@link Properties} instance, bypassing classpath I/O.
     */
    UiTraceConfig(Properties props) {
        this.props = props;
    }

    // ── Capture ───────────────────────────────────────────────────────────

    public Path getOutputDir() {
        return Paths.get(getString(KEY_OUTPUT_DIR, DEFAULT_OUTPUT_DIR));
    }

    public void setOutputDir(String dir) { props.setProperty(KEY_OUTPUT_DIR, dir); }

    /**
     * Device backend. Unknown values fall back to {@link Backend#ADB}.
     */
    public Backend getBackend() {
        String raw = getString(KEY_BACKEND, DEFAULT_BACKEND).toUpperCase(Locale.ROOT);
        try {
            return Backend.valueOf(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown backend '{}', using adb", raw);
            return Backend.ADB;
        }
    }

    public void setBackend(String backend) { props.setProperty(KEY_BACKEND, backend); }

    public String getAdbExecutable() { return getString(KEY_ADB_EXECUTABLE, DEFAULT_ADB_EXECUTABLE); }

    /** Empty string means "first attached device". */
    public String getAdbSerial() { return getString(KEY_ADB_SERIAL, ""); }

    public void setAdbSerial(String serial) { props.setProperty(KEY_ADB_SERIAL, serial); }

    public int getAdbTimeoutSec() { return getInt(KEY_ADB_TIMEOUT, DEFAULT_ADB_TIMEOUT); }

    public String getNativeUrl() { return getString(KEY_NATIVE_URL, DEFAULT_NATIVE_URL); }

    public void setNativeUrl(String url) { props.setProperty(KEY_NATIVE_URL, url); }

    public int getNativeTimeoutSec() { return getInt(KEY_NATIVE_TIMEOUT, DEFAULT_NATIVE_TIMEOUT); }

    public long getWaitAfterMs() { return getLong(KEY_WAIT_AFTER_MS, DEFAULT_WAIT_AFTER_MS); }

    public long getMidDelayMs() { return getLong(KEY_MID_DELAY_MS, DEFAULT_MID_DELAY_MS); }

    public boolean isResetLedger() { return getBool(KEY_RESET_LEDGER, false); }

    public void setResetLedger(boolean reset) { props.setProperty(KEY_RESET_LEDGER, String.valueOf(reset)); }

    // ── Listener ──────────────────────────────────────────────────────────

    /** Empty string means "detect the touchscreen". */
    public String getEventDevice() { return getString(KEY_EVENT_DEVICE, ""); }

    public void setEventDevice(String device) { props.setProperty(KEY_EVENT_DEVICE, device); }

    public int getQueueCapacity() { return getInt(KEY_QUEUE_CAPACITY, DEFAULT_QUEUE_CAPACITY); }

    public long getStopGraceMs() { return getLong(KEY_STOP_GRACE_MS, DEFAULT_STOP_GRACE_MS); }

    public boolean isListenerPostCapture() { return getBool(KEY_POST_CAPTURE, true); }

    public void setListenerPostCapture(boolean enabled) {
        props.setProperty(KEY_POST_CAPTURE, String.valueOf(enabled));
    }

    // ── Server ────────────────────────────────────────────────────────────

    public String getServerHost() { return getString(KEY_SERVER_HOST, DEFAULT_SERVER_HOST); }

    public void setServerHost(String host) { props.setProperty(KEY_SERVER_HOST, host); }

    public int getServerPort() { return getInt(KEY_SERVER_PORT, DEFAULT_SERVER_PORT); }

    public void setServerPort(int port) { props.setProperty(KEY_SERVER_PORT, String.valueOf(port)); }

    // ── Internal helpers ──────────────────────────────────────────────────

    private void loadBase() {
        try (InputStream base = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                log.warn("Classpath resource not found: {}, all settings use defaults", CONFIG_FILE);
                return;
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new RuntimeException("Cannot load " + CONFIG_FILE, e);
        }
    }

    private void loadLocalOverrides() {
        try (InputStream local = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}",
                    CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    private String getString(String key, String defaultValue) {
        String raw = props.getProperty(key);
        return raw == null ? defaultValue : raw.trim();
    }

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}",
                    key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}",
                    key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}

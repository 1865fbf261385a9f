package uitrace.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import uitrace.capture.CaptureLayout;
import uitrace.capture.CaptureOrchestrator;
import uitrace.device.AdbInvoker;
import uitrace.device.DeviceBridge;
import uitrace.device.NativeBackend;
import uitrace.device.ProcessCommandRunner;
import uitrace.device.ShellBackend;
import uitrace.ledger.Ledger;
import uitrace.model.UiTraceException;
import uitrace.recorder.EventStreamReader;
import uitrace.recorder.ListenerSession;
import uitrace.recorder.TouchDeviceProbe;
import uitrace.recorder.UiTraceConfig;
import uitrace.server.CaptureServer;
import uitrace.server.RequestMapper;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI entry-point for UI Trace.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code uitrace listen}  record every tap performed on the device (Ctrl+C to stop)</li>
 *   <li>{@code uitrace serve}   start the HTTP control plane for inspector-driven captures</li>
 *   <li>{@code uitrace version} print build version</li>
 * </ul>
 *
 * <p>Main class wired into the fat-JAR manifest by maven-shade-plugin.
 */
@Command(
        name        = "uitrace",
        description = "Android UI interaction recorder: before/after snapshots per control action",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                UiTraceCLI.ListenCommand.class,
                UiTraceCLI.ServeCommand.class,
                UiTraceCLI.VersionCommand.class
        }
)
public class UiTraceCLI implements Callable<Integer> {

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    // ── Entry-point ───────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new UiTraceCLI()).execute(args);
        System.exit(exit);
    }

    // ── Shared options ────────────────────────────────────────────────────

    /** Device and output options common to every capturing sub-command. */
    static class CaptureOptions {

        @Option(names = {"-o", "--output"}, description = "Output directory (default from config: UI_Automated_acquisition)")
        String outputDir;

        @Option(names = {"-b", "--backend"}, description = "Device backend: adb or native (default from config: adb)")
        String backend;

        @Option(names = {"-s", "--serial"}, description = "adb device serial (default: the only connected device)")
        String serial;

        @Option(names = {"--native-url"}, description = "Base URL of the on-device automation agent")
        String nativeUrl;

        @Option(names = {"--reset"}, description = "Start a new ledger, discarding existing records")
        boolean reset;

        /** Applies the options given on the command line over the config file values. */
        void applyTo(UiTraceConfig config) {
            if (outputDir != null) config.setOutputDir(outputDir);
            if (backend != null)   config.setBackend(backend);
            if (serial != null)    config.setAdbSerial(serial);
            if (nativeUrl != null) config.setNativeUrl(nativeUrl);
            if (reset)             config.setResetLedger(true);
        }
    }

    static AdbInvoker createAdb(UiTraceConfig config) {
        return new AdbInvoker(config.getAdbExecutable(), config.getAdbSerial(),
                Duration.ofSeconds(config.getAdbTimeoutSec()), new ProcessCommandRunner());
    }

    static DeviceBridge createBridge(UiTraceConfig config, AdbInvoker adb) {
        return switch (config.getBackend()) {
            case NATIVE -> new NativeBackend(config.getNativeUrl(), config.getNativeTimeoutSec());
            case ADB    -> new ShellBackend(adb);
        };
    }

    /** Connects to the device, prepares the output tree and opens the ledger. */
    static CaptureOrchestrator createOrchestrator(UiTraceConfig config, DeviceBridge bridge) throws IOException {
        bridge.ensureConnected();
        CaptureLayout layout = new CaptureLayout(config.getOutputDir());
        layout.ensureDirectories();
        Ledger ledger = Ledger.open(layout.ledgerFile(), config.isResetLedger());
        System.out.printf("  Backend    : %s%n", bridge);
        System.out.printf("  Output dir : %s%n", layout.root().toAbsolutePath());
        System.out.printf("  Ledger     : %s (%d record(s))%n", ledger.getFile().toAbsolutePath(), ledger.size());
        return new CaptureOrchestrator(bridge, ledger, layout);
    }

    // ── Sub-commands ──────────────────────────────────────────────────────

    /**
     * Records taps the user performs on the device. Blocks until the process
     * receives SIGINT (Ctrl+C), at which point the shutdown hook stops the
     * listener and saves the exit screenshot.
     */
    @Command(
            name        = "listen",
            description = "Record every tap performed on the device (Ctrl+C to stop)",
            mixinStandardHelpOptions = true
    )
    static class ListenCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(ListenCommand.class);

        @CommandLine.Mixin
        CaptureOptions options = new CaptureOptions();

        @Option(names = {"-d", "--device"}, description = "Input event device, e.g. /dev/input/event2 (default: probe)")
        String eventDevice;

        @Option(names = {"--no-post-capture"}, description = "Skip the after-tap snapshot")
        boolean noPostCapture;

        @Override
        public Integer call() throws Exception {
            UiTraceConfig config = new UiTraceConfig();
            options.applyTo(config);
            if (eventDevice != null) config.setEventDevice(eventDevice);
            if (noPostCapture)       config.setListenerPostCapture(false);

            AdbInvoker adb = createAdb(config);
            CaptureOrchestrator orchestrator;
            try {
                orchestrator = createOrchestrator(config, createBridge(config, adb));
            } catch (UiTraceException e) {
                System.err.println("Cannot start listener: " + e.getMessage());
                return 1;
            }

            String device = config.getEventDevice();
            if (device.isBlank()) {
                Optional<String> probed = TouchDeviceProbe.detect(adb);
                device = probed.orElse("");
            }
            List<String> command = new ArrayList<>(List.of("shell", "getevent", "-lt"));
            if (!device.isBlank()) command.add(device);
            System.out.printf("  Touch dev  : %s%n", device.isBlank() ? "(all devices)" : device);

            EventStreamReader reader = new EventStreamReader(
                    adb.command(command.toArray(new String[0])),
                    config.getQueueCapacity(), config.getStopGraceMs());
            ListenerSession session = new ListenerSession(orchestrator, reader, config);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                try {
                    session.stop();
                    orchestrator.close();
                    System.out.printf("%nListener stopped: %d tap(s) recorded.%n", session.getRecordedCount());
                } catch (RuntimeException e) {
                    log.error("Shutdown hook error", e);
                }
            }, "listener-shutdown"));

            session.start();
            System.out.println("Listening. Tap around on the device, then press Ctrl+C.");

            session.awaitTermination();
            if (session.isRunning()) {
                // event stream ended on its own (device unplugged, adb killed)
                session.stop();
                orchestrator.close();
                return 2;
            }
            return 0;
        }
    }

    /**
     * Starts the HTTP control plane. Blocks until Ctrl+C.
     */
    @Command(
            name        = "serve",
            description = "Start the HTTP control plane for inspector-driven captures",
            mixinStandardHelpOptions = true
    )
    static class ServeCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

        @CommandLine.Mixin
        CaptureOptions options = new CaptureOptions();

        @Option(names = {"-H", "--host"}, description = "Bind address (default from config: 127.0.0.1)")
        String host;

        @Option(names = {"-p", "--port"}, description = "Listen port (default from config: 8001)")
        Integer port;

        @Override
        public Integer call() throws Exception {
            UiTraceConfig config = new UiTraceConfig();
            options.applyTo(config);
            if (host != null) config.setServerHost(host);
            if (port != null) config.setServerPort(port);

            CaptureOrchestrator orchestrator;
            try {
                orchestrator = createOrchestrator(config, createBridge(config, createAdb(config)));
            } catch (UiTraceException e) {
                System.err.println("Cannot start server: " + e.getMessage());
                return 1;
            }

            CaptureServer server = new CaptureServer(orchestrator,
                    new RequestMapper(config.getWaitAfterMs(), config.getMidDelayMs()),
                    config.getServerHost(), config.getServerPort());

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop();
                orchestrator.close();
                log.info("Server shut down");
            }, "server-shutdown"));

            server.start();
            System.out.printf("Capture server on http://%s:%d  (Ctrl+C to stop)%n",
                    config.getServerHost(), server.getPort());

            try {
                Thread.currentThread().join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return 0;
        }
    }

    @Command(
            name        = "version",
            description = "Print build version",
            mixinStandardHelpOptions = true
    )
    static class VersionCommand implements Callable<Integer> {
        @Override
        public Integer call() {
            String version = UiTraceCLI.class.getPackage().getImplementationVersion();
            System.out.println("uitrace " + (version != null ? version : "1.0.0-SNAPSHOT"));
            return 0;
        }
    }
}

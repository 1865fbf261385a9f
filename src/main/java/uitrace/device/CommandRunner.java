package uitrace.device;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/** Runs an external command to completion and captures its output. */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @throws IOException if the command cannot be started, times out, or its
     *                     output cannot be read
     */
    CommandResult run(List<String> command, Duration timeout) throws IOException;
}

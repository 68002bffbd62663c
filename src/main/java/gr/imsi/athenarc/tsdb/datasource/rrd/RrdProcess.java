package gr.imsi.athenarc.tsdb.datasource.rrd;

import com.google.common.base.CharMatcher;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import gr.imsi.athenarc.tsdb.config.RrdConfiguration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A long-lived {@code rrdtool -} process. Commands are written to its stdin one
 * per line; the answer ends with a line starting {@code OK u:} or is a single
 * {@code ERROR: } line.
 * <p>
 * Not thread-safe: every command goes through one pipe, so callers sharing an
 * instance must serialize access themselves.
 */
public class RrdProcess implements RrdCommandRunner, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RrdProcess.class);

    static final String COMMAND_COMPLETE = "OK u:";
    static final String ERROR_PREFIX = "ERROR: ";

    /** Sub-commands that accept {@code --daemon}. */
    static final Set<String> DAEMON_COMMANDS = ImmutableSet.of("update", "fetch", "info", "last");

    public enum State {
        NOT_STARTED,
        RUNNING,
        STOPPED
    }

    private final RrdConfiguration configuration;
    private final ScheduledExecutorService watchdog;

    private State state = State.NOT_STARTED;
    private Process process;
    private Writer input;
    private BufferedReader output;

    public RrdProcess(RrdConfiguration configuration) {
        this.configuration = configuration;
        this.watchdog = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("rrdtool-watchdog-%d").setDaemon(true).build());
    }

    public State getState() {
        return state;
    }

    public void start() {
        if (state == State.RUNNING) {
            return;
        }
        if (state == State.STOPPED) {
            throw new RrdException("RRD process has been stopped");
        }
        ProcessBuilder builder = new ProcessBuilder(Arrays.asList(configuration.getRrdtoolExec(), "-"));
        builder.redirectErrorStream(true);
        if (Files.isDirectory(configuration.getDir())) {
            builder.directory(configuration.getDir().toFile());
        }
        if (configuration.usesRrdcached()) {
            builder.environment().put("RRDCACHED_ADDRESS", configuration.getRrdcachedAddress());
        }
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new RrdException("RRD process failed to start: " + e.getMessage(), e);
        }
        input = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8);
        output = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        state = State.RUNNING;
        LOG.info("Started {} - in {}", configuration.getRrdtoolExec(), configuration.getDir());
    }

    @Override
    public String run(RrdCommand command) {
        return run(commandLine(command));
    }

    /**
     * Sends one raw command line and waits for its answer.
     *
     * @return the output without the trailing {@code OK} line
     */
    public String run(String commandLine) {
        start();
        String line = configuration.usesRrdcached() ? stripDir(commandLine) : commandLine;
        LOG.debug("Running RRD command: {}", line);
        Stopwatch stopwatch = Stopwatch.createStarted();
        ScheduledFuture<?> timeout = watchdog.schedule(process::destroyForcibly,
            configuration.getProcessTimeout().toMillis(), TimeUnit.MILLISECONDS);
        try {
            input.write(line);
            input.write('\n');
            input.flush();
            String result = readAnswer();
            LOG.debug("RRD command answered in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
            return result;
        } catch (IOException e) {
            reset();
            throw new RrdException("Lost connection to rrdtool: " + e.getMessage(), e);
        } finally {
            timeout.cancel(false);
        }
    }

    private String readAnswer() throws IOException {
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = output.readLine()) != null) {
            if (line.startsWith(COMMAND_COMPLETE)) {
                return String.join("\n", lines).trim();
            }
            int error = line.indexOf(ERROR_PREFIX);
            if (error >= 0) {
                String message = line.substring(error + ERROR_PREFIX.length());
                if (message.contains("No such file")) {
                    throw new RrdNotFoundException(message);
                }
                throw new RrdException(message);
            }
            lines.add(line);
        }
        reset();
        throw new RrdException("rrdtool exited before answering");
    }

    /**
     * Drops a process that died or was killed by the watchdog. The next
     * command starts a new one.
     */
    private void reset() {
        LOG.warn("rrdtool process exited unexpectedly, it will be restarted on the next command");
        if (process != null) {
            process.destroyForcibly();
        }
        process = null;
        input = null;
        output = null;
        state = State.NOT_STARTED;
    }

    /**
     * The command as sent to the pipe, with {@code --daemon} added for the
     * sub-commands rrdcached serves.
     */
    String commandLine(RrdCommand command) {
        List<String> args = new ArrayList<>();
        args.add(command.getName());
        if (configuration.usesRrdcached() && DAEMON_COMMANDS.contains(command.getName())) {
            args.add("--daemon");
            args.add(configuration.getRrdcachedAddress());
        }
        args.addAll(command.getOptions());
        args.addAll(command.getArguments());
        List<String> quoted = new ArrayList<>(args.size());
        for (String arg : args) {
            quoted.add(quote(arg));
        }
        return String.join(" ", quoted);
    }

    /**
     * rrdtool splits pipe input on whitespace unless the argument is quoted.
     */
    static String quote(String arg) {
        if (CharMatcher.whitespace().matchesAnyOf(arg)) {
            return '"' + arg + '"';
        }
        return arg;
    }

    /**
     * rrdcached resolves paths against its own base directory.
     */
    private String stripDir(String commandLine) {
        return commandLine.replace(configuration.getDir().toString() + File.separator, "");
    }

    public void stop() {
        if (state != State.RUNNING) {
            state = State.STOPPED;
            watchdog.shutdownNow();
            return;
        }
        try {
            input.write("quit\n");
            input.flush();
            input.close();
        } catch (IOException e) {
            LOG.warn("Failed to send quit to rrdtool: {}", e.getMessage());
        }
        try {
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        state = State.STOPPED;
        watchdog.shutdownNow();
        LOG.info("Stopped rrdtool process");
    }

    @Override
    public void close() {
        stop();
    }
}

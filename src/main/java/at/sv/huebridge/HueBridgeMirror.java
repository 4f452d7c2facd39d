package at.sv.huebridge;

import at.sv.huebridge.api.BridgeConfig;
import at.sv.huebridge.api.HttpResourceProviderImpl;
import at.sv.huebridge.api.hue.HueBridgeApiImpl;
import at.sv.huebridge.api.hue.HueEventStreamSubscriber;
import at.sv.huebridge.api.hue.HueHttpsClientFactory;
import at.sv.huebridge.bus.LocalResourceEventBus;
import at.sv.huebridge.bus.ResourceEventBus;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Command(name = "HueBridgeMirror", version = "0.3.0", mixinStandardHelpOptions = true, sortOptions = false)
public final class HueBridgeMirror implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(HueBridgeMirror.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec commandSpec;

    @Parameters(
            index = "0",
            defaultValue = "${env:API_HOST}",
            description = "The host of your Philips Hue Bridge, without scheme. Example: 192.168.0.157")
    String apiHost;
    @Parameters(
            index = "1",
            defaultValue = "${env:ACCESS_TOKEN}",
            description = "The application key (username) of the bridge, created during the setup process.")
    String accessToken;
    @Option(names = "--name",
            defaultValue = "${env:BRIDGE_NAME:-Hue Bridge}",
            description = "The name of the bridge used in log messages. Default: ${DEFAULT-VALUE}")
    String name;
    @Option(names = "--insecure",
            defaultValue = "${env:INSECURE:-false}",
            description = "Disables the validation of the bridge certificate. Default: ${DEFAULT-VALUE}")
    boolean insecure;
    @Option(names = "--certificate", paramLabel = "<pem>",
            defaultValue = "${env:BRIDGE_CERTIFICATE}",
            description = "The PEM file of the Hue Bridge root certificate. If not set, the JVM trust store is used.")
    Path certificate;
    @Option(names = "--disable-updates",
            defaultValue = "${env:DISABLE_UPDATES:-false}",
            description = "Do not subscribe to the event stream of the bridge; only read the state at start-up." +
                          " Default: ${DEFAULT-VALUE}")
    boolean disableUpdates;
    @Option(names = "--disable-auto-updates",
            defaultValue = "${env:DISABLE_AUTO_UPDATES:-false}",
            description = "Do not periodically ask the bridge to check for and install firmware updates." +
                          " Default: ${DEFAULT-VALUE}")
    boolean disableAutoUpdates;
    @Option(names = "--connection-retry-delay", paramLabel = "<delay>",
            defaultValue = "${env:CONNECTION_RETRY_DELAY:-5}",
            description = "The delay in seconds before retrying to connect, if the bridge could not be reached." +
                          " Default: ${DEFAULT-VALUE} seconds.")
    int connectionRetryDelayInSeconds;
    @Option(names = "--firmware-update-retry-delay", paramLabel = "<delay>",
            defaultValue = "${env:FIRMWARE_UPDATE_RETRY_DELAY:-10}",
            description = "The delay in seconds before retrying a failed firmware update request." +
                          " Default: ${DEFAULT-VALUE} seconds.")
    int firmwareUpdateRetryDelayInSeconds;
    @Option(names = "--event-stream-read-timeout", paramLabel = "<timeout>",
            defaultValue = "${env:EVENT_STREAM_READ_TIMEOUT:-120}",
            description = "The read timeout of the API v2 SSE event stream in minutes. " +
                          "The connection is automatically restored after a timeout. Default: ${DEFAULT-VALUE} minutes.")
    int eventStreamReadTimeoutInMinutes;
    @Option(names = "--log-updates",
            defaultValue = "${env:LOG_UPDATES:-false}",
            description = "Log every resource notification. Default: ${DEFAULT-VALUE}")
    boolean logUpdates;

    public static void main(String[] args) {
        int execute = new CommandLine(new HueBridgeMirror()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        BridgeConfig config = createConfig();
        OkHttpClient httpsClient = createHueHttpsClient();
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
        BridgeTaskScheduler scheduler = new BridgeTaskSchedulerImpl(executor);
        LocalResourceEventBus eventBus = new LocalResourceEventBus();
        if (logUpdates) {
            eventBus.subscribe(ResourceEventBus.GLOBAL_CHANNEL, message -> LOG.info("Update: {}", message));
        }
        HueBridge bridge = new HueBridge(config,
                new HueBridgeApiImpl(new HttpResourceProviderImpl(httpsClient), apiHost, accessToken),
                new HueEventStreamSubscriber(httpsClient, scheduler, eventStreamReadTimeoutInMinutes),
                eventBus, scheduler, ZonedDateTime::now);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(bridge, scheduler, executor, SHUTDOWN_TIMEOUT)));
        scheduler.execute(bridge::start);
        MDC.remove("context");
    }

    /**
     * Stops the bridge on its scheduler thread and waits for it, then shuts the executor down. Each step waits at most
     * the given timeout.
     */
    static void shutdown(HueBridge bridge, Executor scheduler, ExecutorService executor, Duration timeout) {
        MDC.put("context", "shutdown");
        try {
            CompletableFuture.runAsync(bridge::stop, scheduler).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            executor.shutdown();
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Scheduler did not terminate within {}s. Forcing shutdown.", timeout.toSeconds());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        } catch (ExecutionException | TimeoutException e) {
            LOG.warn("Failed to stop bridge: '{}'. Forcing shutdown.", e.toString());
            executor.shutdownNow();
        } finally {
            MDC.remove("context");
        }
    }

    BridgeConfig createConfig() {
        return BridgeConfig.builder()
                           .host(apiHost)
                           .applicationKey(accessToken)
                           .name(name)
                           .disableUpdates(disableUpdates)
                           .autoUpdates(!disableAutoUpdates)
                           .connectionRetryDelay(Duration.ofSeconds(connectionRetryDelayInSeconds))
                           .firmwareUpdateRetryDelay(Duration.ofSeconds(firmwareUpdateRetryDelayInSeconds))
                           .build();
    }

    private OkHttpClient createHueHttpsClient() {
        try {
            return HueHttpsClientFactory.createHttpsClient(apiHost, accessToken, certificate, insecure);
        } catch (Exception e) {
            System.err.println("Failed to create https client: " + e.getLocalizedMessage());
            System.exit(1);
        }
        return null;
    }

    private void assertConfigurationParameters() {
        if (apiHost == null || apiHost.isBlank()) {
            fail("The bridge host is required");
        }
        if (accessToken == null || accessToken.isBlank()) {
            fail("The application key is required");
        }
        if (certificate != null && !Files.isReadable(certificate)) {
            fail("--certificate '" + certificate.toAbsolutePath() + "' does not exist or is not readable");
        }
        if (connectionRetryDelayInSeconds <= 0) {
            fail("--connection-retry-delay must be > 0");
        }
        if (firmwareUpdateRetryDelayInSeconds <= 0) {
            fail("--firmware-update-retry-delay must be > 0");
        }
        if (eventStreamReadTimeoutInMinutes <= 0) {
            fail("--event-stream-read-timeout must be > 0");
        }
    }

    private void fail(String msg) {
        if (commandSpec != null) {
            throw new CommandLine.ParameterException(commandSpec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}

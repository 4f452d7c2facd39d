package at.sv.huebridge;

import at.sv.huebridge.api.ApiFailure;
import at.sv.huebridge.api.BridgeAuthenticationFailure;
import at.sv.huebridge.api.BridgeConfig;
import at.sv.huebridge.api.BridgeConnectionFailure;
import at.sv.huebridge.api.BridgeError;
import at.sv.huebridge.api.BridgeEventSubscriber;
import at.sv.huebridge.api.EventSubscription;
import at.sv.huebridge.api.FirmwareUpdateFailure;
import at.sv.huebridge.api.HueBridgeApi;
import at.sv.huebridge.api.IncomingEvent;
import at.sv.huebridge.api.ResourceNotFoundException;
import at.sv.huebridge.api.UpstreamFetchFailure;
import at.sv.huebridge.bus.ResourceEventBus;
import at.sv.huebridge.resource.BridgeInformationFetcher;
import at.sv.huebridge.resource.Resource;
import at.sv.huebridge.resource.ResourceEnumerator;
import at.sv.huebridge.resource.ResourceStore;
import at.sv.huebridge.sync.EventDiffEngine;
import at.sv.huebridge.sync.StatePropagator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.function.Supplier;

import static at.sv.huebridge.FormatUtil.getCauseMessage;

/**
 * A single bridge node: connects to the bridge, mirrors its resources, keeps them updated through the event stream and
 * periodically requests firmware updates.
 * <p>
 * All methods are expected to be called from the node's {@link BridgeTaskScheduler}.
 */
public final class HueBridge {

    private static final Logger LOG = LoggerFactory.getLogger(HueBridge.class);

    private final BridgeConfig config;
    private final HueBridgeApi api;
    private final BridgeEventSubscriber eventSubscriber;
    private final BridgeTaskScheduler scheduler;
    private final ResourceStore store;
    private final BridgeInformationFetcher bridgeInformationFetcher;
    private final ResourceEnumerator resourceEnumerator;
    private final StatePropagator statePropagator;
    private final EventDiffEngine eventDiffEngine;

    private volatile boolean enabled;
    private ScheduledTask firmwareUpdateTask;
    private EventSubscription eventSubscription;

    public HueBridge(BridgeConfig config, HueBridgeApi api, BridgeEventSubscriber eventSubscriber,
                     ResourceEventBus eventBus, BridgeTaskScheduler scheduler, Supplier<ZonedDateTime> currentTime) {
        this(config, api, eventSubscriber, scheduler, new ResourceStore(), eventBus, currentTime);
    }

    private HueBridge(BridgeConfig config, HueBridgeApi api, BridgeEventSubscriber eventSubscriber,
                      BridgeTaskScheduler scheduler, ResourceStore store, ResourceEventBus eventBus,
                      Supplier<ZonedDateTime> currentTime) {
        this(config, api, eventSubscriber, scheduler, store, new StatePropagator(store, eventBus), currentTime);
    }

    HueBridge(BridgeConfig config, HueBridgeApi api, BridgeEventSubscriber eventSubscriber,
              BridgeTaskScheduler scheduler, ResourceStore store, StatePropagator statePropagator,
              Supplier<ZonedDateTime> currentTime) {
        this.config = config;
        this.api = api;
        this.eventSubscriber = eventSubscriber;
        this.scheduler = scheduler;
        this.store = store;
        this.statePropagator = statePropagator;
        bridgeInformationFetcher = new BridgeInformationFetcher(api, store, currentTime);
        resourceEnumerator = new ResourceEnumerator(api, bridgeInformationFetcher, store);
        eventDiffEngine = new EventDiffEngine(store, statePropagator, currentTime);
        enabled = config.isEnabled();
    }

    /**
     * Connects to the bridge, reads all resources, broadcasts their initial state and starts listening for changes.
     * On failure the whole start is retried after {@link BridgeConfig#getConnectionRetryDelay()}, for as long as the
     * node is enabled.
     *
     * @return true if connected, false if disabled or a retry was scheduled
     */
    public boolean start() {
        if (!enabled) {
            return false;
        }
        MDC.put("context", "init");
        try {
            api.initSession(config);
            resourceEnumerator.enumerateAll();
        } catch (BridgeConnectionFailure | BridgeAuthenticationFailure | ApiFailure | ResourceNotFoundException |
                 UpstreamFetchFailure e) {
            LOG.warn("Bridge '{}' not reachable: '{}'. Retrying in {}s.", config.getName(), getCauseMessage(e),
                    config.getConnectionRetryDelay().toSeconds());
            scheduler.schedule(this::start, config.getConnectionRetryDelay());
            return false;
        } finally {
            MDC.remove("context");
        }
        LOG.info("Connected to bridge '{}' at {}: {} resources.", config.getName(), config.getHost(), store.size());
        emitInitialStates();
        keepUpdated();
        autoUpdateFirmware();
        return true;
    }

    /**
     * Disables the node, cancels the pending firmware update and closes the event stream.
     */
    public void stop() {
        enabled = false;
        cancelFirmwareUpdateTask();
        closeEventSubscription();
    }

    /**
     * Broadcasts every known resource once, on the next run of the scheduler.
     */
    public void emitInitialStates() {
        scheduler.schedule(() -> {
            List<Resource> resources = store.getResources();
            LOG.debug("Emit initial state of {} resources.", resources.size());
            resources.forEach(resource -> statePropagator.pushUpdatedState(resource, resource.getType(), true));
        }, Duration.ZERO);
    }

    /**
     * Subscribes to the event stream. A subscription left over from an earlier start is closed first.
     */
    public void keepUpdated() {
        if (config.isDisableUpdates()) {
            LOG.debug("Updates disabled for bridge '{}'. Not subscribing to events.", config.getName());
            return;
        }
        closeEventSubscription();
        eventSubscription = subscribeToBridgeEventStream();
    }

    private void closeEventSubscription() {
        if (eventSubscription != null) {
            eventSubscription.close();
            eventSubscription = null;
        }
    }

    public EventSubscription subscribeToBridgeEventStream() {
        return eventSubscriber.subscribe(config, this::handleEvents);
    }

    public void handleEvents(List<IncomingEvent> batch) {
        eventDiffEngine.handleEvents(batch);
    }

    /**
     * Requests a firmware update from the bridge and schedules the next request: after
     * {@link BridgeConfig#getFirmwareUpdateInterval()} on success, after
     * {@link BridgeConfig#getFirmwareUpdateRetryDelay()} on failure. Any previously scheduled request is cancelled
     * first, so there is at most one pending.
     *
     * @return true if the request was accepted, false if skipped or failed
     */
    public boolean autoUpdateFirmware() {
        if (!enabled || !config.isAutoUpdatesEnabled()) {
            return false;
        }
        cancelFirmwareUpdateTask();
        MDC.put("context", "firmware");
        try {
            api.requestFirmwareUpdate(config);
            LOG.debug("Requested firmware update. Next request in {}.", config.getFirmwareUpdateInterval());
            firmwareUpdateTask = scheduler.schedule(this::autoUpdateFirmware, config.getFirmwareUpdateInterval());
            return true;
        } catch (FirmwareUpdateFailure e) {
            logFirmwareUpdateErrors(e);
        } catch (RuntimeException e) {
            LOG.warn("Firmware update request failed: '{}'", getCauseMessage(e));
        } finally {
            MDC.remove("context");
        }
        firmwareUpdateTask = scheduler.schedule(this::autoUpdateFirmware, config.getFirmwareUpdateRetryDelay());
        return false;
    }

    private static void logFirmwareUpdateErrors(FirmwareUpdateFailure failure) {
        if (failure.getErrors().isEmpty()) {
            LOG.warn("Error response for firmware update: {}", failure.getMessage());
        }
        for (BridgeError error : failure.getErrors()) {
            LOG.warn("Error response for firmware update ({}): {}", error.address(), error.description());
        }
    }

    private void cancelFirmwareUpdateTask() {
        if (firmwareUpdateTask != null) {
            firmwareUpdateTask.cancel();
            firmwareUpdateTask = null;
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public ScheduledTask getFirmwareUpdateTask() {
        return firmwareUpdateTask;
    }

    public ResourceStore getStore() {
        return store;
    }
}

package at.sv.huebridge.sync;

import at.sv.huebridge.FormatUtil;
import at.sv.huebridge.api.IncomingEvent;
import at.sv.huebridge.resource.MissingResourceException;
import at.sv.huebridge.resource.Resource;
import at.sv.huebridge.resource.ResourceStore;
import at.sv.huebridge.resource.ServiceOwnerType;
import at.sv.huebridge.resource.ServiceType;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Applies event batches of the bridge to the store and notifies about every actual change.
 * <p>
 * Services (e.g. buttons of a switch) are not notified themselves: their owners are.
 */
@Slf4j
public final class EventDiffEngine {

    private static final String BUTTON_STATE = "button";

    private final ResourceStore store;
    private final StatePropagator propagator;
    private final Supplier<ZonedDateTime> currentTime;

    public EventDiffEngine(ResourceStore store, StatePropagator propagator, Supplier<ZonedDateTime> currentTime) {
        this.store = store;
        this.propagator = propagator;
        this.currentTime = currentTime;
    }

    /**
     * Handles the events strictly in the given order.
     *
     * @throws MissingResourceException if an owner of an updated service is not in the store. Events before the
     *                                  failing one stay applied, the failing one is not applied.
     */
    public void handleEvents(List<IncomingEvent> batch) {
        for (IncomingEvent event : batch) {
            handleEvent(event);
        }
    }

    private void handleEvent(IncomingEvent event) {
        switch (event.type()) {
            case UPDATE -> handleUpdate(event.data());
            case ADD -> handleAdd(event.data());
            default -> log.debug("Ignore {} event for {} '{}'", event.type(), event.getResourceType(), event.getResourceId());
        }
    }

    private void handleAdd(ObjectNode data) {
        String id = data.path(Resource.ID).asText(null);
        if (id == null || !data.path(Resource.TYPE).isTextual()) {
            log.debug("Ignore add event without id or type: {}", data);
            return;
        }
        if (store.contains(id)) {
            handleUpdate(data);
            return;
        }
        Resource resource = Resource.of(data.deepCopy());
        resource.setUpdated(now());
        store.put(id, resource);
        log.debug("Added {}", resource);
        propagator.pushUpdatedState(resource, resource.getType());
    }

    private void handleUpdate(ObjectNode update) {
        String id = update.path(Resource.ID).asText(null);
        Resource resource = id == null ? null : store.get(id);
        if (resource == null) {
            log.trace("Ignore update of unknown resource '{}'", id);
            return;
        }
        if (!resource.wouldChange(update)) {
            log.trace("No changes for {}", resource);
            return;
        }
        List<Resource> owners = resolveOwners(resource);
        resource.apply(update);
        resource.setUpdated(now());
        if (owners.isEmpty()) {
            propagator.pushUpdatedState(resource, resource.getType());
            return;
        }
        for (Resource owner : owners) {
            propagateViaOwner(resource, owner);
        }
    }

    private List<Resource> resolveOwners(Resource resource) {
        List<String> ownerIds = store.ownersOf(resource.getId());
        if (ownerIds.isEmpty()) {
            ownerIds = resource.getOwnerReference()
                               .map(reference -> List.of(reference.getRid()))
                               .orElse(List.of());
        }
        List<Resource> owners = new ArrayList<>(ownerIds.size());
        for (String ownerId : ownerIds) {
            Resource owner = store.get(ownerId);
            if (owner == null) {
                throw new MissingResourceException("No resource entry for '" + ownerId + "', the owner of " + resource);
            }
            owners.add(owner);
        }
        return owners;
    }

    private void propagateViaOwner(Resource service, Resource owner) {
        if (!ServiceOwnerType.isServiceOwner(owner.getType())) {
            log.warn("{} is not an expected owner type for {}. Notifying it anyway.", owner, service);
        }
        ServiceType.fromRtype(service.getType()).ifPresent(serviceType -> {
            if (serviceType == ServiceType.BUTTON) {
                clearOtherButtonStates(owner, service);
            }
            owner.embedService(serviceType, service);
        });
        propagator.pushUpdatedState(owner, service.getType());
    }

    /**
     * The bridge only reports the last event per button, so a previous press of a sibling button would otherwise still
     * look current.
     */
    private static void clearOtherButtonStates(Resource owner, Resource pressedButton) {
        owner.getServices(ServiceType.BUTTON)
             .values()
             .stream()
             .filter(button -> !button.getId().equals(pressedButton.getId()))
             .forEach(button -> button.remove(BUTTON_STATE));
    }

    private String now() {
        return FormatUtil.formatTimestamp(currentTime.get());
    }
}

package at.sv.huebridge.sync;

import at.sv.huebridge.bus.ResourceEventBus;
import at.sv.huebridge.bus.ResourceUpdateMessage;
import at.sv.huebridge.resource.Resource;
import at.sv.huebridge.resource.ResourceStore;

import java.util.List;

/**
 * Turns a resource update into notifications: on the resource's own channel, on the global channel, and the same again
 * for every group embedding the resource.
 */
public final class StatePropagator {

    private static final String UNKNOWN_GROUP_TYPE = "group";

    private final ResourceStore store;
    private final ResourceEventBus eventBus;

    public StatePropagator(ResourceStore store, ResourceEventBus eventBus) {
        this.store = store;
        this.eventBus = eventBus;
    }

    public void pushUpdatedState(Resource resource, String updatedType) {
        pushUpdatedState(resource, updatedType, false);
    }

    public void pushUpdatedState(Resource resource, String updatedType, boolean suppressMessage) {
        emit(new ResourceUpdateMessage(resource.getId(), resource.getType(), updatedType, resource.getServiceIds(),
                suppressMessage));
        for (String groupId : store.ownersOf(resource.getId())) {
            emit(createGroupMessage(groupId, updatedType, suppressMessage));
        }
    }

    private ResourceUpdateMessage createGroupMessage(String groupId, String updatedType, boolean suppressMessage) {
        Resource group = store.get(groupId);
        if (group == null) {
            return new ResourceUpdateMessage(groupId, UNKNOWN_GROUP_TYPE, updatedType, List.of(), suppressMessage);
        }
        return new ResourceUpdateMessage(groupId, group.getType(), updatedType, group.getServiceIds(), suppressMessage);
    }

    private void emit(ResourceUpdateMessage message) {
        eventBus.emit(ResourceEventBus.channelOf(message.id()), message);
        eventBus.emit(ResourceEventBus.GLOBAL_CHANNEL, message);
    }
}

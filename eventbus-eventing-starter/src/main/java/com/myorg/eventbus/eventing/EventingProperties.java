package com.myorg.eventbus.eventing;

import com.myorg.eventbus.eventing.store.EventStore;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "eventbus.eventing")
public class EventingProperties {
    // tự subscribe consume-topics khi app start
    private Listener listener = new Listener();
    private List<String> consumeTopics = new ArrayList<>();
    // null -> "<service>-<topic>-group"
    private String groupId;
    // true = log + bỏ qua, false = UnknownEventTypeException (DLQ ngay)
    private boolean ignoreUnknownEventType = true;

    private EventStoreProps eventStore = new EventStoreProps();

    @Data
    public static class Listener {
        private boolean enabled = true;
    }

    @Data
    public static class EventStoreProps {
        private boolean enabled = false;
        private String topic = EventStore.DEFAULT_TOPIC;
        private String groupId = EventStore.DEFAULT_GROUP_ID;
    }
}

package com.myorg.eventbus.eventing;

import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import com.myorg.eventbus.kafka.MessageHandler;
import lombok.RequiredArgsConstructor;
import org.apache.kafka.clients.consumer.ConsumerRecord;

// cầu nối MessageBusClient.subscribe -> dispatcher
@RequiredArgsConstructor
public class DispatchingMessageHandler implements MessageHandler {

    private final EventDispatcher dispatcher;

    @Override
    public void handle(ConsumerRecord<String, String> record, EventEnvelope event, String topic) throws Exception {
        dispatcher.dispatch(event);
    }
}

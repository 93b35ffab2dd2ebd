package com.camingest.camingest.service.kafka;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import com.camingest.camingest.config.CameraIngestProperties;
import com.camingest.camingest.model.dto.CameraEvent;
import com.camingest.camingest.service.events.EventSink;

@Service
@ConditionalOnProperty(prefix = "camera.events.kafka", name = "enabled", havingValue = "true")
public class KafkaEventSink implements EventSink {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;

    public KafkaEventSink(KafkaTemplate<String, Object> kafkaTemplate, CameraIngestProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = properties.getEvents().getKafka().getTopic();
    }

    @Override
    public String getName() {
        return "kafka";
    }

    @Override
    public void deliver(String channel, CameraEvent event) {
        kafkaTemplate.send(
                topic,
                event.getCameraId(), // key (partition by camera)
                event
        );
    }
}

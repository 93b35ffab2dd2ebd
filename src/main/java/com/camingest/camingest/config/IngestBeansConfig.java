package com.camingest.camingest.config;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import com.camingest.camingest.service.events.AsyncEventPublisher;
import com.camingest.camingest.service.events.EventSink;
import com.camingest.camingest.service.inference.DarknetInferenceEngine;
import com.camingest.camingest.service.inference.InferenceEngine;
import com.camingest.camingest.service.inference.NoOpInferenceEngine;
import com.camingest.camingest.service.inference.SnapshotStore;
import com.camingest.camingest.service.metrics.CameraMetrics;
import com.camingest.camingest.service.source.FFmpegFrameSourceOpener;
import com.camingest.camingest.service.source.FrameSourceOpener;
import com.camingest.camingest.service.source.StreamDiscovery;
import com.camingest.camingest.service.source.TemplateStreamDiscovery;

import io.micrometer.core.instrument.MeterRegistry;

@Configuration
public class IngestBeansConfig {

    private static final Logger logger = LoggerFactory.getLogger(IngestBeansConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // One thread per pull camera's read loop; reads block for as long as the camera stalls
    @Bean(name = "cameraWorkerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService cameraWorkerExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("camera-worker-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    public FrameSourceOpener frameSourceOpener(CameraIngestProperties properties) {
        return new FFmpegFrameSourceOpener(properties.getSource().getReadTimeout());
    }

    @Bean
    public StreamDiscovery streamDiscovery(CameraIngestProperties properties) {
        CameraIngestProperties.Discovery discovery = properties.getDiscovery();
        return new TemplateStreamDiscovery(discovery.getUrlTemplate(), discovery.getRtspPort());
    }

    @Bean
    public InferenceEngine inferenceEngine(CameraIngestProperties properties) {
        CameraIngestProperties.Inference inference = properties.getInference();
        if (!inference.isModelConfigured()) {
            logger.info("No detection model configured, person detection disabled");
            return new NoOpInferenceEngine();
        }
        try {
            return new DarknetInferenceEngine(inference.getModelConfig(), inference.getModelWeights(),
                    inference.getClassNames(), inference.getLabel(),
                    inference.getConfidenceThreshold(), inference.getNmsThreshold());
        } catch (IOException e) {
            logger.error("Failed to load detection model, person detection disabled: {}", e.getMessage());
            return new NoOpInferenceEngine();
        }
    }

    @Bean
    public SnapshotStore snapshotStore(CameraIngestProperties properties) {
        return new SnapshotStore(properties.getSnapshots().getDirectory());
    }

    @Bean
    public CameraMetrics cameraMetrics(MeterRegistry registry) {
        return new CameraMetrics(registry);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public AsyncEventPublisher eventPublisher(CameraIngestProperties properties,
                                              ObjectProvider<EventSink> sinks,
                                              CameraMetrics metrics) {
        List<EventSink> all = sinks.orderedStream().collect(Collectors.toList());
        return new AsyncEventPublisher(properties.getEvents().getQueueCapacity(), all, metrics);
    }
}

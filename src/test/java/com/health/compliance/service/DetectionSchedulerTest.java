package com.health.compliance.service;

import com.health.compliance.config.DetectionConfig;
import com.health.compliance.engine.DetectionEngine;
import com.health.compliance.model.DetectionRunReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DetectionSchedulerTest {

    @Mock
    private DetectionEngine detectionEngine;

    private DetectionConfig detectionConfig;
    private DetectionScheduler scheduler;

    @BeforeEach
    void setUp() {
        detectionConfig = new DetectionConfig();
        scheduler = new DetectionScheduler(detectionEngine, detectionConfig);
    }

    @Test
    void runsEngineWhenEnabled() {
        when(detectionEngine.run(anyLong())).thenReturn(new DetectionRunReport());

        scheduler.runScheduledDetection();

        verify(detectionEngine).run(anyLong());
    }

    @Test
    void skipsRunWhenDisabled() {
        detectionConfig.setEnabled(false);

        scheduler.runScheduledDetection();

        verifyNoInteractions(detectionEngine);
    }

    @Test
    void engineFailureDoesNotEscapeScheduler() {
        when(detectionEngine.run(anyLong())).thenThrow(new IllegalStateException("store unavailable"));

        assertThatCode(() -> scheduler.runScheduledDetection()).doesNotThrowAnyException();
    }
}

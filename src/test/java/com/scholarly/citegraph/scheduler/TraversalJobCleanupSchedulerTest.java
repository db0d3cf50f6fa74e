package com.scholarly.citegraph.scheduler;

import com.scholarly.citegraph.service.traversal.TraversalJobService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TraversalJobCleanupSchedulerTest {

    @Mock
    private TraversalJobService traversalJobService;

    @InjectMocks
    private TraversalJobCleanupScheduler scheduler;

    @Test
    void reportsRemainingJobsAfterEviction() {
        when(traversalJobService.cleanupExpiredJobs()).thenReturn(2);
        when(traversalJobService.listJobs()).thenReturn(List.of());

        scheduler.evictExpiredJobs();

        verify(traversalJobService).listJobs();
    }

    @Test
    void failedEvictionDoesNotPropagate() {
        when(traversalJobService.cleanupExpiredJobs()).thenThrow(new IllegalStateException("registry busy"));

        assertThatCode(scheduler::evictExpiredJobs).doesNotThrowAnyException();
        verify(traversalJobService, never()).listJobs();
    }
}

package com.yerin.flowq.service;

import com.yerin.flowq.domain.Flow;
import com.yerin.flowq.domain.ScheduleType;
import com.yerin.flowq.repository.FlowRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("FlowScheduleService 단위 테스트")
public class FlowScheduleServiceTest {

    private final FlowRepository flowRepository = mock(FlowRepository.class);
    private final FlowScheduleService sut = new FlowScheduleService(flowRepository);

    @Test
    @DisplayName("publishedVersionId 로 찾은 플로우에 cron 스케줄을 채운다")
    void backfills_schedule() {
        Flow flow = Flow.builder().id("flow-1").projectId("p-1").publishedVersionId("fv-1").build();
        when(flowRepository.findByPublishedVersionId("fv-1")).thenReturn(Optional.of(flow));

        boolean updated = sut.backfillCron("fv-1", "*/5 * * * *", "Asia/Seoul");

        assertThat(updated).isTrue();
        assertThat(flow.getSchedule().getType()).isEqualTo(ScheduleType.CRON_EXPRESSION);
        assertThat(flow.getSchedule().getCronExpression()).isEqualTo("*/5 * * * *");
        assertThat(flow.getSchedule().getTimezone()).isEqualTo("Asia/Seoul");
        verify(flowRepository).save(flow);
    }

    @Test
    @DisplayName("플로우가 없으면 false 를 돌려주고 저장하지 않는다")
    void missing_flow_returns_false() {
        when(flowRepository.findByPublishedVersionId("fv-x")).thenReturn(Optional.empty());

        assertThat(sut.backfillCron("fv-x", "*/5 * * * *", "UTC")).isFalse();
        verify(flowRepository, never()).save(any());
    }
}

package com.yerin.flowq.controller;

import com.yerin.flowq.dto.response.QueueSnapshotResponse;
import com.yerin.flowq.dto.response.RepeatableJobResponse;
import com.yerin.flowq.global.dto.DataResponse;
import com.yerin.flowq.service.AdminQueueService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/queues")
@ConditionalOnProperty(name = "flowq.board.enabled", havingValue = "true")
public class AdminQueueController {
    private final AdminQueueService adminQueueService;

    @Operation(summary = "큐별 작업 수 조회")
    @GetMapping
    public ResponseEntity<DataResponse<List<QueueSnapshotResponse>>> queues() {
        return ResponseEntity.ok(DataResponse.from(adminQueueService.snapshots()));
    }

    @Operation(summary = "단일 큐 작업 수 조회")
    @GetMapping("/{name}")
    public ResponseEntity<DataResponse<QueueSnapshotResponse>> queue(
            @PathVariable @Parameter(description = "큐 이름", example = "repeatableJobs") String name) {
        return ResponseEntity.ok(DataResponse.from(adminQueueService.snapshot(name)));
    }

    @Operation(summary = "등록된 반복 스케줄 조회")
    @GetMapping("/{name}/repeatables")
    public ResponseEntity<DataResponse<List<RepeatableJobResponse>>> repeatables(
            @PathVariable @Parameter(description = "큐 이름", example = "repeatableJobs") String name) {
        return ResponseEntity.ok(DataResponse.from(adminQueueService.repeatables(name)));
    }
}

package com.example.ingestionservice.controller;

import com.example.ingestionservice.dto.BackfillRequestDto;
import com.example.ingestionservice.dto.CheckpointResponse;
import com.example.ingestionservice.dto.ChunkedBackfillRequestDto;
import com.example.ingestionservice.dto.TaskStatusResponse;
import com.example.ingestionservice.dto.TaskSubmissionResponse;
import com.example.ingestionservice.exception.BadRequestException;
import com.example.ingestionservice.exception.ResourceNotFoundException;
import com.example.ingestionservice.record.Source;
import com.example.ingestionservice.service.BackfillTaskService;
import com.example.ingestionservice.service.CheckpointService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Backfill submission and status.
 * Handlers only enqueue; the work and its errors live in the task.
 */
@RestController
@RequestMapping("/api/backfill")
@RequiredArgsConstructor
@Slf4j
public class BackfillController {

    private final BackfillTaskService backfillTaskService;
    private final CheckpointService checkpointService;

    @PostMapping("/{source}")
    public ResponseEntity<TaskSubmissionResponse> backfill(@PathVariable String source,
                                                           @Valid @RequestBody BackfillRequestDto request) {
        log.info("Backfill requested: source={}, daysBack={}, from={}, to={}, batchId={}",
                source, request.getDaysBack(), request.getFromDate(), request.getToDate(), request.getBatchId());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(backfillTaskService.submitBackfill(source, request));
    }

    @PostMapping("/{source}/chunked")
    public ResponseEntity<TaskSubmissionResponse> chunkedBackfill(@PathVariable String source,
                                                                  @Valid @RequestBody ChunkedBackfillRequestDto request) {
        log.info("Chunked backfill requested: source={}, monthsBack={}", source, request.getMonthsBack());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(backfillTaskService.submitChunked(source, request.getMonthsBack()));
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<TaskStatusResponse> task(@PathVariable String taskId) {
        return ResponseEntity.ok(backfillTaskService.getTask(taskId));
    }

    @GetMapping("/checkpoints/{source}/{batchId}")
    public ResponseEntity<CheckpointResponse> checkpoint(@PathVariable String source, @PathVariable String batchId) {
        Source parsed = Source.fromKey(source).orElseThrow(() -> BadRequestException.unknownSource(source));
        return checkpointService.find(parsed.key(), batchId)
                .map(CheckpointResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> ResourceNotFoundException.checkpointNotFound(parsed.key(), batchId));
    }
}

package com.example.ingestionservice.controller;

import com.example.ingestionservice.dto.SyncStatusResponse;
import com.example.ingestionservice.service.SyncStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncStatusController {

    private final SyncStatusService syncStatusService;

    @GetMapping("/status")
    public ResponseEntity<List<SyncStatusResponse>> status() {
        return ResponseEntity.ok(syncStatusService.statuses());
    }
}

package com.chainvote.chainvote_api.ledger.controller;

import com.chainvote.chainvote_api.global.dto.ApiResult;
import com.chainvote.chainvote_api.ledger.dto.LedgerMonitorStatusResponse;
import com.chainvote.chainvote_api.ledger.event.LedgerEventMonitor;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/admin/ledger/monitor")
public class LedgerMonitorController {

    private final LedgerEventMonitor ledgerEventMonitor;

    @Operation(summary = "이벤트 모니터 상태")
    @GetMapping
    public ResponseEntity<ApiResult<LedgerMonitorStatusResponse>> getStatus() {
        return ResponseEntity.ok(ApiResult.of("monitor_status_loaded", status()));
    }

    @Operation(summary = "이벤트 모니터 재시작")
    @PostMapping("/restart")
    public ResponseEntity<ApiResult<LedgerMonitorStatusResponse>> restart() {
        ledgerEventMonitor.restart();
        return ResponseEntity.ok(ApiResult.of("monitor_restarted", status()));
    }

    @Operation(summary = "이벤트 모니터 중지")
    @PostMapping("/stop")
    public ResponseEntity<ApiResult<LedgerMonitorStatusResponse>> stop() {
        ledgerEventMonitor.stop();
        return ResponseEntity.ok(ApiResult.of("monitor_stopped", status()));
    }

    private LedgerMonitorStatusResponse status() {
        return new LedgerMonitorStatusResponse(
                ledgerEventMonitor.getState().name(),
                ledgerEventMonitor.activeSubscriptionCount(),
                ledgerEventMonitor.subscribedKinds()
        );
    }
}

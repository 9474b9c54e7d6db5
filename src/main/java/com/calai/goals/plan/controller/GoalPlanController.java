package com.calai.goals.plan.controller;

import com.calai.goals.energy.common.AdaptiveTdee;
import com.calai.goals.macro.common.MacroSplit;
import com.calai.goals.plan.dto.AdaptiveTdeeRequest;
import com.calai.goals.plan.dto.PlanRequest;
import com.calai.goals.plan.dto.PlanResponse;
import com.calai.goals.plan.dto.RebalanceRequest;
import com.calai.goals.plan.dto.RecomputeRequest;
import com.calai.goals.plan.dto.RecomputeResponse;
import com.calai.goals.plan.dto.RemainingRequest;
import com.calai.goals.plan.dto.RemainingResponse;
import com.calai.goals.plan.service.GoalPlanService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.DateTimeException;
import java.time.ZoneId;

@Slf4j
@RestController
@RequestMapping(path = "/api/v1/goals", produces = MediaType.APPLICATION_JSON_VALUE)
public class GoalPlanController {

    private final GoalPlanService svc;

    public GoalPlanController(GoalPlanService svc) {
        this.svc = svc;
    }

    /** 資料不足也回 200（ready=false + missingFields） */
    @PostMapping(path = "/plan", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PlanResponse> plan(
            @Valid @RequestBody PlanRequest req,
            @RequestHeader(value = "X-Client-Timezone", required = false) String tzHeader
    ) {
        return ResponseEntity.ok(svc.plan(req, zoneOrNull(tzHeader)));
    }

    @PostMapping(path = "/macros/rebalance", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MacroSplit> rebalance(@Valid @RequestBody RebalanceRequest req) {
        return ResponseEntity.ok(svc.rebalance(req));
    }

    @PostMapping(path = "/remaining", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RemainingResponse> remaining(@Valid @RequestBody RemainingRequest req) {
        return ResponseEntity.ok(svc.remaining(req));
    }

    @PostMapping(path = "/adaptive-tdee", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AdaptiveTdee> adaptiveTdee(
            @Valid @RequestBody AdaptiveTdeeRequest req,
            @RequestHeader(value = "X-Client-Timezone", required = false) String tzHeader
    ) {
        return ResponseEntity.ok(svc.adaptiveTdee(req, zoneOrNull(tzHeader)));
    }

    @PostMapping(path = "/recompute", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RecomputeResponse> recompute(@Valid @RequestBody RecomputeRequest req) {
        return ResponseEntity.ok(svc.recompute(req));
    }

    /** 只接受合法 IANA 時區；不合法就當沒帶（用伺服器時區） */
    private static ZoneId zoneOrNull(String tz) {
        if (tz == null || tz.isBlank()) return null;
        try {
            return ZoneId.of(tz.trim());
        } catch (DateTimeException ex) {
            log.debug("ignore_invalid_timezone tz={} reason={}", tz, ex.getMessage());
            return null;
        }
    }
}

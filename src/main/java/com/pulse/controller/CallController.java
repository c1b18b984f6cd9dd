package com.pulse.controller;

import com.pulse.entity.dto.Result;
import com.pulse.metrics.CallMetrics;
import com.pulse.service.CallService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/call")
@RequiredArgsConstructor
@Slf4j
public class CallController {

    private final CallService callService;
    private final CallMetrics callMetrics;

    @PostMapping("/agents/{userId}")
    public Result register(@PathVariable String userId, @RequestParam(required = false) String name) {
        log.info("注册通话代理 userId={}", userId);
        callService.register(userId, name);
        return Result.success(callService.state(userId));
    }

    @DeleteMapping("/agents/{userId}")
    public Result unregister(@PathVariable String userId) {
        log.info("注销通话代理 userId={}", userId);
        callService.unregister(userId);
        return Result.success();
    }

    @GetMapping("/agents")
    public Result online() {
        return Result.success(callService.onlineUsers());
    }

    @PostMapping("/{userId}/dial")
    public Result dial(@PathVariable String userId,
                       @RequestParam String calleeId,
                       @RequestParam(required = false) String calleeName) {
        log.info("发起呼叫 userId={} callee={}", userId, calleeId);
        return Result.success(callService.dial(userId, calleeId, calleeName));
    }

    @PostMapping("/{userId}/answer")
    public Result answer(@PathVariable String userId) {
        return Result.success(callService.answer(userId));
    }

    @PostMapping("/{userId}/reject")
    public Result reject(@PathVariable String userId) {
        return Result.success(callService.reject(userId));
    }

    @PostMapping("/{userId}/end")
    public Result end(@PathVariable String userId) {
        return Result.success(callService.hangUp(userId));
    }

    @PostMapping("/{userId}/talk")
    public Result talk(@PathVariable String userId, @RequestParam boolean talking) {
        return Result.success(callService.talk(userId, talking));
    }

    @GetMapping("/{userId}/state")
    public Result state(@PathVariable String userId) {
        return Result.success(callService.state(userId));
    }

    @GetMapping("/{userId}/history")
    public Result history(@PathVariable String userId, @RequestParam(defaultValue = "20") int limit) {
        return Result.success(callService.history(userId, limit));
    }

    @GetMapping("/metrics")
    public Result metrics() {
        Map<String, Object> data = new HashMap<>();
        data.put("onlineAgents", callService.onlineUsers().size());
        data.put("callsStarted", callMetrics.count("pulse.call.started"));
        data.put("renegotiations", callMetrics.count("pulse.call.renegotiation"));
        data.put("droppedCandidates", callMetrics.count("pulse.call.candidates.dropped"));
        return Result.success(data);
    }
}

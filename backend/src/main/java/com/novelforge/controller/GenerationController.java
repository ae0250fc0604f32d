package com.novelforge.controller;

import com.novelforge.common.Result;
import com.novelforge.common.util.CollectionUtils;
import com.novelforge.model.GenerationRequest;
import com.novelforge.model.GenerationResult;
import com.novelforge.service.orchestrator.GenerationOrchestrator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.util.Map;

/**
 * 生成请求接口：提交、查询状态、取消、等待结果
 */
@RestController
@RequestMapping("/generation")
@CrossOrigin(origins = "*")
public class GenerationController {

    @Autowired
    private GenerationOrchestrator orchestrator;

    @PostMapping
    public Result<Map<String, Object>> submit(@Valid @RequestBody GenerationRequest request) {
        String requestId = orchestrator.submit(request);
        return Result.success(CollectionUtils.mapOf("requestId", requestId));
    }

    @GetMapping("/{requestId}")
    public Result<GenerationResult> status(@PathVariable String requestId) {
        return Result.success(orchestrator.status(requestId));
    }

    @PostMapping("/{requestId}/cancel")
    public Result<Map<String, Object>> cancel(@PathVariable String requestId) {
        boolean cancelled = orchestrator.cancel(requestId);
        return Result.success(CollectionUtils.mapOf("requestId", requestId, "cancelled", cancelled));
    }

    /**
     * 阻塞等待结束；阻断时返回 409 与冲突列表
     */
    @GetMapping("/{requestId}/await")
    public Result<GenerationResult> await(@PathVariable String requestId,
                                          @RequestParam(defaultValue = "30000") long timeoutMs) {
        return Result.success(orchestrator.await(requestId, timeoutMs));
    }
}

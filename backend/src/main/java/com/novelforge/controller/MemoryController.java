package com.novelforge.controller;

import com.novelforge.common.Result;
import com.novelforge.common.exception.NotFoundException;
import com.novelforge.config.MemoryProperties;
import com.novelforge.domain.entity.MemoryEntry;
import com.novelforge.dto.AddMemoryRequest;
import com.novelforge.dto.ChapterSummaryRequest;
import com.novelforge.dto.CharacterRequest;
import com.novelforge.dto.EventRequest;
import com.novelforge.dto.QueryMemoryRequest;
import com.novelforge.dto.RuleRequest;
import com.novelforge.dto.UpdateMemoryRequest;
import com.novelforge.model.MemoryFilter;
import com.novelforge.model.MemoryKind;
import com.novelforge.model.ScoredMemory;
import com.novelforge.service.memory.LongTermMemoryStore;
import com.novelforge.service.memory.NarrativeMemoryFacade;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.util.List;

/**
 * 长期记忆接口
 */
@RestController
@RequestMapping("/memory")
@CrossOrigin(origins = "*")
public class MemoryController {

    @Autowired
    private LongTermMemoryStore memoryStore;

    @Autowired
    private NarrativeMemoryFacade memoryFacade;

    @Autowired
    private MemoryProperties properties;

    @PostMapping("/{projectId}/entries")
    public Result<MemoryEntry> add(@PathVariable String projectId, @Valid @RequestBody AddMemoryRequest request) {
        return Result.success(memoryStore.add(projectId, request.getKind(), request.getContent(),
            request.getMetadata(), request.getEmbedding()));
    }

    @GetMapping("/{projectId}/entries")
    public Result<List<MemoryEntry>> list(@PathVariable String projectId,
                                         @RequestParam(required = false) MemoryKind kind,
                                         @RequestParam(defaultValue = "50") int limit) {
        return Result.success(memoryStore.list(projectId, kind, limit));
    }

    /**
     * 获取条目；不带 version 时返回所在版本链的最新版本
     */
    @GetMapping("/entries/{entryId}")
    public Result<MemoryEntry> get(@PathVariable String entryId,
                                   @RequestParam(required = false) Integer version) {
        MemoryEntry entry = (version != null ? memoryStore.get(entryId, version) : memoryStore.get(entryId))
            .orElseThrow(() -> new NotFoundException("记忆条目不存在: " + entryId));
        return Result.success(entry);
    }

    @PutMapping("/entries/{entryId}")
    public Result<MemoryEntry> update(@PathVariable String entryId, @Valid @RequestBody UpdateMemoryRequest request) {
        return Result.success(memoryStore.update(entryId, request.getContent(), request.getMetadataChanges()));
    }

    @GetMapping("/entries/{entryId}/history")
    public Result<List<MemoryEntry>> history(@PathVariable String entryId) {
        return Result.success(memoryStore.history(entryId));
    }

    @PostMapping("/entries/{entryId}/rollback")
    public Result<MemoryEntry> rollback(@PathVariable String entryId, @RequestParam int version) {
        return Result.success(memoryStore.rollback(entryId, version));
    }

    @PostMapping("/{projectId}/query")
    public Result<List<ScoredMemory>> query(@PathVariable String projectId,
                                            @Valid @RequestBody QueryMemoryRequest request) {
        MemoryFilter filter = MemoryFilter.builder()
            .kinds(request.getKinds())
            .createdFrom(request.getCreatedFrom())
            .createdTo(request.getCreatedTo())
            .build();
        int topK = request.getTopK() != null ? request.getTopK() : properties.getDefaultTopK();
        return Result.success(memoryStore.query(projectId, request.getText(), filter, topK));
    }

    // ==================== 设定类写入 ====================

    @PostMapping("/{projectId}/characters")
    public Result<MemoryEntry> addCharacter(@PathVariable String projectId, @Valid @RequestBody CharacterRequest request) {
        return Result.success(memoryFacade.addCharacter(projectId, request.getKey(), request.getAttributes(),
            request.getDescription()));
    }

    @PostMapping("/{projectId}/locations")
    public Result<MemoryEntry> addLocation(@PathVariable String projectId, @Valid @RequestBody CharacterRequest request) {
        return Result.success(memoryFacade.addLocation(projectId, request.getKey(), request.getAttributes(),
            request.getDescription()));
    }

    @PostMapping("/{projectId}/rules")
    public Result<MemoryEntry> addRule(@PathVariable String projectId, @Valid @RequestBody RuleRequest request) {
        return Result.success(memoryFacade.addRule(projectId, request.getKey(), request.getDescription(),
            request.getForbiddenActions()));
    }

    @PostMapping("/{projectId}/events")
    public Result<MemoryEntry> addEvent(@PathVariable String projectId, @Valid @RequestBody EventRequest request) {
        return Result.success(memoryFacade.addEvent(projectId, request.getKey(), request.getEventType(),
            request.getParticipants(), request.getSequence(), request.getDescription(), request.isFlashback()));
    }

    @PostMapping("/{projectId}/chapter-summaries")
    public Result<MemoryEntry> addChapterSummary(@PathVariable String projectId,
                                                 @Valid @RequestBody ChapterSummaryRequest request) {
        return Result.success(memoryFacade.addChapterSummary(projectId, request.getChapterNumber(),
            request.getTitle(), request.getSummary()));
    }

    @GetMapping("/{projectId}/context")
    public Result<String> context(@PathVariable String projectId,
                                  @RequestParam String query,
                                  @RequestParam(required = false) Integer topK) {
        return Result.success(memoryFacade.getContextForGeneration(projectId, query,
            topK != null ? topK : properties.getDefaultTopK()));
    }
}

package com.novelforge.dto;

import com.novelforge.model.MemoryKind;
import lombok.Data;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import java.time.LocalDateTime;
import java.util.Set;

@Data
public class QueryMemoryRequest {

    @NotBlank(message = "text不能为空")
    private String text;

    @Min(value = 1, message = "topK必须大于0")
    private Integer topK;

    private Set<MemoryKind> kinds;

    private LocalDateTime createdFrom;

    private LocalDateTime createdTo;
}

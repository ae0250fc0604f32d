package com.novelforge.dto;

import lombok.Data;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.util.List;

@Data
public class EventRequest {

    @NotBlank(message = "key不能为空")
    private String key;

    @NotBlank(message = "eventType不能为空")
    private String eventType;

    private List<String> participants;

    @NotNull(message = "sequence不能为空")
    private Long sequence;

    @NotBlank(message = "description不能为空")
    private String description;

    private boolean flashback;
}

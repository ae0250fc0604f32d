package com.novelforge.dto;

import lombok.Data;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

@Data
public class ChapterSummaryRequest {

    @NotNull(message = "chapterNumber不能为空")
    @Min(value = 1, message = "chapterNumber必须大于0")
    private Integer chapterNumber;

    private String title;

    @NotBlank(message = "summary不能为空")
    private String summary;
}

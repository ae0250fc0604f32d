package com.novelforge.dto;

import lombok.Data;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import java.util.List;

@Data
public class SubgraphRequest {

    @NotEmpty(message = "seeds不能为空")
    private List<String> seeds;

    @Min(value = 0, message = "depth不能为负数")
    private int depth = 1;
}

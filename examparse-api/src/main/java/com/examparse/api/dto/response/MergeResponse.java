package com.examparse.api.dto.response;

import com.examparse.core.model.Question;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeResponse {
    private Integer matched;
    private Integer total;
    private List<Question> questions;
}

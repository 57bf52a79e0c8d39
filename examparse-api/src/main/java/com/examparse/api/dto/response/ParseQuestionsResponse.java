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
public class ParseQuestionsResponse {
    private String fileName;
    private Integer count;
    private Long durationMs;
    private List<Question> questions;
}

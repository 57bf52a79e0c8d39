package com.examparse.api.dto.response;

import com.examparse.core.model.AnswerRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseAnswersResponse {
    private String fileName;
    private Integer count;
    private Long durationMs;
    private List<AnswerRecord> answers;
}

package com.examparse.api.dto.request;

import com.examparse.core.model.AnswerRecord;
import com.examparse.core.model.Question;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MergeRequest {

    @NotNull(message = "questions is required")
    private List<Question> questions;

    @NotNull(message = "answers is required")
    private List<AnswerRecord> answers;
}

package com.examparse.core.service;

import com.examparse.core.config.SubjectCatalog;
import com.examparse.core.model.AnswerRecord;
import com.examparse.core.model.Question;
import com.examparse.core.model.Section;
import com.examparse.core.model.SectionResult;
import com.examparse.core.validation.QuestionResponseValidator;
import com.examparse.llm.client.GeminiPart;
import com.examparse.llm.prompt.ExtractionPrompts;
import com.examparse.llm.service.LlmExtractionClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SectionExtractor")
class SectionExtractorTest {

    private static final String VALID = """
        {"questions": [{"id": 1, "question_text": "Q", "options": ["① A", "② B"], "answer": "②"}]}""";

    @Mock
    private LlmExtractionClient llmClient;

    private SectionExtractor extractor;
    private Section textSection;

    @BeforeEach
    void setUp() {
        QuestionResponseValidator validator = new QuestionResponseValidator(new ObjectMapper(), new SubjectCatalog());
        extractor = new SectionExtractor(llmClient, validator);
        textSection = Section.builder().index(0).subjectHint("무역영어").label("무역영어")
            .pageNumbers(List.of(2)).text("[PAGE 2]\n1. Q").build();
    }

    @Test
    void shouldReturnValidatedQuestions() {
        when(llmClient.call(anyString(), anyList())).thenReturn(Optional.of(VALID));

        SectionResult<Question> result = extractor.extractQuestions(textSection, "system");

        assertThat(result.isFailed()).isFalse();
        assertThat(result.getItems()).hasSize(1);
        assertThat(result.getItems().get(0).getAnswer()).isEqualTo("② B");
        assertThat(result.getItems().get(0).getPageNumber()).isEqualTo(2);
    }

    @Test
    @DisplayName("Unparseable output triggers a second call that demands strict JSON")
    @SuppressWarnings("unchecked")
    void shouldRetryWithStrictJsonInstruction() {
        when(llmClient.call(anyString(), anyList()))
            .thenReturn(Optional.of("Here are the questions you asked for."))
            .thenReturn(Optional.of(VALID));

        SectionResult<Question> result = extractor.extractQuestions(textSection, "system");

        ArgumentCaptor<List<GeminiPart>> parts = ArgumentCaptor.forClass(List.class);
        verify(llmClient, times(2)).call(eq("system"), parts.capture());
        assertThat(parts.getAllValues().get(0)).hasSize(1);
        assertThat(parts.getAllValues().get(1)).hasSize(2);
        assertThat(parts.getAllValues().get(1).get(1).getText()).isEqualTo(ExtractionPrompts.STRICT_JSON_SUFFIX);
        assertThat(result.getItems()).hasSize(1);
    }

    @Test
    @DisplayName("Two unparseable responses give an empty, non-failed result")
    void shouldYieldNoItemsAfterSecondBadResponse() {
        when(llmClient.call(anyString(), anyList())).thenReturn(Optional.of("still not json"));

        SectionResult<Question> result = extractor.extractQuestions(textSection, "system");

        assertThat(result.isFailed()).isFalse();
        assertThat(result.getItems()).isEmpty();
        verify(llmClient, times(2)).call(anyString(), anyList());
    }

    @Test
    @DisplayName("No response after retries marks the section failed")
    void shouldFailWhenModelUnreachable() {
        when(llmClient.call(anyString(), anyList())).thenReturn(Optional.empty());

        SectionResult<Question> result = extractor.extractQuestions(textSection, "system");

        assertThat(result.isFailed()).isTrue();
        verify(llmClient, times(1)).call(anyString(), anyList());
    }

    @Test
    @SuppressWarnings("unchecked")
    void visionSectionSendsOneImagePartPerPage() {
        Section vision = Section.builder().index(0).label("pages 1-2")
            .pageNumbers(List.of(1, 2)).pageImages(List.of("AAA", "BBB")).build();
        when(llmClient.call(anyString(), anyList())).thenReturn(Optional.of("{\"questions\": []}"));

        extractor.extractQuestions(vision, "system");

        ArgumentCaptor<List<GeminiPart>> parts = ArgumentCaptor.forClass(List.class);
        verify(llmClient).call(eq("system"), parts.capture());
        assertThat(parts.getValue()).hasSize(3);
        assertThat(parts.getValue()).filteredOn(GeminiPart::isImage).hasSize(2);
    }

    @Test
    void shouldExtractAnswerRecords() {
        when(llmClient.call(eq(ExtractionPrompts.ANSWER_SYSTEM_PROMPT), anyList()))
            .thenReturn(Optional.of("{\"answers\": [{\"id\": 1, \"answer\": \"③\"}]}"));

        SectionResult<AnswerRecord> result = extractor.extractAnswers(textSection);

        assertThat(result.getItems()).containsExactly(
            AnswerRecord.builder().id(1).subject("무역영어").answer("③").explanation("").build());
    }
}

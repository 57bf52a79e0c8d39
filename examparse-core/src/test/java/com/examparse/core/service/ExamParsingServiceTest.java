package com.examparse.core.service;

import com.examparse.common.exception.InvalidDocumentException;
import com.examparse.common.exception.MissingApiKeyException;
import com.examparse.common.exception.ServiceUnavailableException;
import com.examparse.common.exception.UnextractableContentException;
import com.examparse.core.config.ExtractionProperties;
import com.examparse.core.config.QuestionMode;
import com.examparse.core.config.SubjectCatalog;
import com.examparse.core.merge.AnswerMerger;
import com.examparse.core.model.AnswerRecord;
import com.examparse.core.model.Question;
import com.examparse.core.model.Section;
import com.examparse.core.model.SectionResult;
import com.examparse.core.parser.AnswerTableParser;
import com.examparse.core.processor.DocumentProcessorFactory;
import com.examparse.core.processor.impl.PdfTextProcessor;
import com.examparse.core.processor.impl.PdfVisionProcessor;
import com.examparse.core.segment.PageGrouper;
import com.examparse.core.segment.SectionChunker;
import com.examparse.core.segment.SubjectSegmenter;
import com.examparse.core.support.PdfFixtures;
import com.examparse.llm.client.GeminiClientProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExamParsingService")
class ExamParsingServiceTest {

    private static final List<String> TEXT_PAGE = List.of(
        "1. Which Incoterm requires the seller to clear the goods for import?",
        "1 EXW  2 FCA  3 CPT  4 DDP",
        "2. Under UCP 600, how many banking days does a nominated bank have to examine documents?",
        "1 three  2 five  3 seven  4 ten");

    @Mock
    private SectionExtractor sectionExtractor;

    @Mock
    private GeminiClientProvider clientProvider;

    private ExtractionProperties properties;
    private SubjectCatalog subjectCatalog;
    private ParallelSectionProcessor parallelProcessor;
    private ExamParsingService service;

    @BeforeEach
    void setUp() {
        properties = new ExtractionProperties();
        properties.getPdf().setVisionDpi(10);
        subjectCatalog = new SubjectCatalog();
        parallelProcessor = new ParallelSectionProcessor(properties);

        DocumentProcessorFactory factory = new DocumentProcessorFactory(List.of(
            new PdfTextProcessor(properties), new PdfVisionProcessor(properties)));
        service = new ExamParsingService(
            properties,
            subjectCatalog,
            factory,
            new SubjectSegmenter(subjectCatalog),
            new SectionChunker(properties),
            new PageGrouper(properties),
            new AnswerTableParser(subjectCatalog),
            sectionExtractor,
            parallelProcessor,
            new AnswerMerger(),
            clientProvider);

        lenient().when(clientProvider.hasApiKey()).thenReturn(true);
    }

    @AfterEach
    void tearDown() {
        parallelProcessor.shutdown();
    }

    private static List<Question> questions(int count, int firstId) {
        return IntStream.range(firstId, firstId + count)
            .mapToObj(id -> Question.builder()
                .id(id)
                .subject("무역규범")
                .questionText("question " + id)
                .options(List.of("① A", "② B"))
                .build())
            .toList();
    }

    @Nested
    @DisplayName("parseQuestions")
    class ParseQuestions {

        @Test
        @DisplayName("Two sections, one throwing after retries, yields the other's 3 items")
        void shouldContainFailedSection() {
            properties.getExtraction().setQuestionMode(QuestionMode.VISION);
            properties.getPdf().setPagesPerGroup(1);
            when(sectionExtractor.extractQuestions(any(Section.class), anyString())).thenAnswer(invocation -> {
                Section section = invocation.getArgument(0);
                if (section.getIndex() == 0) {
                    throw new IllegalStateException("retries exhausted");
                }
                return SectionResult.success(section, questions(3, 1), 0);
            });

            List<Question> result = service.parseQuestions(PdfFixtures.blankPdf(2));

            assertThat(result).hasSize(3);
        }

        @Test
        @DisplayName("Text-bearing PDF goes through the text path as one fallback section")
        @SuppressWarnings("unchecked")
        void shouldUseTextPath() {
            when(sectionExtractor.extractQuestions(any(Section.class), anyString()))
                .thenAnswer(invocation -> SectionResult.success(invocation.getArgument(0), questions(2, 1), 0));

            List<Question> result = service.parseQuestions(PdfFixtures.textPdf(List.of(TEXT_PAGE)));

            ArgumentCaptor<Section> section = ArgumentCaptor.forClass(Section.class);
            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(sectionExtractor).extractQuestions(section.capture(), prompt.capture());
            assertThat(section.getValue().isVision()).isFalse();
            assertThat(section.getValue().getSubjectHint()).isEqualTo("일반");
            assertThat(section.getValue().getText()).startsWith("[PAGE 1]").contains("Which Incoterm");
            assertThat(prompt.getValue()).contains("무역규범");
            assertThat(result).extracting(Question::getId).containsExactly(1, 2);
        }

        @Test
        @DisplayName("AUTO switches to page images for a scanned-looking document")
        void shouldSwitchToVisionForScans() {
            when(sectionExtractor.extractQuestions(any(Section.class), anyString()))
                .thenAnswer(invocation -> SectionResult.success(invocation.getArgument(0), questions(1, 1), 0));

            service.parseQuestions(PdfFixtures.blankPdf(4));

            ArgumentCaptor<Section> sections = ArgumentCaptor.forClass(Section.class);
            verify(sectionExtractor, atLeastOnce()).extractQuestions(sections.capture(), anyString());
            assertThat(sections.getAllValues()).hasSize(2).allSatisfy(s -> assertThat(s.isVision()).isTrue());
        }

        @Test
        void textModeRejectsDocumentsWithoutText() {
            properties.getExtraction().setQuestionMode(QuestionMode.TEXT);

            assertThatThrownBy(() -> service.parseQuestions(PdfFixtures.blankPdf(2)))
                .isInstanceOf(UnextractableContentException.class);
            verify(sectionExtractor, never()).extractQuestions(any(), anyString());
        }

        @Test
        @DisplayName("Every section failing with nothing extracted surfaces as service unavailable")
        void shouldRaiseWhenAllSectionsFail() {
            when(sectionExtractor.extractQuestions(any(Section.class), anyString()))
                .thenAnswer(invocation -> SectionResult.failed(invocation.getArgument(0), "503", 0));

            assertThatThrownBy(() -> service.parseQuestions(PdfFixtures.textPdf(List.of(TEXT_PAGE))))
                .isInstanceOf(ServiceUnavailableException.class);
        }

        @Test
        void shouldRejectEmptyInput() {
            assertThatThrownBy(() -> service.parseQuestions(new byte[0]))
                .isInstanceOf(InvalidDocumentException.class);
        }

        @Test
        void shouldRequireApiKey() {
            when(clientProvider.hasApiKey()).thenReturn(false);

            assertThatThrownBy(() -> service.parseQuestions(PdfFixtures.textPdf(List.of(TEXT_PAGE))))
                .isInstanceOf(MissingApiKeyException.class);
        }
    }

    @Nested
    @DisplayName("parseAnswerKey")
    class ParseAnswerKey {

        private byte[] answerTablePdf() {
            List<String> lines = new ArrayList<>(List.of("Regulation", "Payment", "Question No.", "Answer"));
            for (int subject = 0; subject < 2; subject++) {
                for (int id = 1; id <= 5; id++) {
                    lines.add(String.valueOf(id));
                }
                lines.addAll(List.of("1", "3", "2", "4", "1"));
            }
            return PdfFixtures.textPdf(List.of(lines));
        }

        @Test
        @DisplayName("Rigid table is parsed without calling the model")
        void shouldUseDeterministicParser() {
            subjectCatalog.setNames(List.of("Regulation", "Payment"));

            List<AnswerRecord> records = service.parseAnswerKey(answerTablePdf());

            assertThat(records).hasSize(10);
            assertThat(records.get(1).getAnswer()).isEqualTo("3");
            assertThat(records.get(5).getSubject()).isEqualTo("Payment");
            verify(sectionExtractor, never()).extractAnswers(any());
        }

        @Test
        @DisplayName("Ruled table with cell borders is still parsed without calling the model")
        void shouldParseBorderedTableDeterministically() {
            // Given
            subjectCatalog.setNames(List.of("RULES", "PAYMENT"));
            List<String> lines = new ArrayList<>(List.of("RULES", "PAYMENT", "Answer"));
            for (int id = 1; id <= 5; id++) {
                lines.add(String.valueOf(id));
            }
            lines.addAll(List.of("2", "2", "4", "1", "3"));
            for (int id = 1; id <= 5; id++) {
                lines.add(String.valueOf(id));
            }
            lines.addAll(List.of("4", "1", "1", "3", "2"));

            // When
            List<AnswerRecord> records = service.parseAnswerKey(PdfFixtures.borderedTextPdf(lines));

            // Then
            assertThat(records).hasSize(10);
            assertThat(records).extracting(AnswerRecord::getSubject)
                .containsExactly("RULES", "RULES", "RULES", "RULES", "RULES",
                    "PAYMENT", "PAYMENT", "PAYMENT", "PAYMENT", "PAYMENT");
            assertThat(records.get(2).getAnswer()).isEqualTo("4");
            assertThat(records.get(5).getAnswer()).isEqualTo("4");
            verify(sectionExtractor, never()).extractAnswers(any());
        }

        @Test
        @DisplayName("Falls back to the model when the table is not recognised")
        void shouldFallBackToModel() {
            when(sectionExtractor.extractAnswers(any(Section.class))).thenAnswer(invocation ->
                SectionResult.success(invocation.getArgument(0),
                    List.of(AnswerRecord.builder().id(1).answer("④").build()), 0));

            List<AnswerRecord> records = service.parseAnswerKey(PdfFixtures.textPdf(List.of(TEXT_PAGE)));

            assertThat(records).extracting(AnswerRecord::getAnswer).containsExactly("④");
        }

        @Test
        void shouldReturnEmptyWithoutApiKeyForFallback() {
            when(clientProvider.hasApiKey()).thenReturn(false);

            assertThat(service.parseAnswerKey(PdfFixtures.textPdf(List.of(TEXT_PAGE)))).isEmpty();
        }

        @Test
        @DisplayName("Never raises for unreadable or empty input")
        void shouldNeverRaise() {
            assertThat(service.parseAnswerKey(new byte[0])).isEmpty();
            assertThat(service.parseAnswerKey(null)).isEmpty();
            assertThat(service.parseAnswerKey("garbage".getBytes(StandardCharsets.UTF_8))).isEmpty();
        }

        @Test
        void shouldReturnEmptyForOversizedDocument() {
            properties.getPdf().setMaxPages(1);

            assertThat(service.parseAnswerKey(PdfFixtures.blankPdf(2))).isEmpty();
        }
    }

    @Test
    void merge_delegatesToMerger() {
        List<Question> questions = questions(1, 1);

        assertThat(service.merge(questions, List.of(AnswerRecord.builder().id(1).answer("2").build()))
            .getQuestions().get(0).getAnswer()).isEqualTo("② B");
    }

    @Test
    void updateApiKey_rotatesCredential() {
        service.updateApiKey("new-key");

        verify(clientProvider).updateApiKey("new-key");
    }
}

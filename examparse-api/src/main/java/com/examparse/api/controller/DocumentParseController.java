package com.examparse.api.controller;

import com.examparse.api.dto.request.MergeRequest;
import com.examparse.api.dto.response.MergeResponse;
import com.examparse.api.dto.response.ParseAnswersResponse;
import com.examparse.api.dto.response.ParseQuestionsResponse;
import com.examparse.common.exception.InvalidDocumentException;
import com.examparse.common.exception.UnextractableContentException;
import com.examparse.common.exception.UnsupportedFileTypeException;
import com.examparse.common.util.FileUtils;
import com.examparse.core.model.AnswerRecord;
import com.examparse.core.model.MergeResult;
import com.examparse.core.model.Question;
import com.examparse.core.service.ExamParsingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

@RestController
@RequestMapping("/api/v1/parse")
@RequiredArgsConstructor
@Slf4j
public class DocumentParseController {

    private final ExamParsingService parsingService;

    @PostMapping(value = "/questions", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ParseQuestionsResponse> parseQuestions(@RequestParam("file") MultipartFile file) {
        long startTime = System.currentTimeMillis();
        String fileName = FileUtils.sanitizeFileName(file.getOriginalFilename());
        log.info("[PIPELINE] Question upload received | file={} | sizeBytes={}", fileName, file.getSize());

        List<Question> questions = parsingService.parseQuestions(readPdf(file));

        return ResponseEntity.ok(ParseQuestionsResponse.builder()
            .fileName(fileName)
            .count(questions.size())
            .durationMs(System.currentTimeMillis() - startTime)
            .questions(questions)
            .build());
    }

    @PostMapping(value = "/answer-key", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ParseAnswersResponse> parseAnswerKey(@RequestParam("file") MultipartFile file) {
        long startTime = System.currentTimeMillis();
        String fileName = FileUtils.sanitizeFileName(file.getOriginalFilename());
        log.info("[PIPELINE] Answer key upload received | file={} | sizeBytes={}", fileName, file.getSize());

        List<AnswerRecord> answers = parsingService.parseAnswerKey(readPdf(file));
        if (answers.isEmpty()) {
            throw new UnextractableContentException(
                "No answers could be extracted from the answer key. Check the file or configure an API key.", 0);
        }

        return ResponseEntity.ok(ParseAnswersResponse.builder()
            .fileName(fileName)
            .count(answers.size())
            .durationMs(System.currentTimeMillis() - startTime)
            .answers(answers)
            .build());
    }

    @PostMapping(value = "/merge", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MergeResponse> merge(@Valid @RequestBody MergeRequest request) {
        MergeResult result = parsingService.merge(request.getQuestions(), request.getAnswers());
        return ResponseEntity.ok(MergeResponse.builder()
            .matched(result.getMatchedCount())
            .total(result.getQuestions().size())
            .questions(result.getQuestions())
            .build());
    }

    private static byte[] readPdf(MultipartFile file) {
        if (file.isEmpty()) {
            throw new InvalidDocumentException("Uploaded file is empty");
        }
        if (!FileUtils.isPdf(file.getOriginalFilename(), file.getContentType())) {
            throw new UnsupportedFileTypeException("Only PDF files are supported: " + file.getOriginalFilename());
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded file", e);
        }
    }
}

package com.examparse.core.segment;

import com.examparse.core.config.SubjectCatalog;
import com.examparse.core.model.Section;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SubjectSegmenter")
class SubjectSegmenterTest {

    private SubjectSegmenter segmenter;

    @BeforeEach
    void setUp() {
        segmenter = new SubjectSegmenter(new SubjectCatalog());
    }

    @Test
    @DisplayName("Splits at headers and strips letter spacing from subject names")
    void shouldSplitAtLetterSpacedHeaders() {
        String text = "\n[PAGE 1]\n무 역 규 범\n1. 첫 문제\n\n[PAGE 2]\n2. 둘째 문제\n무역 결제\n1. 결제 문제\n";

        List<Section> sections = segmenter.split(text);

        assertThat(sections).extracting(Section::getSubjectHint).containsExactly("무역규범", "무역결제");
        assertThat(sections).extracting(Section::getIndex).containsExactly(0, 1);
        assertThat(sections.get(0).getText()).contains("1. 첫 문제").contains("2. 둘째 문제");
        assertThat(sections.get(0).getPageNumbers()).containsExactly(1, 2);
        assertThat(sections.get(1).getText()).isEqualTo("1. 결제 문제");
        assertThat(sections.get(1).getPageNumbers()).containsExactly(2);
    }

    @Test
    @DisplayName("Prepends text found before the first header to the first section")
    void shouldPrependPreHeaderText() {
        String text = "\n[PAGE 1]\n1. 머리글 앞 문제\n무역계약\n2. 다음 문제\n";

        List<Section> sections = segmenter.split(text);

        assertThat(sections).hasSize(1);
        assertThat(sections.get(0).getSubjectHint()).isEqualTo("무역계약");
        assertThat(sections.get(0).getText())
            .startsWith("[PAGE 1]\n1. 머리글 앞 문제")
            .endsWith("2. 다음 문제");
        assertThat(sections.get(0).getPageNumbers()).containsExactly(1);
    }

    @Test
    @DisplayName("Returns one fallback section when there is no header")
    void shouldFallBackToSingleSection() {
        String text = "\n[PAGE 1]\n1. What is FOB?\n";

        List<Section> sections = segmenter.split(text);

        assertThat(sections).hasSize(1);
        assertThat(sections.get(0).getSubjectHint()).isEqualTo("일반");
        assertThat(sections.get(0).getText()).isEqualTo("[PAGE 1]\n1. What is FOB?");
    }

    @Test
    void shouldRecogniseOrdinalHeadersAndAliases() {
        String text = "제 1 과목\n문제 A\n무역 물류\n문제 B\n";

        List<Section> sections = segmenter.split(text);

        assertThat(sections).extracting(Section::getSubjectHint).containsExactly("제1과목", "무역물류");
    }

    @Test
    @DisplayName("Does not match a name broken across lines")
    void shouldNotBridgeNewlines() {
        String text = "무역\n규범 이라는 단어가 줄바꿈으로 나뉨\n";

        List<Section> sections = segmenter.split(text);

        assertThat(sections).hasSize(1);
        assertThat(sections.get(0).getSubjectHint()).isEqualTo("일반");
    }

    @Test
    @DisplayName("Keeps a question whole when its stem mentions another subject")
    void shouldIgnoreSubjectNamesInsideQuestionText() {
        // Given
        String text = "\n[PAGE 1]\n무 역 규 범\n1. 다음 중 무역계약의 성립 요건으로 옳은 것은?\n① 청약\n② 승낙\n"
            + "2. 무역결제 방식에 관한 설명이다.\n① 신용장\n② 송금\n";

        // When
        List<Section> sections = segmenter.split(text);

        // Then
        assertThat(sections).hasSize(1);
        assertThat(sections.get(0).getSubjectHint()).isEqualTo("무역규범");
        assertThat(sections.get(0).getText())
            .contains("1. 다음 중 무역계약의 성립 요건으로 옳은 것은?")
            .contains("2. 무역결제 방식에 관한 설명이다.");
    }

    @Test
    @DisplayName("Accepts an ordinal in front of the subject name on a header line")
    void shouldAcceptOrdinalPrefixedHeader() {
        String text = "제1과목 무역규범\n문제 A\n제 2 과목: 무 역 결 제\n문제 B\n";

        List<Section> sections = segmenter.split(text);

        assertThat(sections).extracting(Section::getSubjectHint).containsExactly("무역규범", "무역결제");
        assertThat(sections).extracting(Section::getText).containsExactly("문제 A", "문제 B");
    }

    @Test
    void shouldDropHeadersWithoutContent() {
        String text = "무역규범\n무역영어\nQuestion 1\n";

        List<Section> sections = segmenter.split(text);

        assertThat(sections).extracting(Section::getSubjectHint).containsExactly("무역영어");
    }
}

package com.examparse.llm.prompt;

import java.util.List;
import java.util.stream.Collectors;

public final class ExtractionPrompts {

    public static final String UNDERLINE_START = "[[u]]";
    public static final String UNDERLINE_END = "[[/u]]";

    public static final String STRICT_JSON_SUFFIX = """


            ⚠️ 이전 응답은 JSON으로 해석할 수 없었다. 마크다운이나 설명 없이 유효한 JSON 객체 하나만 반환하라.
            """;

    private static final String QUESTION_PROMPT_TEMPLATE = """
            너는 한국 자격증 시험지에서 객관식 문제를 구조화된 데이터로 옮기는 파서다.

            [출력 형식]
            {"questions": [...]} 형태의 JSON 객체 하나만 반환하라. 문제가 없으면 {"questions": []}.

            [문제 객체 필드]
            - "id" (int): 과목 안에서의 문제 번호. 과목마다 1번부터 시작한다.
            - "subject" (string): 과목명. 다음 중 하나만 사용하라: %s
            - "context" (string|null): 문제 앞에 제시된 지문. 없으면 null.
            - "question_text" (string): 발문. 보기를 포함하지 않는다.
            - "options" (string[]): 보기 목록. ①②③④ 같은 번호 표기를 포함해 원문 그대로, 원문 순서대로.
            - "answer" (string): 문서에 정답이 표시된 경우에만 options 중 하나의 전체 문자열. 모르면 "".
            - "explanation" (string): 해설. 없으면 "".
            - "page_number" (int): 문제가 시작되는 페이지 번호.

            [지문 규칙]
            - "다음을 읽고 물음에 답하시오" 같은 안내 뒤의 영문 지문, 계약 조항, 사례, 표가 지문이다.
            - 하나의 지문을 여러 문제가 공유하면 각 문제의 context에 같은 지문 전체를 넣어라.
              첫 문제에만 넣고 나머지를 null로 두지 마라.
            - 앞 페이지에서 이어지는 지문은 보이는 부분만 넣어라.

            [밑줄]
            - 밑줄이 그어진 텍스트는 %s텍스트%s 로 감싸라. context, question_text, options 모두 적용한다.
            - 입력 텍스트에 이미 이 표시가 있으면 그대로 유지하라.

            [표]
            - 표는 <table><tr><th>..</th></tr><tr><td>..</td></tr></table> 형태의 HTML로 보존하라.
            - 표는 context 또는 question_text에만 넣고 options에는 넣지 마라. 보기는 순수 텍스트다.

            [텍스트 정확성]
            - 영어 지문, 약어(L/C, B/L, CIF, FOB, DDP 등), 조문 번호는 보이는 그대로 옮겨라.
            - options 개수는 원문 보기 개수와 같아야 한다.
            """;

    public static final String ANSWER_SYSTEM_PROMPT = """
            너는 한국 자격증 시험 답지(정답표, 해설지) 텍스트에서 정답을 추출하는 파서다.

            [출력 형식]
            {"answers": [...]} 형태의 JSON 객체 하나만 반환하라.

            [답 객체 필드]
            - "id" (int): 과목 안에서의 문제 번호 (1~30 등).
            - "subject" (string): 과목명. 반드시 포함한다.
            - "answer" (string): 정답 번호 또는 기호. 원문 그대로 (예: "④").
            - "explanation" (string): 해설이 있으면 포함, 없으면 "".

            [규칙]
            - 과목별로 나뉜 답지는 각 답에 해당 과목명을 넣어라.
            - 번호와 정답만 나열된 표도 빠짐없이 추출하라.
            """;

    public static String stripUnderlineMarkers(String text) {
        return text.replace(UNDERLINE_START, "").replace(UNDERLINE_END, "");
    }

    public static String questionSystemPrompt(List<String> subjects) {
        String subjectList = subjects.stream()
            .map(s -> "\"" + s + "\"")
            .collect(Collectors.joining(", "));
        return String.format(QUESTION_PROMPT_TEMPLATE, subjectList, UNDERLINE_START, UNDERLINE_END);
    }

    public static String buildTextSectionMessage(String subjectHint, String sectionText) {
        StringBuilder prompt = new StringBuilder();
        if (subjectHint != null && !subjectHint.isBlank()) {
            prompt.append("현재 구역의 과목 추정: ").append(subjectHint).append("\n");
        }
        prompt.append("[PAGE n] 표시는 페이지 경계다. 아래 시험지 텍스트에서 모든 문제를 추출하라.\n\n");
        prompt.append(sectionText);
        return prompt.toString();
    }

    public static String buildImageGroupMessage(List<Integer> pageNumbers) {
        return "다음은 시험지 페이지 " + pageNumbers + "의 이미지다. 순서대로 이어지는 페이지이며, 모든 문제를 추출하라.";
    }

    public static String buildAnswerSectionMessage(String subjectHint, String sectionText) {
        return "현재 분석 중인 답안 구역: " + (subjectHint != null ? subjectHint : "") + "\n\n텍스트 내용:\n" + sectionText;
    }

    private ExtractionPrompts() {}
}

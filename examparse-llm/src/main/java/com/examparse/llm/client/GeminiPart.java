package com.examparse.llm.client;

import com.examparse.common.constants.FileTypes;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Map;

/**
 * One element of a user message: either plain text or an inline base64 image.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class GeminiPart {

    private final String text;
    private final String mimeType;
    private final String base64Data;

    public static GeminiPart text(String text) {
        return new GeminiPart(text, null, null);
    }

    public static GeminiPart pngImage(String base64Data) {
        return new GeminiPart(null, FileTypes.PNG_MIME_TYPE, base64Data);
    }

    public boolean isImage() {
        return base64Data != null;
    }

    Map<String, Object> toRequestPart() {
        if (isImage()) {
            return Map.of("inline_data", Map.of(
                "mime_type", mimeType,
                "data", base64Data
            ));
        }
        return Map.of("text", text);
    }
}

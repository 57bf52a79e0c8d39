package com.examparse.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyRequest {

    @NotBlank(message = "apiKey must not be blank")
    private String apiKey;

    @Override
    public String toString() {
        return "ApiKeyRequest(apiKey=***)";
    }
}

package com.wpanther.ocppcentral.dto.ocpp;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuthorizeRequest {

    @NotBlank
    @Size(max = 20)
    private String idTag;
}

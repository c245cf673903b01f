package com.wpanther.ocppcentral.dto.ocpp;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuthorizeResponse {

    private IdTagInfo idTagInfo;
}

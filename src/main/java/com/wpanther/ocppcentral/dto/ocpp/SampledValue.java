package com.wpanther.ocppcentral.dto.ocpp;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SampledValue {

    /** Measurand assumed by OCPP 1.6 when the charger omits it. */
    public static final String DEFAULT_MEASURAND = "Energy.Active.Import.Register";

    @NotNull
    private String value;

    private String context;
    private String format;
    private String measurand;
    private String phase;
    private String location;
    private String unit;
}

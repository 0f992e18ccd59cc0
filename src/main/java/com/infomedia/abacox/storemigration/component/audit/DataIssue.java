package com.infomedia.abacox.storemigration.component.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataIssue {

    public static final String MISSING_NATURAL_ID = "missing_natural_id";
    public static final String INVALID_PAYLOAD = "invalid_payload";
    public static final String DATA_MISMATCH = "data_mismatch";

    private String issue;
    private Long id;
    /**
     * Top-level payload fields whose values differ between source and staging.
     */
    private List<String> differingFields;
    private String apiLabel;
    private String dbLabel;
    private String detail;
}

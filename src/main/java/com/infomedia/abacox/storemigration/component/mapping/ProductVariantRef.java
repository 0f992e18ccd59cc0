package com.infomedia.abacox.storemigration.component.mapping;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class ProductVariantRef {
    private Long productId;
    private Long variantId;
    private String title;
    private String variantTitle;
    private String price;
}

package com.delta.adinsights.search.model;

public record AdRecord(
    String type,
    Integer rankGroup,
    Integer rankAbsolute,
    String advertiserId,
    String creativeId,
    String title,
    String url,
    Boolean verified,
    String format,
    PreviewImage previewImage,
    String firstShown,
    String lastShown,
    AdTextContent textContent
) {
}

package com.jobscout.links.model;

import java.util.List;

public record PageLinks(
    String sourcePageUrl,
    List<RawLink> links,
    String errorCode,
    String errorMessage
) {
    public static PageLinks failed(String sourcePageUrl, String errorCode, String errorMessage) {
        return new PageLinks(sourcePageUrl, List.of(), errorCode, errorMessage);
    }

    public boolean isSuccessful() {
        return errorCode == null;
    }
}

package com.jobscout.links.api;

import com.jobscout.links.model.RawLink;

import java.util.List;

public record ClassifyLinksRequest(
    List<RawLink> links
) {
}

package com.jobscout.links.api;

import java.util.List;

public record ScoutApiRunRequest(
    List<String> targets
) {
}

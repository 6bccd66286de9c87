package com.jobscout.links.classify;

public enum PostingVerdict {
    ACCEPT,
    REJECT_SELF_LINK,
    REJECT
}

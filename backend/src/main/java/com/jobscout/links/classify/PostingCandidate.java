package com.jobscout.links.classify;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * A normalized URL under evaluation together with the page it was found on. Lowercased forms
 * and vendor matches are computed once and shared by every rule.
 */
public record PostingCandidate(
    String url,
    String lowerUrl,
    String sourcePageUrl,
    String lowerSourcePageUrl,
    Set<VendorPattern> vendors
) {
    public static PostingCandidate of(String url, String sourcePageUrl) {
        String safeUrl = url == null ? "" : url;
        String safeSource = sourcePageUrl == null ? "" : sourcePageUrl;
        Set<VendorPattern> vendors = EnumSet.noneOf(VendorPattern.class);
        for (VendorPattern vendor : VendorPattern.values()) {
            if (vendor.matches(safeUrl)) {
                vendors.add(vendor);
            }
        }
        return new PostingCandidate(
            safeUrl,
            safeUrl.toLowerCase(Locale.ROOT),
            safeSource,
            safeSource.toLowerCase(Locale.ROOT),
            vendors
        );
    }

    public boolean isVendorPosting() {
        return !vendors.isEmpty();
    }

    public boolean vendorAllowsNegative(String negativeKeyword) {
        for (VendorPattern vendor : vendors) {
            if (vendor.allowsNegative(negativeKeyword)) {
                return true;
            }
        }
        return false;
    }
}

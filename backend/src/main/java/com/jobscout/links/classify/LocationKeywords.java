package com.jobscout.links.classify;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Default location vocabularies. Allowed entries cover US metros and Hong Kong; disallowed
 * entries cover other regions plus locale path segments such as {@code /fr-fr}.
 */
public final class LocationKeywords {
    public static final List<String> DEFAULT_ALLOWED = List.of(
        "new york", "nyc", "ny", "los angeles", "la", "chicago", "san francisco", "sf",
        "boston", "houston", "dallas", "philadelphia", "atlanta", "washington dc", "dc",
        "seattle", "miami", "denver", "austin", "menlo park", "palo alto", "charlotte",
        "greenwich", "stamford", "irvine", "newport beach",
        "usa", "us", "united states", "hong kong", "hk"
    );

    public static final List<String> DEFAULT_DISALLOWED = List.of(
        // europe
        "london", "paris", "frankfurt", "milan", "zurich", "geneva", "madrid",
        "amsterdam", "dublin", "luxembourg", "brussels", "stockholm", "warsaw", "birmingham",
        "uk", "united kingdom", "great britain", "france", "germany", "italy",
        "spain", "switzerland", "ireland", "benelux", "nordics", "emea",
        // asia and middle east, excluding hong kong
        "singapore", "tokyo", "seoul", "mumbai", "delhi", "beijing", "shanghai",
        "shenzhen", "dubai", "riyadh", "tel aviv",
        "japan", "korea", "india", "china", "mainland", "australia", "asean", "mea", "israel",
        // americas outside the us
        "toronto", "montreal", "vancouver", "canada", "mexico city", "sao paulo", "brazil", "latam",
        // locale path segments
        "/fr-fr", "/de-de", "/it-it", "/ja-jp", "/ko-kr", "/es-es"
    );

    private LocationKeywords() {
    }

    public static boolean isPathSegment(String keyword) {
        return keyword.startsWith("/");
    }

    public static List<String> clean(List<String> keywords) {
        if (keywords == null) {
            return new ArrayList<>();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            unique.add(keyword.trim().toLowerCase(Locale.ROOT));
        }
        return new ArrayList<>(unique);
    }
}

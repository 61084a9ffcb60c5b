package com.photo.panogroup.core.match;

/**
 * 单对图像的匹配明细
 */
public class MatchResult {

    private final int matchCount;
    private final boolean homographyChecked;
    private final boolean homographyFound;
    private final int inlierCount;
    private final boolean overlap;

    private MatchResult(int matchCount, boolean homographyChecked, boolean homographyFound, int inlierCount, boolean overlap) {
        this.matchCount = matchCount;
        this.homographyChecked = homographyChecked;
        this.homographyFound = homographyFound;
        this.inlierCount = inlierCount;
        this.overlap = overlap;
    }

    /**
     * 匹配数不足，未做几何校验
     */
    public static MatchResult rejected(int matchCount) {
        return new MatchResult(matchCount, false, false, 0, false);
    }

    public static MatchResult verified(int matchCount, boolean homographyFound, int inlierCount, int minMatches) {
        return new MatchResult(matchCount, true, homographyFound, inlierCount,
                HomographyPairMatcher.accepts(homographyFound, inlierCount, minMatches));
    }

    public int getMatchCount() { return matchCount; }
    public boolean isHomographyChecked() { return homographyChecked; }
    public boolean isHomographyFound() { return homographyFound; }
    public int getInlierCount() { return inlierCount; }
    public boolean isOverlap() { return overlap; }

    @Override
    public String toString() {
        return "MatchResult{matches=" + matchCount
                + (homographyChecked ? ", homography=" + homographyFound + ", inliers=" + inlierCount : ", rejected early")
                + ", overlap=" + overlap + "}";
    }
}
